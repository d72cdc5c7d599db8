package com.wshg.catalog.embedding;

import com.wshg.catalog.error.EmbeddingException;

import java.util.Map;

/**
 * Turns resource content into a fixed-length vector.
 *
 * <p>Implementations must be free of side effects. Every vector produced for one store
 * must have the same dimensionality; the resource store rejects any other length.</p>
 */
public interface EmbeddingPort {

    /**
     * @param content  resource content (type, provider, region, name, data, tags)
     * @param metadata enrichment metadata relevant to similarity
     * @return the vector, never null or empty
     * @throws EmbeddingException when no vector can be produced
     */
    float[] generateVector(Map<String, Object> content, Map<String, Object> metadata);
}
