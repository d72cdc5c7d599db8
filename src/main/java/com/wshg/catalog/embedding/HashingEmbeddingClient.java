package com.wshg.catalog.embedding;

import com.wshg.catalog.error.EmbeddingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.MurmurHash3;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Local embedding by signed feature hashing of the resource text, L2-normalized.
 * Deterministic and offline; identical input always yields the identical vector.
 */
@Slf4j
public class HashingEmbeddingClient implements EmbeddingPort {

    private final int dimensions;

    public HashingEmbeddingClient(int dimensions) {
        if (dimensions <= 0) throw new IllegalArgumentException("dimensions must be positive: " + dimensions);
        this.dimensions = dimensions;
    }

    @Override
    public float[] generateVector(Map<String, Object> content, Map<String, Object> metadata) {
        if (content == null || content.isEmpty()) {
            throw new EmbeddingException("nothing to embed: content is empty");
        }
        String text = ResourceToVectorHelper.buildText(content, metadata);
        float[] vec = new float[dimensions];
        int tokens = 0;
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.isEmpty()) continue;
            int h = MurmurHash3.hash32x86(token.getBytes(StandardCharsets.UTF_8));
            int bucket = Math.floorMod(h, dimensions);
            vec[bucket] += (h & 0x80000000) == 0 ? 1f : -1f;
            tokens++;
        }
        double norm = 0;
        for (float v : vec) norm += v * v;
        if (norm == 0) {
            throw new EmbeddingException("no features extracted from content (tokens=" + tokens + ")");
        }
        float inv = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vec.length; i++) vec[i] *= inv;
        log.debug("[Embedding] hashing tokens={}, dim={}", tokens, dimensions);
        return vec;
    }
}
