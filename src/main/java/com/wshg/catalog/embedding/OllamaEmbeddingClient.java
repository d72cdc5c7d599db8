package com.wshg.catalog.embedding;

import com.wshg.catalog.config.CatalogProperties;
import com.wshg.catalog.dto.OllamaEmbedRequest;
import com.wshg.catalog.dto.OllamaEmbedResponse;
import com.wshg.catalog.error.EmbeddingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Embedding via a local Ollama server ({@code POST /api/embed}).
 */
@Slf4j
@RequiredArgsConstructor
public class OllamaEmbeddingClient implements EmbeddingPort {

    private static final String OLLAMA_EMBED_PATH = "/api/embed";

    private final CatalogProperties props;
    private final RestTemplate restTemplate;

    @Override
    public float[] generateVector(Map<String, Object> content, Map<String, Object> metadata) {
        String text = ResourceToVectorHelper.buildText(content, metadata);
        String url = buildUrl();
        OllamaEmbedRequest req = OllamaEmbedRequest.single(props.getEmbeddingModel(), text);
        ResponseEntity<OllamaEmbedResponse> res;
        try {
            res = restTemplate.postForEntity(url, new HttpEntity<>(req, jsonHeaders()), OllamaEmbedResponse.class);
        } catch (RestClientException e) {
            log.error("[Embedding] Ollama call failed url={}", url, e);
            throw new EmbeddingException("Ollama embedding call failed: " + e.getMessage(), e);
        }
        if (!res.getStatusCode().is2xxSuccessful() || res.getBody() == null) {
            throw new EmbeddingException("Ollama embedding returned status " + res.getStatusCode().value());
        }
        float[] emb = res.getBody().getFirstEmbedding();
        if (emb == null || emb.length == 0) {
            throw new EmbeddingException("Ollama embedding response carried no vector");
        }
        log.debug("[Embedding] Ollama ok url={}, dim={}", url, emb.length);
        return emb;
    }

    private String buildUrl() {
        String base = props.getEmbeddingBaseUrl();
        if (base == null || base.isBlank()) base = "http://localhost:11434";
        return base.replaceAll("/$", "") + OLLAMA_EMBED_PATH;
    }

    private HttpHeaders jsonHeaders() {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        return h;
    }
}
