package com.wshg.catalog.embedding;

import com.wshg.catalog.config.CatalogProperties;
import com.wshg.catalog.dto.EmbeddingRequest;
import com.wshg.catalog.dto.EmbeddingResponse;
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
 * Embedding via an OpenAI-compatible endpoint ({@code POST /v1/embeddings}, bearer key).
 */
@Slf4j
@RequiredArgsConstructor
public class OpenAiEmbeddingClient implements EmbeddingPort {

    private static final String EMBEDDINGS_PATH = "/v1/embeddings";

    private final CatalogProperties props;
    private final RestTemplate restTemplate;

    @Override
    public float[] generateVector(Map<String, Object> content, Map<String, Object> metadata) {
        String apiKey = props.getEmbeddingApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new EmbeddingException("catalog.embedding-api-key is not configured");
        }
        String text = ResourceToVectorHelper.buildText(content, metadata);
        String url = buildUrl();
        EmbeddingRequest req = EmbeddingRequest.single(props.getEmbeddingModel(), text, props.getEmbeddingDimensions());
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);
        ResponseEntity<EmbeddingResponse> res;
        try {
            res = restTemplate.postForEntity(url, new HttpEntity<>(req, headers), EmbeddingResponse.class);
        } catch (RestClientException e) {
            log.error("[Embedding] OpenAI-compatible call failed url={}", url, e);
            throw new EmbeddingException("embedding call failed: " + e.getMessage(), e);
        }
        if (!res.getStatusCode().is2xxSuccessful() || res.getBody() == null) {
            throw new EmbeddingException("embedding endpoint returned status " + res.getStatusCode().value());
        }
        float[] emb = res.getBody().getFirstEmbedding();
        if (emb == null || emb.length == 0) {
            throw new EmbeddingException("embedding response carried no vector");
        }
        log.debug("[Embedding] OpenAI-compatible ok dim={}", emb.length);
        return emb;
    }

    private String buildUrl() {
        String base = props.getEmbeddingBaseUrl();
        if (base == null || base.isBlank()) base = "https://api.openai.com";
        return base.replaceAll("/$", "") + EMBEDDINGS_PATH;
    }
}
