package com.wshg.catalog.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Ollama /api/embed request body.
 */
@Data
@Builder
public class OllamaEmbedRequest {
    private String model;
    private String input;

    public static OllamaEmbedRequest single(String model, String text) {
        return OllamaEmbedRequest.builder().model(model).input(text).build();
    }
}
