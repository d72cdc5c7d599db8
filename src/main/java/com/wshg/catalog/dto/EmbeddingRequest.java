package com.wshg.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * OpenAI-compatible /v1/embeddings request body.
 */
@Data
@Builder
public class EmbeddingRequest {

    private String model;
    private String input;
    private Integer dimensions;
    @JsonProperty("encoding_format")
    private String encodingFormat;

    public static EmbeddingRequest single(String model, String text, int dimensions) {
        return EmbeddingRequest.builder()
                .model(model)
                .input(text)
                .dimensions(dimensions)
                .encodingFormat("float")
                .build();
    }
}
