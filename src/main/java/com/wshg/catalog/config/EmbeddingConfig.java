package com.wshg.catalog.config;

import com.wshg.catalog.embedding.EmbeddingPort;
import com.wshg.catalog.embedding.HashingEmbeddingClient;
import com.wshg.catalog.embedding.OllamaEmbeddingClient;
import com.wshg.catalog.embedding.OpenAiEmbeddingClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class EmbeddingConfig {

    @Bean
    @ConditionalOnProperty(name = "catalog.embedding-provider", havingValue = "hashing", matchIfMissing = true)
    public EmbeddingPort hashingEmbeddingClient(CatalogProperties props) {
        return new HashingEmbeddingClient(props.getEmbeddingDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "catalog.embedding-provider", havingValue = "ollama")
    public EmbeddingPort ollamaEmbeddingClient(CatalogProperties props, RestTemplate restTemplate) {
        return new OllamaEmbeddingClient(props, restTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "catalog.embedding-provider", havingValue = "openai")
    public EmbeddingPort openAiEmbeddingClient(CatalogProperties props, RestTemplate restTemplate) {
        return new OpenAiEmbeddingClient(props, restTemplate);
    }
}
