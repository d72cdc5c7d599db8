package com.wshg.catalog.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate for the remote embedding endpoints (Ollama / OpenAI-compatible).
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(CatalogProperties props) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(props.getEmbeddingConnectTimeoutMs());
        factory.setReadTimeout(props.getEmbeddingReadTimeoutMs());
        return new RestTemplate(factory);
    }
}
