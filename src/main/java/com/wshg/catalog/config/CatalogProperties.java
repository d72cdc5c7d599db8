package com.wshg.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Catalog configuration.
 * - embedding-provider: hashing (local, deterministic) / ollama / openai
 * - embedding-enabled=false persists new resources as UNVECTORIZED instead of calling the port
 */
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    // ---------- embedding ----------
    private String embeddingProvider = "hashing";
    private boolean embeddingEnabled = true;
    /** Fixed dimensionality of every vector in the store. */
    private int embeddingDimensions = 256;
    private String embeddingBaseUrl;
    private String embeddingModel = "text-embedding-v3";
    private String embeddingApiKey;
    private int embeddingConnectTimeoutMs = 10_000;
    private int embeddingReadTimeoutMs = 60_000;

    // ---------- search / list ----------
    private int searchDefaultK = 10;
    private int searchMaxK = 100;
    private int listDefaultLimit = 50;
    private int listMaxLimit = 1000;

    // ---------- validation ----------
    /** Empty means any provider is accepted. */
    private List<String> allowedProviders = new ArrayList<>();

    /** Deadline applied to operations whose caller supplies none. */
    private long operationTimeoutMs = 30_000;

    public String getEmbeddingProvider() { return embeddingProvider; }
    public void setEmbeddingProvider(String embeddingProvider) { this.embeddingProvider = embeddingProvider; }
    public boolean isEmbeddingEnabled() { return embeddingEnabled; }
    public void setEmbeddingEnabled(boolean embeddingEnabled) { this.embeddingEnabled = embeddingEnabled; }
    public int getEmbeddingDimensions() { return embeddingDimensions; }
    public void setEmbeddingDimensions(int embeddingDimensions) { this.embeddingDimensions = embeddingDimensions; }
    public String getEmbeddingBaseUrl() { return embeddingBaseUrl; }
    public void setEmbeddingBaseUrl(String embeddingBaseUrl) { this.embeddingBaseUrl = embeddingBaseUrl; }
    public String getEmbeddingModel() { return embeddingModel; }
    public void setEmbeddingModel(String embeddingModel) { this.embeddingModel = embeddingModel; }
    public String getEmbeddingApiKey() { return embeddingApiKey; }
    public void setEmbeddingApiKey(String embeddingApiKey) { this.embeddingApiKey = embeddingApiKey; }
    public int getEmbeddingConnectTimeoutMs() { return embeddingConnectTimeoutMs; }
    public void setEmbeddingConnectTimeoutMs(int embeddingConnectTimeoutMs) { this.embeddingConnectTimeoutMs = embeddingConnectTimeoutMs; }
    public int getEmbeddingReadTimeoutMs() { return embeddingReadTimeoutMs; }
    public void setEmbeddingReadTimeoutMs(int embeddingReadTimeoutMs) { this.embeddingReadTimeoutMs = embeddingReadTimeoutMs; }

    public int getSearchDefaultK() { return searchDefaultK; }
    public void setSearchDefaultK(int searchDefaultK) { this.searchDefaultK = searchDefaultK; }
    public int getSearchMaxK() { return searchMaxK; }
    public void setSearchMaxK(int searchMaxK) { this.searchMaxK = searchMaxK; }
    public int getListDefaultLimit() { return listDefaultLimit; }
    public void setListDefaultLimit(int listDefaultLimit) { this.listDefaultLimit = listDefaultLimit; }
    public int getListMaxLimit() { return listMaxLimit; }
    public void setListMaxLimit(int listMaxLimit) { this.listMaxLimit = listMaxLimit; }

    public List<String> getAllowedProviders() { return allowedProviders; }
    public void setAllowedProviders(List<String> allowedProviders) { this.allowedProviders = allowedProviders; }

    public long getOperationTimeoutMs() { return operationTimeoutMs; }
    public void setOperationTimeoutMs(long operationTimeoutMs) { this.operationTimeoutMs = operationTimeoutMs; }

    public Duration getOperationTimeout() { return Duration.ofMillis(operationTimeoutMs); }
}
