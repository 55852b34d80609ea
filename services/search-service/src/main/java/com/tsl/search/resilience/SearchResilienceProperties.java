package com.tsl.search.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.resilience")
public class SearchResilienceProperties {
    private int embedFailureThreshold = 3;
    private long embedOpenMs = 30000;
    private int extractionFailureThreshold = 5;
    private long extractionOpenMs = 60000;

    public int getEmbedFailureThreshold() {
        return embedFailureThreshold;
    }

    public void setEmbedFailureThreshold(int embedFailureThreshold) {
        this.embedFailureThreshold = embedFailureThreshold;
    }

    public long getEmbedOpenMs() {
        return embedOpenMs;
    }

    public void setEmbedOpenMs(long embedOpenMs) {
        this.embedOpenMs = embedOpenMs;
    }

    public int getExtractionFailureThreshold() {
        return extractionFailureThreshold;
    }

    public void setExtractionFailureThreshold(int extractionFailureThreshold) {
        this.extractionFailureThreshold = extractionFailureThreshold;
    }

    public long getExtractionOpenMs() {
        return extractionOpenMs;
    }

    public void setExtractionOpenMs(long extractionOpenMs) {
        this.extractionOpenMs = extractionOpenMs;
    }
}
