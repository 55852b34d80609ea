package com.tsl.search.taxonomy;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "taxonomy")
public class TaxonomyProperties {
    private String path = "classpath:taxonomy/travel-taxonomy.yml";
    private double similarityThreshold = ActivityMatcher.DEFAULT_SIMILARITY_THRESHOLD;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }
}
