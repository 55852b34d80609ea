package com.tsl.search.taxonomy;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TaxonomyProperties.class)
public class TaxonomyConfig {

    @Bean
    public Taxonomy taxonomy(TaxonomyProperties properties) {
        return new TaxonomyLoader().load(properties.getPath());
    }

    @Bean
    public ActivityMatcher activityMatcher(Taxonomy taxonomy, TaxonomyProperties properties) {
        return new ActivityMatcher(taxonomy, properties.getSimilarityThreshold());
    }
}
