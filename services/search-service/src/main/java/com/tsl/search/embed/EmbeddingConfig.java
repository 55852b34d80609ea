package com.tsl.search.embed;

import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfig {

    @Bean
    public HttpClient embeddingHttpClient(EmbeddingProperties properties) {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(Math.max(1, properties.getConnectTimeoutMs())))
            .build();
    }

    @Bean
    public ToyEmbedder toyEmbedder(EmbeddingProperties properties) {
        return new ToyEmbedder(properties.getDimension());
    }
}
