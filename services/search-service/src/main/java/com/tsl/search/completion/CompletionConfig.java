package com.tsl.search.completion;

import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CompletionProperties.class)
public class CompletionConfig {

    @Bean
    public HttpClient completionHttpClient(CompletionProperties properties) {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(Math.max(1, properties.getConnectTimeoutMs())))
            .build();
    }
}
