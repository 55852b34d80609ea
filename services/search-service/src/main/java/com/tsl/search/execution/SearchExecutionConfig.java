package com.tsl.search.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SearchExecutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService searchExecutor(@Value("${search.execution.pool-size:8}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(4, poolSize));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService indexingExecutor(@Value("${indexing.concurrency:5}") int concurrency) {
        return Executors.newFixedThreadPool(Math.max(1, concurrency));
    }
}
