package com.tsl.search.index;

import com.tsl.search.embed.EmbeddingProperties;
import com.tsl.search.service.SearchProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({SearchProperties.class, EmbeddingProperties.class})
public class IndexConfig {

    @Bean
    public LexicalIndex lexicalIndex(SearchProperties properties) {
        SearchProperties.Bm25 bm25 = properties.getBm25();
        return new LexicalIndex(bm25.getK1(), bm25.getB());
    }

    @Bean
    public VectorIndex vectorIndex(EmbeddingProperties properties) {
        return new VectorIndex(properties.getDimension());
    }
}
