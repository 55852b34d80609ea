package com.tsl.search.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.SocketTimeoutException;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

@Component
public class EmbeddingGateway {
    private final HttpClient httpClient;
    private final EmbeddingProperties properties;

    public EmbeddingGateway(
        @Qualifier("embeddingHttpClient") HttpClient httpClient,
        EmbeddingProperties properties
    ) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    public List<Double> embed(String text, Integer timeBudgetMs) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text", false);
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new EmbeddingUnavailableException("embed_base_url_missing", false);
        }
        EmbeddingRequest request = new EmbeddingRequest();
        request.setModel(properties.getModel());
        request.setInput(List.of(text));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey());
        }
        HttpEntity<EmbeddingRequest> entity = new HttpEntity<>(request, headers);

        int retries = Math.max(0, properties.getRetryCount());
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                ResponseEntity<EmbeddingResponse> response = restTemplateFor(timeBudgetMs).exchange(
                    buildUrl("/v1/embeddings"),
                    HttpMethod.POST,
                    entity,
                    EmbeddingResponse.class
                );
                EmbeddingResponse body = response.getBody();
                if (body == null || body.getData() == null || body.getData().isEmpty()) {
                    throw new EmbeddingUnavailableException("embed_empty_response");
                }
                List<Double> vector = body.getData().get(0).getEmbedding();
                if (vector == null || vector.isEmpty()) {
                    throw new EmbeddingUnavailableException("embed_empty_vector");
                }
                return vector;
            } catch (ResourceAccessException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new EmbeddingUnavailableException("embed_interrupted", e);
                }
                if (attempt >= retries) {
                    String reason = "embed_unavailable";
                    if (e.getCause() instanceof HttpTimeoutException || e.getCause() instanceof SocketTimeoutException) {
                        reason = "embed_timeout";
                    }
                    throw new EmbeddingUnavailableException(reason, e);
                }
            } catch (HttpStatusCodeException e) {
                int status = e.getStatusCode().value();
                boolean retryable = status == 408 || status == 429 || status >= 500;
                if (!retryable || attempt >= retries) {
                    throw new EmbeddingUnavailableException("embed_http_" + status, retryable, e);
                }
            }
        }
        throw new EmbeddingUnavailableException("embed_unavailable");
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private RestTemplate restTemplateFor(Integer timeBudgetMs) {
        int timeoutMs = timeBudgetMs == null || timeBudgetMs <= 0 ? properties.getTimeoutMs() : timeBudgetMs;
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofMillis(Math.max(1, timeoutMs)));
        return new RestTemplate(factory);
    }

    public static class EmbeddingRequest {
        private String model;
        private List<String> input;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<String> getInput() {
            return input;
        }

        public void setInput(List<String> input) {
            this.input = input;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingResponse {
        private String model;
        private List<EmbeddingData> data;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<EmbeddingData> getData() {
            return data;
        }

        public void setData(List<EmbeddingData> data) {
            this.data = data;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingData {
        private Integer index;
        private List<Double> embedding;

        public Integer getIndex() {
            return index;
        }

        public void setIndex(Integer index) {
            this.index = index;
        }

        public List<Double> getEmbedding() {
            return embedding;
        }

        public void setEmbedding(List<Double> embedding) {
            this.embedding = embedding;
        }
    }
}
