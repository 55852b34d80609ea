package com.tsl.search.completion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
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
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
public class CompletionGateway implements CompletionProvider {
    static final String SYSTEM_PROMPT =
        "You extract structured information from travel text. Always answer with valid JSON only.";

    private final HttpClient httpClient;
    private final CompletionProperties properties;

    public CompletionGateway(
        @Qualifier("completionHttpClient") HttpClient httpClient,
        CompletionProperties properties
    ) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public String complete(String prompt, Integer timeoutMs) {
        if (prompt == null || prompt.isBlank()) {
            throw new CompletionUnavailableException("completion_empty_prompt", false);
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new CompletionUnavailableException("completion_base_url_missing", false);
        }

        ChatRequest request = new ChatRequest();
        request.setModel(properties.getModel());
        request.setTemperature(properties.getTemperature());
        request.setMaxTokens(properties.getMaxTokens());
        request.setMessages(List.of(new ChatMessage("system", SYSTEM_PROMPT), new ChatMessage("user", prompt)));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey());
        }

        try {
            ResponseEntity<ChatResponse> response = restTemplateFor(timeoutMs).exchange(
                buildUrl("/v1/chat/completions"),
                HttpMethod.POST,
                new HttpEntity<>(request, headers),
                ChatResponse.class
            );
            return firstContent(response.getBody());
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            boolean retryable = status == 408 || status == 429 || status >= 500;
            throw new CompletionUnavailableException("completion_http_" + status, retryable, e);
        } catch (ResourceAccessException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CompletionUnavailableException("completion_interrupted", false, e);
            }
            Throwable cause = e.getCause();
            if (cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException) {
                throw new CompletionUnavailableException("completion_timeout", true, e);
            }
            throw new CompletionUnavailableException("completion_unavailable", true, e);
        } catch (RestClientException e) {
            throw new CompletionUnavailableException("completion_bad_response", false, e);
        }
    }

    private String firstContent(ChatResponse body) {
        if (body == null || body.getChoices() == null || body.getChoices().isEmpty()) {
            throw new CompletionUnavailableException("completion_empty_response", true);
        }
        ChatMessage message = body.getChoices().get(0).getMessage();
        if (message == null || message.getContent() == null) {
            throw new CompletionUnavailableException("completion_empty_message", true);
        }
        return message.getContent();
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private RestTemplate restTemplateFor(Integer timeoutMs) {
        int effective = timeoutMs == null || timeoutMs <= 0 ? properties.getTimeoutMs() : timeoutMs;
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofMillis(Math.max(1, effective)));
        return new RestTemplate(factory);
    }

    public static class ChatRequest {
        private String model;
        private List<ChatMessage> messages;
        private Double temperature;

        @JsonProperty("max_tokens")
        private Integer maxTokens;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<ChatMessage> getMessages() {
            return messages;
        }

        public void setMessages(List<ChatMessage> messages) {
            this.messages = messages;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public Integer getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatMessage {
        private String role;
        private String content;

        public ChatMessage() {
        }

        public ChatMessage(String role, String content) {
            this.role = role;
            this.content = content;
        }

        public String getRole() {
            return role;
        }

        public void setRole(String role) {
            this.role = role;
        }

        public String getContent() {
            return content;
        }

        public void setContent(String content) {
            this.content = content;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatResponse {
        private List<Choice> choices;

        public List<Choice> getChoices() {
            return choices;
        }

        public void setChoices(List<Choice> choices) {
            this.choices = choices;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private ChatMessage message;

        public ChatMessage getMessage() {
            return message;
        }

        public void setMessage(ChatMessage message) {
            this.message = message;
        }
    }
}
