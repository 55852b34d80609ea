package com.tsl.search.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.tsl.search.completion.CompletionJson;
import com.tsl.search.completion.CompletionProvider;
import com.tsl.search.completion.CompletionUnavailableException;
import com.tsl.search.completion.MalformedCompletionException;
import com.tsl.search.model.PriceTier;
import com.tsl.search.model.StructuredFields;
import com.tsl.search.resilience.Backoff;
import com.tsl.search.resilience.CircuitBreaker;
import com.tsl.search.resilience.SearchResilienceRegistry;
import com.tsl.search.taxonomy.ActivityMatcher;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@EnableConfigurationProperties(ExtractionProperties.class)
public class FieldExtractor {
    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    static final String PROMPT_TEMPLATE = String.join("\n",
        "Extract structured facts from the travel document below.",
        "Respond with a single JSON object and nothing else, using exactly these keys:",
        "{\"city\": string or null, \"country\": string or null, \"activities\": [string],",
        " \"price_tier\": \"budget\" | \"mid_range\" | \"luxury\" | null}",
        "List every activity the document offers as a short phrase.",
        "Title: %s",
        "Body: %s"
    );

    private final CompletionProvider completionProvider;
    private final ActivityMatcher activityMatcher;
    private final SearchResilienceRegistry resilienceRegistry;
    private final ExtractionProperties properties;
    private final MeterRegistry meterRegistry;

    public FieldExtractor(
        CompletionProvider completionProvider,
        ActivityMatcher activityMatcher,
        SearchResilienceRegistry resilienceRegistry,
        ExtractionProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.completionProvider = completionProvider;
        this.activityMatcher = activityMatcher;
        this.resilienceRegistry = resilienceRegistry;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public ExtractionResult extract(String title, String bodyText) {
        CircuitBreaker breaker = resilienceRegistry.getExtractionBreaker();
        if (!breaker.allowRequest()) {
            return fallback(title, bodyText, ExtractionOutcome.FALLBACK_CIRCUIT_OPEN, 0, "extraction_circuit_open");
        }
        String prompt = String.format(PROMPT_TEMPLATE, nullToEmpty(title), truncate(bodyText));
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        Backoff backoff = new Backoff(properties.getInitialBackoffMs(), properties.getMaxBackoffMs());

        String lastReason = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String completion;
            try {
                completion = completionProvider.complete(prompt, properties.getTimeoutMs());
            } catch (CompletionUnavailableException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new ExtractionCancelledException("extraction_interrupted", e);
                }
                lastReason = e.getMessage();
                boolean opened = breaker.recordFailure();
                log.debug("extraction_attempt_failed attempt={} reason={} retryable={}",
                    attempt, lastReason, e.isRetryable());
                if (opened) {
                    log.warn("extraction_circuit_opened reason={}", lastReason);
                    return fallback(title, bodyText, ExtractionOutcome.FALLBACK_CIRCUIT_OPEN, attempt, lastReason);
                }
                if (!e.isRetryable()) {
                    break;
                }
                if (attempt < maxAttempts) {
                    pause(backoff, attempt);
                }
                continue;
            }

            try {
                StructuredFields fields = toFields(CompletionJson.parseObject(completion));
                breaker.recordSuccess();
                return new ExtractionResult(fields, ExtractionOutcome.EXTRACTED, attempt, null);
            } catch (MalformedCompletionException e) {
                breaker.recordFailure();
                return fallback(title, bodyText, ExtractionOutcome.FALLBACK_SCHEMA, attempt, e.getMessage());
            }
        }
        return fallback(title, bodyText, ExtractionOutcome.FALLBACK_PROVIDER, maxAttempts, lastReason);
    }

    public StructuredFields heuristic(String title, String bodyText) {
        Set<String> activities = activityMatcher.scan(nullToEmpty(title) + "\n" + nullToEmpty(bodyText));
        return new StructuredFields(null, null, activities, null, true);
    }

    private StructuredFields toFields(JsonNode root) {
        String city = CompletionJson.optionalText(root, "city");
        String country = CompletionJson.optionalText(root, "country");
        Set<String> activities = activityMatcher.matchAll(CompletionJson.textList(root, "activities"));
        String tier = CompletionJson.optionalText(root, "price_tier");
        PriceTier priceTier = PriceTier.fromString(tier);
        if (tier != null && priceTier == null) {
            throw new MalformedCompletionException("completion_invalid_price_tier:" + tier);
        }
        return new StructuredFields(city, country, activities, priceTier, false);
    }

    private ExtractionResult fallback(
        String title,
        String bodyText,
        ExtractionOutcome outcome,
        int attempts,
        String reason
    ) {
        meterRegistry.counter("ts_extraction_fallback_total", "reason", outcome.label()).increment();
        log.warn("extraction_fallback outcome={} attempts={} reason={}", outcome.label(), attempts, reason);
        return new ExtractionResult(heuristic(title, bodyText), outcome, attempts, reason);
    }

    private void pause(Backoff backoff, int attempt) {
        try {
            backoff.pause(attempt);
        } catch (InterruptedException e) {
            throw new ExtractionCancelledException("extraction_interrupted", e);
        }
    }

    private String truncate(String bodyText) {
        String body = nullToEmpty(bodyText);
        int max = properties.getMaxBodyChars();
        if (max > 0 && body.length() > max) {
            return body.substring(0, max);
        }
        return body;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
