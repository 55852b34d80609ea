package com.tsl.search.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tsl.search.completion.CompletionProvider;
import com.tsl.search.completion.CompletionUnavailableException;
import com.tsl.search.model.PriceTier;
import com.tsl.search.model.StructuredFields;
import com.tsl.search.resilience.SearchResilienceProperties;
import com.tsl.search.resilience.SearchResilienceRegistry;
import com.tsl.search.taxonomy.ActivityMatcher;
import com.tsl.search.taxonomy.TaxonomyLoader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FieldExtractorTest {
    private static final ActivityMatcher MATCHER = new ActivityMatcher(
        new TaxonomyLoader().load("classpath:taxonomy/travel-taxonomy.yml"),
        ActivityMatcher.DEFAULT_SIMILARITY_THRESHOLD
    );
    private static final String TITLE = "Maldives reef escape";
    private static final String BODY = "Snorkelling over coral reefs and scuba diving at dawn.";

    private CompletionProvider completionProvider;
    private SearchResilienceRegistry resilienceRegistry;
    private SimpleMeterRegistry meterRegistry;
    private FieldExtractor extractor;

    @BeforeEach
    void setUp() {
        completionProvider = mock(CompletionProvider.class);
        SearchResilienceProperties resilience = new SearchResilienceProperties();
        resilience.setExtractionFailureThreshold(3);
        resilienceRegistry = new SearchResilienceRegistry(resilience);
        ExtractionProperties properties = new ExtractionProperties();
        properties.setMaxAttempts(2);
        properties.setInitialBackoffMs(0L);
        meterRegistry = new SimpleMeterRegistry();
        extractor = new FieldExtractor(completionProvider, MATCHER, resilienceRegistry, properties, meterRegistry);
    }

    @Test
    void extractsCanonicalFields() {
        when(completionProvider.complete(anyString(), any())).thenReturn(
            "{\"city\": \"Male\", \"country\": \"Maldives\", \"activities\": [\"snorkelling\", \"scuba\"],"
                + " \"price_tier\": \"luxury\"}"
        );

        ExtractionResult result = extractor.extract(TITLE, BODY);

        assertThat(result.getOutcome()).isEqualTo(ExtractionOutcome.EXTRACTED);
        StructuredFields fields = result.getFields();
        assertThat(fields.getCity()).isEqualTo("Male");
        assertThat(fields.getCountry()).isEqualTo("Maldives");
        assertThat(fields.getActivities()).containsExactly("diving", "snorkeling");
        assertThat(fields.getPriceTier()).isEqualTo(PriceTier.LUXURY);
        assertThat(fields.isPartial()).isFalse();
    }

    @Test
    void providerFailureFallsBackToKeywordScan() {
        when(completionProvider.complete(anyString(), any()))
            .thenThrow(new CompletionUnavailableException("completion_http_503", true));

        ExtractionResult result = extractor.extract(TITLE, BODY);

        assertThat(result.getOutcome()).isEqualTo(ExtractionOutcome.FALLBACK_PROVIDER);
        assertThat(result.getAttempts()).isEqualTo(2);
        assertThat(result.getFields().isPartial()).isTrue();
        assertThat(result.getFields().getCity()).isNull();
        assertThat(result.getFields().getActivities()).contains("snorkeling", "diving");
        assertThat(meterRegistry.counter("ts_extraction_fallback_total", "reason", "fallback_provider").count())
            .isEqualTo(1.0);
        verify(completionProvider, times(2)).complete(anyString(), any());
    }

    @Test
    void nonRetryableFailureStopsImmediately() {
        when(completionProvider.complete(anyString(), any()))
            .thenThrow(new CompletionUnavailableException("completion_http_401", false));

        ExtractionResult result = extractor.extract(TITLE, BODY);

        assertThat(result.getOutcome()).isEqualTo(ExtractionOutcome.FALLBACK_PROVIDER);
        verify(completionProvider, times(1)).complete(anyString(), any());
    }

    @Test
    void schemaViolationFallsBackWithoutRetry() {
        when(completionProvider.complete(anyString(), any()))
            .thenReturn("{\"city\": \"Male\", \"price_tier\": \"astronomical\"}");

        ExtractionResult result = extractor.extract(TITLE, BODY);

        assertThat(result.getOutcome()).isEqualTo(ExtractionOutcome.FALLBACK_SCHEMA);
        assertThat(result.getReason()).startsWith("completion_invalid_price_tier");
        assertThat(result.getFields().isPartial()).isTrue();
        verify(completionProvider, times(1)).complete(anyString(), any());
    }

    @Test
    void openBreakerSkipsProvider() {
        when(completionProvider.complete(anyString(), any()))
            .thenThrow(new CompletionUnavailableException("completion_timeout", true));

        extractor.extract(TITLE, BODY);
        ExtractionResult tripped = extractor.extract(TITLE, BODY);
        ExtractionResult skipped = extractor.extract(TITLE, BODY);

        assertThat(tripped.getOutcome()).isEqualTo(ExtractionOutcome.FALLBACK_CIRCUIT_OPEN);
        assertThat(skipped.getOutcome()).isEqualTo(ExtractionOutcome.FALLBACK_CIRCUIT_OPEN);
        assertThat(skipped.getAttempts()).isZero();
        verify(completionProvider, times(3)).complete(anyString(), any());
    }

    @Test
    void heuristicScansLiteralMentions() {
        StructuredFields fields = extractor.heuristic("Hot air balloon at sunrise", null);

        assertThat(fields.getActivities()).containsExactly("balloon_ride");
        assertThat(fields.isPartial()).isTrue();
        verify(completionProvider, never()).complete(anyString(), any());
    }
}
