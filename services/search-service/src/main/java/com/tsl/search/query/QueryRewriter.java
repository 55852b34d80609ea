package com.tsl.search.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.tsl.search.completion.CompletionJson;
import com.tsl.search.completion.CompletionProvider;
import com.tsl.search.completion.CompletionUnavailableException;
import com.tsl.search.completion.MalformedCompletionException;
import com.tsl.search.model.StructuredFilter;
import com.tsl.search.resilience.Backoff;
import com.tsl.search.service.SearchProperties;
import com.tsl.search.taxonomy.ActivityMatcher;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class QueryRewriter {
    private static final Logger log = LoggerFactory.getLogger(QueryRewriter.class);

    static final String PROMPT_TEMPLATE = String.join("\n",
        "Extract travel search constraints from the user query.",
        "Respond with a single JSON object and nothing else, using exactly these keys:",
        "{\"city\": string or null, \"country\": string or null, \"activities\": [string]}",
        "Use the country the place belongs to (e.g. a region implies its country).",
        "Use null for anything the query does not state or clearly imply.",
        "Query: %s"
    );

    private final CompletionProvider completionProvider;
    private final ActivityMatcher activityMatcher;
    private final SearchProperties properties;

    public QueryRewriter(
        CompletionProvider completionProvider,
        ActivityMatcher activityMatcher,
        SearchProperties properties
    ) {
        this.completionProvider = completionProvider;
        this.activityMatcher = activityMatcher;
        this.properties = properties;
    }

    public RewriteResult rewrite(String query) {
        if (query == null || query.isBlank()) {
            return RewriteResult.skipped();
        }
        SearchProperties.Rewrite rewrite = properties.getRewrite();
        int maxAttempts = Math.max(1, rewrite.getMaxAttempts());
        Backoff backoff = Backoff.fixed(rewrite.getBackoffMs());
        String prompt = String.format(PROMPT_TEMPLATE, query.trim());

        String lastReason = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String completion = completionProvider.complete(prompt, rewrite.getTimeoutMs());
                StructuredFilter filter = toFilter(CompletionJson.parseObject(completion));
                return new RewriteResult(filter, false, attempt, null);
            } catch (CompletionUnavailableException | MalformedCompletionException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new QueryRewriteCancelledException("rewrite_interrupted", e);
                }
                lastReason = e.getMessage();
                log.debug("rewrite_attempt_failed attempt={} reason={}", attempt, lastReason);
            }
            if (attempt < maxAttempts) {
                try {
                    backoff.pause(attempt);
                } catch (InterruptedException e) {
                    throw new QueryRewriteCancelledException("rewrite_interrupted", e);
                }
            }
        }
        log.warn("rewrite_degraded attempts={} reason={}", maxAttempts, lastReason);
        return RewriteResult.degraded(maxAttempts, lastReason);
    }

    private StructuredFilter toFilter(JsonNode root) {
        String city = CompletionJson.optionalText(root, "city");
        String country = CompletionJson.optionalText(root, "country");
        List<String> phrases = CompletionJson.textList(root, "activities");
        Set<String> activities = activityMatcher.matchAll(phrases);
        return new StructuredFilter(city, country, activities);
    }
}
