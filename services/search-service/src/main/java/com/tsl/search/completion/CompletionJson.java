package com.tsl.search.completion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class CompletionJson {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Set<String> NULL_WORDS = Set.of("null", "none", "n/a", "unknown", "");

    private CompletionJson() {
    }

    public static JsonNode parseObject(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedCompletionException("completion_blank");
        }
        String body = stripFences(text.trim());
        int start = body.indexOf('{');
        int end = body.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new MalformedCompletionException("completion_not_object");
        }
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(body.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new MalformedCompletionException("completion_invalid_json", e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedCompletionException("completion_not_object");
        }
        return node;
    }

    public static String optionalText(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new MalformedCompletionException("completion_field_not_scalar:" + field);
        }
        String text = value.asText("").trim();
        return NULL_WORDS.contains(text.toLowerCase(Locale.ROOT)) ? null : text;
    }

    public static List<String> textList(JsonNode root, String field) {
        JsonNode value = root.get(field);
        List<String> items = new ArrayList<>();
        if (value == null || value.isNull()) {
            return items;
        }
        if (value.isTextual()) {
            addIfPresent(items, value.asText());
            return items;
        }
        if (!value.isArray()) {
            throw new MalformedCompletionException("completion_field_not_list:" + field);
        }
        for (JsonNode item : value) {
            if (item != null && item.isValueNode() && !item.isNull()) {
                addIfPresent(items, item.asText());
            }
        }
        return items;
    }

    private static void addIfPresent(List<String> items, String raw) {
        String text = raw == null ? "" : raw.trim();
        if (!NULL_WORDS.contains(text.toLowerCase(Locale.ROOT))) {
            items.add(text);
        }
    }

    private static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String inner = text.substring(3);
        int close = inner.lastIndexOf("```");
        if (close >= 0) {
            inner = inner.substring(0, close);
        }
        if (inner.regionMatches(true, 0, "json", 0, 4)) {
            inner = inner.substring(4);
        }
        return inner.trim();
    }
}
