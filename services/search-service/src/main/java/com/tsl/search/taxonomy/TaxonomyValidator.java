package com.tsl.search.taxonomy;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class TaxonomyValidator {
    private static final Pattern ID_PATTERN = Pattern.compile("^[a-z0-9]+(_[a-z0-9]+)*$");

    private TaxonomyValidator() {}

    public static void validate(TaxonomyDefinition definition) {
        if (definition == null) {
            throw new TaxonomyConfigurationException("taxonomy missing");
        }
        Map<Object, Object> synonyms = definition.getSynonyms();
        Map<Object, Object> categories = definition.getCategories();
        if (synonyms == null || synonyms.isEmpty()) {
            throw new TaxonomyConfigurationException("synonyms table empty");
        }
        if (categories == null || categories.isEmpty()) {
            throw new TaxonomyConfigurationException("categories table empty");
        }

        Set<String> activityIds = new HashSet<>();
        Map<String, String> keyOwners = new HashMap<>();

        for (Map.Entry<Object, Object> entry : synonyms.entrySet()) {
            String phrase = requireText(entry.getKey(), "synonym key");
            String id = requireText(entry.getValue(), "synonym target for '" + phrase + "'");
            requireId(id, "activity id");
            activityIds.add(id);
            String key = TextNormalizer.normalize(phrase);
            if (key.isEmpty()) {
                throw new TaxonomyConfigurationException("synonym key normalizes to nothing: '" + phrase + "'");
            }
            claim(keyOwners, key, id, phrase);
        }

        Map<String, List<?>> members = new HashMap<>();
        for (Map.Entry<Object, Object> entry : categories.entrySet()) {
            String categoryId = requireText(entry.getKey(), "category id");
            requireId(categoryId, "category id");
            if (!(entry.getValue() instanceof List<?> list) || list.isEmpty()) {
                throw new TaxonomyConfigurationException("category '" + categoryId + "' must list at least one activity");
            }
            for (Object member : list) {
                String id = requireText(member, "member of category '" + categoryId + "'");
                requireId(id, "activity id in category '" + categoryId + "'");
                activityIds.add(id);
            }
            members.put(categoryId, list);
        }

        for (String id : activityIds) {
            claim(keyOwners, TextNormalizer.idToPhrase(id), id, id);
        }

        for (String categoryId : members.keySet()) {
            if (activityIds.contains(categoryId)) {
                throw new TaxonomyConfigurationException("category id collides with activity id: " + categoryId);
            }
            String key = TextNormalizer.idToPhrase(categoryId);
            if (keyOwners.containsKey(key)) {
                throw new TaxonomyConfigurationException(
                    "category '" + categoryId + "' shadows synonym key '" + key + "'"
                );
            }
        }
    }

    private static void claim(Map<String, String> owners, String key, String id, String source) {
        String existing = owners.putIfAbsent(key, id);
        if (existing != null && !existing.equals(id)) {
            throw new TaxonomyConfigurationException(
                "ambiguous key '" + key + "' (from '" + source + "') maps to both " + existing + " and " + id
            );
        }
    }

    private static String requireText(Object raw, String what) {
        if (!(raw instanceof String text)) {
            throw new TaxonomyConfigurationException(what + " must be a string, got: " + raw);
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new TaxonomyConfigurationException(what + " must not be blank");
        }
        return trimmed;
    }

    private static void requireId(String id, String what) {
        if (!ID_PATTERN.matcher(id).matches()) {
            throw new TaxonomyConfigurationException("invalid " + what + ": " + id);
        }
    }
}
