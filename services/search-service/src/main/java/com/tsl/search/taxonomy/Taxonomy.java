package com.tsl.search.taxonomy;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

public final class Taxonomy {
    private final String version;
    private final Map<String, String> synonymMap;
    private final Map<String, Set<String>> categoryMap;
    private final Map<String, String> categoryKeys;
    private final Set<String> activityIds;
    private final int maxKeyTokens;

    private Taxonomy(
        String version,
        Map<String, String> synonymMap,
        Map<String, Set<String>> categoryMap,
        Map<String, String> categoryKeys,
        Set<String> activityIds
    ) {
        this.version = version;
        this.synonymMap = Collections.unmodifiableMap(synonymMap);
        this.categoryMap = Collections.unmodifiableMap(categoryMap);
        this.categoryKeys = Collections.unmodifiableMap(categoryKeys);
        this.activityIds = Collections.unmodifiableSet(activityIds);
        int longest = 1;
        for (String key : synonymMap.keySet()) {
            longest = Math.max(longest, key.split(" ").length);
        }
        for (String key : categoryKeys.keySet()) {
            longest = Math.max(longest, key.split(" ").length);
        }
        this.maxKeyTokens = longest;
    }

    public static Taxonomy from(TaxonomyDefinition definition) {
        Map<String, String> synonyms = new TreeMap<>();
        Set<String> activityIds = new TreeSet<>();
        for (Map.Entry<Object, Object> entry : definition.getSynonyms().entrySet()) {
            String id = entry.getValue().toString().trim();
            synonyms.put(TextNormalizer.normalize(entry.getKey().toString()), id);
            activityIds.add(id);
        }

        Map<String, Set<String>> categories = new TreeMap<>();
        Map<String, String> categoryKeys = new HashMap<>();
        for (Map.Entry<Object, Object> entry : definition.getCategories().entrySet()) {
            String categoryId = entry.getKey().toString().trim();
            Set<String> members = new LinkedHashSet<>();
            for (Object member : (List<?>) entry.getValue()) {
                String id = member.toString().trim();
                members.add(id);
                activityIds.add(id);
            }
            categories.put(categoryId, Collections.unmodifiableSet(new TreeSet<>(members)));
            categoryKeys.put(TextNormalizer.idToPhrase(categoryId), categoryId);
        }

        for (String id : activityIds) {
            synonyms.putIfAbsent(TextNormalizer.idToPhrase(id), id);
        }
        return new Taxonomy(definition.getVersion(), synonyms, categories, categoryKeys, activityIds);
    }

    public String getVersion() {
        return version;
    }

    public Map<String, String> getSynonymMap() {
        return synonymMap;
    }

    public Map<String, Set<String>> getCategoryMap() {
        return categoryMap;
    }

    public Set<String> getActivityIds() {
        return activityIds;
    }

    public int getMaxKeyTokens() {
        return maxKeyTokens;
    }

    String lookupActivity(String normalizedKey) {
        return synonymMap.get(normalizedKey);
    }

    Set<String> lookupCategory(String normalizedKey) {
        String categoryId = categoryKeys.get(normalizedKey);
        return categoryId == null ? null : categoryMap.get(categoryId);
    }

    Set<String> allKeys() {
        Set<String> keys = new TreeSet<>(synonymMap.keySet());
        keys.addAll(categoryKeys.keySet());
        return keys;
    }
}
