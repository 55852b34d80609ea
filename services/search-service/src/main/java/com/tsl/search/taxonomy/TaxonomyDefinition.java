package com.tsl.search.taxonomy;

import java.util.Map;

public class TaxonomyDefinition {
    private final String version;
    private final Map<Object, Object> synonyms;
    private final Map<Object, Object> categories;

    public TaxonomyDefinition(String version, Map<Object, Object> synonyms, Map<Object, Object> categories) {
        this.version = version;
        this.synonyms = synonyms;
        this.categories = categories;
    }

    public String getVersion() {
        return version;
    }

    public Map<Object, Object> getSynonyms() {
        return synonyms;
    }

    public Map<Object, Object> getCategories() {
        return categories;
    }
}
