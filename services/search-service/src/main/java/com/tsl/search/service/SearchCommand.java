package com.tsl.search.service;

public final class SearchCommand {
    private final String query;
    private final SearchMode mode;
    private final Integer limit;

    public SearchCommand(String query, SearchMode mode, Integer limit) {
        this.query = query;
        this.mode = mode == null ? SearchMode.HYBRID : mode;
        this.limit = limit;
    }

    public static SearchCommand hybrid(String query, Integer limit) {
        return new SearchCommand(query, SearchMode.HYBRID, limit);
    }

    public String getQuery() {
        return query;
    }

    public SearchMode getMode() {
        return mode;
    }

    public Integer getLimit() {
        return limit;
    }
}
