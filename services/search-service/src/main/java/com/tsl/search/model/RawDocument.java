package com.tsl.search.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class RawDocument {
    private final String docId;
    private final String title;
    private final String bodyText;
    private final List<String> activities;

    public RawDocument(String docId, String title, String bodyText, List<String> activities) {
        this.docId = docId;
        this.title = title;
        this.bodyText = bodyText;
        this.activities = activities == null
            ? List.of()
            : activities.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }

    public String getDocId() {
        return docId;
    }

    public String getTitle() {
        return title;
    }

    public String getBodyText() {
        return bodyText;
    }

    public List<String> getActivities() {
        return activities;
    }
}
