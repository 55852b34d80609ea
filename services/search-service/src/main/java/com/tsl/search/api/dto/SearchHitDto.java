package com.tsl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class SearchHitDto {
    @JsonProperty("doc_id")
    private String docId;
    private int rank;
    private double score;
    private List<String> sources;
    private String title;
    private FieldsDto fields;

    public String getDocId() {
        return docId;
    }

    public void setDocId(String docId) {
        this.docId = docId;
    }

    public int getRank() {
        return rank;
    }

    public void setRank(int rank) {
        this.rank = rank;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public FieldsDto getFields() {
        return fields;
    }

    public void setFields(FieldsDto fields) {
        this.fields = fields;
    }
}
