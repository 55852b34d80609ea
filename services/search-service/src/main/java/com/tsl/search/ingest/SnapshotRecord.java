package com.tsl.search.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tsl.search.model.Document;
import com.tsl.search.model.PriceTier;
import com.tsl.search.model.RawDocument;
import com.tsl.search.model.StructuredFields;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SnapshotRecord {
    @JsonProperty("doc_id")
    private String docId;
    private String title;
    @JsonProperty("body_text")
    private String bodyText;
    @JsonProperty("declared_activities")
    private List<String> declaredActivities;
    private String city;
    private String country;
    private List<String> activities;
    @JsonProperty("price_tier")
    private PriceTier priceTier;
    private boolean partial;
    private float[] embedding;

    public static SnapshotRecord of(Document document, RawDocument raw) {
        SnapshotRecord record = new SnapshotRecord();
        StructuredFields fields = document.getFields();
        record.setDocId(document.getDocId());
        record.setTitle(document.getTitle());
        record.setBodyText(document.getBodyText());
        record.setDeclaredActivities(raw == null ? List.of() : raw.getActivities());
        record.setCity(fields.getCity());
        record.setCountry(fields.getCountry());
        record.setActivities(new ArrayList<>(fields.getActivities()));
        record.setPriceTier(fields.getPriceTier());
        record.setPartial(fields.isPartial());
        record.setEmbedding(document.getEmbedding());
        return record;
    }

    public Document toDocument() {
        StructuredFields fields = new StructuredFields(
            city,
            country,
            activities == null ? null : new TreeSet<>(activities),
            priceTier,
            partial
        );
        return new Document(docId, title, bodyText, fields, embedding);
    }

    public RawDocument toRaw() {
        return new RawDocument(docId, title, bodyText, declaredActivities);
    }

    public String getDocId() {
        return docId;
    }

    public void setDocId(String docId) {
        this.docId = docId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getBodyText() {
        return bodyText;
    }

    public void setBodyText(String bodyText) {
        this.bodyText = bodyText;
    }

    public List<String> getDeclaredActivities() {
        return declaredActivities;
    }

    public void setDeclaredActivities(List<String> declaredActivities) {
        this.declaredActivities = declaredActivities;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public List<String> getActivities() {
        return activities;
    }

    public void setActivities(List<String> activities) {
        this.activities = activities;
    }

    public PriceTier getPriceTier() {
        return priceTier;
    }

    public void setPriceTier(PriceTier priceTier) {
        this.priceTier = priceTier;
    }

    public boolean isPartial() {
        return partial;
    }

    public void setPartial(boolean partial) {
        this.partial = partial;
    }

    public float[] getEmbedding() {
        return embedding;
    }

    public void setEmbedding(float[] embedding) {
        this.embedding = embedding;
    }
}
