package com.tsl.search.model;

import java.util.Arrays;

public final class Document {
    private final String docId;
    private final String title;
    private final String bodyText;
    private final StructuredFields fields;
    private final float[] embedding;

    public Document(String docId, String title, String bodyText, StructuredFields fields, float[] embedding) {
        this.docId = docId;
        this.title = title == null ? "" : title;
        this.bodyText = bodyText == null ? "" : bodyText;
        this.fields = fields == null ? StructuredFields.empty() : fields;
        this.embedding = embedding == null ? new float[0] : embedding.clone();
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

    public StructuredFields getFields() {
        return fields;
    }

    public float[] getEmbedding() {
        return embedding.clone();
    }

    public int getDimension() {
        return embedding.length;
    }

    public Document withEmbedding(float[] vector) {
        return new Document(docId, title, bodyText, fields, vector);
    }

    public RawDocument toRaw() {
        return new RawDocument(docId, title, bodyText, null);
    }

    public boolean sameContent(Document other) {
        return other != null
            && docId.equals(other.docId)
            && title.equals(other.title)
            && bodyText.equals(other.bodyText)
            && fields.equals(other.fields)
            && Arrays.equals(embedding, other.embedding);
    }
}
