package com.tsl.search.index;

import com.tsl.search.model.Document;
import com.tsl.search.model.RankedEntry;
import com.tsl.search.model.RetrievalSource;
import com.tsl.search.model.StructuredFields;
import com.tsl.search.model.StructuredFilter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherFactory;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopFieldDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.util.BytesRef;

public class LexicalIndex implements Closeable {
    private static final String DOC_ID_FIELD = "doc_id";
    private static final String CITY_FIELD = "city";
    private static final String COUNTRY_FIELD = "country";
    private static final String ACTIVITY_FIELD = "activity";
    private static final Set<String> ID_ONLY = Set.of(DOC_ID_FIELD);
    private static final Sort RANKING = new Sort(
        SortField.FIELD_SCORE,
        new SortField(DOC_ID_FIELD, SortField.Type.STRING)
    );

    private final ByteBuffersDirectory directory = new ByteBuffersDirectory();
    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    public LexicalIndex(double k1, double b) {
        if (k1 < 0.0) {
            throw new IllegalArgumentException("k1 must be >= 0: " + k1);
        }
        if (b < 0.0 || b > 1.0) {
            throw new IllegalArgumentException("b must be within [0, 1]: " + b);
        }
        BM25Similarity similarity = new BM25Similarity((float) k1, (float) b);
        try {
            this.writer = new IndexWriter(
                directory,
                new IndexWriterConfig(TextAnalyzer.analyzer()).setSimilarity(similarity)
            );
            this.searcherManager = new SearcherManager(writer, new SearcherFactory() {
                @Override
                public IndexSearcher newSearcher(IndexReader reader, IndexReader previousReader) {
                    IndexSearcher searcher = new IndexSearcher(reader);
                    searcher.setSimilarity(similarity);
                    return searcher;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("lexical index could not be opened", e);
        }
    }

    public void upsert(Document document) {
        if (document == null || document.getDocId() == null || document.getDocId().isBlank()) {
            throw new IndexWriteException("lexical_invalid_document");
        }
        Entry entry = Entry.of(document);
        writeLock.lock();
        try {
            // unchanged content keeps collection statistics stable for every other document
            if (entry.equals(entries.get(entry.docId))) {
                return;
            }
            writer.updateDocument(new Term(DOC_ID_FIELD, entry.docId), entry.toLucene());
            searcherManager.maybeRefreshBlocking();
            entries.put(entry.docId, entry);
        } catch (IOException e) {
            throw new IndexWriteException("lexical_write_failed", e);
        } finally {
            writeLock.unlock();
        }
    }

    public boolean delete(String docId) {
        if (docId == null) {
            return false;
        }
        writeLock.lock();
        try {
            if (!entries.containsKey(docId)) {
                return false;
            }
            writer.deleteDocuments(new Term(DOC_ID_FIELD, docId));
            searcherManager.maybeRefreshBlocking();
            entries.remove(docId);
            return true;
        } catch (IOException e) {
            throw new IndexWriteException("lexical_delete_failed", e);
        } finally {
            writeLock.unlock();
        }
    }

    public List<RankedEntry> search(String queryText, StructuredFilter filter, int topK) {
        if (topK <= 0 || entries.isEmpty()) {
            return List.of();
        }
        Set<String> terms = new LinkedHashSet<>(TextAnalyzer.analyze(queryText));
        if (terms.isEmpty()) {
            return List.of();
        }
        BooleanQuery.Builder text = new BooleanQuery.Builder();
        for (String term : terms) {
            text.add(new TermQuery(new Term(TextAnalyzer.TEXT_FIELD, term)), BooleanClause.Occur.SHOULD);
        }
        BooleanQuery.Builder query = new BooleanQuery.Builder().add(text.build(), BooleanClause.Occur.MUST);
        addFilters(query, filter);

        IndexSearcher searcher = acquire();
        try {
            TopFieldDocs top = searcher.search(query.build(), topK, RANKING, true);
            StoredFields stored = searcher.storedFields();
            List<RankedEntry> ranked = new ArrayList<>(top.scoreDocs.length);
            for (int i = 0; i < top.scoreDocs.length; i++) {
                ScoreDoc hit = top.scoreDocs[i];
                String docId = stored.document(hit.doc, ID_ONLY).get(DOC_ID_FIELD);
                ranked.add(new RankedEntry(docId, RetrievalSource.LEXICAL, i + 1, hit.score));
            }
            return ranked;
        } catch (IOException e) {
            throw new UncheckedIOException("lexical search failed", e);
        } finally {
            release(searcher);
        }
    }

    public boolean contains(String docId) {
        return docId != null && entries.containsKey(docId);
    }

    public Optional<StructuredFields> fields(String docId) {
        Entry entry = docId == null ? null : entries.get(docId);
        return entry == null ? Optional.empty() : Optional.of(entry.fields);
    }

    public Set<String> docIds() {
        return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        writeLock.lock();
        try {
            writer.deleteAll();
            searcherManager.maybeRefreshBlocking();
            entries.clear();
        } catch (IOException e) {
            throw new IndexWriteException("lexical_clear_failed", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
    }

    private IndexSearcher acquire() {
        try {
            return searcherManager.acquire();
        } catch (IOException e) {
            throw new UncheckedIOException("lexical searcher unavailable", e);
        }
    }

    private void release(IndexSearcher searcher) {
        try {
            searcherManager.release(searcher);
        } catch (IOException e) {
            throw new UncheckedIOException("lexical searcher release failed", e);
        }
    }

    private static void addFilters(BooleanQuery.Builder query, StructuredFilter filter) {
        if (filter == null || filter.isUnconstrained()) {
            return;
        }
        if (filter.getCity() != null) {
            query.add(new TermQuery(new Term(CITY_FIELD, key(filter.getCity()))), BooleanClause.Occur.FILTER);
        }
        if (filter.getCountry() != null) {
            query.add(new TermQuery(new Term(COUNTRY_FIELD, key(filter.getCountry()))), BooleanClause.Occur.FILTER);
        }
        if (!filter.getActivities().isEmpty()) {
            BooleanQuery.Builder anyActivity = new BooleanQuery.Builder();
            for (String activity : filter.getActivities()) {
                anyActivity.add(new TermQuery(new Term(ACTIVITY_FIELD, activity)), BooleanClause.Occur.SHOULD);
            }
            query.add(anyActivity.build(), BooleanClause.Occur.FILTER);
        }
    }

    // same normalization as StructuredFilterPredicate
    static String key(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static final class Entry {
        private final String docId;
        private final String text;
        private final StructuredFields fields;

        private Entry(String docId, String text, StructuredFields fields) {
            this.docId = docId;
            this.text = text;
            this.fields = fields;
        }

        static Entry of(Document document) {
            StructuredFields fields = document.getFields();
            StringBuilder text = new StringBuilder()
                .append(Objects.toString(document.getTitle(), "")).append(' ')
                .append(Objects.toString(document.getBodyText(), ""));
            if (fields.getCity() != null) {
                text.append(' ').append(fields.getCity());
            }
            if (fields.getCountry() != null) {
                text.append(' ').append(fields.getCountry());
            }
            for (String activity : fields.getActivities()) {
                text.append(' ').append(activity);
            }
            return new Entry(document.getDocId(), TextAnalyzer.prepare(text.toString()), fields);
        }

        org.apache.lucene.document.Document toLucene() {
            org.apache.lucene.document.Document doc = new org.apache.lucene.document.Document();
            doc.add(new StringField(DOC_ID_FIELD, docId, Field.Store.YES));
            doc.add(new SortedDocValuesField(DOC_ID_FIELD, new BytesRef(docId)));
            doc.add(new TextField(TextAnalyzer.TEXT_FIELD, text, Field.Store.NO));
            if (fields.getCity() != null) {
                doc.add(new StringField(CITY_FIELD, key(fields.getCity()), Field.Store.NO));
            }
            if (fields.getCountry() != null) {
                doc.add(new StringField(COUNTRY_FIELD, key(fields.getCountry()), Field.Store.NO));
            }
            for (String activity : fields.getActivities()) {
                doc.add(new StringField(ACTIVITY_FIELD, activity, Field.Store.NO));
            }
            return doc;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Entry other)) {
                return false;
            }
            return docId.equals(other.docId) && text.equals(other.text) && fields.equals(other.fields);
        }

        @Override
        public int hashCode() {
            return Objects.hash(docId, text, fields);
        }
    }
}
