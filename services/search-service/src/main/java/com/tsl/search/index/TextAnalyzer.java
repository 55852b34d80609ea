package com.tsl.search.index;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

public final class TextAnalyzer {
    static final String TEXT_FIELD = "text";

    private static final Analyzer ANALYZER = new EnglishAnalyzer();

    private TextAnalyzer() {
    }

    public static Analyzer analyzer() {
        return ANALYZER;
    }

    // canonical ids such as wine_tasting index as separate words
    public static String prepare(String text) {
        return text == null ? "" : text.replace('_', ' ');
    }

    public static List<String> analyze(String text) {
        String prepared = prepare(text);
        List<String> terms = new ArrayList<>();
        if (prepared.isBlank()) {
            return terms;
        }
        try (TokenStream stream = ANALYZER.tokenStream(TEXT_FIELD, prepared)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                terms.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("text analysis failed", e);
        }
        return terms;
    }
}
