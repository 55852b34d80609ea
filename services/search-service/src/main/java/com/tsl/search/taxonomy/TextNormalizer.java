package com.tsl.search.taxonomy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class TextNormalizer {
    private TextNormalizer() {
    }

    public static String normalize(String text) {
        return String.join(" ", tokens(text));
    }

    public static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < lowered.length(); i++) {
            char ch = lowered.charAt(i);
            if (ch == '\'' || ch == '’') {
                continue;
            }
            if (Character.isLetterOrDigit(ch)) {
                current.append(ch);
            } else if (current.length() > 0) {
                tokens.add(singularize(current.toString()));
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            tokens.add(singularize(current.toString()));
        }
        return tokens;
    }

    public static String singularize(String token) {
        if (token == null || token.length() <= 3) {
            return token;
        }
        if (token.endsWith("ies") && token.length() > 4) {
            return token.substring(0, token.length() - 3) + "y";
        }
        if (token.endsWith("es")) {
            String stem = token.substring(0, token.length() - 2);
            if (stem.endsWith("x") || stem.endsWith("z") || stem.endsWith("ch")
                || stem.endsWith("sh") || stem.endsWith("ss")) {
                return stem;
            }
        }
        if (token.endsWith("s")) {
            char before = token.charAt(token.length() - 2);
            if (before != 's' && before != 'u' && before != 'i') {
                return token.substring(0, token.length() - 1);
            }
        }
        return token;
    }

    // wine_tasting -> wine tasting
    public static String idToPhrase(String id) {
        return id == null ? "" : normalize(id.replace('_', ' '));
    }
}
