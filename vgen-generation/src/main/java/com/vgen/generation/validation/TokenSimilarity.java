package com.vgen.generation.validation;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard similarity over lower-cased word tokens. Punctuation other than {@code |} separates tokens,
 * so word order is ignored.
 */
public final class TokenSimilarity {

    private static final Pattern NON_TOKEN = Pattern.compile("[^a-z0-9\\s|]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TokenSimilarity() {
    }

    public static Set<String> tokens(String text) {
        Set<String> out = new LinkedHashSet<>();
        String normalized = NON_TOKEN.matcher(text.toLowerCase()).replaceAll(" ");
        for (String token : WHITESPACE.split(normalized)) {
            if (!token.isEmpty()) {
                out.add(token);
            }
        }
        return out;
    }

    /** |A ∩ B| / |A ∪ B|; 0 when both token sets are empty. */
    public static double jaccard(String a, String b) {
        Set<String> ta = tokens(a);
        Set<String> tb = tokens(b);
        Set<String> intersection = new HashSet<>(ta);
        intersection.retainAll(tb);
        int union = ta.size() + tb.size() - intersection.size();
        return union == 0 ? 0.0 : (double) intersection.size() / union;
    }
}
