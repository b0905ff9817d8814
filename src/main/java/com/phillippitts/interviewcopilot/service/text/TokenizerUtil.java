package com.phillippitts.interviewcopilot.service.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Utility for tokenizing transcript and profile text into normalized alpha tokens.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Split on non-alphabetic characters except the apostrophe (regex: [^\p{Alpha}']+)</li>
 *   <li>Convert all tokens to lowercase and strip surrounding apostrophes</li>
 *   <li>Filter out blank tokens</li>
 *   <li>Return immutable list</li>
 * </ul>
 *
 * <p>Used by question detection, story selection and Q&amp;A matching so all three agree on
 * what a word is.
 */
public final class TokenizerUtil {

    /** Function words ignored when measuring keyword overlap. */
    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "if", "of", "to", "in", "on", "at", "for", "with",
            "about", "from", "by", "as", "into", "is", "are", "was", "were", "be", "been", "being",
            "i", "you", "your", "yours", "me", "my", "we", "our", "they", "their", "he", "she", "it",
            "its", "this", "that", "these", "those", "there", "here", "do", "does", "did", "have",
            "has", "had", "can", "could", "would", "will", "should", "tell", "time", "what", "how",
            "why", "when", "where", "who", "which", "some", "any", "so", "then", "than", "just",
            "also", "very", "really", "let's", "i'm", "you're", "it's", "that's", "don't");

    private TokenizerUtil() {
        // Prevent instantiation
    }

    /**
     * Tokenizes text into normalized alpha tokens.
     *
     * @param text input text to tokenize (may be null or blank)
     * @return immutable list of lowercase tokens (empty if no valid tokens)
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] parts = text.toLowerCase(Locale.ROOT).split("[^\\p{Alpha}']+");
        List<String> tokens = new ArrayList<>();
        for (String part : parts) {
            String token = stripApostrophes(part);
            if (!token.isBlank()) {
                tokens.add(token);
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Content keywords: tokens minus stop words, with a light plural/suffix normalisation so
     * "conflicts" and "conflict" compare equal.
     *
     * @return ordered, de-duplicated keyword set
     */
    public static Set<String> keywords(String text) {
        Set<String> out = new LinkedHashSet<>();
        for (String token : tokenize(text)) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                out.add(stem(token));
            }
        }
        return out;
    }

    /**
     * Jaccard similarity |A ∩ B| / |A ∪ B| of two token sets; 0.0 when both are empty.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new LinkedHashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new LinkedHashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    /** Strips common English inflection suffixes; deliberately crude. */
    static String stem(String token) {
        if (token.length() > 5 && token.endsWith("ing")) {
            return token.substring(0, token.length() - 3);
        }
        if (token.length() > 4 && token.endsWith("ed")) {
            return token.substring(0, token.length() - 2);
        }
        if (token.length() > 4 && token.endsWith("es") && !token.endsWith("ses")) {
            return token.substring(0, token.length() - 2);
        }
        if (token.length() > 3 && token.endsWith("s") && !token.endsWith("ss")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }

    private static String stripApostrophes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '\'') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '\'') {
            end--;
        }
        return s.substring(start, end);
    }
}
