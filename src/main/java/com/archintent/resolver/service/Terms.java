package com.archintent.resolver.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tokenizing and normalization shared by the tagger, the ontology loader and discovery.
 */
final class Terms {

    private static final Pattern TOKEN_PATTERN = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}'-]*");

    private Terms() {
    }

    record Token(String word, int start, int end) {
    }

    static List<Token> tokens(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(text);
        while (matcher.find()) {
            String word = trimTrailing(matcher.group().toLowerCase(Locale.ROOT));
            if (!word.isEmpty()) {
                tokens.add(new Token(word, matcher.start(), matcher.start() + word.length()));
            }
        }
        return tokens;
    }

    static List<String> words(String text) {
        return tokens(text).stream().map(Token::word).collect(Collectors.toList());
    }

    /**
     * Lower-cases a vocabulary phrase and collapses it to single-space separated words.
     */
    static String normalizePhrase(String phrase) {
        return String.join(" ", words(phrase));
    }

    /**
     * Strips common English inflections, but only accepts a stripped form the vocabulary knows.
     * Unknown words come back unchanged (apart from a possessive suffix).
     */
    static String normalizeWord(String word, Set<String> knownWords) {
        String w = word.endsWith("'s") ? word.substring(0, word.length() - 2) : word;
        if (knownWords.contains(w)) {
            return w;
        }
        for (String candidate : inflectionCandidates(w)) {
            if (knownWords.contains(candidate)) {
                return candidate;
            }
        }
        return w;
    }

    private static List<String> inflectionCandidates(String w) {
        List<String> candidates = new ArrayList<>();
        int n = w.length();
        if (n > 4 && (w.endsWith("ies") || w.endsWith("ied"))) {
            candidates.add(w.substring(0, n - 3) + "y");
        }
        if (n > 3 && w.endsWith("es")) {
            candidates.add(w.substring(0, n - 2));
        }
        if (n > 3 && w.endsWith("s") && !w.endsWith("ss")) {
            candidates.add(w.substring(0, n - 1));
        }
        if (n > 4 && w.endsWith("ed")) {
            candidates.add(w.substring(0, n - 2));
            candidates.add(w.substring(0, n - 1));
        }
        if (n > 5 && w.endsWith("ing")) {
            candidates.add(w.substring(0, n - 3));
            candidates.add(w.substring(0, n - 3) + "e");
        }
        return candidates;
    }

    private static String trimTrailing(String word) {
        int end = word.length();
        while (end > 0 && (word.charAt(end - 1) == '-' || word.charAt(end - 1) == '\'')) {
            end--;
        }
        return word.substring(0, end);
    }
}
