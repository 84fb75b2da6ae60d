package com.phillippitts.selfconsistency.service.voting;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces free-form final answers to comparable keys.
 *
 * <p>Key rules:
 * <ul>
 *   <li>Only the first sentence counts (split at '.', '!' or '?' followed by whitespace or end)</li>
 *   <li>Lower-cased</li>
 *   <li>Punctuation removed, except decimal points and separators between digits</li>
 *   <li>Whitespace collapsed</li>
 * </ul>
 */
public final class AnswerNormalizer {

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?](\\s|$)");
    private static final Pattern NON_NUMERIC_SEPARATOR = Pattern.compile("(?<!\\d)[.,]|[.,](?!\\d)");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{Nd}\\s.,]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "of", "to", "in", "on", "at",
            "for", "and", "or", "it", "its", "this", "that", "answer", "final", "so", "by", "as", "with");

    private static final Set<String> NEGATIONS = Set.of(
            "not", "no", "never", "none", "cannot", "cant", "isnt", "arent", "wasnt", "werent",
            "dont", "doesnt", "didnt", "wont", "false", "incorrect");

    private AnswerNormalizer() {}

    /**
     * Returns the normalized key of an answer; "" for null or blank input.
     */
    public static String key(String answer) {
        if (answer == null || answer.isBlank()) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(answer.trim()).replaceAll(" ");
        String first = firstSentence(collapsed).toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(first).replaceAll("");
        stripped = NON_NUMERIC_SEPARATOR.matcher(stripped).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    static String firstSentence(String text) {
        var m = SENTENCE_END.matcher(text);
        if (m.find() && m.start() > 0) {
            return text.substring(0, m.start());
        }
        return text;
    }

    /**
     * Content tokens of a key: whitespace-split, stopwords removed.
     */
    public static List<String> contentTokens(String key) {
        if (key == null || key.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String part : WHITESPACE.split(key)) {
            if (!part.isBlank() && !STOPWORDS.contains(part)) {
                tokens.add(part);
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Whether the key contains a negation word (after punctuation removal, so "isn't" counts as "isnt").
     */
    public static boolean isNegated(String key) {
        if (key == null || key.isBlank()) {
            return false;
        }
        for (String part : WHITESPACE.split(key)) {
            if (NEGATIONS.contains(part)) {
                return true;
            }
        }
        return false;
    }
}
