package com.phillippitts.convocapture.service.transcript;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a self-introduced name from a transcript fragment.
 *
 * <p>Patterns are tried in order; a rejected candidate falls through to the next pattern,
 * and the first accepted candidate wins. A candidate is cut at the first sentence punctuation, loses any
 * trailing "and/but/so ..." clause, and must then consist of one to three purely alphabetic
 * words of at least two letters each.
 *
 * <p>Examples:
 * <pre>
 * "Hi, my name is John Smith."    → "John Smith"
 * "call me mary-jane and welcome" → "Mary Jane"
 * "my name is X1 Y2"              → empty
 * "my name is J, call me Robert"  → "Robert"
 * </pre>
 */
public final class NameDetector {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\bmy name is\\s+([a-zA-Z][a-zA-Z\\s'-]{1,40})", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bcall me\\s+([a-zA-Z][a-zA-Z\\s'-]{1,40})", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?,;]");
    private static final Pattern TRAILING_FILLER =
            Pattern.compile("\\b(and|but|so)\\b.*", Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[\\s\\-]+");
    private static final Pattern ALPHA_WORD = Pattern.compile("\\p{Alpha}+");

    static final int MAX_WORDS = 3;
    static final int MIN_WORD_LENGTH = 2;
    static final int MIN_NAME_LENGTH = 3;

    private NameDetector() {
        // Utility class - prevent instantiation
    }

    /**
     * Detects a name in the given fragment.
     *
     * @param text transcript fragment; null or blank yields empty
     * @return title-cased name, or empty if no pattern matches or the candidate is invalid
     */
    public static Optional<String> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                Optional<String> name = clean(m.group(1));
                if (name.isPresent()) {
                    return name;
                }
            }
        }
        return Optional.empty();
    }

    static Optional<String> clean(String raw) {
        String candidate = SENTENCE_END.split(raw, 2)[0].strip();
        candidate = TRAILING_FILLER.matcher(candidate).replaceFirst("").strip();
        if (candidate.isEmpty()) {
            return Optional.empty();
        }

        List<String> words = new ArrayList<>();
        for (String w : WORD_SEPARATOR.split(candidate)) {
            if (!w.isEmpty()) {
                words.add(w);
            }
        }
        if (words.isEmpty() || words.size() > MAX_WORDS) {
            return Optional.empty();
        }

        List<String> capitalized = new ArrayList<>(words.size());
        for (String w : words) {
            if (w.length() < MIN_WORD_LENGTH || !ALPHA_WORD.matcher(w).matches()) {
                return Optional.empty();
            }
            capitalized.add(capitalize(w));
        }

        String name = String.join(" ", capitalized);
        return name.length() < MIN_NAME_LENGTH ? Optional.empty() : Optional.of(name);
    }

    private static String capitalize(String word) {
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
