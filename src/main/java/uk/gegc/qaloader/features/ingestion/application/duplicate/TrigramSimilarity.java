package uk.gegc.qaloader.features.ingestion.application.duplicate;

import java.text.Normalizer;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Text normalization and word trigram similarity in the style of PostgreSQL {@code pg_trgm}:
 * each word is padded with two leading blanks and one trailing blank, and similarity is the
 * Jaccard index of the two trigram sets.
 */
public final class TrigramSimilarity {

    private TrigramSimilarity() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * NFKC, lower-cased, trimmed, whitespace collapsed. Equal output means an exact duplicate.
     */
    public static String normalize(String input) {
        if (input == null) {
            return "";
        }
        return Normalizer.normalize(input, Normalizer.Form.NFKC)
                .toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    public static Set<String> trigrams(String input) {
        String normalized = normalize(input);
        Set<String> result = new HashSet<>();
        StringBuilder word = new StringBuilder();
        for (int i = 0; i <= normalized.length(); i++) {
            char c = i < normalized.length() ? normalized.charAt(i) : ' ';
            if (Character.isLetterOrDigit(c)) {
                word.append(c);
            } else if (word.length() > 0) {
                addWordTrigrams(word.toString(), result);
                word.setLength(0);
            }
        }
        return result;
    }

    public static double similarity(Set<String> left, Set<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = left.size() <= right.size() ? left : right;
        Set<String> larger = smaller == left ? right : left;
        int shared = 0;
        for (String trigram : smaller) {
            if (larger.contains(trigram)) {
                shared++;
            }
        }
        int union = left.size() + right.size() - shared;
        return (double) shared / union;
    }

    public static double similarity(String left, String right) {
        return similarity(trigrams(left), trigrams(right));
    }

    private static void addWordTrigrams(String word, Set<String> sink) {
        String padded = "  " + word + " ";
        for (int i = 0; i + 3 <= padded.length(); i++) {
            sink.add(padded.substring(i, i + 3));
        }
    }
}
