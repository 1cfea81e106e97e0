package pl.marcinmilkowski.string_analyzer.analysis;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Computes the {@link PropertyBundle} of a string.
 *
 * <p>All counts work on Unicode code points, so a character outside the BMP
 * counts once. Stateless and safe to share between threads.</p>
 */
public class PropertyAnalyzer {

    /**
     * Analyze a value. Defined for every string, including the empty one.
     */
    public PropertyBundle analyze(String value) {
        Objects.requireNonNull(value, "value");

        int[] codePoints = value.codePoints().toArray();
        Map<String, Integer> frequency = new TreeMap<>();
        for (int cp : codePoints) {
            frequency.merge(new String(Character.toChars(cp)), 1, Integer::sum);
        }

        return new PropertyBundle(
            codePoints.length,
            isPalindrome(value),
            frequency.size(),
            wordCount(value),
            ContentHasher.sha256Hex(value),
            frequency
        );
    }

    /**
     * Lowercase the value and compare it with its own reversal.
     * Whitespace and punctuation take part in the comparison.
     */
    boolean isPalindrome(String value) {
        int[] folded = value.toLowerCase(Locale.ROOT).codePoints().toArray();
        for (int i = 0, j = folded.length - 1; i < j; i++, j--) {
            if (folded[i] != folded[j]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Count maximal runs of non-whitespace code points.
     */
    int wordCount(String value) {
        int words = 0;
        boolean inWord = false;
        for (int i = 0; i < value.length(); ) {
            int cp = value.codePointAt(i);
            if (Character.isWhitespace(cp)) {
                inWord = false;
            } else if (!inWord) {
                inWord = true;
                words++;
            }
            i += Character.charCount(cp);
        }
        return words;
    }
}
