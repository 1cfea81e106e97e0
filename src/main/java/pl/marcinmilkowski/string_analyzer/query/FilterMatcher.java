package pl.marcinmilkowski.string_analyzer.query;

import pl.marcinmilkowski.string_analyzer.ErrorKind;
import pl.marcinmilkowski.string_analyzer.StringAnalyzerException;
import pl.marcinmilkowski.string_analyzer.analysis.PropertyBundle;

import java.util.Locale;

/**
 * Applies a {@link FilterSet} to analyzed strings.
 */
public class FilterMatcher {

    /**
     * Reject filter sets that contradict themselves.
     *
     * @throws StringAnalyzerException with {@link ErrorKind#FILTER_CONFLICT} when min_length exceeds max_length
     */
    public void validate(FilterSet filters) {
        if (filters.minLength() != null && filters.maxLength() != null
                && filters.minLength() > filters.maxLength()) {
            throw new StringAnalyzerException(ErrorKind.FILTER_CONFLICT,
                "Conflicting filters: min_length " + filters.minLength()
                    + " is greater than max_length " + filters.maxLength());
        }
    }

    /**
     * True iff every present filter holds. Length bounds are inclusive and
     * character containment ignores case.
     *
     * @param value  the original string
     * @param bundle properties computed from {@code value}
     */
    public boolean matches(String value, PropertyBundle bundle, FilterSet filters) {
        if (filters.isPalindrome() != null && bundle.isPalindrome() != filters.isPalindrome()) {
            return false;
        }
        if (filters.minLength() != null && bundle.length() < filters.minLength()) {
            return false;
        }
        if (filters.maxLength() != null && bundle.length() > filters.maxLength()) {
            return false;
        }
        if (filters.wordCount() != null && bundle.wordCount() != filters.wordCount()) {
            return false;
        }
        if (filters.containsCharacter() != null) {
            String needle = filters.containsCharacter().toLowerCase(Locale.ROOT);
            return value.toLowerCase(Locale.ROOT).contains(needle);
        }
        return true;
    }
}
