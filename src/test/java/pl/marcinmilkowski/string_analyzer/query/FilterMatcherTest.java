package pl.marcinmilkowski.string_analyzer.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.string_analyzer.ErrorKind;
import pl.marcinmilkowski.string_analyzer.StringAnalyzerException;
import pl.marcinmilkowski.string_analyzer.analysis.PropertyAnalyzer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FilterMatcher.
 */
class FilterMatcherTest {

    private final FilterMatcher matcher = new FilterMatcher();
    private final PropertyAnalyzer analyzer = new PropertyAnalyzer();

    private boolean matches(String value, FilterSet filters) {
        return matcher.matches(value, analyzer.analyze(value), filters);
    }

    @Test
    @DisplayName("Character containment ignores case")
    void testPalindromeWithUppercaseCharacter() {
        FilterSet filters = FilterSet.builder().isPalindrome(true).containsCharacter("M").build();
        assertTrue(matches("madam", filters));
    }

    @Test
    void testEmptyFiltersMatchEverything() {
        assertTrue(matches("", FilterSet.empty()));
        assertTrue(matches("anything at all", FilterSet.empty()));
    }

    @Test
    void testPalindromeFlag() {
        assertTrue(matches("hello", FilterSet.builder().isPalindrome(false).build()));
        assertFalse(matches("hello", FilterSet.builder().isPalindrome(true).build()));
    }

    @Test
    @DisplayName("Length bounds are inclusive")
    void testLengthBounds() {
        assertTrue(matches("hello", FilterSet.builder().minLength(5).maxLength(5).build()));
        assertFalse(matches("hello", FilterSet.builder().minLength(6).build()));
        assertFalse(matches("hello", FilterSet.builder().maxLength(4).build()));
    }

    @Test
    void testWordCount() {
        assertTrue(matches("hello world", FilterSet.builder().wordCount(2).build()));
        assertFalse(matches("hello world", FilterSet.builder().wordCount(1).build()));
    }

    @Test
    void testMissingCharacter() {
        assertFalse(matches("hello", FilterSet.builder().containsCharacter("z").build()));
        assertTrue(matches("HELLO", FilterSet.builder().containsCharacter("h").build()));
    }

    @Test
    void testAllFiltersMustHold() {
        FilterSet filters = FilterSet.builder().isPalindrome(true).wordCount(1).containsCharacter("z").build();
        assertFalse(matches("racecar", filters));
        assertTrue(matches("zaz", filters));
    }

    @Test
    void testValidateRejectsMinAboveMax() {
        FilterSet filters = FilterSet.builder().minLength(20).maxLength(5).build();
        StringAnalyzerException e = assertThrows(StringAnalyzerException.class, () -> matcher.validate(filters));
        assertEquals(ErrorKind.FILTER_CONFLICT, e.getKind());
    }

    @Test
    void testValidateAcceptsConsistentFilters() {
        assertDoesNotThrow(() -> matcher.validate(FilterSet.builder().minLength(5).maxLength(5).build()));
        assertDoesNotThrow(() -> matcher.validate(FilterSet.builder().minLength(50).build()));
        assertDoesNotThrow(() -> matcher.validate(FilterSet.empty()));
    }
}
