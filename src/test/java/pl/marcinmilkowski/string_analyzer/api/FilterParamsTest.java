package pl.marcinmilkowski.string_analyzer.api;

import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.string_analyzer.ErrorKind;
import pl.marcinmilkowski.string_analyzer.StringAnalyzerException;
import pl.marcinmilkowski.string_analyzer.query.FilterSet;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FilterParams.
 */
class FilterParamsTest {

    private void assertInvalid(Map<String, String> params) {
        StringAnalyzerException e = assertThrows(StringAnalyzerException.class, () -> FilterParams.toFilterSet(params));
        assertEquals(ErrorKind.INVALID_INPUT, e.getKind());
    }

    @Test
    void testParseQueryParams() {
        Map<String, String> params = FilterParams.parseQueryParams("query=single%20word+strings&flag&a=1&a=2");
        assertEquals("single word strings", params.get("query"));
        assertEquals("", params.get("flag"));
        assertEquals("2", params.get("a"));
        assertTrue(FilterParams.parseQueryParams(null).isEmpty());
    }

    @Test
    void testMalformedEncoding() {
        assertThrows(StringAnalyzerException.class, () -> FilterParams.parseQueryParams("query=%zz"));
    }

    @Test
    void testAllFilters() {
        FilterSet filters = FilterParams.toFilterSet(Map.of(
            "is_palindrome", "true",
            "min_length", "5",
            "max_length", "20",
            "word_count", "2",
            "contains_character", "a",
            "unrelated", "ignored"));

        assertEquals(new FilterSet(true, 5, 20, 2, "a"), filters);
    }

    @Test
    void testNoFilters() {
        assertTrue(FilterParams.toFilterSet(Map.of()).isEmpty());
    }

    @Test
    void testInvalidValues() {
        assertInvalid(Map.of("is_palindrome", "yes"));
        assertInvalid(Map.of("min_length", "abc"));
        assertInvalid(Map.of("max_length", "-1"));
        assertInvalid(Map.of("word_count", ""));
        assertInvalid(Map.of("contains_character", "ab"));
        assertInvalid(Map.of("contains_character", ""));
    }

    @Test
    void testSupplementaryCharacterIsOneCharacter() {
        assertEquals("\uD83D\uDE00", FilterParams.toFilterSet(Map.of("contains_character", "\uD83D\uDE00")).containsCharacter());
    }
}
