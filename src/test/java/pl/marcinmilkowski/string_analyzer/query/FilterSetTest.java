package pl.marcinmilkowski.string_analyzer.query;

import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FilterSet and its builder.
 */
class FilterSetTest {

    @Test
    void testToJsonContainsOnlyPresentFields() {
        JSONObject json = FilterSet.builder().wordCount(2).containsCharacter("a").build().toJson();
        assertEquals(List.of("word_count", "contains_character"), List.copyOf(json.keySet()));
        assertEquals(2, json.getIntValue("word_count"));
        assertEquals("a", json.getString("contains_character"));
    }

    @Test
    void testEmpty() {
        assertTrue(FilterSet.empty().isEmpty());
        assertTrue(FilterSet.empty().toJson().isEmpty());
        assertFalse(FilterSet.builder().isPalindrome(false).build().isEmpty());
    }

    @Test
    void testTightenBounds() {
        FilterSet f = FilterSet.builder()
            .tightenMinLength(3).tightenMinLength(8).tightenMinLength(5)
            .tightenMaxLength(30).tightenMaxLength(12).tightenMaxLength(20)
            .build();
        assertEquals(8, f.minLength());
        assertEquals(12, f.maxLength());
    }
}
