package pl.marcinmilkowski.string_analyzer.api;

import pl.marcinmilkowski.string_analyzer.ErrorKind;
import pl.marcinmilkowski.string_analyzer.StringAnalyzerException;
import pl.marcinmilkowski.string_analyzer.query.FilterSet;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Query-string parsing and validation for the list endpoint.
 */
final class FilterParams {

    static final String IS_PALINDROME = "is_palindrome";
    static final String MIN_LENGTH = "min_length";
    static final String MAX_LENGTH = "max_length";
    static final String WORD_COUNT = "word_count";
    static final String CONTAINS_CHARACTER = "contains_character";

    private FilterParams() {}

    /**
     * Decode a raw query string. Keys without "=" map to an empty value; the last
     * occurrence of a repeated key wins.
     *
     * @throws StringAnalyzerException INVALID_INPUT for malformed percent-encoding
     */
    static Map<String, String> parseQueryParams(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }

        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] keyValue = pair.split("=", 2);
            params.put(decode(keyValue[0]), keyValue.length == 2 ? decode(keyValue[1]) : "");
        }
        return params;
    }

    /**
     * Build a filter set from decoded parameters. Unknown parameters are ignored.
     *
     * @throws StringAnalyzerException INVALID_INPUT for a malformed value
     */
    static FilterSet toFilterSet(Map<String, String> params) {
        FilterSet.Builder builder = FilterSet.builder();

        String palindrome = params.get(IS_PALINDROME);
        if (palindrome != null) {
            builder.isPalindrome(switch (palindrome) {
                case "true" -> true;
                case "false" -> false;
                default -> throw invalid(IS_PALINDROME + " must be \"true\" or \"false\"");
            });
        }

        builder.minLength(nonNegativeInt(params, MIN_LENGTH));
        builder.maxLength(nonNegativeInt(params, MAX_LENGTH));
        builder.wordCount(nonNegativeInt(params, WORD_COUNT));

        String character = params.get(CONTAINS_CHARACTER);
        if (character != null) {
            if (character.codePointCount(0, character.length()) != 1) {
                throw invalid(CONTAINS_CHARACTER + " must be a single character");
            }
            builder.containsCharacter(character);
        }

        return builder.build();
    }

    private static Integer nonNegativeInt(Map<String, String> params, String name) {
        String raw = params.get(name);
        if (raw == null) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < 0) {
                throw invalid(name + " must be a non-negative integer");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw invalid(name + " must be a non-negative integer");
        }
    }

    private static String decode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw invalid("Malformed query parameter: " + raw);
        }
    }

    private static StringAnalyzerException invalid(String message) {
        return new StringAnalyzerException(ErrorKind.INVALID_INPUT, message);
    }
}
