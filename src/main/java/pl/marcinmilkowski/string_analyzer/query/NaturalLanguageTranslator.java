package pl.marcinmilkowski.string_analyzer.query;

import pl.marcinmilkowski.string_analyzer.ErrorKind;
import pl.marcinmilkowski.string_analyzer.StringAnalyzerException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Translates free-text queries such as "all single word palindromic strings" into a {@link FilterSet}.
 *
 * <p>The translator is an ordered list of {@link TranslationRule}s checked independently
 * against the lowercased query. Every matching rule contributes; for the same field a
 * later match overwrites an earlier one, except for length bounds where the tightest
 * bound is kept.</p>
 *
 * <p>Threshold phrasings ending in "than" are exclusive: "longer than 10" means a
 * minimum length of 11 and "shorter than 10" a maximum of 9. "at least", "at most"
 * and the min/max length phrasings are inclusive. Numbers above {@link Integer#MAX_VALUE}
 * saturate.</p>
 *
 * <p>Comparative word counts ("fewer than 3 words", "at least 2 words") have no
 * filter field; neither the word-count rule nor the length rules accept them.</p>
 */
public class NaturalLanguageTranslator {

    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
        Map.entry("single", 1),
        Map.entry("one", 1),
        Map.entry("two", 2),
        Map.entry("three", 3),
        Map.entry("four", 4),
        Map.entry("five", 5),
        Map.entry("six", 6),
        Map.entry("seven", 7),
        Map.entry("eight", 8),
        Map.entry("nine", 9),
        Map.entry("ten", 10)
    );

    // a threshold followed by "words" is a word count, not a character length
    private static final String NOT_A_WORD_COUNT = "(?!\\d|\\s*words?\\b)";

    private static final String CHARACTER = "['\"]?([a-z0-9])['\"]?(?![a-z0-9])";

    private final List<TranslationRule> rules;

    public NaturalLanguageTranslator() {
        this(defaultRules());
    }

    public NaturalLanguageTranslator(List<TranslationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<TranslationRule> getRules() {
        return rules;
    }

    /**
     * Translate a query.
     *
     * @throws StringAnalyzerException with {@link ErrorKind#UNPARSEABLE_QUERY} if no rule set a filter
     */
    public InterpretedQuery translate(String query) {
        if (query == null || query.isBlank()) {
            throw new StringAnalyzerException(ErrorKind.UNPARSEABLE_QUERY,
                "Unable to parse natural language query into structured filters");
        }

        String lowerQuery = query.toLowerCase(Locale.ROOT);
        FilterSet.Builder filters = FilterSet.builder();
        for (TranslationRule rule : rules) {
            rule.apply(lowerQuery, filters);
        }

        if (filters.isEmpty()) {
            throw new StringAnalyzerException(ErrorKind.UNPARSEABLE_QUERY,
                "Unable to parse natural language query into structured filters");
        }
        return new InterpretedQuery(query, filters.build());
    }

    /**
     * The built-in rule set, in evaluation order.
     */
    public static List<TranslationRule> defaultRules() {
        return List.of(
            TranslationRule.of("word_count",
                "(?<!(?:than|least|most)\\s{1,9})\\b(single|one|two|three|four|five|six|seven|eight|nine|ten|\\d+)\\s+words?\\b",
                (m, f) -> f.wordCount(parseCount(m.group(1)))),

            TranslationRule.of("palindrome",
                "palindrom",
                (m, f) -> f.isPalindrome(true)),

            TranslationRule.of("min_length",
                "\\b(longer than|greater than|more than|at least|minimum length(?: of)?|min length(?: of)?)\\s*(\\d+)" + NOT_A_WORD_COUNT,
                (m, f) -> {
                    int n = parseNumber(m.group(2));
                    f.tightenMinLength(isExclusive(m.group(1)) && n < Integer.MAX_VALUE ? n + 1 : n);
                }),

            TranslationRule.of("max_length",
                "\\b(shorter than|less than|fewer than|at most|maximum length(?: of)?|max length(?: of)?)\\s*(\\d+)" + NOT_A_WORD_COUNT,
                (m, f) -> {
                    int n = parseNumber(m.group(2));
                    f.tightenMaxLength(isExclusive(m.group(1)) ? Math.max(0, n - 1) : n);
                }),

            TranslationRule.of("contains_character",
                "\\b(?:contains|containing|contain|with (?:the )?character|has)\\s+" + CHARACTER,
                (m, f) -> f.containsCharacter(m.group(1))),

            TranslationRule.of("letter",
                "\\bletter\\s+" + CHARACTER,
                (m, f) -> f.containsCharacter(m.group(1))),

            // "first vowel" is read as 'a'; general vowel detection is not attempted
            TranslationRule.of("first_vowel",
                "\\bfirst vowel\\b",
                (m, f) -> {
                    if (f.containsCharacter() == null) {
                        f.containsCharacter("a");
                    }
                })
        );
    }

    private static boolean isExclusive(String phrase) {
        return phrase.endsWith("than");
    }

    private static int parseCount(String token) {
        Integer word = NUMBER_WORDS.get(token);
        return word != null ? word : parseNumber(token);
    }

    /**
     * Parse a run of digits, saturating at {@link Integer#MAX_VALUE}.
     */
    private static int parseNumber(String digits) {
        String trimmed = digits.replaceFirst("^0+(?=\\d)", "");
        if (trimmed.length() > 10) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.min(Long.parseLong(trimmed), Integer.MAX_VALUE);
    }
}
