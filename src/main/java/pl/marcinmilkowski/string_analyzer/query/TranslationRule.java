package pl.marcinmilkowski.string_analyzer.query;

import java.util.function.BiConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One pattern of the natural-language translator and the effect a match has on the filters.
 *
 * @param name    short identifier used in logs and tests
 * @param pattern pattern searched in the lowercased query
 * @param effect  applied once per match, in match order
 */
public record TranslationRule(String name, Pattern pattern, BiConsumer<Matcher, FilterSet.Builder> effect) {

    public static TranslationRule of(String name, String regex, BiConsumer<Matcher, FilterSet.Builder> effect) {
        return new TranslationRule(name, Pattern.compile(regex), effect);
    }

    /**
     * Apply the effect for every match in the query.
     *
     * @param lowerQuery query already lowercased
     * @return true if the pattern matched at least once
     */
    public boolean apply(String lowerQuery, FilterSet.Builder filters) {
        Matcher m = pattern.matcher(lowerQuery);
        boolean matched = false;
        while (m.find()) {
            effect.accept(m, filters);
            matched = true;
        }
        return matched;
    }
}
