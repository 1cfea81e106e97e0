package pl.marcinmilkowski.string_analyzer.service;

import pl.marcinmilkowski.string_analyzer.query.InterpretedQuery;
import pl.marcinmilkowski.string_analyzer.store.StringRecord;

import java.util.List;

/**
 * Records matched by a natural-language query, with the interpretation that selected them.
 */
public record NaturalLanguageResult(InterpretedQuery interpretedQuery, List<StringRecord> records) {
}
