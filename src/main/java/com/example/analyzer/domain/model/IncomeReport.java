package com.example.analyzer.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Collected outputs of the external income classifier across a statement batch.
 *
 * @param enrichedTransactions concatenated enriched transaction records
 * @param summaries            one monthly income summary record per classified statement
 * @param failures             statements the classifier could not be run for
 */
public record IncomeReport(
        List<Map<String, Object>> enrichedTransactions,
        List<Map<String, Object>> summaries,
        List<StatementFailure> failures
) {

    public IncomeReport {
        enrichedTransactions = enrichedTransactions == null ? List.of() : List.copyOf(enrichedTransactions);
        summaries = summaries == null ? List.of() : List.copyOf(summaries);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static IncomeReport empty() {
        return new IncomeReport(List.of(), List.of(), List.of());
    }
}
