package com.example.analyzer.application.port;

import java.util.List;
import java.util.Map;

/**
 * Result returned by an {@link IncomeClassifier} for one statement.
 *
 * @param enrichedTransactions transaction records carrying income-eligibility flags
 * @param summary              monthly income summary record, may be {@code null}
 */
public record IncomeClassification(
        List<Map<String, Object>> enrichedTransactions,
        Map<String, Object> summary
) {
}
