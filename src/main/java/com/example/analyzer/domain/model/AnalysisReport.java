package com.example.analyzer.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Everything one analysis run produces for a statement batch.
 */
public record AnalysisReport(
        AnalysisWindow window,
        Ledger ledger,
        List<CanonicalTransaction> transactions,
        TopCounterparties topCounterparties,
        List<NetRow> relatedParties,
        List<Map<String, Object>> statements,
        IncomeReport income
) {

    public AnalysisReport {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        relatedParties = relatedParties == null ? List.of() : List.copyOf(relatedParties);
        statements = statements == null ? List.of() : List.copyOf(statements);
        income = income == null ? IncomeReport.empty() : income;
    }
}
