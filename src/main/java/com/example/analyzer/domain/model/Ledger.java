package com.example.analyzer.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Merged, window-filtered and deduplicated transactions of a statement batch.
 *
 * @param window            window the entries were confined to
 * @param entries           entries in insertion order
 * @param contributions     per-statement counts for statements that contributed
 * @param failures          statements that could not contribute
 * @param duplicatesRemoved rows collapsed by the (bank, account, date) key
 */
public record Ledger(
        AnalysisWindow window,
        List<LedgerEntry> entries,
        List<StatementContribution> contributions,
        List<StatementFailure> failures,
        int duplicatesRemoved
) {

    public Ledger {
        entries = entries == null ? List.of() : List.copyOf(entries);
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int undatedRows() {
        return contributions.stream().mapToInt(StatementContribution::rowsUndated).sum();
    }

    public List<Map<String, Object>> toRecords() {
        return entries.stream().map(LedgerEntry::toRecord).toList();
    }
}
