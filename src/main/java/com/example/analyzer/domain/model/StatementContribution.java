package com.example.analyzer.domain.model;

import java.util.List;

/**
 * Outcome of placing one statement into the analysis window, before cross-statement deduplication.
 *
 * @param statementId       source statement identifier
 * @param bank              bank key
 * @param dateColumn        column the operation date was read from
 * @param rowsRead          rows present in the statement
 * @param rowsUndated       rows dropped because their date could not be parsed
 * @param rowsOutsideWindow dated rows falling outside the window
 * @param entries           dated, in-window entries in document order
 */
public record StatementContribution(
        String statementId,
        String bank,
        String dateColumn,
        int rowsRead,
        int rowsUndated,
        int rowsOutsideWindow,
        List<LedgerEntry> entries
) {

    public StatementContribution {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public int rowsRetained() {
        return entries.size();
    }
}
