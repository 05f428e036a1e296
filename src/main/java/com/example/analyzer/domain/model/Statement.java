package com.example.analyzer.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One parsed bank statement: header metadata plus the raw transaction table.
 * Instances are immutable; ledger and normalization stages derive new tables instead of enriching this one.
 *
 * @param statementId    source document identifier (file name), used for traceability
 * @param bank           bank key as registered in the bank schema registry
 * @param holderName     account holder name
 * @param holderId       holder national ID (IIN/BIN)
 * @param accountNumber  account number, may be {@code null}
 * @param periodFrom     declared statement period start
 * @param periodTo       declared statement period end
 * @param generationDate date the bank generated the statement
 * @param columns        declared column order of the transaction table, may be empty
 * @param rows           transaction rows in document order
 * @param header         extra raw header fields (currency, opening balance, ...)
 * @param footer         footer/summary block
 */
public record Statement(
        String statementId,
        String bank,
        String holderName,
        String holderId,
        String accountNumber,
        LocalDate periodFrom,
        LocalDate periodTo,
        LocalDate generationDate,
        List<String> columns,
        List<StatementRow> rows,
        Map<String, String> header,
        StatementFooter footer
) {

    public Statement {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
        header = header == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(header));
        footer = footer == null ? StatementFooter.empty() : footer;
    }

	/**
	 * Returns the schema of the transaction table: the declared columns, or the union of row keys
	 * in first-seen order when the extractor did not declare any.
	 *
	 * @return ordered column names
	 */
    public List<String> columnNames() {
        if (!columns.isEmpty()) {
            return columns;
        }
        Set<String> names = new LinkedHashSet<>();
        for (StatementRow row : rows) {
            names.addAll(row.values().keySet());
        }
        return new ArrayList<>(names);
    }

    public boolean hasColumn(String column) {
        return column != null && columnNames().contains(column);
    }
}
