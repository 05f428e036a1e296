package com.example.analyzer.domain.model;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A dated transaction row tagged with the statement it came from.
 *
 * @param operationDate   parsed operation date, never {@code null}
 * @param bank            originating bank key
 * @param accountNumber   originating account number, may be {@code null}
 * @param sourceStatement originating statement identifier
 * @param row             raw columns as emitted by the extractor
 */
public record LedgerEntry(
        LocalDate operationDate,
        String bank,
        String accountNumber,
        String sourceStatement,
        StatementRow row
) {

	/**
	 * Flattens the entry into the raw columns followed by the ledger tags.
	 *
	 * @return ordered field-name to value map
	 */
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>(row.values());
        record.put("txn_date", operationDate);
        record.put("bank", bank);
        record.put("account_number", accountNumber);
        record.put("source_statement", sourceStatement);
        return record;
    }
}
