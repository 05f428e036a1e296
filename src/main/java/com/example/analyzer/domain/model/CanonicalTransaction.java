package com.example.analyzer.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-shape transaction consumed by the aggregation stages, independent of the source bank's column names.
 *
 * @param operationDate    operation date
 * @param amount           signed amount: positive for credit (incoming), negative for debit (outgoing)
 * @param description      free-text description or payment purpose
 * @param counterpartyId   grouping key of the counterparty
 * @param counterpartyName display label of the counterparty
 * @param bank             originating bank key
 * @param accountNumber    originating account number
 * @param sourceStatement  originating statement identifier
 */
public record CanonicalTransaction(
        LocalDate operationDate,
        BigDecimal amount,
        String description,
        String counterpartyId,
        String counterpartyName,
        String bank,
        String accountNumber,
        String sourceStatement
) {

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("txn_date", operationDate);
        record.put("amount", amount);
        record.put("description", description);
        record.put("counterparty_id", counterpartyId);
        record.put("counterparty_name", counterpartyName);
        record.put("bank", bank);
        record.put("account_number", accountNumber);
        record.put("source_statement", sourceStatement);
        return record;
    }
}
