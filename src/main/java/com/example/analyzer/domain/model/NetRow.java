package com.example.analyzer.domain.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Net position against one counterparty over the whole window.
 *
 * @param counterpartyId   counterparty grouping key
 * @param counterpartyName display label
 * @param debit            sum of negative amounts (zero or negative)
 * @param credit           sum of positive amounts (zero or positive)
 * @param balance          sum of signed amounts
 * @param turnover         sum of absolute amounts
 * @param coefficient      weighting coefficient, currently always 1
 */
public record NetRow(
        String counterpartyId,
        String counterpartyName,
        BigDecimal debit,
        BigDecimal credit,
        BigDecimal balance,
        BigDecimal turnover,
        int coefficient
) {

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("counterparty_id", counterpartyId);
        record.put("counterparty", counterpartyName);
        record.put("debit", debit);
        record.put("credit", credit);
        record.put("balance", balance);
        record.put("turnover", turnover);
        record.put("coefficient", coefficient);
        return record;
    }
}
