package com.example.analyzer.domain.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One ranked counterparty of a Top-N table.
 *
 * @param counterpartyId counterparty grouping key, {@link #OTHERS_ID} for the folded remainder
 * @param label          display label
 * @param turnover       absolute turnover on this side
 * @param share          formatted share of the side's total turnover
 * @param coefficient    weighting coefficient, currently always 1
 */
public record AggregationRow(
        String counterpartyId,
        String label,
        BigDecimal turnover,
        String share,
        int coefficient
) {

    public static final String OTHERS_ID = "OTHERS";
    public static final String OTHERS_LABEL = "Others";

    public boolean isOthers() {
        return OTHERS_ID.equals(counterpartyId);
    }

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("counterparty_id", counterpartyId);
        record.put("counterparty", label);
        record.put("turnover", turnover);
        record.put("share", share);
        record.put("coefficient", coefficient);
        return record;
    }
}
