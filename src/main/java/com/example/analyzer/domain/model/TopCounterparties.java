package com.example.analyzer.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Ranked outgoing (suppliers) and incoming (clients) counterparty tables.
 */
public record TopCounterparties(List<AggregationRow> debitTop, List<AggregationRow> creditTop) {

    public TopCounterparties {
        debitTop = debitTop == null ? List.of() : List.copyOf(debitTop);
        creditTop = creditTop == null ? List.of() : List.copyOf(creditTop);
    }

    public List<AggregationRow> side(FlowSide side) {
        return side == FlowSide.DEBIT ? debitTop : creditTop;
    }

    public List<Map<String, Object>> toRecords(FlowSide side) {
        return side(side).stream().map(AggregationRow::toRecord).toList();
    }
}
