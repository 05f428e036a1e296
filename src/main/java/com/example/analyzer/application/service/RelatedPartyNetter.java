package com.example.analyzer.application.service;

import com.example.analyzer.application.support.SelfTransferFilter;
import com.example.analyzer.domain.model.CanonicalTransaction;
import com.example.analyzer.domain.model.NetRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application-layer service computing the net position against every counterparty.
 * Unlike the Top-N ranking the table is exhaustive: one row per distinct (id, name) pair in
 * first-seen order, self-transfers excluded.
 */
@Service
public class RelatedPartyNetter {

    private static final Logger log = LoggerFactory.getLogger(RelatedPartyNetter.class);

    static final int COEFFICIENT = 1;

    public List<NetRow> net(List<CanonicalTransaction> transactions) {
        Map<PartyKey, Position> positions = new LinkedHashMap<>();
        for (CanonicalTransaction transaction : SelfTransferFilter.exclude(transactions)) {
            BigDecimal amount = transaction.amount() != null ? transaction.amount() : BigDecimal.ZERO;
            positions.computeIfAbsent(
                            new PartyKey(transaction.counterpartyId(), transaction.counterpartyName()),
                            key -> new Position())
                    .add(amount);
        }

        List<NetRow> rows = positions.entrySet().stream()
                .map(entry -> entry.getValue().toRow(entry.getKey()))
                .toList();
        log.info("Related-party netting: {} counterparties", rows.size());
        return rows;
    }

    private record PartyKey(String id, String name) {
    }

    private static final class Position {
        private BigDecimal debit = BigDecimal.ZERO;
        private BigDecimal credit = BigDecimal.ZERO;
        private BigDecimal turnover = BigDecimal.ZERO;

        private void add(BigDecimal amount) {
            if (amount.signum() < 0) {
                debit = debit.add(amount);
            } else {
                credit = credit.add(amount);
            }
            turnover = turnover.add(amount.abs());
        }

        private NetRow toRow(PartyKey key) {
            return new NetRow(key.id(), key.name(), debit, credit, credit.add(debit), turnover, COEFFICIENT);
        }
    }
}
