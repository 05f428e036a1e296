package com.example.analyzer.application.service;

import com.example.analyzer.application.support.PercentageFormatter;
import com.example.analyzer.application.support.SelfTransferFilter;
import com.example.analyzer.domain.model.AggregationRow;
import com.example.analyzer.domain.model.CanonicalTransaction;
import com.example.analyzer.domain.model.FlowSide;
import com.example.analyzer.domain.model.TopCounterparties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application-layer service that ranks counterparties by turnover, separately for outgoing
 * (debit, suppliers) and incoming (credit, clients) flows.
 * <p>
 * Transfers between the holder's own accounts are excluded first. Each side keeps the nine largest
 * counterparties and folds the remainder into a single {@code Others} row, so the turnover of a side's
 * table always adds up to the side's total.
 */
@Service
public class CounterpartyAggregator {

    private static final Logger log = LoggerFactory.getLogger(CounterpartyAggregator.class);

    static final int TOP_N = 9;
    static final int COEFFICIENT = 1;

	/**
	 * Builds both Top-N tables.
	 *
	 * @param transactions canonical transactions
	 * @return debit and credit rankings, each at most {@code TOP_N + 1} rows
	 */
    public TopCounterparties aggregateTopN(List<CanonicalTransaction> transactions) {
        List<CanonicalTransaction> thirdParty = SelfTransferFilter.exclude(transactions);
        int excluded = (transactions == null ? 0 : transactions.size()) - thirdParty.size();
        if (excluded > 0) {
            log.debug("Excluded {} self-transfers from counterparty ranking", excluded);
        }
        TopCounterparties top = new TopCounterparties(
                rank(thirdParty, FlowSide.DEBIT),
                rank(thirdParty, FlowSide.CREDIT));
        log.info("Top counterparties: {} debit rows, {} credit rows", top.debitTop().size(), top.creditTop().size());
        return top;
    }

    List<AggregationRow> rank(List<CanonicalTransaction> transactions, FlowSide side) {
        Map<String, Group> groups = new LinkedHashMap<>();
        for (CanonicalTransaction transaction : transactions) {
            if (!side.matches(transaction.amount())) {
                continue;
            }
            groups.computeIfAbsent(transaction.counterpartyId(),
                            id -> new Group(id, transaction.counterpartyName()))
                    .add(transaction.amount().abs());
        }
        if (groups.isEmpty()) {
            return List.of();
        }

        // List.sort is stable, so ties keep first-seen order
        List<Group> sorted = new ArrayList<>(groups.values());
        sorted.sort(Comparator.comparing(Group::turnover).reversed());

        BigDecimal total = sorted.stream().map(Group::turnover).reduce(BigDecimal.ZERO, BigDecimal::add);
        List<AggregationRow> rows = new ArrayList<>();
        for (Group group : sorted.subList(0, Math.min(TOP_N, sorted.size()))) {
            rows.add(new AggregationRow(group.id, group.label(), group.turnover,
                    PercentageFormatter.format(group.turnover, total), COEFFICIENT));
        }
        if (sorted.size() > TOP_N) {
            BigDecimal others = sorted.subList(TOP_N, sorted.size()).stream()
                    .map(Group::turnover)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            rows.add(new AggregationRow(AggregationRow.OTHERS_ID, AggregationRow.OTHERS_LABEL, others,
                    PercentageFormatter.format(others, total), COEFFICIENT));
        }
        return rows;
    }

    private static final class Group {
        private final String id;
        private final String name;
        private BigDecimal turnover = BigDecimal.ZERO;

        private Group(String id, String name) {
            this.id = id;
            this.name = name;
        }

        private void add(BigDecimal amount) {
            turnover = turnover.add(amount);
        }

        private BigDecimal turnover() {
            return turnover;
        }

        private String label() {
            return name != null && !name.isBlank() ? name : id;
        }
    }
}
