package com.example.analyzer.application.service;

import com.example.analyzer.domain.model.NetRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.analyzer.StatementFixtures.transaction;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for per-counterparty net positions.
 */
class RelatedPartyNetterTest {

    private final RelatedPartyNetter netter = new RelatedPartyNetter();

    /**
     * Ensures debit, credit, balance and turnover are summed per counterparty.
     */
    @Test
    void netSumsDebitCreditBalanceAndTurnover() {
        List<NetRow> rows = netter.net(List.of(
                transaction("X", "-100"),
                transaction("X", "300"),
                transaction("X", "-50")));

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.debit()).isEqualByComparingTo("-150");
            assertThat(row.credit()).isEqualByComparingTo("300");
            assertThat(row.balance()).isEqualByComparingTo("150");
            assertThat(row.turnover()).isEqualByComparingTo("450");
            assertThat(row.coefficient()).isEqualTo(1);
        });
    }

    /**
     * Ensures every counterparty is kept, in first-seen order.
     */
    @Test
    void netKeepsEveryCounterpartyInFirstSeenOrder() {
        List<NetRow> rows = netter.net(List.of(
                transaction("B", "1"),
                transaction("A", "-1"),
                transaction("C", "5"),
                transaction("B", "2")));

        assertThat(rows).extracting(NetRow::counterpartyId).containsExactly("B", "A", "C");
        assertThat(rows.get(1).toRecord()).containsEntry("counterparty", "A");
    }

    /**
     * Ensures transfers between own accounts are left out of netting.
     */
    @Test
    void netExcludesSelfTransfers() {
        List<NetRow> rows = netter.net(List.of(
                transaction("Own", "500", "Transfer between own accounts"),
                transaction("Client", "20")));

        assertThat(rows).extracting(NetRow::counterpartyId).containsExactly("Client");
    }

    /**
     * Ensures an empty input gives an empty table.
     */
    @Test
    void netReturnsEmptyForNoTransactions() {
        assertThat(netter.net(List.of())).isEmpty();
    }
}
