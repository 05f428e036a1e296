package com.example.analyzer.application.support;

import com.example.analyzer.domain.model.CanonicalTransaction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.analyzer.StatementFixtures.transaction;
import static org.assertj.core.api.Assertions.assertThat;

class SelfTransferFilterTest {

    /**
     * Ensures self-transfer keywords match the description regardless of case.
     */
    @Test
    void isSelfTransferMatchesDescriptionCaseInsensitively() {
        assertThat(SelfTransferFilter.isSelfTransfer(transaction("ACME", "-10", "Перевод МЕЖДУ СВОИМИ счетами"))).isTrue();
        assertThat(SelfTransferFilter.isSelfTransfer(transaction("ACME", "-10", "Internal Transfer"))).isTrue();
    }

    /**
     * Ensures self-transfer keywords also match the counterparty name.
     */
    @Test
    void isSelfTransferMatchesCounterpartyName() {
        assertThat(SelfTransferFilter.isSelfTransfer(transaction("Between own accounts", "10", ""))).isTrue();
    }

    /**
     * Ensures exclusion keeps the remaining transactions in order.
     */
    @Test
    void excludeKeepsThirdPartyTransactionsInOrder() {
        CanonicalTransaction first = transaction("A", "10");
        CanonicalTransaction own = transaction("B", "20", "own account top-up");
        CanonicalTransaction last = transaction("C", "30");

        assertThat(SelfTransferFilter.exclude(List.of(first, own, last))).containsExactly(first, last);
    }
}
