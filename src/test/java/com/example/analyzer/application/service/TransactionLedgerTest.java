package com.example.analyzer.application.service;

import com.example.analyzer.StatementFixtures;
import com.example.analyzer.application.exception.StatementsRequiredException;
import com.example.analyzer.domain.exception.MissingDateColumnException;
import com.example.analyzer.domain.model.AnalysisWindow;
import com.example.analyzer.domain.model.Ledger;
import com.example.analyzer.domain.model.LedgerEntry;
import com.example.analyzer.domain.model.Statement;
import com.example.analyzer.domain.model.StatementContribution;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.example.analyzer.StatementFixtures.HALYK;
import static com.example.analyzer.StatementFixtures.row;
import static com.example.analyzer.StatementFixtures.statement;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for merging statements into a windowed, deduplicated ledger.
 */
class TransactionLedgerTest {

    private static final AnalysisWindow WINDOW =
            new AnalysisWindow(LocalDate.of(2023, 3, 1), LocalDate.of(2024, 2, 29));

    private final TransactionLedger ledger =
            new TransactionLedger(new OperationDateResolver(StatementFixtures.registry()));

    /**
     * Ensures the first and last window days are kept and rows outside are dropped.
     */
    @Test
    void buildKeepsBoundaryDaysAndDropsOutsideRows() {
        Statement statement = statement("s1.pdf", HALYK, "KZ01", List.of(
                row("Дата", "28.02.2023", "Кредит", "1"),
                row("Дата", "01.03.2023", "Кредит", "2"),
                row("Дата", "29.02.2024", "Кредит", "3"),
                row("Дата", "01.03.2024", "Кредит", "4")));

        Ledger result = ledger.build(List.of(statement), WINDOW);

        assertThat(result.entries()).extracting(LedgerEntry::operationDate)
                .containsExactly(LocalDate.of(2023, 3, 1), LocalDate.of(2024, 2, 29));
        assertThat(result.contributions().get(0).rowsOutsideWindow()).isEqualTo(2);
    }

    /**
     * Ensures overlapping statements collapse to the first occurrence.
     */
    @Test
    void buildDeduplicatesOverlappingStatementsKeepingFirst() {
        Statement first = statement("jan.pdf", HALYK, "KZ01", List.of(
                row("Дата", "10.01.2024", "Кредит", "100")));
        Statement second = statement("jan-copy.pdf", HALYK, "KZ01", List.of(
                row("Дата", "10.01.2024", "Кредит", "100"),
                row("Дата", "11.01.2024", "Кредит", "50")));

        Ledger result = ledger.build(List.of(first, second), WINDOW);

        assertThat(result.entries()).hasSize(2);
        assertThat(result.entries().get(0).sourceStatement()).isEqualTo("jan.pdf");
        assertThat(result.entries().get(1).operationDate()).isEqualTo(LocalDate.of(2024, 1, 11));
        assertThat(result.duplicatesRemoved()).isEqualTo(1);
    }

    /**
     * Ensures same-day rows of different accounts are both kept.
     */
    @Test
    void buildDoesNotDeduplicateAcrossAccounts() {
        Statement first = statement("a.pdf", HALYK, "KZ01", List.of(row("Дата", "10.01.2024")));
        Statement second = statement("b.pdf", HALYK, "KZ02", List.of(row("Дата", "10.01.2024")));

        assertThat(ledger.build(List.of(first, second), WINDOW).entries()).hasSize(2);
    }

    /**
     * Ensures uploading the same statement twice changes nothing.
     */
    @Test
    void buildIsIdempotentForRepeatedUpload() {
        Statement statement = statement("s1.pdf", HALYK, "KZ01", List.of(
                row("Дата", "10.01.2024"), row("Дата", "12.01.2024")));

        Ledger once = ledger.build(List.of(statement), WINDOW);
        Ledger twice = ledger.build(List.of(statement, statement), WINDOW);

        assertThat(twice.entries()).isEqualTo(once.entries());
    }

    /**
     * Ensures rows with unparseable dates are dropped and counted.
     */
    @Test
    void buildDropsAndCountsUnparseableDates() {
        Statement statement = statement("s1.pdf", HALYK, "KZ01", List.of(
                row("Дата", "10.01.2024 14:35"),
                row("Дата", "not a date"),
                row("Дата", "31.02.2024"),
                row("Дата", "")));

        Ledger result = ledger.build(List.of(statement), WINDOW);

        assertThat(result.entries()).hasSize(1);
        assertThat(result.undatedRows()).isEqualTo(3);
    }

    /**
     * Ensures a statement without a date column is reported while the others still contribute.
     */
    @Test
    void buildReportsStatementWithoutDateColumnAndKeepsOthers() {
        Statement broken = statement("broken.pdf", HALYK, "KZ01", List.of(row("Сумма", "10")));
        Statement valid = statement("valid.pdf", HALYK, "KZ02", List.of(row("Дата", "10.01.2024")));

        Ledger result = ledger.build(List.of(broken, valid), WINDOW);

        assertThat(result.entries()).hasSize(1);
        assertThat(result.failures()).singleElement()
                .satisfies(failure -> assertThat(failure.statementId()).isEqualTo("broken.pdf"));
    }

    /**
     * Ensures the per-statement step reports the date columns it tried.
     */
    @Test
    void contributeThrowsWhenDateColumnMissing() {
        Statement broken = statement("broken.pdf", HALYK, "KZ01", List.of(row("Сумма", "10")));

        MissingDateColumnException ex = assertThrows(MissingDateColumnException.class,
                () -> ledger.contribute(broken, WINDOW));

        assertThat(ex.getCandidates()).startsWith("Дата").contains("txn_date", "Operation date");
    }

    /**
     * Ensures the configured date column wins over aliases.
     */
    @Test
    void contributePrefersConfiguredColumnOverAliases() {
        Statement statement = statement("s1.pdf", StatementFixtures.KASPI_GOLD, "KZ01", List.of(
                row("txn_date", "01.01.2020", "date", "15.01.24")));

        StatementContribution contribution = ledger.contribute(statement, WINDOW);

        assertThat(contribution.dateColumn()).isEqualTo("date");
        assertThat(contribution.entries()).extracting(LedgerEntry::operationDate)
                .containsExactly(LocalDate.of(2024, 1, 15));
    }

    /**
     * Ensures unknown banks fall back to alias date columns.
     */
    @Test
    void contributeFallsBackToAliasesForUnknownBank() {
        Statement statement = statement("s1.pdf", "unknown-bank", "KZ01", List.of(
                row("Operation date", "2024-01-15")));

        assertThat(ledger.contribute(statement, WINDOW).dateColumn()).isEqualTo("Operation date");
    }

    /**
     * Ensures ledger entries carry bank, account and source statement.
     */
    @Test
    void buildTagsEntriesWithOrigin() {
        Statement statement = statement("s1.pdf", HALYK, "KZ01", List.of(row("Дата", "10.01.2024")));

        LedgerEntry entry = ledger.build(List.of(statement), WINDOW).entries().get(0);

        assertThat(entry.toRecord())
                .containsEntry("bank", HALYK)
                .containsEntry("account_number", "KZ01")
                .containsEntry("source_statement", "s1.pdf")
                .containsEntry("Дата", "10.01.2024");
    }

    /**
     * Ensures validation fails for a null or empty batch.
     */
    @Test
    void buildRequiresStatements() {
        assertThrows(StatementsRequiredException.class, () -> ledger.build(List.of(), WINDOW));
        assertThrows(StatementsRequiredException.class, () -> ledger.build(null, WINDOW));
    }
}
