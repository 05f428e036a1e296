package com.example.analyzer.application.service;

import com.example.analyzer.StatementFixtures;
import com.example.analyzer.domain.model.BankSchema;
import com.example.analyzer.domain.model.CanonicalTransaction;
import com.example.analyzer.domain.model.LedgerEntry;
import com.example.analyzer.domain.model.StatementRow;
import com.example.analyzer.infrastructure.config.BankSchemaRegistry;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.example.analyzer.StatementFixtures.HALYK;
import static com.example.analyzer.StatementFixtures.KASPI_GOLD;
import static com.example.analyzer.StatementFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for mapping bank columns onto canonical transactions.
 */
class SchemaNormalizerTest {

    private final BankSchemaRegistry registry = StatementFixtures.registry();
    private final SchemaNormalizer normalizer = new SchemaNormalizer(registry);

    /**
     * Ensures split debit/credit columns become one signed amount.
     */
    @Test
    void normalizeComputesCreditMinusDebit() {
        List<CanonicalTransaction> result = normalizer.normalize(List.of(
                entry(HALYK, row("Дебет", "1 500,00", "Кредит", "")),
                entry(HALYK, row("Дебет", "", "Кредит", "2 000,50"))));

        assertThat(result).extracting(CanonicalTransaction::amount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("-1500.00"), new BigDecimal("2000.50"));
    }

    /**
     * Ensures an existing canonical amount wins over debit/credit columns.
     */
    @Test
    void normalizePrefersCanonicalAmountColumn() {
        CanonicalTransaction result = normalizer.normalize(List.of(
                entry(HALYK, row("amount", "-42", "Дебет", "100", "Кредит", "")))).get(0);

        assertThat(result.amount()).isEqualByComparingTo("-42");
    }

    /**
     * Ensures a signed operation-amount column is used when nothing else exists.
     */
    @Test
    void normalizeFallsBackToSignedOperationAmount() {
        CanonicalTransaction result = normalizer.normalize(List.of(
                entry("unknown-bank", row("Сумма операции", "-3 200,00 ₸")))).get(0);

        assertThat(result.amount()).isEqualByComparingTo("-3200.00");
    }

    /**
     * Ensures a row without any amount column degrades to zero.
     */
    @Test
    void normalizeDefaultsMissingAmountToZero() {
        CanonicalTransaction result = normalizer.normalize(List.of(
                entry(HALYK, row("Детали платежа", "fee")))).get(0);

        assertThat(result.amount()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(result.description()).isEqualTo("fee");
    }

    /**
     * Ensures a 12-digit BIN becomes the counterparty id and the text before it the name.
     */
    @Test
    void normalizeExtractsBusinessIdentifierFromCounterpartyText() {
        CanonicalTransaction result = normalizer.normalize(List.of(
                entry(HALYK, row("Кредит", "10", "Контрагент (имя)", "TOO Alpha, БИН 123456789012\nKZ123 Halyk")))).get(0);

        assertThat(result.counterpartyId()).isEqualTo("123456789012");
        assertThat(result.counterpartyName()).isEqualTo("TOO Alpha");
    }

    /**
     * Ensures counterparty text without an identifier is both id and name.
     */
    @Test
    void normalizeUsesWholeTextWhenNoIdentifier() {
        CanonicalTransaction result = normalizer.normalize(List.of(
                entry(HALYK, row("Кредит", "10", "Контрагент (имя)", "IP Beta")))).get(0);

        assertThat(result.counterpartyId()).isEqualTo("IP Beta");
        assertThat(result.counterpartyName()).isEqualTo("IP Beta");
    }

    /**
     * Ensures fixed bank phrases are stripped from counterparty text but kept in the description.
     */
    @Test
    void normalizeStripsBankPrefixesFromDescription() {
        CanonicalTransaction result = normalizer.normalize(List.of(
                entry(KASPI_GOLD, row("amount", "-500", "details", "Payment to merchant Magnum")))).get(0);

        assertThat(result.counterpartyId()).isEqualTo("Magnum");
        assertThat(result.description()).isEqualTo("Payment to merchant Magnum");
    }

    /**
     * Ensures existing canonical counterparty columns win.
     */
    @Test
    void normalizeKeepsExistingCanonicalCounterparty() {
        CanonicalTransaction result = normalizer.normalize(List.of(
                entry(HALYK, row("counterparty_id", "999", "counterparty_name", "Gamma", "Контрагент (имя)", "Other")))).get(0);

        assertThat(result.counterpartyId()).isEqualTo("999");
        assertThat(result.counterpartyName()).isEqualTo("Gamma");
    }

    /**
     * Ensures rows without counterparty text are marked N/A.
     */
    @Test
    void normalizeMarksUnknownCounterparty() {
        CanonicalTransaction result = normalizer.normalize(List.of(entry(HALYK, row("Кредит", "1")))).get(0);

        assertThat(result.counterpartyId()).isEqualTo("N/A");
        assertThat(result.counterpartyName()).isEqualTo("N/A");
        assertThat(result.description()).isEmpty();
    }

    /**
     * Ensures canonical transactions keep their ledger origin tags.
     */
    @Test
    void normalizeCarriesOriginTags() {
        CanonicalTransaction result = normalizer.normalize(List.of(entry(HALYK, row("Кредит", "1")))).get(0);

        assertThat(result.toRecord())
                .containsEntry("bank", HALYK)
                .containsEntry("account_number", "KZ01")
                .containsEntry("source_statement", "s1.pdf")
                .containsEntry("txn_date", LocalDate.of(2024, 1, 10));
    }

    /**
     * Ensures the identifier doubles as the name when only a label precedes it.
     */
    @Test
    void extractCounterpartyUsesIdentifierAsNameWhenNothingPrecedesIt() {
        SchemaNormalizer.Counterparty counterparty = SchemaNormalizer.extractCounterparty("BIN: 123456789012 payment");

        assertThat(counterparty.id()).isEqualTo("123456789012");
        assertThat(counterparty.name()).isEqualTo("123456789012");
    }

    /**
     * Ensures a debit printed with a minus sign still yields a negative amount.
     */
    @Test
    void resolveAmountIgnoresSignOfDebitColumn() {
        BankSchema schema = registry.schemaFor(HALYK);

        BigDecimal amount = normalizer.resolveAmount(new StatementRow(row("Дебет", "-250")), schema);

        assertThat(amount).isEqualByComparingTo("-250");
    }

    private static LedgerEntry entry(String bank, Map<String, String> values) {
        return new LedgerEntry(LocalDate.of(2024, 1, 10), bank, "KZ01", "s1.pdf", new StatementRow(values));
    }
}
