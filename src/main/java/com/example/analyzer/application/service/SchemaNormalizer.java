package com.example.analyzer.application.service;

import com.example.analyzer.application.support.AmountParser;
import com.example.analyzer.domain.model.BankSchema;
import com.example.analyzer.domain.model.CanonicalTransaction;
import com.example.analyzer.domain.model.Ledger;
import com.example.analyzer.domain.model.LedgerEntry;
import com.example.analyzer.domain.model.StatementRow;
import com.example.analyzer.infrastructure.config.BankSchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Application-layer service that maps bank-specific columns onto {@link CanonicalTransaction}.
 * <p>
 * Amount resolution order: the canonical {@code amount} column, then {@code credit - debit} from the
 * debit/credit columns, then a single signed operation-amount column, then zero. A missing amount never
 * aborts the batch.
 * <p>
 * Counterparty resolution scans structured counterparty columns before free-text descriptions. A 12-digit
 * business identifier found in the text becomes the grouping key and the text before it the display name.
 */
@Service
public class SchemaNormalizer {

    private static final Logger log = LoggerFactory.getLogger(SchemaNormalizer.class);

    static final String CANONICAL_AMOUNT = "amount";
    static final String CANONICAL_COUNTERPARTY_ID = "counterparty_id";
    static final String CANONICAL_COUNTERPARTY_NAME = "counterparty_name";
    static final String UNKNOWN_COUNTERPARTY = "N/A";

    private static final List<String> DEBIT_ALIASES = List.of("Дебет", "debit", "Debit");
    private static final List<String> CREDIT_ALIASES = List.of("Кредит", "credit", "Credit");
    private static final List<String> SIGNED_AMOUNT_ALIASES = List.of(
            "Сумма операции", "Сумма", "Operation amount", "operation_amount");
    private static final List<String> COUNTERPARTY_ALIASES = List.of(
            "counterparty", "Контрагент", "Получатель", "Корреспондент", "recipient", "correspondent");
    private static final List<String> DESCRIPTION_ALIASES = List.of(
            "details", "description", "Назначение платежа", "Детали платежа", "Описание операции");

    private static final Pattern BUSINESS_ID = Pattern.compile("(?<!\\d)(\\d{12})(?!\\d)");
    private static final Pattern TRAILING_ID_LABEL = Pattern.compile(
            "(?iu)(?:^|[\\s,;:()№#/-]+)(?:(?:БИН|ИИН|BIN|IIN)[\\s,;:()№#/-]*)?$");

    private final BankSchemaRegistry registry;

    /**
     * @param registry per-bank column mapping
     */
    public SchemaNormalizer(BankSchemaRegistry registry) {
        this.registry = registry;
    }

	/**
	 * Normalizes every ledger entry.
	 *
	 * @param ledger merged ledger
	 * @return new canonical table in ledger order
	 */
    public List<CanonicalTransaction> normalize(Ledger ledger) {
        return normalize(ledger.entries());
    }

	/**
	 * Normalizes the given entries without touching them.
	 *
	 * @param entries ledger entries
	 * @return new canonical table in the same order
	 */
    public List<CanonicalTransaction> normalize(List<LedgerEntry> entries) {
        Map<String, BankSchema> schemas = new HashMap<>();
        List<CanonicalTransaction> transactions = new ArrayList<>(entries.size());
        int unresolvedAmounts = 0;
        for (LedgerEntry entry : entries) {
            BankSchema schema = schemas.computeIfAbsent(String.valueOf(entry.bank()),
                    bank -> registry.schemaFor(entry.bank()));
            BigDecimal amount = resolveAmount(entry.row(), schema);
            if (amount == null) {
                unresolvedAmounts++;
                amount = BigDecimal.ZERO;
            }
            String description = firstText(entry.row(), descriptionCandidates(schema));
            Counterparty counterparty = resolveCounterparty(entry.row(), schema);
            transactions.add(new CanonicalTransaction(
                    entry.operationDate(),
                    amount,
                    description != null ? description : "",
                    counterparty.id(),
                    counterparty.name(),
                    entry.bank(),
                    entry.accountNumber(),
                    entry.sourceStatement()));
        }
        if (unresolvedAmounts > 0) {
            log.warn("{} of {} transactions had no parseable amount and were set to zero",
                    unresolvedAmounts, entries.size());
        }
        log.debug("Normalized {} transactions", transactions.size());
        return transactions;
    }

	/**
	 * Resolves the signed amount of one row.
	 *
	 * @param row    raw row
	 * @param schema bank schema
	 * @return signed amount, or {@code null} when no amount column yields a number
	 */
    BigDecimal resolveAmount(StatementRow row, BankSchema schema) {
        if (row.hasColumn(CANONICAL_AMOUNT)) {
            BigDecimal canonical = AmountParser.parse(row.value(CANONICAL_AMOUNT));
            if (canonical != null) {
                return canonical;
            }
        }

        String debitColumn = presentColumn(row, schema.debitColumn(), DEBIT_ALIASES);
        String creditColumn = presentColumn(row, schema.creditColumn(), CREDIT_ALIASES);
        if (debitColumn != null || creditColumn != null) {
            BigDecimal debit = debitColumn != null ? AmountParser.parse(row.value(debitColumn)) : null;
            BigDecimal credit = creditColumn != null ? AmountParser.parse(row.value(creditColumn)) : null;
            if (debit != null || credit != null) {
                BigDecimal creditPart = credit != null ? credit.abs() : BigDecimal.ZERO;
                BigDecimal debitPart = debit != null ? debit.abs() : BigDecimal.ZERO;
                return creditPart.subtract(debitPart);
            }
        }

        String signedColumn = presentColumn(row, schema.amountColumn(), SIGNED_AMOUNT_ALIASES);
        if (signedColumn != null) {
            return AmountParser.parse(row.value(signedColumn));
        }
        return null;
    }

	/**
	 * Resolves counterparty id and display name of one row.
	 *
	 * @param row    raw row
	 * @param schema bank schema supplying candidate columns and text prefixes
	 * @return counterparty, {@code N/A} when nothing usable exists
	 */
    Counterparty resolveCounterparty(StatementRow row, BankSchema schema) {
        String existingId = row.text(CANONICAL_COUNTERPARTY_ID);
        String existingName = row.text(CANONICAL_COUNTERPARTY_NAME);
        if (existingId != null || existingName != null) {
            return new Counterparty(
                    existingId != null ? existingId : existingName,
                    existingName != null ? existingName : existingId);
        }

        for (String column : counterpartyCandidates(schema)) {
            String text = firstLine(row.text(column));
            if (text == null) {
                continue;
            }
            text = stripPrefixes(text, schema.textPrefixes());
            if (!text.isEmpty()) {
                return extractCounterparty(text);
            }
        }
        return new Counterparty(UNKNOWN_COUNTERPARTY, UNKNOWN_COUNTERPARTY);
    }

    static Counterparty extractCounterparty(String text) {
        Matcher matcher = BUSINESS_ID.matcher(text);
        if (matcher.find()) {
            String id = matcher.group(1);
            String name = TRAILING_ID_LABEL.matcher(text.substring(0, matcher.start())).replaceFirst("").strip();
            return new Counterparty(id, name.isEmpty() ? id : name);
        }
        return new Counterparty(text, text);
    }

    static String stripPrefixes(String text, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (text.regionMatches(true, 0, prefix, 0, prefix.length())) {
                return text.substring(prefix.length()).strip();
            }
        }
        return text;
    }

    private static String firstLine(String text) {
        if (text == null) {
            return null;
        }
        String line = text.lines().map(String::strip).filter(value -> !value.isEmpty()).findFirst().orElse("");
        return line.isEmpty() ? null : line;
    }

    private static String firstText(StatementRow row, List<String> columns) {
        for (String column : columns) {
            String text = row.text(column);
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    private static String presentColumn(StatementRow row, String configured, List<String> aliases) {
        if (configured != null && row.hasColumn(configured)) {
            return configured;
        }
        for (String alias : aliases) {
            if (row.hasColumn(alias)) {
                return alias;
            }
        }
        return null;
    }

    private static List<String> descriptionCandidates(BankSchema schema) {
        Set<String> columns = new LinkedHashSet<>(schema.descriptionColumns());
        columns.addAll(DESCRIPTION_ALIASES);
        return new ArrayList<>(columns);
    }

    private static List<String> counterpartyCandidates(BankSchema schema) {
        Set<String> columns = new LinkedHashSet<>(schema.counterpartyColumns());
        columns.addAll(COUNTERPARTY_ALIASES);
        columns.addAll(descriptionCandidates(schema));
        return new ArrayList<>(columns);
    }

    record Counterparty(String id, String name) {
    }
}
