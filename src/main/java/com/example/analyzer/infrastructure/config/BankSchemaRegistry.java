package com.example.analyzer.infrastructure.config;

import com.example.analyzer.domain.model.BankSchema;
import com.example.analyzer.domain.model.IncomeColumns;
import com.example.analyzer.infrastructure.exception.BankSchemaConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only lookup of bank schemas, built once from {@link AnalyzerProperties} at startup.
 * Banks without an entry resolve to {@link BankSchema#unconfigured(String)}.
 */
@Component
public class BankSchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(BankSchemaRegistry.class);

    private final Map<String, BankSchema> schemas;

	/**
	 * Validates and freezes the configured bank schemas.
	 *
	 * @param properties bound {@code analyzer.*} configuration
	 * @throws BankSchemaConfigurationException when an entry has a blank key or an invalid date pattern
	 */
    public BankSchemaRegistry(AnalyzerProperties properties) {
        Map<String, BankSchema> loaded = new LinkedHashMap<>();
        Map<String, AnalyzerProperties.Bank> banks = properties == null || properties.banks() == null
                ? Map.of()
                : properties.banks();
        banks.forEach((key, bank) -> {
            if (key == null || key.isBlank()) {
                throw new BankSchemaConfigurationException("Bank schema entry without a key.");
            }
            loaded.put(key, toSchema(key, bank));
        });
        this.schemas = Collections.unmodifiableMap(loaded);
        log.info("Loaded {} bank schemas: {}", schemas.size(), schemas.keySet());
    }

	/**
	 * @param bankKey bank key carried by a statement
	 * @return configured schema, or an unconfigured one for unknown keys
	 */
    public BankSchema schemaFor(String bankKey) {
        BankSchema schema = bankKey == null ? null : schemas.get(bankKey);
        return schema != null ? schema : BankSchema.unconfigured(bankKey);
    }

    public boolean isConfigured(String bankKey) {
        return bankKey != null && schemas.containsKey(bankKey);
    }

    public Set<String> bankKeys() {
        return schemas.keySet();
    }

    private BankSchema toSchema(String key, AnalyzerProperties.Bank bank) {
        if (bank == null) {
            return BankSchema.unconfigured(key);
        }
        if (bank.dateFormats() != null) {
            for (String pattern : bank.dateFormats()) {
                validateDatePattern(key, pattern);
            }
        }
        IncomeColumns income = null;
        if (bank.income() != null) {
            income = new IncomeColumns(
                    bank.dateColumn(),
                    bank.income().creditColumn(),
                    bank.income().purposeCodeColumn(),
                    bank.income().purposeColumn(),
                    bank.income().counterpartyColumn());
        }
        return new BankSchema(
                key,
                bank.displayName() != null ? bank.displayName() : key,
                bank.dateColumn(),
                bank.dateFormats(),
                bank.amountColumn(),
                bank.debitColumn(),
                bank.creditColumn(),
                bank.counterpartyColumns(),
                bank.descriptionColumns(),
                bank.textPrefixes(),
                income);
    }

	/**
	 * Patterns are parsed with {@link ResolverStyle#STRICT}, where a year-of-era ({@code y}) or week-based
	 * year ({@code Y}) without an era never resolves to a date, so only {@code u} is accepted for the year.
	 */
    private static void validateDatePattern(String key, String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new BankSchemaConfigurationException("Blank date format for bank " + key);
        }
        try {
            DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
        } catch (IllegalArgumentException ex) {
            throw new BankSchemaConfigurationException(
                    "Invalid date format '" + pattern + "' for bank " + key, ex);
        }
        if (hasUnquotedYearOfEra(pattern)) {
            throw new BankSchemaConfigurationException("Date format '" + pattern + "' for bank " + key
                    + " uses 'y'/'Y' for the year, which never matches under strict parsing; use 'u' instead");
        }
    }

    private static boolean hasUnquotedYearOfEra(String pattern) {
        boolean quoted = false;
        for (char c : pattern.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && (c == 'y' || c == 'Y')) {
                return true;
            }
        }
        return false;
    }
}
