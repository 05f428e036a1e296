package com.example.analyzer.domain.model;

import java.util.List;

/**
 * Column-name mapping of one bank's transaction tables onto the canonical transaction shape.
 *
 * @param bankKey             registry key, e.g. {@code halyk-business}
 * @param displayName         human friendly bank name
 * @param dateColumn          operation date column, may be {@code null}
 * @param dateFormats         extra date patterns tried before the defaults
 * @param amountColumn        signed amount column, may be {@code null}
 * @param debitColumn         outgoing amount column, may be {@code null}
 * @param creditColumn        incoming amount column, may be {@code null}
 * @param counterpartyColumns structured counterparty columns in priority order
 * @param descriptionColumns  free-text description columns in priority order
 * @param textPrefixes        fixed phrases stripped from counterparty text
 * @param income              columns for the income classifier, {@code null} when unsupported
 */
public record BankSchema(
        String bankKey,
        String displayName,
        String dateColumn,
        List<String> dateFormats,
        String amountColumn,
        String debitColumn,
        String creditColumn,
        List<String> counterpartyColumns,
        List<String> descriptionColumns,
        List<String> textPrefixes,
        IncomeColumns income
) {

    public BankSchema {
        dateFormats = dateFormats == null ? List.of() : List.copyOf(dateFormats);
        counterpartyColumns = counterpartyColumns == null ? List.of() : List.copyOf(counterpartyColumns);
        descriptionColumns = descriptionColumns == null ? List.of() : List.copyOf(descriptionColumns);
        textPrefixes = textPrefixes == null ? List.of() : List.copyOf(textPrefixes);
    }

	/**
	 * Schema for a bank without a registry entry: only the well-known aliases apply.
	 *
	 * @param bankKey bank key found on the statement
	 * @return schema without any configured column
	 */
    public static BankSchema unconfigured(String bankKey) {
        return new BankSchema(bankKey, bankKey, null, List.of(), null, null, null,
                List.of(), List.of(), List.of(), null);
    }
}
