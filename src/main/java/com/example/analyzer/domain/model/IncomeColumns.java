package com.example.analyzer.domain.model;

/**
 * Bank-specific column names handed to the external income classifier.
 */
public record IncomeColumns(
        String dateColumn,
        String creditColumn,
        String purposeCodeColumn,
        String purposeColumn,
        String counterpartyColumn
) {
}
