package com.example.analyzer.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Binds the {@code analyzer.*} section of {@code application.yml}.
 *
 * @param banks bank key to column mapping
 */
@ConfigurationProperties(prefix = "analyzer")
public record AnalyzerProperties(Map<String, Bank> banks) {

    /**
     * Column names used by one bank's extractor.
     */
    public record Bank(
            String displayName,
            String dateColumn,
            List<String> dateFormats,
            String amountColumn,
            String debitColumn,
            String creditColumn,
            List<String> counterpartyColumns,
            List<String> descriptionColumns,
            List<String> textPrefixes,
            Income income
    ) {
    }

    /**
     * Columns the external income classifier reads.
     */
    public record Income(
            String creditColumn,
            String purposeCodeColumn,
            String purposeColumn,
            String counterpartyColumn
    ) {
    }
}
