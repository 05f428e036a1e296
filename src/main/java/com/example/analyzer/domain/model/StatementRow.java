package com.example.analyzer.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One raw transaction line as produced by a bank-specific extractor.
 * Column names are whatever the extractor emitted; values keep their original text.
 */
public record StatementRow(Map<String, String> values) {

    public StatementRow {
        values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @param column column name as emitted by the extractor
     * @return raw cell text or {@code null} when the column is absent
     */
    public String value(String column) {
        return column == null ? null : values.get(column);
    }

    public boolean hasColumn(String column) {
        return column != null && values.containsKey(column);
    }

    /**
     * @param column column name
     * @return trimmed cell text, or {@code null} when absent or blank
     */
    public String text(String column) {
        String value = value(column);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.strip();
    }
}
