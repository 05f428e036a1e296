package com.example.analyzer.domain.model;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inclusive calendar range covering twelve full months.
 *
 * @param start first day of the first month
 * @param end   last day of the last month
 */
public record AnalysisWindow(LocalDate start, LocalDate end) {

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("window_start", start);
        record.put("window_end", end);
        return record;
    }
}
