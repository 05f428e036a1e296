package com.example.analyzer.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Footer/summary block of a statement. Extractors return nothing, a single record or several records;
 * every shape is normalized to a list through {@link #records()}.
 */
public sealed interface StatementFooter
        permits StatementFooter.Empty, StatementFooter.SingleRecord, StatementFooter.RecordList {

    List<Map<String, String>> records();

    static StatementFooter empty() {
        return new Empty();
    }

	/**
	 * Picks the narrowest variant for the given records.
	 *
	 * @param records footer records, possibly {@code null}
	 * @return {@link Empty}, {@link SingleRecord} or {@link RecordList}
	 */
    static StatementFooter fromRecords(List<Map<String, String>> records) {
        if (records == null || records.isEmpty()) {
            return empty();
        }
        if (records.size() == 1) {
            return new SingleRecord(records.get(0));
        }
        return new RecordList(records);
    }

    record Empty() implements StatementFooter {
        @Override
        public List<Map<String, String>> records() {
            return List.of();
        }
    }

    record SingleRecord(Map<String, String> values) implements StatementFooter {
        public SingleRecord {
            values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        @Override
        public List<Map<String, String>> records() {
            return List.of(values);
        }
    }

    record RecordList(List<Map<String, String>> records) implements StatementFooter {
        public RecordList {
            records = records == null
                    ? List.of()
                    : records.stream()
                    .map(values -> Collections.unmodifiableMap(new LinkedHashMap<>(values)))
                    .toList();
        }
    }
}
