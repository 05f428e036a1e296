package com.example.analyzer.application.service;

import com.example.analyzer.application.support.OperationDateParser;
import com.example.analyzer.domain.exception.MissingDateColumnException;
import com.example.analyzer.domain.model.BankSchema;
import com.example.analyzer.domain.model.Statement;
import com.example.analyzer.infrastructure.config.BankSchemaRegistry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the operation-date column of a statement and the date patterns to read it with.
 * The bank's configured column wins; otherwise well-known aliases are tried in order.
 */
@Service
public class OperationDateResolver {

    static final List<String> DATE_ALIASES = List.of(
            "txn_date",
            "Дата",
            "date",
            "Дата операции",
            "Дата проводки",
            "Дата отражения по счету",
            "Operation date"
    );

    private final BankSchemaRegistry registry;

    public OperationDateResolver(BankSchemaRegistry registry) {
        this.registry = registry;
    }

	/**
	 * @param statement statement to inspect
	 * @return candidate column names in resolution order
	 */
    public List<String> candidates(Statement statement) {
        Set<String> candidates = new LinkedHashSet<>();
        String configured = registry.schemaFor(statement.bank()).dateColumn();
        if (configured != null && !configured.isBlank()) {
            candidates.add(configured);
        }
        candidates.addAll(DATE_ALIASES);
        return new ArrayList<>(candidates);
    }

    public Optional<String> findColumn(Statement statement) {
        return candidates(statement).stream()
                .filter(statement::hasColumn)
                .findFirst();
    }

	/**
	 * @param statement statement to inspect
	 * @return the first candidate present in the statement's schema
	 * @throws MissingDateColumnException when no candidate exists
	 */
    public String resolveColumn(Statement statement) {
        return findColumn(statement)
                .orElseThrow(() -> new MissingDateColumnException(
                        statement.bank(), statement.statementId(), candidates(statement)));
    }

    public OperationDateParser parserFor(Statement statement) {
        BankSchema schema = registry.schemaFor(statement.bank());
        return OperationDateParser.withPatterns(schema.dateFormats());
    }
}
