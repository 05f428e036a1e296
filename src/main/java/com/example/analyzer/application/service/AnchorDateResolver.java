package com.example.analyzer.application.service;

import com.example.analyzer.application.exception.StatementsRequiredException;
import com.example.analyzer.application.support.OperationDateParser;
import com.example.analyzer.domain.exception.AnchorDateUnavailableException;
import com.example.analyzer.domain.model.Statement;
import com.example.analyzer.domain.model.StatementRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the anchor date of the analysis window when the caller does not supply one.
 * Per statement the generation date is preferred, then the declared period end, then the latest
 * operation date that parses.
 */
@Service
public class AnchorDateResolver {

    private static final Logger log = LoggerFactory.getLogger(AnchorDateResolver.class);

    private final OperationDateResolver dateResolver;

    public AnchorDateResolver(OperationDateResolver dateResolver) {
        this.dateResolver = dateResolver;
    }

	/**
	 * @param statement statement to inspect
	 * @return anchor date for this statement
	 * @throws AnchorDateUnavailableException when no date source is available
	 */
    public LocalDate resolve(Statement statement) {
        if (statement.generationDate() != null) {
            return statement.generationDate();
        }
        if (statement.periodTo() != null) {
            return statement.periodTo();
        }
        return latestOperationDate(statement)
                .orElseThrow(() -> new AnchorDateUnavailableException(statement.statementId()));
    }

	/**
	 * Resolves the latest anchor across a batch. Statements that cannot provide an anchor are skipped.
	 *
	 * @param statements statement batch
	 * @return latest per-statement anchor
	 * @throws StatementsRequiredException    when the batch is null or empty
	 * @throws AnchorDateUnavailableException when no statement provides an anchor
	 */
    public LocalDate resolve(List<Statement> statements) {
        if (statements == null || statements.isEmpty()) {
            throw new StatementsRequiredException();
        }
        LocalDate latest = null;
        String lastStatementId = null;
        for (Statement statement : statements) {
            if (statement == null) {
                continue;
            }
            lastStatementId = statement.statementId();
            try {
                LocalDate anchor = resolve(statement);
                if (latest == null || anchor.isAfter(latest)) {
                    latest = anchor;
                }
            } catch (AnchorDateUnavailableException ex) {
                log.warn("Skipping statement for anchor resolution: {}", ex.getMessage());
            }
        }
        if (latest == null) {
            throw new AnchorDateUnavailableException(Objects.toString(lastStatementId, "batch"));
        }
        log.debug("Resolved anchor date {}", latest);
        return latest;
    }

    private Optional<LocalDate> latestOperationDate(Statement statement) {
        Optional<String> column = dateResolver.findColumn(statement);
        if (column.isEmpty()) {
            return Optional.empty();
        }
        OperationDateParser parser = dateResolver.parserFor(statement);
        LocalDate latest = null;
        for (StatementRow row : statement.rows()) {
            LocalDate date = parser.parse(row.value(column.get()));
            if (date != null && (latest == null || date.isAfter(latest))) {
                latest = date;
            }
        }
        return Optional.ofNullable(latest);
    }
}
