package com.example.analyzer.application.service;

import com.example.analyzer.application.exception.StatementsRequiredException;
import com.example.analyzer.application.support.OperationDateParser;
import com.example.analyzer.domain.exception.MissingDateColumnException;
import com.example.analyzer.domain.model.AnalysisWindow;
import com.example.analyzer.domain.model.Ledger;
import com.example.analyzer.domain.model.LedgerEntry;
import com.example.analyzer.domain.model.Statement;
import com.example.analyzer.domain.model.StatementContribution;
import com.example.analyzer.domain.model.StatementFailure;
import com.example.analyzer.domain.model.StatementRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Application-layer service that merges the transactions of a statement batch into one ledger.
 * <p>
 * Each statement is placed in time independently (date column resolution, date parsing, window filter,
 * tagging). The merge is a single ordered pass that collapses rows sharing bank, account number and
 * operation date, keeping the first occurrence; this guards against the same statement, or statements
 * with overlapping periods, being uploaded twice.
 */
@Service
public class TransactionLedger {

    private static final Logger log = LoggerFactory.getLogger(TransactionLedger.class);

    private final OperationDateResolver dateResolver;

    /**
     * @param dateResolver resolves the operation-date column and patterns per statement
     */
    public TransactionLedger(OperationDateResolver dateResolver) {
        this.dateResolver = dateResolver;
    }

	/**
	 * Builds the merged ledger for the window.
	 * A statement without a usable date column is reported in {@link Ledger#failures()} and does not
	 * prevent the remaining statements from contributing.
	 *
	 * @param statements statement batch, in upload order
	 * @param window     analysis window
	 * @return windowed, deduplicated ledger in insertion order
	 * @throws StatementsRequiredException when the batch is null or empty
	 */
    public Ledger build(List<Statement> statements, AnalysisWindow window) {
        if (statements == null || statements.isEmpty()) {
            throw new StatementsRequiredException();
        }
        Objects.requireNonNull(window, "window");

        List<StatementContribution> contributions = new ArrayList<>();
        List<StatementFailure> failures = new ArrayList<>();
        for (Statement statement : statements) {
            if (statement == null) {
                continue;
            }
            try {
                contributions.add(contribute(statement, window));
            } catch (MissingDateColumnException ex) {
                log.warn("Statement {} excluded from ledger: {}", statement.statementId(), ex.getMessage());
                failures.add(new StatementFailure(statement.statementId(), statement.bank(), ex.getMessage()));
            }
        }

        List<LedgerEntry> entries = new ArrayList<>();
        Set<DedupKey> seen = new HashSet<>();
        int duplicates = 0;
        for (StatementContribution contribution : contributions) {
            for (LedgerEntry entry : contribution.entries()) {
                DedupKey key = dedupKey(entry);
                if (key == null || seen.add(key)) {
                    entries.add(entry);
                } else {
                    duplicates++;
                }
            }
        }

        Ledger ledger = new Ledger(window, entries, contributions, failures, duplicates);
        log.info("Ledger for {}..{}: {} entries from {} statements ({} failed, {} undated rows dropped, {} duplicates removed)",
                window.start(), window.end(), entries.size(), contributions.size(), failures.size(),
                ledger.undatedRows(), duplicates);
        return ledger;
    }

	/**
	 * Places one statement's rows in time: resolves the date column, drops rows with unparseable
	 * dates, keeps in-window rows and tags them with bank, account and source statement.
	 *
	 * @param statement statement to place
	 * @param window    analysis window
	 * @return per-statement contribution with drop counts
	 * @throws MissingDateColumnException when the statement has no usable date column
	 */
    public StatementContribution contribute(Statement statement, AnalysisWindow window) {
        String dateColumn = dateResolver.resolveColumn(statement);
        OperationDateParser parser = dateResolver.parserFor(statement);

        List<LedgerEntry> entries = new ArrayList<>();
        int undated = 0;
        int outside = 0;
        for (StatementRow row : statement.rows()) {
            LocalDate date = parser.parse(row.value(dateColumn));
            if (date == null) {
                undated++;
            } else if (!window.contains(date)) {
                outside++;
            } else {
                entries.add(new LedgerEntry(date, statement.bank(), statement.accountNumber(),
                        statement.statementId(), row));
            }
        }

        if (undated > 0) {
            log.warn("{}/{}: dropped {} of {} rows with unparseable dates in column '{}'",
                    statement.bank(), statement.statementId(), undated, statement.rows().size(), dateColumn);
        }
        log.debug("{}/{}: {} rows in window, {} outside", statement.bank(), statement.statementId(),
                entries.size(), outside);
        return new StatementContribution(statement.statementId(), statement.bank(), dateColumn,
                statement.rows().size(), undated, outside, entries);
    }

	/**
	 * @return composite key, or {@code null} when bank or account number is missing
	 */
    static DedupKey dedupKey(LedgerEntry entry) {
        if (isBlank(entry.bank()) || isBlank(entry.accountNumber()) || entry.operationDate() == null) {
            return null;
        }
        return new DedupKey(entry.bank(), entry.accountNumber(), entry.operationDate());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    record DedupKey(String bank, String accountNumber, LocalDate operationDate) {
    }
}
