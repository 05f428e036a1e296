package com.example.analyzer.application.service;

import com.example.analyzer.application.port.IncomeClassification;
import com.example.analyzer.application.port.IncomeClassifier;
import com.example.analyzer.domain.exception.MissingDateColumnException;
import com.example.analyzer.domain.model.AnalysisWindow;
import com.example.analyzer.domain.model.BankSchema;
import com.example.analyzer.domain.model.IncomeColumns;
import com.example.analyzer.domain.model.IncomeReport;
import com.example.analyzer.domain.model.Statement;
import com.example.analyzer.domain.model.StatementContribution;
import com.example.analyzer.domain.model.StatementFailure;
import com.example.analyzer.infrastructure.config.BankSchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the external {@link IncomeClassifier} once per statement on that statement's windowed
 * transactions and collects the enriched records and monthly summaries.
 * Without a classifier bean the collector returns an empty report.
 */
@Service
public class IncomeCollector {

    private static final Logger log = LoggerFactory.getLogger(IncomeCollector.class);

    private final BankSchemaRegistry registry;
    private final TransactionLedger ledger;
    private final Optional<IncomeClassifier> classifier;

    public IncomeCollector(BankSchemaRegistry registry, TransactionLedger ledger,
                           Optional<IncomeClassifier> classifier) {
        this.registry = registry;
        this.ledger = ledger;
        this.classifier = classifier;
    }

	/**
	 * Classifies each statement separately. Banks without income columns are skipped; a statement missing
	 * its credit or date column is recorded as a failure and the rest still run.
	 *
	 * @param statements statement batch
	 * @param window     analysis window
	 * @return collected classifier output
	 */
    public IncomeReport collect(List<Statement> statements, AnalysisWindow window) {
        if (classifier.isEmpty()) {
            log.debug("No income classifier configured, skipping income analysis");
            return IncomeReport.empty();
        }
        if (statements == null || statements.isEmpty()) {
            return IncomeReport.empty();
        }

        List<Map<String, Object>> enriched = new ArrayList<>();
        List<Map<String, Object>> summaries = new ArrayList<>();
        List<StatementFailure> failures = new ArrayList<>();
        for (Statement statement : statements) {
            BankSchema schema = registry.schemaFor(statement.bank());
            IncomeColumns columns = schema.income();
            if (columns == null) {
                log.debug("{}/{}: bank has no income columns, skipped", statement.bank(), statement.statementId());
                continue;
            }
            if (!statement.hasColumn(columns.creditColumn())) {
                String reason = "Credit column '" + columns.creditColumn() + "' not found";
                log.warn("{}/{}: {}", statement.bank(), statement.statementId(), reason);
                failures.add(new StatementFailure(statement.statementId(), statement.bank(), reason));
                continue;
            }
            try {
                StatementContribution contribution = ledger.contribute(statement, window);
                if (contribution.entries().isEmpty()) {
                    continue;
                }
                IncomeColumns resolved = new IncomeColumns(contribution.dateColumn(), columns.creditColumn(),
                        columns.purposeCodeColumn(), columns.purposeColumn(), columns.counterpartyColumn());
                IncomeClassification result = classifier.get().classify(contribution.entries(), resolved);
                collect(statement, result, enriched, summaries);
            } catch (MissingDateColumnException ex) {
                log.warn("{}/{}: income analysis skipped: {}", statement.bank(), statement.statementId(), ex.getMessage());
                failures.add(new StatementFailure(statement.statementId(), statement.bank(), ex.getMessage()));
            }
        }
        log.info("Income analysis: {} summaries, {} enriched transactions, {} failures",
                summaries.size(), enriched.size(), failures.size());
        return new IncomeReport(enriched, summaries, failures);
    }

    private static void collect(Statement statement, IncomeClassification result,
                                List<Map<String, Object>> enriched, List<Map<String, Object>> summaries) {
        if (result == null) {
            return;
        }
        if (result.enrichedTransactions() != null) {
            for (Map<String, Object> transaction : result.enrichedTransactions()) {
                Map<String, Object> record = new LinkedHashMap<>(transaction);
                record.put("bank", statement.bank());
                record.put("account_number", statement.accountNumber());
                record.put("source_statement", statement.statementId());
                enriched.add(record);
            }
        }
        if (result.summary() != null) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("bank", statement.bank());
            summary.put("account_number", statement.accountNumber());
            summary.put("source_statement", statement.statementId());
            result.summary().forEach(summary::putIfAbsent);
            summaries.add(summary);
        }
    }
}
