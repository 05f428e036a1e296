package com.example.analyzer.application.service;

import com.example.analyzer.application.exception.StatementsRequiredException;
import com.example.analyzer.domain.model.AnalysisReport;
import com.example.analyzer.domain.model.AnalysisWindow;
import com.example.analyzer.domain.model.CanonicalTransaction;
import com.example.analyzer.domain.model.IncomeReport;
import com.example.analyzer.domain.model.Ledger;
import com.example.analyzer.domain.model.NetRow;
import com.example.analyzer.domain.model.Statement;
import com.example.analyzer.domain.model.StatementSession;
import com.example.analyzer.domain.model.TopCounterparties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the analysis core. Exposes each stage on its own and {@link #analyze} which runs
 * window, ledger, normalization, ranking, netting, metadata and income collection in order.
 */
@Service
public class StatementAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(StatementAnalysisService.class);

    private final WindowCalculator windowCalculator;
    private final TransactionLedger transactionLedger;
    private final SchemaNormalizer schemaNormalizer;
    private final CounterpartyAggregator counterpartyAggregator;
    private final RelatedPartyNetter relatedPartyNetter;
    private final AnchorDateResolver anchorDateResolver;
    private final StatementMetadataService metadataService;
    private final IncomeCollector incomeCollector;

    public StatementAnalysisService(WindowCalculator windowCalculator,
                                    TransactionLedger transactionLedger,
                                    SchemaNormalizer schemaNormalizer,
                                    CounterpartyAggregator counterpartyAggregator,
                                    RelatedPartyNetter relatedPartyNetter,
                                    AnchorDateResolver anchorDateResolver,
                                    StatementMetadataService metadataService,
                                    IncomeCollector incomeCollector) {
        this.windowCalculator = windowCalculator;
        this.transactionLedger = transactionLedger;
        this.schemaNormalizer = schemaNormalizer;
        this.counterpartyAggregator = counterpartyAggregator;
        this.relatedPartyNetter = relatedPartyNetter;
        this.anchorDateResolver = anchorDateResolver;
        this.metadataService = metadataService;
        this.incomeCollector = incomeCollector;
    }

    public AnalysisWindow computeWindow(LocalDate anchor) {
        return windowCalculator.compute(anchor);
    }

    public Ledger buildLedger(List<Statement> statements, AnalysisWindow window) {
        return transactionLedger.build(statements, window);
    }

    public List<CanonicalTransaction> normalize(Ledger ledger) {
        return schemaNormalizer.normalize(ledger);
    }

    public TopCounterparties aggregateTopN(List<CanonicalTransaction> transactions) {
        return counterpartyAggregator.aggregateTopN(transactions);
    }

    public List<NetRow> netRelatedParties(List<CanonicalTransaction> transactions) {
        return relatedPartyNetter.net(transactions);
    }

	/**
	 * Runs the full analysis for a session's statements.
	 *
	 * @param session statement batch of one holder
	 * @param anchor  anchor date, or {@code null} to derive it from the statements
	 * @return analysis report
	 */
    public AnalysisReport analyze(StatementSession session, LocalDate anchor) {
        return analyze(session.statements(), anchor);
    }

	/**
	 * Runs the full analysis.
	 *
	 * @param statements statement batch
	 * @param anchor     anchor date, or {@code null} to derive it from the statements
	 * @return analysis report
	 * @throws StatementsRequiredException when the batch is empty
	 */
    public AnalysisReport analyze(List<Statement> statements, LocalDate anchor) {
        if (statements == null || statements.isEmpty()) {
            throw new StatementsRequiredException();
        }
        LocalDate effectiveAnchor = anchor != null ? anchor : anchorDateResolver.resolve(statements);
        AnalysisWindow window = computeWindow(effectiveAnchor);
        log.info("Analyzing {} statements for window {}..{} (anchor {})",
                statements.size(), window.start(), window.end(), effectiveAnchor);

        Ledger ledger = buildLedger(statements, window);
        List<CanonicalTransaction> transactions = normalize(ledger);
        TopCounterparties top = aggregateTopN(transactions);
        List<NetRow> related = netRelatedParties(transactions);
        List<Map<String, Object>> metadata = metadataService.toRecords(statements);
        IncomeReport income = incomeCollector.collect(statements, window);

        log.info("Analysis complete: {} transactions, {} related parties", transactions.size(), related.size());
        return new AnalysisReport(window, ledger, transactions, top, related, metadata, income);
    }
}
