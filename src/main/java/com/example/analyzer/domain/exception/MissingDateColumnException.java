package com.example.analyzer.domain.exception;

import java.util.List;

/**
 * Raised when a statement exposes none of the configured or well-known operation-date columns.
 * Such a statement cannot be placed in time, so its whole contribution to the ledger is rejected.
 */
public class MissingDateColumnException extends DomainException {

    private final String statementId;
    private final List<String> candidates;

	/**
	 * Creates the exception and records which columns were tried.
	 *
	 * @param bank        bank key of the offending statement
	 * @param statementId source statement identifier
	 * @param candidates  date column names looked up, in resolution order
	 */
    public MissingDateColumnException(String bank, String statementId, List<String> candidates) {
        super(bank + "/" + statementId + ": no operation date column found (tried " + candidates + ")");
        this.statementId = statementId;
        this.candidates = List.copyOf(candidates);
    }

    public String getStatementId() {
        return statementId;
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
