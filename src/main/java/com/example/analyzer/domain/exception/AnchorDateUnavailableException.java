package com.example.analyzer.domain.exception;

/**
 * Raised when neither the statement header nor its transactions yield a date to anchor the analysis window.
 */
public class AnchorDateUnavailableException extends DomainException {

	/**
	 * @param statementId statement that could not provide an anchor
	 */
    public AnchorDateUnavailableException(String statementId) {
        super("Cannot determine anchor date for " + statementId
                + ": no generation date, no period end and no parseable operation dates.");
    }
}
