package com.example.analyzer.domain.exception;

/**
 * Raised when a statement belongs to a different holder than the one the batch was opened for.
 */
public class HolderIdentityMismatchException extends DomainException {

	/**
	 * @param statementHolderId holder national ID found on the rejected statement
	 * @param sessionHolderId   holder national ID fixed by the first statement of the batch
	 */
    public HolderIdentityMismatchException(String statementHolderId, String sessionHolderId) {
        super("Holder ID mismatch: statement=" + statementHolderId + " vs session=" + sessionHolderId);
    }
}
