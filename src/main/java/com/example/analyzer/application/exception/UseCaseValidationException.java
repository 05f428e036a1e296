package com.example.analyzer.application.exception;

/**
 * Signals validation issues detected while running an analysis use case.
 * Callers may translate this exception into a user-facing message depending on context.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * Builds an exception containing a validation message that can be propagated to the caller.
	 *
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
