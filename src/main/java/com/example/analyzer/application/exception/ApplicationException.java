package com.example.analyzer.application.exception;

/**
 * Base unchecked exception for failures in the application layer.
 * Analysis services throw subclasses of this type to signal invalid use-case input without
 * coupling to whatever caller (batch job, UI, API) drives the analysis.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * Creates a new application-layer exception with the provided message.
	 *
	 * @param message human readable error description suitable for surfacing to the caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }

	/**
	 * Creates a new application-layer exception that wraps an underlying cause.
	 *
	 * @param message human readable error description suitable for surfacing to the caller
	 * @param cause   underlying exception coming from deeper layers
	 */
    protected ApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
