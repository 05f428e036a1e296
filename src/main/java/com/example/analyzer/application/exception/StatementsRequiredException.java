package com.example.analyzer.application.exception;

/**
 * Thrown when a ledger is requested for an empty statement batch.
 */
public class StatementsRequiredException extends UseCaseValidationException {

    public StatementsRequiredException() {
        super("At least one statement is required to build a ledger.");
    }
}
