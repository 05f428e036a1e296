package com.example.analyzer.domain.model;

/**
 * A statement whose contribution was rejected, with the reason surfaced to the caller.
 */
public record StatementFailure(String statementId, String bank, String reason) {
}
