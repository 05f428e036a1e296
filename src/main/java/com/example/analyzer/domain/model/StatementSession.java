package com.example.analyzer.domain.model;

import com.example.analyzer.domain.exception.HolderIdentityMismatchException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered batch of statements belonging to one account holder.
 * The first statement added fixes the holder ID; later statements of another holder are rejected
 * unless the session was opened with {@code allowHolderMismatch}.
 * Not thread-safe; one session per caller.
 */
public class StatementSession {

    private final boolean allowHolderMismatch;
    private final List<Statement> statements = new ArrayList<>();
    private String holderId;

    public StatementSession() {
        this(false);
    }

	/**
	 * @param allowHolderMismatch accept statements of a different holder
	 */
    public StatementSession(boolean allowHolderMismatch) {
        this.allowHolderMismatch = allowHolderMismatch;
    }

	/**
	 * Appends a statement to the batch.
	 *
	 * @param statement parsed statement
	 * @throws HolderIdentityMismatchException when the holder differs and mismatches are not allowed
	 */
    public void add(Statement statement) {
        Objects.requireNonNull(statement, "statement");
        if (statements.isEmpty()) {
            holderId = statement.holderId();
        } else if (!allowHolderMismatch && !Objects.equals(holderId, statement.holderId())) {
            throw new HolderIdentityMismatchException(statement.holderId(), holderId);
        }
        statements.add(statement);
    }

    public List<Statement> statements() {
        return List.copyOf(statements);
    }

    public String holderId() {
        return holderId;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public int size() {
        return statements.size();
    }
}
