package com.example.analyzer.domain.model;

import java.math.BigDecimal;

/**
 * Direction of a money flow relative to the statement holder.
 */
public enum FlowSide {
    DEBIT,
    CREDIT;

	/**
	 * @param amount signed canonical amount
	 * @return {@code true} when the amount belongs to this side; zero amounts belong to neither
	 */
    public boolean matches(BigDecimal amount) {
        if (amount == null) {
            return false;
        }
        return this == DEBIT ? amount.signum() < 0 : amount.signum() > 0;
    }
}
