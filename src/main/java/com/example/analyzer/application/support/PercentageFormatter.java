package com.example.analyzer.application.support;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Formats a turnover share of a total as the percentage label shown in Top-N tables.
 * <p>
 * Zero part or zero total gives {@code "0%"}. Shares below 0.1% give {@code "<0.1%"} so that a tiny but
 * non-zero share never reads as zero. Shares below 1% keep one decimal, anything else is a whole percent.
 * Bands are decided on the exact ratio; rounding (half-up) only applies to the printed figure, and a
 * sub-1% share that rounds up to one prints as {@code "1%"}.
 */
public final class PercentageFormatter {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private PercentageFormatter() {
    }

    public static String format(BigDecimal part, BigDecimal total) {
        if (part == null || total == null || part.signum() == 0 || total.signum() == 0) {
            return "0%";
        }
        BigDecimal absPart = part.abs();
        BigDecimal absTotal = total.abs();
        if (absPart.multiply(THOUSAND).compareTo(absTotal) < 0) {
            return "<0.1%";
        }
        BigDecimal percent = absPart.multiply(HUNDRED);
        if (percent.compareTo(absTotal) < 0) {
            BigDecimal oneDecimal = percent.divide(absTotal, 1, RoundingMode.HALF_UP);
            if (oneDecimal.compareTo(BigDecimal.ONE) < 0) {
                return oneDecimal.toPlainString() + "%";
            }
        }
        return percent.divide(absTotal, 0, RoundingMode.HALF_UP).toPlainString() + "%";
    }
}
