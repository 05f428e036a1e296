package com.example.analyzer.application.support;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Parses amounts as printed on bank statements ({@code "5 576 876,37"}, {@code "- 2 000,00 ₸"},
 * {@code "1,234.50"}) into {@link BigDecimal}.
 * <p>
 * Whitespace of any kind (including non-breaking and narrow no-break spaces) and currency marks are removed.
 * When both separators appear the last one is the decimal separator; a single comma is a decimal comma;
 * a separator repeated several times is a thousands separator.
 */
public final class AmountParser {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u2007\\u202F]+");
    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9,.+\\-]");

    private AmountParser() {
    }

	/**
	 * @param raw cell text
	 * @return parsed amount, or {@code null} for blank or unparseable input
	 */
    public static BigDecimal parse(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = WHITESPACE.matcher(raw.replace('−', '-')).replaceAll("");
        cleaned = NON_NUMERIC.matcher(cleaned).replaceAll("");
        int firstDigit = indexOfFirstDigit(cleaned);
        if (firstDigit < 0) {
            return null;
        }
        boolean negative = cleaned.substring(0, firstDigit).indexOf('-') >= 0;
        String number = normalizeSeparators(cleaned.substring(firstDigit).replace("+", "").replace("-", ""));
        if (number.isEmpty() || ".".equals(number)) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(number);
            return negative ? value.negate() : value;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static String normalizeSeparators(String digits) {
        int lastComma = digits.lastIndexOf(',');
        int lastDot = digits.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            char decimal = lastComma > lastDot ? ',' : '.';
            char grouping = decimal == ',' ? '.' : ',';
            return digits.replace(String.valueOf(grouping), "").replace(decimal, '.');
        }
        if (lastComma >= 0) {
            return digits.indexOf(',') != lastComma ? digits.replace(",", "") : digits.replace(',', '.');
        }
        if (lastDot >= 0 && digits.indexOf('.') != lastDot) {
            return digits.replace(".", "");
        }
        return digits;
    }

    private static int indexOfFirstDigit(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isDigit(value.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
