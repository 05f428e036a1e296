package com.example.analyzer.application.support;

import com.example.analyzer.domain.model.CanonicalTransaction;

import java.util.List;
import java.util.Locale;

/**
 * Recognizes transfers between the holder's own accounts. These are not activity with third parties
 * and are excluded from counterparty rankings and netting.
 */
public final class SelfTransferFilter {

    static final List<String> KEYWORDS = List.of(
            "between own accounts",
            "own account",
            "internal transfer",
            "между своими",
            "перевод между своими",
            "со своего счета",
            "с карты другого банка"
    );

    private SelfTransferFilter() {
    }

	/**
	 * @param transaction canonical transaction
	 * @return {@code true} when its description or counterparty name carries a self-transfer keyword
	 */
    public static boolean isSelfTransfer(CanonicalTransaction transaction) {
        return containsKeyword(transaction.description()) || containsKeyword(transaction.counterpartyName());
    }

    public static List<CanonicalTransaction> exclude(List<CanonicalTransaction> transactions) {
        if (transactions == null) {
            return List.of();
        }
        return transactions.stream()
                .filter(transaction -> !isSelfTransfer(transaction))
                .toList();
    }

    private static boolean containsKeyword(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        for (String keyword : KEYWORDS) {
            if (normalized.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
