package com.example.analyzer.application.port;

import com.example.analyzer.domain.model.IncomeColumns;
import com.example.analyzer.domain.model.LedgerEntry;

import java.util.List;

/**
 * Port to the external per-transaction income classification engine.
 * Implementations categorize entrepreneurial income from payment-purpose codes and keywords;
 * the analysis core treats their output as opaque records.
 */
public interface IncomeClassifier {

	/**
	 * Classifies the windowed transactions of one statement.
	 *
	 * @param transactions statement transactions already confined to the analysis window
	 * @param columns      bank-specific column names the classifier should read
	 * @return enriched transactions and a monthly income summary
	 */
    IncomeClassification classify(List<LedgerEntry> transactions, IncomeColumns columns);
}
