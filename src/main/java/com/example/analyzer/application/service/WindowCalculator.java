package com.example.analyzer.application.service;

import com.example.analyzer.application.exception.AnchorDateRequiredException;
import com.example.analyzer.domain.model.AnalysisWindow;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Derives the analysis window: the twelve full calendar months before the anchor date's month.
 * The anchor's own, possibly partial, month is never included.
 */
@Service
public class WindowCalculator {

	/**
	 * Computes the window for an anchor date, e.g. 2024-03-15 gives 2023-03-01..2024-02-29.
	 *
	 * @param anchor anchor date, usually today or the statement generation date
	 * @return inclusive window starting on the first day of a month and ending on the last day of a month
	 * @throws AnchorDateRequiredException when {@code anchor} is null
	 */
    public AnalysisWindow compute(LocalDate anchor) {
        if (anchor == null) {
            throw new AnchorDateRequiredException();
        }
        LocalDate firstAnchorMonth = anchor.withDayOfMonth(1);
        LocalDate end = firstAnchorMonth.minusDays(1);
        LocalDate start = end.withDayOfMonth(1).minusMonths(11);
        return new AnalysisWindow(start, end);
    }
}
