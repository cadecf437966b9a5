package com.papertrail.core.analytics;

import java.util.List;
import java.util.Objects;

/**
 * Herfindahl-Hirschman index of one agency's awards.
 *
 * @param agencyId      the agency
 * @param hhi           sum of squared contractor shares, or null when the agency
 *                      awarded no value in the window
 * @param level         concentration band, null when {@code hhi} is null
 * @param totalValue    awarded value in the window
 * @param contractCount contracts in the window
 * @param shares        contractor shares, largest first
 * @param window        the analysis window
 */
public record ConcentrationMetric(
        String agencyId,
        Double hhi,
        ConcentrationLevel level,
        double totalValue,
        int contractCount,
        List<MarketShare> shares,
        AnalysisWindow window
) {
    public ConcentrationMetric {
        Objects.requireNonNull(agencyId, "agencyId is required");
        shares = List.copyOf(shares);
    }

    public boolean isDefined() {
        return hhi != null;
    }

    public boolean isMonopoly() {
        return shares.size() == 1 && hhi != null;
    }
}
