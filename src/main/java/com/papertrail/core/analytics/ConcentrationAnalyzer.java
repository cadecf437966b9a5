package com.papertrail.core.analytics;

import com.papertrail.core.derive.ResolvedGraph;
import com.papertrail.core.facts.Contract;
import com.papertrail.core.model.CanonicalEntity;
import com.papertrail.core.model.EntityKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-agency HHI over contract award values.
 */
public class ConcentrationAnalyzer {

    public List<ConcentrationMetric> analyze(ResolvedGraph graph) {
        return analyze(graph, AnalysisWindow.unbounded());
    }

    /**
     * One metric per agency that either awarded a contract or is a resolved
     * agency entity, sorted by agency id.
     */
    public List<ConcentrationMetric> analyze(ResolvedGraph graph, AnalysisWindow window) {
        Map<String, List<Contract>> byAgency = new TreeMap<>();
        for (CanonicalEntity agency : graph.entitiesOfKind(EntityKind.AGENCY)) {
            byAgency.put(agency.getId(), new ArrayList<>());
        }
        for (Contract c : graph.getFacts().getContracts()) {
            List<Contract> list = byAgency.computeIfAbsent(c.agencyId(), k -> new ArrayList<>());
            if (window.contains(c.awardDate())) {
                list.add(c);
            }
        }
        List<ConcentrationMetric> metrics = new ArrayList<>();
        byAgency.forEach((agencyId, contracts) -> metrics.add(compute(agencyId, contracts, window)));
        return metrics;
    }

    public ConcentrationMetric compute(String agencyId, List<Contract> contracts, AnalysisWindow window) {
        Map<String, Double> byContractor = new TreeMap<>();
        double total = 0;
        for (Contract c : contracts) {
            byContractor.merge(c.awardeeId(), c.amount(), Double::sum);
            total += c.amount();
        }
        if (total <= 0) {
            return new ConcentrationMetric(agencyId, null, null, total, contracts.size(), List.of(), window);
        }

        List<MarketShare> shares = new ArrayList<>();
        double hhi = 0;
        for (Map.Entry<String, Double> e : byContractor.entrySet()) {
            if (e.getValue() <= 0) {
                continue;
            }
            double share = e.getValue() / total;
            shares.add(new MarketShare(e.getKey(), e.getValue(), share));
            hhi += share * share;
        }
        shares.sort(Comparator.comparingDouble(MarketShare::share).reversed()
                .thenComparing(MarketShare::contractorId));
        // rounding can nudge a sum of squares a hair past 1
        hhi = Math.min(1.0, hhi);
        return new ConcentrationMetric(agencyId, hhi, ConcentrationLevel.of(hhi), total, contracts.size(),
                shares, window);
    }
}
