package com.papertrail.core.derive;

import com.papertrail.core.config.DerivationOptions;
import com.papertrail.core.facts.Donation;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeEvidence;
import com.papertrail.core.model.EdgeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * ALLIED_WITH between politicians funded by at least
 * {@link DerivationOptions#getMinSharedDonors()} of the same donors.
 */
public class DonorAllianceDeriver implements EdgeDeriver {

    private final DerivationOptions options;

    public DonorAllianceDeriver(DerivationOptions options) {
        this.options = options;
    }

    @Override
    public String getName() {
        return "donor-alliance";
    }

    @Override
    public List<DerivedEdge> derive(ResolvedGraph graph) {
        // recipient -> donor -> amount
        Map<String, Map<String, Double>> received = new TreeMap<>();
        for (Donation d : graph.getFacts().getDonations()) {
            received.computeIfAbsent(d.recipientId(), k -> new TreeMap<>()).merge(d.donorId(), d.amount(), Double::sum);
        }
        List<String> recipients = new ArrayList<>(received.keySet());
        List<DerivedEdge> edges = new ArrayList<>();
        for (int i = 0; i < recipients.size(); i++) {
            Map<String, Double> a = received.get(recipients.get(i));
            for (int j = i + 1; j < recipients.size(); j++) {
                Map<String, Double> b = received.get(recipients.get(j));
                TreeSet<String> shared = new TreeSet<>(a.keySet());
                shared.retainAll(b.keySet());
                if (shared.size() < options.getMinSharedDonors()) {
                    continue;
                }
                double combined = 0;
                for (String donor : shared) {
                    combined += a.get(donor) + b.get(donor);
                }
                edges.add(new DerivedEdge(EdgeType.ALLIED_WITH, recipients.get(i), recipients.get(j),
                        new EdgeEvidence.DonorAlliance(List.copyOf(shared), combined)));
            }
        }
        return edges;
    }
}
