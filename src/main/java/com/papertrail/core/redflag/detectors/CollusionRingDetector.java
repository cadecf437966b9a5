package com.papertrail.core.redflag.detectors;

import com.papertrail.core.config.DetectionOptions;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeEvidence;
import com.papertrail.core.model.EdgeType;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;
import com.papertrail.core.model.WinPattern;
import com.papertrail.core.redflag.DetectionContext;
import com.papertrail.core.redflag.RedFlagDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Densely connected rotating-win groups in the co-bidding graph.
 *
 * <p>Communities come from modularity-based local moving over CO_BID_WITH
 * edges weighted by shared contract count. Nodes are visited in id order and
 * ties go to the lowest community, so the partition is deterministic. A
 * community is flagged when it is large enough, dense enough and enough of its
 * internal edges show rotating wins.</p>
 */
public class CollusionRingDetector implements RedFlagDetector {
    private static final Logger log = LoggerFactory.getLogger(CollusionRingDetector.class);

    @Override
    public RedFlagType getType() {
        return RedFlagType.COLLUSION_RING;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        DetectionOptions options = context.options();
        List<DerivedEdge> edges = context.edges(EdgeType.CO_BID_WITH);
        if (edges.isEmpty()) {
            return List.of();
        }

        Communities communities = findCommunities(edges, options.getCommunityIterationBudget());
        if (communities.truncated()) {
            log.warn("collusion_ring.budget_exhausted iterations={}", options.getCommunityIterationBudget());
        }

        List<RedFlag> flags = new ArrayList<>();
        for (List<String> members : communities.groups()) {
            if (members.size() < options.getRingMinSize()) {
                continue;
            }
            TreeSet<String> memberSet = new TreeSet<>(members);
            List<DerivedEdge> internal = edges.stream()
                    .filter(e -> memberSet.contains(e.sourceId()) && memberSet.contains(e.targetId()))
                    .toList();
            long possible = (long) members.size() * (members.size() - 1) / 2;
            double density = (double) internal.size() / possible;
            long rotating = internal.stream()
                    .filter(e -> e.evidence() instanceof EdgeEvidence.CoBid coBid
                            && coBid.winPattern() == WinPattern.ROTATING)
                    .count();
            double rotation = internal.isEmpty() ? 0.0 : (double) rotating / internal.size();
            if (density < options.getRingMinDensity() || rotation < options.getRingMinRotation()) {
                continue;
            }

            boolean critical = members.size() >= options.getRingCriticalSize()
                    && rotation >= options.getRingCriticalRotation();
            TreeSet<String> contractRefs = new TreeSet<>();
            int sharedContracts = 0;
            for (DerivedEdge edge : internal) {
                if (edge.evidence() instanceof EdgeEvidence.CoBid coBid) {
                    contractRefs.addAll(coBid.contractRefs());
                    sharedContracts += coBid.contractCount();
                }
            }

            flags.add(RedFlag.builder(RedFlagType.COLLUSION_RING)
                    .severity(critical ? Severity.CRITICAL : Severity.HIGH)
                    .description(String.format("%d contractors co-bid as a ring with %.0f%% rotating pairs",
                            members.size(), rotation * 100))
                    .subjects(members)
                    .evidence("members", members)
                    .evidence("size", members.size())
                    .evidence("internal_edges", internal.size())
                    .evidence("density", density)
                    .evidence("rotation_ratio", rotation)
                    .evidence("shared_contract_count", sharedContracts)
                    .evidence("contract_refs", new ArrayList<>(contractRefs))
                    .evidence("truncated", communities.truncated())
                    .detectedAt(context.detectedAt())
                    .build());
        }
        return flags;
    }

    /**
     * Groups of node ids, each sorted, ordered by their smallest member.
     */
    record Communities(List<List<String>> groups, boolean truncated) {
    }

    static Communities findCommunities(List<DerivedEdge> edges, int iterationBudget) {
        TreeSet<String> ids = new TreeSet<>();
        edges.forEach(e -> {
            ids.add(e.sourceId());
            ids.add(e.targetId());
        });
        List<String> nodes = new ArrayList<>(ids);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i), i);
        }

        int n = nodes.size();
        List<Map<Integer, Double>> adjacency = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            adjacency.add(new TreeMap<>());
        }
        double[] degree = new double[n];
        double totalWeight = 0;
        for (DerivedEdge edge : edges) {
            double weight = edge.evidence() instanceof EdgeEvidence.CoBid coBid
                    ? Math.max(1, coBid.contractCount()) : 1.0;
            int a = index.get(edge.sourceId());
            int b = index.get(edge.targetId());
            adjacency.get(a).merge(b, weight, Double::sum);
            adjacency.get(b).merge(a, weight, Double::sum);
            degree[a] += weight;
            degree[b] += weight;
            totalWeight += weight;
        }

        int[] community = new int[n];
        double[] communityDegree = new double[n];
        for (int i = 0; i < n; i++) {
            community[i] = i;
            communityDegree[i] = degree[i];
        }

        double twoM = 2 * totalWeight;
        boolean moved = true;
        int iterations = 0;
        while (moved && iterations < iterationBudget) {
            moved = false;
            iterations++;
            for (int node = 0; node < n; node++) {
                int current = community[node];
                communityDegree[current] -= degree[node];

                Map<Integer, Double> linksTo = new TreeMap<>();
                for (Map.Entry<Integer, Double> neighbour : adjacency.get(node).entrySet()) {
                    linksTo.merge(community[neighbour.getKey()], neighbour.getValue(), Double::sum);
                }

                double stayGain = linksTo.getOrDefault(current, 0.0)
                        - communityDegree[current] * degree[node] / twoM;
                int best = current;
                double bestGain = stayGain;
                for (Map.Entry<Integer, Double> candidate : linksTo.entrySet()) {
                    double gain = candidate.getValue() - communityDegree[candidate.getKey()] * degree[node] / twoM;
                    if (gain > bestGain + 1e-12
                            || (Math.abs(gain - bestGain) <= 1e-12 && best != current && candidate.getKey() < best)) {
                        best = candidate.getKey();
                        bestGain = gain;
                    }
                }

                community[node] = best;
                communityDegree[best] += degree[node];
                if (best != current) {
                    moved = true;
                }
            }
        }

        Map<Integer, List<String>> grouped = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            grouped.computeIfAbsent(community[i], k -> new ArrayList<>()).add(nodes.get(i));
        }
        List<List<String>> groups = new ArrayList<>(grouped.values());
        groups.sort((x, y) -> x.get(0).compareTo(y.get(0)));
        return new Communities(groups, moved);
    }
}
