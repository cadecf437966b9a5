package com.papertrail.core.redflag.detectors;

import com.papertrail.core.config.DetectionOptions;
import com.papertrail.core.facts.Contract;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeEvidence;
import com.papertrail.core.model.EdgeType;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;
import com.papertrail.core.redflag.DetectionContext;
import com.papertrail.core.redflag.RedFlagDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed cycles in the SUBCONTRACTED_TO graph that start and end at a
 * prime contractor.
 *
 * <p>Search is a bounded depth-first walk from each awardee in id order. A
 * cycle found from several roots is reported once, rooted at the first
 * awardee that reaches it. The value retained in the loop is the smallest hop
 * amount, since no more than that can have travelled all the way round.</p>
 */
public class CircularSubcontractingDetector implements RedFlagDetector {
    private static final Logger log = LoggerFactory.getLogger(CircularSubcontractingDetector.class);

    @Override
    public RedFlagType getType() {
        return RedFlagType.CIRCULAR_SUBCONTRACTING;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        DetectionOptions options = context.options();
        Map<String, List<DerivedEdge>> outgoing = new TreeMap<>();
        for (DerivedEdge edge : context.edges(EdgeType.SUBCONTRACTED_TO)) {
            outgoing.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge);
        }
        if (outgoing.isEmpty()) {
            return List.of();
        }

        Map<String, Double> awarded = new TreeMap<>();
        Map<String, TreeSet<String>> awardRefs = new TreeMap<>();
        for (Contract contract : context.graph().getFacts().getContracts()) {
            awarded.merge(contract.awardeeId(), contract.amount(), Double::sum);
            awardRefs.computeIfAbsent(contract.awardeeId(), k -> new TreeSet<>()).add(contract.ref());
        }

        Search search = new Search(outgoing, options.getMaxCycleLength(), options.getCycleSearchBudget());
        for (String root : awarded.keySet()) {
            if (outgoing.containsKey(root)) {
                search.from(root);
            }
        }
        if (search.truncated) {
            log.warn("circular_subcontracting.budget_exhausted steps={}", options.getCycleSearchBudget());
        }

        List<RedFlag> flags = new ArrayList<>();
        for (List<DerivedEdge> cycle : search.cycles) {
            String root = cycle.get(0).sourceId();
            List<String> path = new ArrayList<>();
            List<Double> hopAmounts = new ArrayList<>();
            TreeSet<String> refs = new TreeSet<>(awardRefs.getOrDefault(root, new TreeSet<>()));
            double retained = Double.MAX_VALUE;
            for (DerivedEdge hop : cycle) {
                path.add(hop.sourceId());
                double amount = 0;
                if (hop.evidence() instanceof EdgeEvidence.SubcontractFlow flow) {
                    amount = flow.totalAmount();
                    refs.addAll(flow.contractRefs());
                }
                hopAmounts.add(amount);
                retained = Math.min(retained, amount);
            }
            path.add(root);

            List<String> members = new ArrayList<>(new TreeSet<>(path));
            members.remove(root);
            members.add(0, root);

            flags.add(RedFlag.builder(RedFlagType.CIRCULAR_SUBCONTRACTING)
                    .severity(Severity.CRITICAL)
                    .description(String.format("Subcontracted work flows from %s back to itself through %d hop(s)",
                            context.graph().displayName(root), cycle.size()))
                    .subjects(members)
                    .evidence("path", path)
                    .evidence("hops", cycle.size())
                    .evidence("hop_amounts", hopAmounts)
                    .evidence("award_value", awarded.getOrDefault(root, 0.0))
                    .evidence("net_retained_value", retained)
                    .evidence("contract_refs", new ArrayList<>(refs))
                    .evidence("truncated", search.truncated)
                    .detectedAt(context.detectedAt())
                    .build());
        }
        return flags;
    }

    /**
     * Bounded DFS collecting simple cycles through the root, deduplicated by
     * their node sequence rotated to start at the smallest id.
     */
    static final class Search {
        private final Map<String, List<DerivedEdge>> outgoing;
        private final int maxLength;
        private final long budget;
        private final Set<String> seen = new HashSet<>();
        final List<List<DerivedEdge>> cycles = new ArrayList<>();
        long steps;
        boolean truncated;

        Search(Map<String, List<DerivedEdge>> outgoing, int maxLength, long budget) {
            this.outgoing = outgoing;
            this.maxLength = maxLength;
            this.budget = budget;
        }

        void from(String root) {
            Deque<DerivedEdge> path = new ArrayDeque<>();
            Set<String> onPath = new HashSet<>();
            onPath.add(root);
            walk(root, root, path, onPath);
        }

        private void walk(String root, String node, Deque<DerivedEdge> path, Set<String> onPath) {
            for (DerivedEdge edge : outgoing.getOrDefault(node, List.of())) {
                if (++steps > budget) {
                    truncated = true;
                    return;
                }
                String next = edge.targetId();
                if (next.equals(root)) {
                    path.addLast(edge);
                    record(new ArrayList<>(path));
                    path.removeLast();
                } else if (!onPath.contains(next) && path.size() + 1 < maxLength) {
                    path.addLast(edge);
                    onPath.add(next);
                    walk(root, next, path, onPath);
                    onPath.remove(next);
                    path.removeLast();
                }
                if (truncated) {
                    return;
                }
            }
        }

        private void record(List<DerivedEdge> cycle) {
            List<String> nodes = new ArrayList<>();
            cycle.forEach(e -> nodes.add(e.sourceId()));
            int start = nodes.indexOf(new TreeSet<>(nodes).first());
            List<String> rotated = new ArrayList<>(nodes.subList(start, nodes.size()));
            rotated.addAll(nodes.subList(0, start));
            if (seen.add(String.join(">", rotated))) {
                cycles.add(cycle);
            }
        }
    }
}
