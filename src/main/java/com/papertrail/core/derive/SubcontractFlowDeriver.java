package com.papertrail.core.derive;

import com.papertrail.core.facts.Subcontract;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeEvidence;
import com.papertrail.core.model.EdgeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * One SUBCONTRACTED_TO edge per (from, to) pair, aggregating every subcontract between them.
 * Subcontracts from a contractor to itself are ignored.
 */
public class SubcontractFlowDeriver implements EdgeDeriver {

    @Override
    public String getName() {
        return "subcontract-flow";
    }

    @Override
    public List<DerivedEdge> derive(ResolvedGraph graph) {
        Map<String, Flow> flows = new TreeMap<>();
        for (Subcontract s : graph.getFacts().getSubcontracts()) {
            if (s.fromId().equals(s.toId())) {
                continue;
            }
            flows.computeIfAbsent(s.fromId() + "\u0000" + s.toId(), k -> new Flow(s.fromId(), s.toId())).add(s);
        }
        List<DerivedEdge> edges = new ArrayList<>();
        for (Flow flow : flows.values()) {
            edges.add(new DerivedEdge(EdgeType.SUBCONTRACTED_TO, flow.from, flow.to,
                    new EdgeEvidence.SubcontractFlow(flow.total, flow.count, List.copyOf(flow.refs))));
        }
        return edges;
    }

    private static final class Flow {
        private final String from;
        private final String to;
        private final TreeSet<String> refs = new TreeSet<>();
        private double total;
        private int count;

        Flow(String from, String to) {
            this.from = from;
            this.to = to;
        }

        void add(Subcontract s) {
            refs.add(s.contractRef());
            total += s.amount();
            count++;
        }
    }
}
