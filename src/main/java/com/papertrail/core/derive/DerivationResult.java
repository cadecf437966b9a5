package com.papertrail.core.derive;

import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeType;

import java.util.List;

/**
 * Derived edges sorted by type, source and target, plus split-contract clusters.
 */
public record DerivationResult(List<DerivedEdge> edges, List<SplitContractCluster> splitClusters) {

    public DerivationResult {
        edges = List.copyOf(edges);
        splitClusters = List.copyOf(splitClusters);
    }

    public List<DerivedEdge> edgesOfType(EdgeType type) {
        return edges.stream().filter(e -> e.type() == type).toList();
    }
}
