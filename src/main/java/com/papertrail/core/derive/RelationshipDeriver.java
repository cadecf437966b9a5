package com.papertrail.core.derive;

import com.papertrail.core.config.DerivationOptions;
import com.papertrail.core.metrics.MetricsService;
import com.papertrail.core.metrics.NoOpMetricsService;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeType;
import com.papertrail.core.similarity.SimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Runs every {@link EdgeDeriver} and the contract-splitting clusterer over one
 * graph snapshot. Output is sorted and deduplicated, so two runs over the same
 * snapshot yield equal results.
 */
public class RelationshipDeriver {
    private static final Logger log = LoggerFactory.getLogger(RelationshipDeriver.class);

    private final List<EdgeDeriver> derivers;
    private final ContractSplittingClusterer splitting;
    private final MetricsService metrics;

    public RelationshipDeriver(List<EdgeDeriver> derivers, ContractSplittingClusterer splitting,
                               MetricsService metrics) {
        this.derivers = List.copyOf(derivers);
        this.splitting = splitting;
        this.metrics = metrics;
    }

    /**
     * The standard deriver set.
     */
    public static RelationshipDeriver standard(DerivationOptions options, SimilarityScorer scorer,
                                               MetricsService metrics) {
        return new RelationshipDeriver(List.of(
                new CoBiddingDeriver(options),
                new SubcontractFlowDeriver(),
                new ShellIndicatorDeriver(scorer.getCanonicalizer()),
                new FamilyLinkDeriver(options, scorer),
                new DonorAllianceDeriver(options)),
                new ContractSplittingClusterer(options, scorer),
                metrics);
    }

    public static RelationshipDeriver standard(DerivationOptions options, SimilarityScorer scorer) {
        return standard(options, scorer, new NoOpMetricsService());
    }

    public DerivationResult derive(ResolvedGraph graph) {
        TreeSet<DerivedEdge> edges = new TreeSet<>();
        for (EdgeDeriver deriver : derivers) {
            List<DerivedEdge> produced = deriver.derive(graph);
            for (DerivedEdge edge : produced) {
                if (!edges.add(edge)) {
                    log.debug("derive.duplicate deriver={} edge={}", deriver.getName(), edge);
                }
            }
            log.debug("derive.deriver name={} edges={}", deriver.getName(), produced.size());
        }
        List<SplitContractCluster> clusters = splitting.findClusters(graph);

        Map<EdgeType, Integer> counts = new EnumMap<>(EdgeType.class);
        edges.forEach(e -> counts.merge(e.type(), 1, Integer::sum));
        counts.forEach(metrics::recordDerivedEdges);

        log.info("derive.completed edges={} splitClusters={} byType={}", edges.size(), clusters.size(), counts);
        return new DerivationResult(new ArrayList<>(edges), clusters);
    }
}
