package com.papertrail.core.derive;

import com.papertrail.core.config.DerivationOptions;
import com.papertrail.core.facts.Contract;
import com.papertrail.core.similarity.SimilarityScorer;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups each agency's sub-threshold awards to one contractor into clusters of
 * nearby award dates and similar titles, and keeps the clusters whose total
 * reaches the competitive-bidding threshold.
 *
 * <p>A contract joins the first open cluster whose first award is less than the
 * window before it and, when both sides have titles, whose titles overlap enough
 * with one of the cluster's. Otherwise it opens a new cluster.</p>
 */
public class ContractSplittingClusterer {

    private final DerivationOptions options;
    private final SimilarityScorer scorer;

    public ContractSplittingClusterer(DerivationOptions options, SimilarityScorer scorer) {
        this.options = options;
        this.scorer = scorer;
    }

    public List<SplitContractCluster> findClusters(ResolvedGraph graph) {
        double threshold = options.getBiddingThreshold();
        Map<String, List<Contract>> groups = new TreeMap<>();
        for (Contract c : graph.getFacts().getContracts()) {
            if (c.amount() < threshold) {
                groups.computeIfAbsent(c.agencyId() + "\u0000" + c.awardeeId(), k -> new ArrayList<>()).add(c);
            }
        }

        List<SplitContractCluster> result = new ArrayList<>();
        for (List<Contract> group : groups.values()) {
            group.sort(Comparator.comparing(Contract::awardDate).thenComparing(Contract::ref));
            List<List<Contract>> clusters = new ArrayList<>();
            for (Contract contract : group) {
                List<Contract> target = null;
                for (List<Contract> cluster : clusters) {
                    if (fits(cluster, contract)) {
                        target = cluster;
                        break;
                    }
                }
                if (target == null) {
                    target = new ArrayList<>();
                    clusters.add(target);
                }
                target.add(contract);
            }
            for (List<Contract> cluster : clusters) {
                double total = cluster.stream().mapToDouble(Contract::amount).sum();
                if (cluster.size() >= 2 && total >= threshold) {
                    result.add(toCluster(cluster, total, threshold));
                }
            }
        }
        result.sort(Comparator.comparing(SplitContractCluster::agencyId)
                .thenComparing(SplitContractCluster::contractorId)
                .thenComparing(SplitContractCluster::firstAwardDate)
                .thenComparing(c -> c.contractRefs().get(0)));
        return result;
    }

    private boolean fits(List<Contract> cluster, Contract contract) {
        long days = ChronoUnit.DAYS.between(cluster.get(0).awardDate(), contract.awardDate());
        if (days >= options.getSplitWindowDays()) {
            return false;
        }
        if (isBlank(contract.title())) {
            return true;
        }
        boolean anyTitled = false;
        for (Contract member : cluster) {
            if (isBlank(member.title())) {
                continue;
            }
            anyTitled = true;
            if (scorer.scoreTitles(member.title(), contract.title()) >= options.getSplitTitleSimilarity()) {
                return true;
            }
        }
        return !anyTitled;
    }

    private static SplitContractCluster toCluster(List<Contract> cluster, double total, double threshold) {
        Contract first = cluster.get(0);
        return new SplitContractCluster(
                first.agencyId(),
                first.awardeeId(),
                cluster.stream().map(Contract::ref).toList(),
                cluster.stream().map(Contract::amount).toList(),
                total,
                threshold,
                first.awardDate(),
                cluster.get(cluster.size() - 1).awardDate());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
