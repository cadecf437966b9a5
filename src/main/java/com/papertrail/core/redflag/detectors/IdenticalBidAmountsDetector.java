package com.papertrail.core.redflag.detectors;

import com.papertrail.core.facts.Bid;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;
import com.papertrail.core.redflag.DetectionContext;
import com.papertrail.core.redflag.RedFlagDetector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Bids on the same contract from different contractors whose amounts differ
 * by less than a relative epsilon. Bids are sorted by amount and chained while
 * each neighbour is within epsilon of the previous one.
 */
public class IdenticalBidAmountsDetector implements RedFlagDetector {

    @Override
    public RedFlagType getType() {
        return RedFlagType.IDENTICAL_BID_AMOUNTS;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        double epsilon = context.options().getIdenticalBidEpsilon();
        List<RedFlag> flags = new ArrayList<>();
        for (Map.Entry<String, List<Bid>> entry : context.graph().getFacts().bidsByContract().entrySet()) {
            List<Bid> bids = new ArrayList<>(entry.getValue());
            bids.removeIf(b -> b.amount() <= 0);
            bids.sort(Comparator.comparingDouble(Bid::amount).thenComparing(Bid::contractorId));

            List<Bid> run = new ArrayList<>();
            double maxDiff = 0;
            for (Bid bid : bids) {
                if (!run.isEmpty()) {
                    double diff = relativeDifference(run.get(run.size() - 1).amount(), bid.amount());
                    if (diff >= epsilon) {
                        emit(context, entry.getKey(), run, maxDiff, epsilon, flags);
                        run = new ArrayList<>();
                        maxDiff = 0;
                    } else {
                        maxDiff = Math.max(maxDiff, diff);
                    }
                }
                run.add(bid);
            }
            emit(context, entry.getKey(), run, maxDiff, epsilon, flags);
        }
        return flags;
    }

    private static void emit(DetectionContext context, String contractRef, List<Bid> run, double maxDiff,
                             double epsilon, List<RedFlag> flags) {
        TreeSet<String> contractors = new TreeSet<>();
        run.forEach(b -> contractors.add(b.contractorId()));
        if (contractors.size() < 2) {
            return;
        }
        flags.add(RedFlag.builder(RedFlagType.IDENTICAL_BID_AMOUNTS)
                .severity(Severity.CRITICAL)
                .description(String.format("%d bidders on %s submitted amounts within %.2f%% of each other",
                        contractors.size(), contractRef, epsilon * 100))
                .subjects(new ArrayList<>(contractors))
                .evidence("contract_ref", contractRef)
                .evidence("contractors", run.stream().map(Bid::contractorId).toList())
                .evidence("amounts", run.stream().map(Bid::amount).toList())
                .evidence("max_relative_difference", maxDiff)
                .evidence("epsilon", epsilon)
                .detectedAt(context.detectedAt())
                .build());
    }

    static double relativeDifference(double a, double b) {
        double larger = Math.max(Math.abs(a), Math.abs(b));
        return larger == 0 ? 0 : Math.abs(a - b) / larger;
    }
}
