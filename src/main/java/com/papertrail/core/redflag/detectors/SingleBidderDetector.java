package com.papertrail.core.redflag.detectors;

import com.papertrail.core.config.DetectionOptions;
import com.papertrail.core.facts.Bid;
import com.papertrail.core.facts.Contract;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;
import com.papertrail.core.redflag.DetectionContext;
import com.papertrail.core.redflag.RedFlagDetector;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Contracts awarded with exactly one bidder.
 *
 * <p>Each such contract is flagged {@code medium}, or {@code high} when the
 * winner's single-bidder rate over all its awards with a known bidder count
 * exceeds the escalation rate. A contractor with at least the aggregate minimum
 * of single-bidder awards also gets one contractor-level flag, {@code critical}
 * above the escalation rate and {@code medium} otherwise.</p>
 */
public class SingleBidderDetector implements RedFlagDetector {

    @Override
    public RedFlagType getType() {
        return RedFlagType.SINGLE_BIDDER;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        DetectionOptions options = context.options();
        Map<String, List<Bid>> bidsByContract = context.graph().getFacts().bidsByContract();

        Map<String, List<Contract>> singles = new TreeMap<>();
        Map<String, Integer> known = new TreeMap<>();
        Map<String, Integer> bidderCounts = new TreeMap<>();
        for (Contract contract : context.graph().getFacts().getContracts()) {
            Integer bidders = bidderCount(contract, bidsByContract.get(contract.ref()));
            if (bidders == null) {
                continue;
            }
            bidderCounts.put(contract.ref(), bidders);
            known.merge(contract.awardeeId(), 1, Integer::sum);
            if (bidders == 1) {
                singles.computeIfAbsent(contract.awardeeId(), k -> new ArrayList<>()).add(contract);
            }
        }

        List<RedFlag> flags = new ArrayList<>();
        singles.forEach((contractorId, contracts) -> {
            int total = known.get(contractorId);
            double rate = (double) contracts.size() / total;
            boolean escalated = rate > options.getSingleBidderEscalationRate();

            for (Contract contract : contracts) {
                flags.add(RedFlag.builder(RedFlagType.SINGLE_BIDDER)
                        .severity(escalated ? Severity.HIGH : Severity.MEDIUM)
                        .description(String.format("Contract %s awarded to %s with a single bidder",
                                contract.ref(), context.graph().displayName(contractorId)))
                        .subjects(contractorId)
                        .evidence("contract_ref", contract.ref())
                        .evidence("agency_id", contract.agencyId())
                        .evidence("amount", contract.amount())
                        .evidence("bid_count", bidderCounts.get(contract.ref()))
                        .evidence("contractor_single_bid_rate", rate)
                        .evidence("escalation_rate", options.getSingleBidderEscalationRate())
                        .detectedAt(context.detectedAt())
                        .build());
            }

            if (contracts.size() >= options.getSingleBidderAggregateMinimum()) {
                flags.add(RedFlag.builder(RedFlagType.SINGLE_BIDDER)
                        .severity(escalated ? Severity.CRITICAL : Severity.MEDIUM)
                        .description(String.format("%s won %d of %d awards as the only bidder",
                                context.graph().displayName(contractorId), contracts.size(), total))
                        .subjects(contractorId)
                        .evidence("scope", "contractor")
                        .evidence("single_bid_contracts", contracts.stream().map(Contract::ref).toList())
                        .evidence("single_bid_count", contracts.size())
                        .evidence("awards_with_known_bidders", total)
                        .evidence("contractor_single_bid_rate", rate)
                        .evidence("escalation_rate", options.getSingleBidderEscalationRate())
                        .detectedAt(context.detectedAt())
                        .build());
            }
        });
        return flags;
    }

    /**
     * Declared bid count when present, otherwise the number of distinct bidders
     * recorded, otherwise unknown.
     */
    private static Integer bidderCount(Contract contract, List<Bid> bids) {
        if (contract.bidCount() != null) {
            return contract.bidCount();
        }
        if (bids == null || bids.isEmpty()) {
            return null;
        }
        Set<String> bidders = new HashSet<>();
        bids.forEach(b -> bidders.add(b.contractorId()));
        return bidders.size();
    }
}
