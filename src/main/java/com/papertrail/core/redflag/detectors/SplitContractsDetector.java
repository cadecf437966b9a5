package com.papertrail.core.redflag.detectors;

import com.papertrail.core.derive.SplitContractCluster;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;
import com.papertrail.core.redflag.DetectionContext;
import com.papertrail.core.redflag.RedFlagDetector;

import java.util.ArrayList;
import java.util.List;

/**
 * One {@code high} flag per split-contract cluster found during derivation.
 */
public class SplitContractsDetector implements RedFlagDetector {

    @Override
    public RedFlagType getType() {
        return RedFlagType.SPLIT_CONTRACTS;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        List<RedFlag> flags = new ArrayList<>();
        for (SplitContractCluster cluster : context.derivation().splitClusters()) {
            flags.add(RedFlag.builder(RedFlagType.SPLIT_CONTRACTS)
                    .severity(Severity.HIGH)
                    .description(String.format(
                            "%d contracts to %s by %s total PHP %,.2f, each below the PHP %,.2f bidding threshold",
                            cluster.size(), context.graph().displayName(cluster.contractorId()),
                            context.graph().displayName(cluster.agencyId()), cluster.totalAmount(),
                            cluster.threshold()))
                    .subjects(cluster.contractorId(), cluster.agencyId())
                    .evidence("agency_id", cluster.agencyId())
                    .evidence("contractor_id", cluster.contractorId())
                    .evidence("contract_refs", cluster.contractRefs())
                    .evidence("amounts", cluster.amounts())
                    .evidence("total_amount", cluster.totalAmount())
                    .evidence("threshold", cluster.threshold())
                    .evidence("first_award_date", cluster.firstAwardDate().toString())
                    .evidence("last_award_date", cluster.lastAwardDate().toString())
                    .evidence("span_days", cluster.spanDays())
                    .detectedAt(context.detectedAt())
                    .build());
        }
        return flags;
    }
}
