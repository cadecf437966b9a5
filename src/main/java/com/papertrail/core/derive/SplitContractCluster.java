package com.papertrail.core.derive;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Contracts from one agency to one contractor, close in time and scope, each
 * below the competitive-bidding threshold while their sum is not.
 */
public record SplitContractCluster(
        String agencyId,
        String contractorId,
        List<String> contractRefs,
        List<Double> amounts,
        double totalAmount,
        double threshold,
        LocalDate firstAwardDate,
        LocalDate lastAwardDate
) {
    public SplitContractCluster {
        Objects.requireNonNull(agencyId, "agencyId is required");
        Objects.requireNonNull(contractorId, "contractorId is required");
        contractRefs = List.copyOf(contractRefs);
        amounts = List.copyOf(amounts);
    }

    public int size() {
        return contractRefs.size();
    }

    public long spanDays() {
        return ChronoUnit.DAYS.between(firstAwardDate, lastAwardDate);
    }
}
