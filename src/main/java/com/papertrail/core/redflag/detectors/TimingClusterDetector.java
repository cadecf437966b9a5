package com.papertrail.core.redflag.detectors;

import com.papertrail.core.facts.Contract;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;
import com.papertrail.core.redflag.DetectionContext;
import com.papertrail.core.redflag.RedFlagDetector;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One agency awarding several contracts to one contractor within days of each
 * other.
 *
 * <p>A contract counts toward the cluster of its (agency, contractor) pair when
 * another award of that pair falls within the window. One {@code high} flag is
 * raised per pair with enough such contracts.</p>
 */
public class TimingClusterDetector implements RedFlagDetector {

    private static final Comparator<Contract> BY_DATE = Comparator
            .comparing(Contract::awardDate)
            .thenComparing(Contract::ref);

    @Override
    public RedFlagType getType() {
        return RedFlagType.TIMING_CLUSTER;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        int minimum = context.options().getTimingClusterMinAwards();
        int window = context.options().getTimingClusterWindowDays();

        // agency -> contractor -> awards
        Map<String, Map<String, List<Contract>>> byAgency = new TreeMap<>();
        for (Contract contract : context.graph().getFacts().getContracts()) {
            byAgency.computeIfAbsent(contract.agencyId(), k -> new TreeMap<>())
                    .computeIfAbsent(contract.awardeeId(), k -> new ArrayList<>())
                    .add(contract);
        }

        List<RedFlag> flags = new ArrayList<>();
        byAgency.forEach((agencyId, byContractor) -> byContractor.forEach((contractorId, contracts) -> {
            List<Contract> clustered = clustered(contracts, window);
            if (clustered.size() < minimum) {
                return;
            }
            List<String> refs = new ArrayList<>();
            List<Double> amounts = new ArrayList<>();
            List<String> dates = new ArrayList<>();
            double total = 0;
            for (Contract c : clustered) {
                refs.add(c.ref());
                amounts.add(c.amount());
                dates.add(c.awardDate().toString());
                total += c.amount();
            }
            flags.add(RedFlag.builder(RedFlagType.TIMING_CLUSTER)
                    .severity(Severity.HIGH)
                    .description(String.format("%s awarded %d contracts to %s within %d day(s) of each other",
                            context.graph().displayName(agencyId), clustered.size(),
                            context.graph().displayName(contractorId), window))
                    .subjects(contractorId, agencyId)
                    .evidence("agency_id", agencyId)
                    .evidence("contractor_id", contractorId)
                    .evidence("contract_count", clustered.size())
                    .evidence("contract_refs", refs)
                    .evidence("amounts", amounts)
                    .evidence("award_dates", dates)
                    .evidence("total_amount", total)
                    .evidence("window_days", window)
                    .detectedAt(context.detectedAt())
                    .build());
        }));
        return flags;
    }

    /**
     * Contracts with at least one neighbour, in date order, no more than
     * {@code window} days away.
     */
    static List<Contract> clustered(List<Contract> contracts, int window) {
        List<Contract> sorted = new ArrayList<>(contracts);
        sorted.sort(BY_DATE);
        List<Contract> clustered = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            boolean near = (i > 0 && gap(sorted.get(i - 1), sorted.get(i)) <= window)
                    || (i + 1 < sorted.size() && gap(sorted.get(i), sorted.get(i + 1)) <= window);
            if (near) {
                clustered.add(sorted.get(i));
            }
        }
        return clustered;
    }

    private static long gap(Contract earlier, Contract later) {
        return ChronoUnit.DAYS.between(earlier.awardDate(), later.awardDate());
    }
}
