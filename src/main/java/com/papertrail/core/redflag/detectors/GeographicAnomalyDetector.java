package com.papertrail.core.redflag.detectors;

import com.papertrail.core.facts.AgencyProfile;
import com.papertrail.core.facts.Contract;
import com.papertrail.core.facts.ContractorProfile;
import com.papertrail.core.facts.ProcurementFacts;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;
import com.papertrail.core.redflag.DetectionContext;
import com.papertrail.core.redflag.RedFlagDetector;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Contractors repeatedly winning work from agencies outside their home
 * province. Awards where either province is unknown are not counted.
 */
public class GeographicAnomalyDetector implements RedFlagDetector {

    @Override
    public RedFlagType getType() {
        return RedFlagType.GEOGRAPHIC_ANOMALY;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        ProcurementFacts facts = context.graph().getFacts();
        int minimum = context.options().getGeographicMinAwards();

        Map<String, Away> awayByContractor = new TreeMap<>();
        for (Contract contract : facts.getContracts()) {
            String home = facts.contractorProfile(contract.awardeeId())
                    .map(ContractorProfile::province)
                    .orElse(null);
            String awarding = facts.agencyProfile(contract.agencyId())
                    .map(AgencyProfile::province)
                    .orElse(null);
            if (isBlank(home) || isBlank(awarding) || normalize(home).equals(normalize(awarding))) {
                continue;
            }
            awayByContractor.computeIfAbsent(contract.awardeeId(), k -> new Away(home.trim()))
                    .add(contract, awarding.trim());
        }

        List<RedFlag> flags = new ArrayList<>();
        awayByContractor.forEach((contractorId, away) -> {
            if (away.refs.size() < minimum) {
                return;
            }
            flags.add(RedFlag.builder(RedFlagType.GEOGRAPHIC_ANOMALY)
                    .severity(Severity.MEDIUM)
                    .description(String.format("%s (based in %s) won %d contracts in other provinces: %s",
                            context.graph().displayName(contractorId), away.home, away.refs.size(),
                            String.join(", ", away.provinces)))
                    .subjects(contractorId)
                    .evidence("home_province", away.home)
                    .evidence("award_provinces", new ArrayList<>(away.provinces))
                    .evidence("contracts_outside_home", away.refs.size())
                    .evidence("value_outside_home", away.value)
                    .evidence("contract_refs", new ArrayList<>(away.refs))
                    .detectedAt(context.detectedAt())
                    .build());
        });
        return flags;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String normalize(String province) {
        return province.trim().toLowerCase(Locale.ROOT);
    }

    private static final class Away {
        private final String home;
        private final TreeSet<String> provinces = new TreeSet<>();
        private final TreeSet<String> refs = new TreeSet<>();
        private double value;

        Away(String home) {
            this.home = home;
        }

        void add(Contract contract, String province) {
            provinces.add(province);
            if (refs.add(contract.ref())) {
                value += contract.amount();
            }
        }
    }
}
