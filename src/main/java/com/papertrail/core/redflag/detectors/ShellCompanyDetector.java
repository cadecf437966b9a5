package com.papertrail.core.redflag.detectors;

import com.papertrail.core.facts.Contract;
import com.papertrail.core.facts.ContractorProfile;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;
import com.papertrail.core.redflag.DetectionContext;
import com.papertrail.core.redflag.RedFlagDetector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Contractors whose awarded value dwarfs their registered capital.
 * Contractors without a known positive capital are skipped.
 */
public class ShellCompanyDetector implements RedFlagDetector {

    @Override
    public RedFlagType getType() {
        return RedFlagType.SHELL_COMPANY;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        double ratioLimit = context.options().getShellCapitalRatio();
        Map<String, Double> awarded = new TreeMap<>();
        Map<String, Integer> counts = new TreeMap<>();
        for (Contract contract : context.graph().getFacts().getContracts()) {
            awarded.merge(contract.awardeeId(), contract.amount(), Double::sum);
            counts.merge(contract.awardeeId(), 1, Integer::sum);
        }

        List<RedFlag> flags = new ArrayList<>();
        awarded.forEach((contractorId, total) -> {
            Double capital = context.graph().getFacts().contractorProfile(contractorId)
                    .map(ContractorProfile::registeredCapital)
                    .orElse(null);
            if (capital == null || capital <= 0) {
                return;
            }
            double ratio = total / capital;
            if (ratio <= ratioLimit) {
                return;
            }
            flags.add(RedFlag.builder(RedFlagType.SHELL_COMPANY)
                    .severity(Severity.HIGH)
                    .description(String.format("%s was awarded PHP %,.2f against PHP %,.2f registered capital (%.0fx)",
                            context.graph().displayName(contractorId), total, capital, ratio))
                    .subjects(contractorId)
                    .evidence("total_awarded", total)
                    .evidence("contract_count", counts.get(contractorId))
                    .evidence("registered_capital", capital)
                    .evidence("ratio", ratio)
                    .evidence("ratio_limit", ratioLimit)
                    .detectedAt(context.detectedAt())
                    .build());
        });
        return flags;
    }
}
