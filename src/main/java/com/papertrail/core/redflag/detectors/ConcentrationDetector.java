package com.papertrail.core.redflag.detectors;

import com.papertrail.core.analytics.ConcentrationMetric;
import com.papertrail.core.analytics.MarketShare;
import com.papertrail.core.config.DetectionOptions;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;
import com.papertrail.core.redflag.DetectionContext;
import com.papertrail.core.redflag.RedFlagDetector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agencies whose award HHI reaches the medium threshold; severity rises
 * through the high and critical thresholds.
 */
public class ConcentrationDetector implements RedFlagDetector {

    @Override
    public RedFlagType getType() {
        return RedFlagType.CONCENTRATION;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        DetectionOptions options = context.options();
        List<RedFlag> flags = new ArrayList<>();
        for (ConcentrationMetric metric : context.concentration()) {
            if (!metric.isDefined() || metric.hhi() < options.getHhiMediumThreshold()) {
                continue;
            }
            double hhi = metric.hhi();
            Severity severity = hhi >= options.getHhiCriticalThreshold() ? Severity.CRITICAL
                    : hhi >= options.getHhiHighThreshold() ? Severity.HIGH
                    : Severity.MEDIUM;
            MarketShare top = metric.shares().get(0);

            List<Map<String, Object>> shares = new ArrayList<>();
            for (MarketShare share : metric.shares()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("contractor_id", share.contractorId());
                entry.put("value", share.value());
                entry.put("share", share.share());
                shares.add(entry);
            }
            flags.add(RedFlag.builder(RedFlagType.CONCENTRATION)
                    .severity(severity)
                    .description(String.format("%s awards are concentrated (HHI %.4f); top contractor %s holds %.1f%%",
                            context.graph().displayName(metric.agencyId()), hhi,
                            context.graph().displayName(top.contractorId()), top.share() * 100))
                    .subjects(metric.agencyId())
                    .evidence("hhi", hhi)
                    .evidence("level", metric.level().name())
                    .evidence("total_value", metric.totalValue())
                    .evidence("contract_count", metric.contractCount())
                    .evidence("top_contractor_id", top.contractorId())
                    .evidence("top_share", top.share())
                    .evidence("shares", shares)
                    .detectedAt(context.detectedAt())
                    .build());
        }
        return flags;
    }
}
