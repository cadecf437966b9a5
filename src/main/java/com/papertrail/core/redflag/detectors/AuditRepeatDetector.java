package com.papertrail.core.redflag.detectors;

import com.papertrail.core.facts.AuditFinding;
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
 * The same audit finding type recurring for an agency in consecutive years.
 * Each unbroken run of two or more years is one {@code high} flag.
 */
public class AuditRepeatDetector implements RedFlagDetector {

    @Override
    public RedFlagType getType() {
        return RedFlagType.AUDIT_REPEAT;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        Map<String, Map<String, TreeMap<Integer, List<AuditFinding>>>> byAgency = new TreeMap<>();
        for (AuditFinding finding : context.graph().getFacts().getAuditFindings()) {
            byAgency.computeIfAbsent(finding.agencyId(), k -> new TreeMap<>())
                    .computeIfAbsent(normalizeType(finding.findingType()), k -> new TreeMap<>())
                    .computeIfAbsent(finding.year(), k -> new ArrayList<>())
                    .add(finding);
        }

        List<RedFlag> flags = new ArrayList<>();
        byAgency.forEach((agencyId, byType) -> byType.forEach((type, byYear) -> {
            List<Integer> run = new ArrayList<>();
            for (Integer year : byYear.keySet()) {
                if (!run.isEmpty() && year != run.get(run.size() - 1) + 1) {
                    emit(context, agencyId, type, run, byYear, flags);
                    run = new ArrayList<>();
                }
                run.add(year);
            }
            emit(context, agencyId, type, run, byYear, flags);
        }));
        return flags;
    }

    private static void emit(DetectionContext context, String agencyId, String type, List<Integer> years,
                             TreeMap<Integer, List<AuditFinding>> byYear, List<RedFlag> flags) {
        if (years.size() < 2) {
            return;
        }
        TreeSet<String> findingIds = new TreeSet<>();
        double total = 0;
        for (Integer year : years) {
            for (AuditFinding finding : byYear.get(year)) {
                findingIds.add(finding.id());
                total += finding.amount();
            }
        }
        flags.add(RedFlag.builder(RedFlagType.AUDIT_REPEAT)
                .severity(Severity.HIGH)
                .description(String.format("%s has recurring '%s' audit findings in %d consecutive years (%d-%d)",
                        context.graph().displayName(agencyId), type, years.size(),
                        years.get(0), years.get(years.size() - 1)))
                .subjects(agencyId)
                .evidence("finding_type", type)
                .evidence("years", List.copyOf(years))
                .evidence("finding_ids", new ArrayList<>(findingIds))
                .evidence("total_amount", total)
                .detectedAt(context.detectedAt())
                .build());
    }

    private static String normalizeType(String type) {
        return type.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
