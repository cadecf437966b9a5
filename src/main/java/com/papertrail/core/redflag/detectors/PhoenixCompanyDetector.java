package com.papertrail.core.redflag.detectors;

import com.papertrail.core.facts.Blacklisting;
import com.papertrail.core.facts.ProcurementFacts;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeType;
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
import java.util.TreeSet;

/**
 * Contractors that look like a blacklisted contractor under a new name:
 * an explicit RE_REGISTERED_AS edge from the blacklisted one, or both a
 * shared address and a shared director with it. One {@code critical} flag per
 * (successor, blacklisted) pair listing every indicator found.
 */
public class PhoenixCompanyDetector implements RedFlagDetector {

    @Override
    public RedFlagType getType() {
        return RedFlagType.PHOENIX_COMPANY;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        ProcurementFacts facts = context.graph().getFacts();
        Set<String> blacklisted = new HashSet<>();
        facts.getBlacklistings().forEach(b -> blacklisted.add(b.contractorId()));
        if (blacklisted.isEmpty()) {
            return List.of();
        }

        // key: successor|blacklisted
        Map<String, TreeSet<String>> indicators = new TreeMap<>();
        for (DerivedEdge edge : context.edges(EdgeType.RE_REGISTERED_AS)) {
            if (blacklisted.contains(edge.sourceId())) {
                indicators.computeIfAbsent(edge.targetId() + "|" + edge.sourceId(), k -> new TreeSet<>())
                        .add(EdgeType.RE_REGISTERED_AS.name());
            }
        }

        Set<String> sameAddress = pairKeys(context.edges(EdgeType.SAME_ADDRESS_AS));
        for (DerivedEdge edge : context.edges(EdgeType.SHARES_DIRECTOR_WITH)) {
            if (!sameAddress.contains(edge.sourceId() + "|" + edge.targetId())) {
                continue;
            }
            for (String end : List.of(edge.sourceId(), edge.targetId())) {
                String other = edge.otherEnd(end);
                if (blacklisted.contains(end) && !blacklisted.contains(other)) {
                    TreeSet<String> found = indicators.computeIfAbsent(other + "|" + end, k -> new TreeSet<>());
                    found.add(EdgeType.SAME_ADDRESS_AS.name());
                    found.add(EdgeType.SHARES_DIRECTOR_WITH.name());
                }
            }
        }

        List<RedFlag> flags = new ArrayList<>();
        indicators.forEach((key, found) -> {
            String successor = key.substring(0, key.indexOf('|'));
            String predecessor = key.substring(key.indexOf('|') + 1);
            Blacklisting entry = facts.getBlacklistings().stream()
                    .filter(b -> b.contractorId().equals(predecessor))
                    .findFirst()
                    .orElseThrow();
            RedFlag.Builder builder = RedFlag.builder(RedFlagType.PHOENIX_COMPANY)
                    .severity(Severity.CRITICAL)
                    .description(String.format("%s appears to be a re-registration of blacklisted %s",
                            context.graph().displayName(successor), context.graph().displayName(predecessor)))
                    .subjects(successor, predecessor)
                    .evidence("successor_id", successor)
                    .evidence("blacklisted_id", predecessor)
                    .evidence("indicators", new ArrayList<>(found));
            if (entry.blacklistedOn() != null) {
                builder.evidence("blacklisted_on", entry.blacklistedOn().toString());
            }
            if (entry.reason() != null) {
                builder.evidence("blacklist_reason", entry.reason());
            }
            facts.contractorProfile(successor)
                    .filter(p -> p.registeredOn() != null)
                    .ifPresent(p -> builder.evidence("successor_registered_on", p.registeredOn().toString()));
            flags.add(builder.detectedAt(context.detectedAt()).build());
        });
        return flags;
    }

    private static Set<String> pairKeys(List<DerivedEdge> edges) {
        Set<String> keys = new HashSet<>();
        edges.forEach(e -> keys.add(e.sourceId() + "|" + e.targetId()));
        return keys;
    }
}
