package com.papertrail.core.redflag.detectors;

import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeEvidence;
import com.papertrail.core.model.EdgeType;
import com.papertrail.core.model.RecordPair;
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
 * Contractors registered at the same address, with any directors they also
 * share. One {@code high} flag per SAME_ADDRESS_AS pair.
 */
public class ShellNetworkDetector implements RedFlagDetector {

    @Override
    public RedFlagType getType() {
        return RedFlagType.SHELL_NETWORK;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        Map<RecordPair, List<String>> directors = new TreeMap<>();
        for (DerivedEdge edge : context.edges(EdgeType.SHARES_DIRECTOR_WITH)) {
            directors.put(RecordPair.of(edge.sourceId(), edge.targetId()), attributeValues(edge));
        }

        List<RedFlag> flags = new ArrayList<>();
        for (DerivedEdge edge : context.edges(EdgeType.SAME_ADDRESS_AS)) {
            RecordPair pair = RecordPair.of(edge.sourceId(), edge.targetId());
            List<String> addresses = attributeValues(edge);
            String address = addresses.isEmpty() ? null : addresses.get(0);
            List<String> shared = directors.getOrDefault(pair, List.of());

            String description = String.format("%s and %s share the registered address %s",
                    context.graph().displayName(pair.first()), context.graph().displayName(pair.second()),
                    address != null ? address : "(unknown)");
            if (!shared.isEmpty()) {
                description += String.format(" and %d director(s)", shared.size());
            }
            flags.add(RedFlag.builder(RedFlagType.SHELL_NETWORK)
                    .severity(Severity.HIGH)
                    .description(description)
                    .subjects(pair.first(), pair.second())
                    .evidence("address", address)
                    .evidence("shared_directors", shared.size())
                    .evidence("director_names", shared)
                    .detectedAt(context.detectedAt())
                    .build());
        }
        return flags;
    }

    private static List<String> attributeValues(DerivedEdge edge) {
        return edge.evidence() instanceof EdgeEvidence.SharedAttribute shared ? shared.values() : List.of();
    }
}
