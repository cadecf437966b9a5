package com.papertrail.core.redflag.detectors;

import com.papertrail.core.facts.Ownership;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeEvidence;
import com.papertrail.core.model.EdgeType;
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
 * Contractors tied to a politician by a surname match. FAMILY_OF through an
 * owner gives {@code medium}, ASSOCIATED_WITH gives {@code low}; a pair linked
 * both ways keeps the stronger flag. These rest on heuristics and the evidence
 * says so.
 */
public class PoliticalConnectionDetector implements RedFlagDetector {

    @Override
    public RedFlagType getType() {
        return RedFlagType.POLITICAL_CONNECTION;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        Map<String, RedFlag> best = new TreeMap<>();

        for (DerivedEdge edge : context.edges(EdgeType.FAMILY_OF)) {
            for (Ownership ownership : context.graph().getFacts().getOwnerships()) {
                if (edge.sourceId().equals(ownership.personId())) {
                    keep(best, flag(context, ownership.contractorId(), edge, Severity.MEDIUM, ownership.personId()));
                }
            }
        }
        for (DerivedEdge edge : context.edges(EdgeType.ASSOCIATED_WITH)) {
            keep(best, flag(context, edge.sourceId(), edge, Severity.LOW, null));
        }
        return new ArrayList<>(best.values());
    }

    private static void keep(Map<String, RedFlag> best, RedFlag flag) {
        String key = String.join("|", flag.getSubjectIds());
        best.merge(key, flag, (current, candidate) ->
                candidate.getSeverity().ordinal() < current.getSeverity().ordinal() ? candidate : current);
    }

    private static RedFlag flag(DetectionContext context, String contractorId, DerivedEdge edge,
                                Severity severity, String ownerId) {
        String politicianId = edge.targetId();
        RedFlag.Builder builder = RedFlag.builder(RedFlagType.POLITICAL_CONNECTION)
                .severity(severity)
                .description(String.format("%s is linked to %s by surname (%s)",
                        context.graph().displayName(contractorId), context.graph().displayName(politicianId),
                        edge.type().name()))
                .subjects(contractorId, politicianId)
                .evidence("heuristic", true)
                .evidence("edge_type", edge.type().name());
        if (ownerId != null) {
            builder.evidence("owner_id", ownerId);
        }
        if (edge.evidence() instanceof EdgeEvidence.FamilyMatch match) {
            builder.evidence("surname", match.surname())
                    .evidence("jurisdiction", match.jurisdiction())
                    .evidence("confidence", match.confidence())
                    .evidence("matched_name", match.matchedName());
        }
        return builder.detectedAt(context.detectedAt()).build();
    }
}
