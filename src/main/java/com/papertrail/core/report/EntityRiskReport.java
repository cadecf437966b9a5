package com.papertrail.core.report;

import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.Severity;

import java.util.List;
import java.util.Objects;

/**
 * Red flags concerning one entity with their roll-up.
 *
 * @param entityId        canonical entity id
 * @param displayName     display name, the id when the entity is unknown
 * @param kind            entity kind, null when the id is not a resolved entity
 * @param riskScore       roll-up of all flags in [0, 1]
 * @param highestSeverity most severe flag
 * @param flags           flags naming this entity as a subject
 */
public record EntityRiskReport(
        String entityId,
        String displayName,
        EntityKind kind,
        double riskScore,
        Severity highestSeverity,
        List<RedFlag> flags
) {
    public EntityRiskReport {
        Objects.requireNonNull(entityId, "entityId is required");
        flags = List.copyOf(flags);
    }

    public boolean exceeds(double threshold) {
        return riskScore >= threshold;
    }
}
