package com.papertrail.core.facts;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A COA audit observation against an agency.
 */
public record AuditFinding(String id, String agencyId, String findingType, int year, double amount) {

    public AuditFinding {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(agencyId, "agencyId is required");
        Objects.requireNonNull(findingType, "findingType is required");
    }

    public AuditFinding remap(UnaryOperator<String> ids) {
        return new AuditFinding(id, ids.apply(agencyId), findingType, year, amount);
    }
}
