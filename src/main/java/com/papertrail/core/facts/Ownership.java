package com.papertrail.core.facts;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A beneficial owner or director of a contractor.
 *
 * @param contractorId the contractor
 * @param personId     resolved person id, may be null when only a name is known
 * @param personName   the person's name as recorded
 * @param role         owner or director
 */
public record Ownership(String contractorId, String personId, String personName, OwnershipRole role) {

    public Ownership {
        Objects.requireNonNull(contractorId, "contractorId is required");
        Objects.requireNonNull(personName, "personName is required");
        Objects.requireNonNull(role, "role is required");
    }

    public Ownership remap(UnaryOperator<String> ids) {
        return new Ownership(ids.apply(contractorId), personId == null ? null : ids.apply(personId),
                personName, role);
    }
}
