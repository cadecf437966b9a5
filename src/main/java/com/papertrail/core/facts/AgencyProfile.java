package com.papertrail.core.facts;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Where an agency sits.
 */
public record AgencyProfile(String agencyId, String municipalityId, String province) {

    public AgencyProfile {
        Objects.requireNonNull(agencyId, "agencyId is required");
    }

    public AgencyProfile remap(UnaryOperator<String> ids) {
        return new AgencyProfile(ids.apply(agencyId),
                municipalityId == null ? null : ids.apply(municipalityId), province);
    }
}
