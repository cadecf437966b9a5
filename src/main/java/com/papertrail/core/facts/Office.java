package com.papertrail.core.facts;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * An elected position held by a politician.
 *
 * @param politicianId   office holder
 * @param familyId       political family the holder belongs to, may be null
 * @param position       e.g. "Governor", "Mayor", "Representative"
 * @param municipalityId municipality governed, may be null for provincial or national posts
 * @param province       jurisdiction used for surname matching
 * @param startYear      first year of the term
 */
public record Office(String politicianId, String familyId, String position,
                     String municipalityId, String province, int startYear) {

    public Office {
        Objects.requireNonNull(politicianId, "politicianId is required");
        Objects.requireNonNull(position, "position is required");
    }

    public Office remap(UnaryOperator<String> ids) {
        return new Office(ids.apply(politicianId), familyId, position,
                municipalityId == null ? null : ids.apply(municipalityId), province, startYear);
    }
}
