package com.papertrail.core.analytics;

import java.util.List;
import java.util.Objects;

/**
 * Dynasty score of one political family with the counts it was computed from.
 */
public record DynastyScore(
        String familyId,
        String familyName,
        List<String> memberIds,
        int distinctPositions,
        int distinctMunicipalities,
        int contractorLinkedMembers,
        double positionsComponent,
        double municipalitiesComponent,
        double ownershipComponent,
        double score
) {
    public DynastyScore {
        Objects.requireNonNull(familyId, "familyId is required");
        memberIds = List.copyOf(memberIds);
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
    }

    public int memberCount() {
        return memberIds.size();
    }
}
