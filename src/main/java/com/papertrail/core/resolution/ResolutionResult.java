package com.papertrail.core.resolution;

import com.papertrail.core.model.CanonicalEntity;
import com.papertrail.core.model.DataQualityWarning;
import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.MergeDecision;
import com.papertrail.core.review.ReviewItem;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of one resolution pass.
 *
 * <p>Every input record is accounted for exactly once: either as a source of
 * one entity, or as a data-quality warning.</p>
 *
 * @param entities       canonical entities sorted by id
 * @param decisions      every scored pair, sorted by pair
 * @param newReviews     review items submitted during this pass
 * @param warnings       records skipped as malformed, and names that cannot be matched
 * @param recordToEntity raw record id to canonical entity id
 */
public record ResolutionResult(
        List<CanonicalEntity> entities,
        List<MergeDecision> decisions,
        List<ReviewItem> newReviews,
        List<DataQualityWarning> warnings,
        Map<String, String> recordToEntity
) {
    public ResolutionResult {
        entities = List.copyOf(entities);
        decisions = List.copyOf(decisions);
        newReviews = List.copyOf(newReviews);
        warnings = List.copyOf(warnings);
        recordToEntity = Map.copyOf(recordToEntity);
    }

    public Optional<String> entityIdFor(String recordId) {
        return Optional.ofNullable(recordToEntity.get(recordId));
    }

    public Optional<CanonicalEntity> entity(String entityId) {
        return entities.stream().filter(e -> e.getId().equals(entityId)).findFirst();
    }

    public List<CanonicalEntity> entitiesOfKind(EntityKind kind) {
        return entities.stream().filter(e -> e.getKind() == kind).toList();
    }

    /**
     * Maps a raw reference to its entity id, passing through ids that are
     * already canonical or unknown.
     */
    public String canonicalId(String reference) {
        return recordToEntity.getOrDefault(reference, reference);
    }
}
