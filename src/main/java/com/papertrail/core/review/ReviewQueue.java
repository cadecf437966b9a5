package com.papertrail.core.review;

import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.RecordPair;

import java.util.Optional;
import java.util.Set;

/**
 * Pending {@code needs_review} decisions with their adjudication callbacks.
 *
 * <p>The resolver reads confirmed pairs back as merges and rejected pairs
 * as permanent distinctions on its next run.</p>
 */
public interface ReviewQueue {

    /**
     * Queues a pair. If the pair was already queued, in any status,
     * the existing item is returned unchanged.
     */
    ReviewItem submit(ReviewItem item);

    /**
     * Pending items, oldest first.
     */
    Page<ReviewItem> getPending(PageRequest page);

    Page<ReviewItem> getPendingByKind(EntityKind kind, PageRequest page);

    /**
     * Confirms the pair is one entity.
     *
     * @throws IllegalArgumentException if no such item exists
     * @throws IllegalStateException    if the item was already adjudicated
     */
    void confirm(String reviewId, String reviewerId, String notes);

    /**
     * Rules the pair distinct.
     *
     * @throws IllegalArgumentException if no such item exists
     * @throws IllegalStateException    if the item was already adjudicated
     */
    void reject(String reviewId, String reviewerId, String notes);

    Optional<ReviewItem> get(String reviewId);

    Optional<ReviewItem> findByPair(RecordPair pair);

    long countPending();

    Set<RecordPair> confirmedPairs();

    Set<RecordPair> rejectedPairs();
}
