package com.papertrail.core.review;

import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.RecordPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory {@link ReviewQueue}, keyed by pair so a pair is queued at most once.
 * Suitable for tests and single-JVM batch runs.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<RecordPair, ReviewItem> byPair = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReviewItem> byId = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        ReviewItem existing = byPair.putIfAbsent(item.getPair(), item);
        if (existing != null) {
            log.debug("review.duplicate pair={} status={}", item.getPair(), existing.getStatus());
            return existing;
        }
        byId.put(item.getId(), item);
        log.debug("review.submitted id={} pair={} score={}", item.getId(), item.getPair(), item.getSimilarityScore());
        return item;
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        return paginate(pending(i -> true), page);
    }

    @Override
    public Page<ReviewItem> getPendingByKind(EntityKind kind, PageRequest page) {
        return paginate(pending(i -> i.getKind() == kind), page);
    }

    @Override
    public void confirm(String reviewId, String reviewerId, String notes) {
        require(reviewId).markConfirmed(reviewerId, notes);
        log.info("review.confirmed id={} reviewer={}", reviewId, reviewerId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        require(reviewId).markRejected(reviewerId, notes);
        log.info("review.rejected id={} reviewer={}", reviewId, reviewerId);
    }

    @Override
    public Optional<ReviewItem> get(String reviewId) {
        return Optional.ofNullable(byId.get(reviewId));
    }

    @Override
    public Optional<ReviewItem> findByPair(RecordPair pair) {
        return Optional.ofNullable(byPair.get(pair));
    }

    @Override
    public long countPending() {
        return byId.values().stream().filter(ReviewItem::isPending).count();
    }

    @Override
    public Set<RecordPair> confirmedPairs() {
        return pairsWithStatus(ReviewStatus.CONFIRMED);
    }

    @Override
    public Set<RecordPair> rejectedPairs() {
        return pairsWithStatus(ReviewStatus.REJECTED);
    }

    private Set<RecordPair> pairsWithStatus(ReviewStatus status) {
        return byPair.values().stream()
                .filter(i -> i.getStatus() == status)
                .map(ReviewItem::getPair)
                .collect(Collectors.toUnmodifiableSet());
    }

    private List<ReviewItem> pending(Predicate<ReviewItem> filter) {
        return byId.values().stream()
                .filter(ReviewItem::isPending)
                .filter(filter)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt).thenComparing(ReviewItem::getPair))
                .toList();
    }

    private ReviewItem require(String reviewId) {
        ReviewItem item = byId.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        return item;
    }

    private Page<ReviewItem> paginate(List<ReviewItem> all, PageRequest page) {
        int total = all.size();
        int fromIndex = Math.min(page.offset(), total);
        int toIndex = Math.min(page.offset() + page.limit(), total);
        return new Page<>(all.subList(fromIndex, toIndex), total, page.pageNumber(), page.limit());
    }
}
