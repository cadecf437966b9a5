package com.papertrail.core.review;

import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.RecordPair;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A record pair whose similarity fell in the review band, awaiting a human decision.
 */
public class ReviewItem {

    private final String id;
    private final RecordPair pair;
    private final String firstName;
    private final String secondName;
    private final EntityKind kind;
    private final double similarityScore;
    private final Instant submittedAt;
    private volatile ReviewStatus status;
    private volatile Instant reviewedAt;
    private volatile String reviewerId;
    private volatile String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.pair = Objects.requireNonNull(builder.pair, "pair is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.firstName = builder.firstName;
        this.secondName = builder.secondName;
        this.similarityScore = builder.similarityScore;
        this.status = ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public RecordPair getPair() {
        return pair;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getSecondName() {
        return secondName;
    }

    public EntityKind getKind() {
        return kind;
    }

    public double getSimilarityScore() {
        return similarityScore;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    synchronized void markConfirmed(String reviewerId, String notes) {
        transition(ReviewStatus.CONFIRMED, reviewerId, notes);
    }

    synchronized void markRejected(String reviewerId, String notes) {
        transition(ReviewStatus.REJECTED, reviewerId, notes);
    }

    private void transition(ReviewStatus target, String reviewerId, String notes) {
        if (status != ReviewStatus.PENDING) {
            throw new IllegalStateException("Review item " + id + " is already " + status);
        }
        this.status = target;
        this.reviewerId = reviewerId;
        this.notes = notes;
        this.reviewedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", pair=" + pair +
                ", kind=" + kind +
                ", score=" + similarityScore +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private RecordPair pair;
        private String firstName;
        private String secondName;
        private EntityKind kind;
        private double similarityScore;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder pair(RecordPair pair) {
            this.pair = pair;
            return this;
        }

        public Builder names(String firstName, String secondName) {
            this.firstName = firstName;
            this.secondName = secondName;
            return this;
        }

        public Builder kind(EntityKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder similarityScore(double similarityScore) {
            this.similarityScore = similarityScore;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
