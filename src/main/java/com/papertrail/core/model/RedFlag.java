package com.papertrail.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A statistical risk indicator produced by one detector.
 *
 * <p>Red flags are derived facts: every run recomputes the full set, nothing
 * here is ever resolved or deleted. The evidence map carries the exact values
 * and paths that triggered the flag so it can be re-checked by machine.</p>
 */
public final class RedFlag {

    private final RedFlagType type;
    private final Severity severity;
    private final String description;
    private final Map<String, Object> evidence;
    private final Instant detectedAt;
    private final List<String> subjectIds;

    private RedFlag(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.severity = Objects.requireNonNull(builder.severity, "severity is required");
        this.description = Objects.requireNonNull(builder.description, "description is required");
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt is required");
        if (builder.subjectIds == null || builder.subjectIds.isEmpty()) {
            throw new IllegalArgumentException("A red flag needs at least one subject");
        }
        this.subjectIds = List.copyOf(builder.subjectIds);
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(builder.evidence));
    }

    public RedFlagType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getEvidence() {
        return evidence;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    /**
     * The entity (or entity pair, or group) the flag is attached to.
     * The first id is the primary subject.
     */
    public List<String> getSubjectIds() {
        return subjectIds;
    }

    public String getPrimarySubjectId() {
        return subjectIds.get(0);
    }

    public boolean concerns(String entityId) {
        return subjectIds.contains(entityId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RedFlag that = (RedFlag) o;
        return type == that.type
                && severity == that.severity
                && subjectIds.equals(that.subjectIds)
                && evidence.equals(that.evidence)
                && detectedAt.equals(that.detectedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, severity, subjectIds, evidence, detectedAt);
    }

    @Override
    public String toString() {
        return "RedFlag{" +
                "type=" + type.getCode() +
                ", severity=" + severity.getLabel() +
                ", subjects=" + subjectIds +
                ", description='" + description + '\'' +
                '}';
    }

    public static Builder builder(RedFlagType type) {
        return new Builder().type(type);
    }

    public static class Builder {
        private RedFlagType type;
        private Severity severity;
        private String description;
        private final Map<String, Object> evidence = new LinkedHashMap<>();
        private Instant detectedAt;
        private List<String> subjectIds;

        public Builder type(RedFlagType type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder evidence(String key, Object value) {
            this.evidence.put(key, value);
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder subjects(String... subjectIds) {
            this.subjectIds = List.of(subjectIds);
            return this;
        }

        public Builder subjects(List<String> subjectIds) {
            this.subjectIds = subjectIds;
            return this;
        }

        public RedFlag build() {
            return new RedFlag(this);
        }
    }
}
