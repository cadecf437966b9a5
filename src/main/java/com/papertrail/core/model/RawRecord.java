package com.papertrail.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An entity mention as collected from a source system.
 * Immutable; the name may be missing, in which case the resolver reports
 * the record as a data-quality warning instead of clustering it.
 */
public final class RawRecord {

    private final String id;
    private final EntityKind kind;
    private final String name;
    private final String address;
    private final String registrationNumber;
    private final String sourceSystem;
    private final Instant retrievedAt;

    private RawRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.name = builder.name;
        this.address = builder.address;
        this.registrationNumber = builder.registrationNumber;
        this.sourceSystem = builder.sourceSystem != null ? builder.sourceSystem : "UNKNOWN";
        this.retrievedAt = builder.retrievedAt;
    }

    public String getId() {
        return id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getAddress() {
        return address;
    }

    public String getRegistrationNumber() {
        return registrationNumber;
    }

    public String getSourceSystem() {
        return sourceSystem;
    }

    public Instant getRetrievedAt() {
        return retrievedAt;
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    public boolean hasRegistrationNumber() {
        return registrationNumber != null && !registrationNumber.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawRecord that = (RawRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "RawRecord{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", name='" + name + '\'' +
                ", source='" + sourceSystem + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private EntityKind kind;
        private String name;
        private String address;
        private String registrationNumber;
        private String sourceSystem;
        private Instant retrievedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(EntityKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder registrationNumber(String registrationNumber) {
            this.registrationNumber = registrationNumber;
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            this.sourceSystem = sourceSystem;
            return this;
        }

        public Builder retrievedAt(Instant retrievedAt) {
            this.retrievedAt = retrievedAt;
            return this;
        }

        public RawRecord build() {
            return new RawRecord(this);
        }
    }
}
