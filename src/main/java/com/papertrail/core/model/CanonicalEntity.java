package com.papertrail.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A resolved real-world identity.
 *
 * <p>Aliases and source record ids are insertion-ordered and deduplicated.
 * Entities are never deleted: when a later pass finds two entities to be
 * the same, one {@linkplain #absorb(CanonicalEntity) absorbs} the other and
 * keeps the union of both alias and source sets under its own id.</p>
 */
public class CanonicalEntity {

    private final String id;
    private final EntityKind kind;
    private String displayName;
    private final Set<String> aliases = new LinkedHashSet<>();
    private final Set<String> sourceRecordIds = new LinkedHashSet<>();

    public CanonicalEntity(String id, EntityKind kind, String displayName) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.displayName = Objects.requireNonNull(displayName, "displayName is required");
    }

    public String getId() {
        return id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = Objects.requireNonNull(displayName, "displayName is required");
    }

    public Set<String> getAliases() {
        return Collections.unmodifiableSet(aliases);
    }

    public Set<String> getSourceRecordIds() {
        return Collections.unmodifiableSet(sourceRecordIds);
    }

    /**
     * Records that a raw record resolved into this entity.
     */
    public void addSource(RawRecord record) {
        if (record.getKind() != kind) {
            throw new IllegalArgumentException("Record " + record.getId() + " is a " + record.getKind()
                    + ", entity " + id + " is a " + kind);
        }
        sourceRecordIds.add(record.getId());
        if (record.hasName()) {
            aliases.add(record.getName().trim());
        }
    }

    public void addAlias(String alias) {
        if (alias != null && !alias.isBlank()) {
            aliases.add(alias.trim());
        }
    }

    /**
     * Merges another entity of the same kind into this one.
     * The other entity's aliases and sources are appended after this entity's own.
     */
    public void absorb(CanonicalEntity other) {
        if (other == this) {
            return;
        }
        if (other.kind != kind) {
            throw new IllegalArgumentException("Cannot merge " + other.kind + " " + other.id
                    + " into " + kind + " " + id);
        }
        aliases.addAll(other.aliases);
        sourceRecordIds.addAll(other.sourceRecordIds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalEntity that = (CanonicalEntity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CanonicalEntity{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", displayName='" + displayName + '\'' +
                ", aliases=" + aliases.size() +
                ", sources=" + sourceRecordIds.size() +
                '}';
    }
}
