package com.papertrail.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A relationship inferred from the resolved graph and transactional history.
 * Symmetric edge types are stored with the smaller endpoint id as source,
 * so the same pair always yields an equal edge.
 */
public record DerivedEdge(EdgeType type, String sourceId, String targetId, EdgeEvidence evidence)
        implements Comparable<DerivedEdge> {

    private static final Comparator<DerivedEdge> ORDER = Comparator
            .comparing(DerivedEdge::type)
            .thenComparing(DerivedEdge::sourceId)
            .thenComparing(DerivedEdge::targetId);

    public DerivedEdge {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(targetId, "targetId is required");
        Objects.requireNonNull(evidence, "evidence is required");
        if (sourceId.equals(targetId)) {
            throw new IllegalArgumentException("Self-loop " + type + " on " + sourceId);
        }
        if (type.isSymmetric() && sourceId.compareTo(targetId) > 0) {
            String tmp = sourceId;
            sourceId = targetId;
            targetId = tmp;
        }
    }

    public boolean connects(String a, String b) {
        return (sourceId.equals(a) && targetId.equals(b)) || (sourceId.equals(b) && targetId.equals(a));
    }

    public boolean touches(String id) {
        return sourceId.equals(id) || targetId.equals(id);
    }

    public String otherEnd(String id) {
        return sourceId.equals(id) ? targetId : sourceId;
    }

    @Override
    public int compareTo(DerivedEdge o) {
        return ORDER.compare(this, o);
    }
}
