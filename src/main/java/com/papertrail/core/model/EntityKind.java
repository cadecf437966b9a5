package com.papertrail.core.model;

/**
 * Kinds of real-world entity the resolver clusters.
 * Records are only ever compared against records of the same kind.
 */
public enum EntityKind {
    CONTRACTOR(NodeLabel.CONTRACTOR, "con"),
    AGENCY(NodeLabel.AGENCY, "agy"),
    POLITICIAN(NodeLabel.POLITICIAN, "pol"),
    MUNICIPALITY(NodeLabel.MUNICIPALITY, "mun"),
    PERSON(NodeLabel.PERSON, "per");

    private final NodeLabel nodeLabel;
    private final String idPrefix;

    EntityKind(NodeLabel nodeLabel, String idPrefix) {
        this.nodeLabel = nodeLabel;
        this.idPrefix = idPrefix;
    }

    public NodeLabel getNodeLabel() {
        return nodeLabel;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    /**
     * Whether names of this kind are personal names (titles, generational
     * suffixes and surname particles apply).
     */
    public boolean isPersonName() {
        return this == POLITICIAN || this == PERSON;
    }
}
