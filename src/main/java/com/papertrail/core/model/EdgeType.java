package com.papertrail.core.model;

/**
 * Relationship vocabulary of the graph store. Only some of these are
 * produced by derivation; the rest arrive with collected records.
 */
public enum EdgeType {
    MEMBER_OF(false),
    GOVERNS(false),
    HAS_AGENCY(false),
    PROCURED(false),
    AWARDED_TO(false),
    BID_ON(false),
    CO_BID_WITH(true),
    SUBCONTRACTED_TO(false),
    AUDITED(false),
    OWNED_BY(false),
    FAMILY_OF(false),
    LOCATED_IN(false),
    ASSOCIATED_WITH(false),
    DONATED_TO(false),
    BLACKLISTED(false),
    RE_REGISTERED_AS(false),
    SAME_ADDRESS_AS(true),
    SHARES_DIRECTOR_WITH(true),
    ALLIED_WITH(true);

    private final boolean symmetric;

    EdgeType(boolean symmetric) {
        this.symmetric = symmetric;
    }

    /**
     * Symmetric edges are stored once with the lexicographically smaller
     * endpoint as source.
     */
    public boolean isSymmetric() {
        return symmetric;
    }
}
