package com.papertrail.core.model;

/**
 * Fixed node vocabulary of the graph store.
 */
public enum NodeLabel {
    POLITICIAN("Politician"),
    POLITICAL_FAMILY("PoliticalFamily"),
    MUNICIPALITY("Municipality"),
    AGENCY("Agency"),
    CONTRACT("Contract"),
    CONTRACTOR("Contractor"),
    AUDIT_FINDING("AuditFinding"),
    BILL("Bill"),
    PERSON("Person"),
    CAMPAIGN_DONATION("CampaignDonation"),
    BLACKLIST_ENTRY("BlacklistEntry"),
    SALN_RECORD("SALNRecord");

    private final String label;

    NodeLabel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
