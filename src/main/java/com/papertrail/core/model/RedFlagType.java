package com.papertrail.core.model;

/**
 * The fixed battery of red-flag detectors, by the code each reports under.
 */
public enum RedFlagType {
    SINGLE_BIDDER("single_bidder"),
    IDENTICAL_BID_AMOUNTS("identical_bid_amounts"),
    SPLIT_CONTRACTS("split_contracts"),
    CONCENTRATION("concentration"),
    COLLUSION_RING("collusion_ring"),
    PHOENIX_COMPANY("phoenix_company"),
    CIRCULAR_SUBCONTRACTING("circular_subcontracting"),
    AUDIT_REPEAT("audit_repeat"),
    SHELL_COMPANY("shell_company"),
    CAMPAIGN_CONNECTION("campaign_connection"),
    POLITICAL_CONNECTION("political_connection"),
    GEOGRAPHIC_ANOMALY("geographic_anomaly"),
    TIMING_CLUSTER("timing_cluster"),
    SHELL_NETWORK("shell_network");

    private final String code;

    RedFlagType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
