package com.papertrail.core.analytics;

/**
 * One contractor's portion of an agency's awarded value.
 */
public record MarketShare(String contractorId, double value, double share) {
}
