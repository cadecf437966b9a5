package com.papertrail.core.similarity;

import java.util.Set;

/**
 * Generates blocking keys for a record. Records sharing at least one key
 * are candidate pairs; all other pairs are never scored.
 */
public interface BlockingKeyStrategy {

    /**
     * @param canonicalName      canonical name, never empty
     * @param registrationNumber raw registration number, may be null
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(String canonicalName, String registrationNumber);
}
