package com.papertrail.core.model;

/**
 * A record or fact that was skipped because a field was missing or malformed.
 *
 * @param recordId id of the offending record, or a positional reference when it has none
 * @param field    the field at fault
 * @param reason   human-readable explanation
 */
public record DataQualityWarning(String recordId, String field, String reason) {

    @Override
    public String toString() {
        return recordId + "." + field + ": " + reason;
    }
}
