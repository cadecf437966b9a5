package com.papertrail.core.facts;

import java.time.LocalDate;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A GPPB/agency blacklist entry against a contractor.
 */
public record Blacklisting(String contractorId, LocalDate blacklistedOn, String reason) {

    public Blacklisting {
        Objects.requireNonNull(contractorId, "contractorId is required");
    }

    public Blacklisting remap(UnaryOperator<String> ids) {
        return new Blacklisting(ids.apply(contractorId), blacklistedOn, reason);
    }
}
