package com.papertrail.core.facts;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A bid submitted on a contract, winning or losing.
 */
public record Bid(String contractRef, String contractorId, double amount, boolean winning) {

    public Bid {
        Objects.requireNonNull(contractRef, "contractRef is required");
        Objects.requireNonNull(contractorId, "contractorId is required");
    }

    public Bid remap(UnaryOperator<String> ids) {
        return new Bid(contractRef, ids.apply(contractorId), amount, winning);
    }
}
