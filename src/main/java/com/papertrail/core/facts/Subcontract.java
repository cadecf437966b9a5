package com.papertrail.core.facts;

import java.time.LocalDate;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Work passed from one contractor to another under a contract.
 */
public record Subcontract(String contractRef, String fromId, String toId, double amount, LocalDate date) {

    public Subcontract {
        Objects.requireNonNull(contractRef, "contractRef is required");
        Objects.requireNonNull(fromId, "fromId is required");
        Objects.requireNonNull(toId, "toId is required");
    }

    public Subcontract remap(UnaryOperator<String> ids) {
        return new Subcontract(contractRef, ids.apply(fromId), ids.apply(toId), amount, date);
    }
}
