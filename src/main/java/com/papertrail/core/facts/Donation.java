package com.papertrail.core.facts;

import java.time.LocalDate;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A campaign contribution from a contractor to a politician.
 */
public record Donation(String donorId, String recipientId, double amount, LocalDate date) {

    public Donation {
        Objects.requireNonNull(donorId, "donorId is required");
        Objects.requireNonNull(recipientId, "recipientId is required");
    }

    public Donation remap(UnaryOperator<String> ids) {
        return new Donation(ids.apply(donorId), ids.apply(recipientId), amount, date);
    }
}
