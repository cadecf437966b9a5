package com.papertrail.core.facts;

import java.time.LocalDate;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * An awarded contract.
 *
 * @param ref             contract reference number
 * @param agencyId        procuring agency
 * @param awardeeId       winning contractor
 * @param title           scope or title, may be null
 * @param amount          awarded amount in pesos
 * @param awardDate       award date
 * @param bidCount        declared number of bidders, or null when only bids are known
 * @param procurementMode e.g. "Public Bidding", "Negotiated", may be null
 */
public record Contract(
        String ref,
        String agencyId,
        String awardeeId,
        String title,
        double amount,
        LocalDate awardDate,
        Integer bidCount,
        String procurementMode
) {
    public Contract {
        Objects.requireNonNull(ref, "ref is required");
        Objects.requireNonNull(agencyId, "agencyId is required");
        Objects.requireNonNull(awardeeId, "awardeeId is required");
        Objects.requireNonNull(awardDate, "awardDate is required");
        if (amount < 0) {
            throw new IllegalArgumentException("Contract " + ref + " has a negative amount");
        }
    }

    public Contract remap(UnaryOperator<String> ids) {
        return new Contract(ref, ids.apply(agencyId), ids.apply(awardeeId), title, amount,
                awardDate, bidCount, procurementMode);
    }
}
