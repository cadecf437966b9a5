package com.papertrail.core.facts;

import java.time.LocalDate;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Registration details of a contractor (SEC/DTI, PhilGEPS).
 *
 * @param registeredCapital paid-up capital in pesos, or null when unknown
 */
public record ContractorProfile(String contractorId, String address, Double registeredCapital,
                                LocalDate registeredOn, String province) {

    public ContractorProfile {
        Objects.requireNonNull(contractorId, "contractorId is required");
    }

    public ContractorProfile remap(UnaryOperator<String> ids) {
        return new ContractorProfile(ids.apply(contractorId), address, registeredCapital, registeredOn, province);
    }
}
