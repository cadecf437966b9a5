package com.papertrail.core.model;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evidence justifying a derived edge. One variant per kind of inference,
 * each flattening to an ordered property map for the graph store.
 */
public interface EdgeEvidence {

    /**
     * Properties written onto the edge, in a stable order.
     */
    Map<String, Object> toProperties();

    /**
     * Two contractors bid on the same contracts.
     */
    record CoBid(int contractCount, WinPattern winPattern, List<String> contractRefs) implements EdgeEvidence {
        public CoBid {
            Objects.requireNonNull(winPattern, "winPattern is required");
            contractRefs = List.copyOf(contractRefs);
        }

        @Override
        public Map<String, Object> toProperties() {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("contract_count", contractCount);
            props.put("win_pattern", winPattern.getLabel());
            props.put("contract_refs", contractRefs);
            return props;
        }
    }

    /**
     * Two contractors share a normalized attribute such as an address or a director.
     */
    record SharedAttribute(String attribute, List<String> values) implements EdgeEvidence {
        public SharedAttribute {
            Objects.requireNonNull(attribute, "attribute is required");
            values = List.copyOf(values);
        }

        @Override
        public Map<String, Object> toProperties() {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("attribute", attribute);
            props.put("shared_values", values);
            return props;
        }
    }

    /**
     * A newer contractor carries the directors and address of a blacklisted one.
     */
    record ReRegistration(List<String> sharedDirectors, String sharedAddress,
                          LocalDate blacklistedOn, LocalDate registeredOn) implements EdgeEvidence {
        public ReRegistration {
            sharedDirectors = List.copyOf(sharedDirectors);
            Objects.requireNonNull(sharedAddress, "sharedAddress is required");
        }

        @Override
        public Map<String, Object> toProperties() {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("shared_directors", sharedDirectors);
            props.put("shared_address", sharedAddress);
            if (blacklistedOn != null) {
                props.put("blacklisted_on", blacklistedOn.toString());
            }
            if (registeredOn != null) {
                props.put("registered_on", registeredOn.toString());
            }
            return props;
        }
    }

    /**
     * Surname match between an owner or contractor and a politician.
     * Always heuristic.
     */
    record FamilyMatch(String surname, String jurisdiction, double confidence,
                       String matchedName, String politicianName) implements EdgeEvidence {
        public FamilyMatch {
            Objects.requireNonNull(surname, "surname is required");
        }

        public boolean heuristic() {
            return true;
        }

        @Override
        public Map<String, Object> toProperties() {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("heuristic", true);
            props.put("surname", surname);
            props.put("jurisdiction", jurisdiction);
            props.put("confidence", confidence);
            props.put("matched_name", matchedName);
            props.put("politician_name", politicianName);
            return props;
        }
    }

    /**
     * Aggregated subcontract flow between two contractors.
     */
    record SubcontractFlow(double totalAmount, int subcontractCount, List<String> contractRefs) implements EdgeEvidence {
        public SubcontractFlow {
            contractRefs = List.copyOf(contractRefs);
        }

        @Override
        public Map<String, Object> toProperties() {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("total_amount", totalAmount);
            props.put("subcontract_count", subcontractCount);
            props.put("contract_refs", contractRefs);
            return props;
        }
    }

    /**
     * Two politicians funded by the same contractors.
     */
    record DonorAlliance(List<String> sharedDonorIds, double combinedAmount) implements EdgeEvidence {
        public DonorAlliance {
            sharedDonorIds = List.copyOf(sharedDonorIds);
        }

        @Override
        public Map<String, Object> toProperties() {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("shared_donor_count", sharedDonorIds.size());
            props.put("shared_donors", sharedDonorIds);
            props.put("combined_amount", combinedAmount);
            return props;
        }
    }
}
