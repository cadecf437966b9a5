package com.papertrail.core.facts;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Transactional history attached to entity references: contracts, bids,
 * subcontracts, donations, audits, ownership, blacklistings, offices and
 * registration profiles.
 *
 * <p>References may be raw record ids as collected or canonical entity ids;
 * {@link #remap(UnaryOperator)} translates the former into the latter once
 * resolution has run. Instances are immutable.</p>
 */
public final class ProcurementFacts {

    private final List<Contract> contracts;
    private final List<Bid> bids;
    private final List<Subcontract> subcontracts;
    private final List<Donation> donations;
    private final List<AuditFinding> auditFindings;
    private final List<Ownership> ownerships;
    private final List<Blacklisting> blacklistings;
    private final List<Office> offices;
    private final List<PoliticalFamily> families;
    private final Map<String, ContractorProfile> contractorProfiles;
    private final Map<String, AgencyProfile> agencyProfiles;

    private ProcurementFacts(Builder builder) {
        this.contracts = List.copyOf(builder.contracts);
        this.bids = List.copyOf(builder.bids);
        this.subcontracts = List.copyOf(builder.subcontracts);
        this.donations = List.copyOf(builder.donations);
        this.auditFindings = List.copyOf(builder.auditFindings);
        this.ownerships = List.copyOf(builder.ownerships);
        this.blacklistings = List.copyOf(builder.blacklistings);
        this.offices = List.copyOf(builder.offices);
        this.families = List.copyOf(builder.families);
        Map<String, ContractorProfile> cp = new LinkedHashMap<>();
        builder.contractorProfiles.forEach(p -> cp.merge(p.contractorId(), p, ProcurementFacts::preferRicher));
        this.contractorProfiles = Collections.unmodifiableMap(cp);
        Map<String, AgencyProfile> ap = new LinkedHashMap<>();
        builder.agencyProfiles.forEach(p -> ap.putIfAbsent(p.agencyId(), p));
        this.agencyProfiles = Collections.unmodifiableMap(ap);
    }

    public static ProcurementFacts empty() {
        return builder().build();
    }

    public List<Contract> getContracts() {
        return contracts;
    }

    public List<Bid> getBids() {
        return bids;
    }

    public List<Subcontract> getSubcontracts() {
        return subcontracts;
    }

    public List<Donation> getDonations() {
        return donations;
    }

    public List<AuditFinding> getAuditFindings() {
        return auditFindings;
    }

    public List<Ownership> getOwnerships() {
        return ownerships;
    }

    public List<Blacklisting> getBlacklistings() {
        return blacklistings;
    }

    public List<Office> getOffices() {
        return offices;
    }

    public List<PoliticalFamily> getFamilies() {
        return families;
    }

    public Collection<ContractorProfile> getContractorProfiles() {
        return contractorProfiles.values();
    }

    public Optional<ContractorProfile> contractorProfile(String contractorId) {
        return Optional.ofNullable(contractorProfiles.get(contractorId));
    }

    public Optional<AgencyProfile> agencyProfile(String agencyId) {
        return Optional.ofNullable(agencyProfiles.get(agencyId));
    }

    public Optional<Contract> contract(String ref) {
        return contracts.stream().filter(c -> c.ref().equals(ref)).findFirst();
    }

    /**
     * Bids grouped by contract reference, preserving input order.
     */
    public Map<String, List<Bid>> bidsByContract() {
        return bids.stream().collect(Collectors.groupingBy(Bid::contractRef, LinkedHashMap::new, Collectors.toList()));
    }

    public boolean isBlacklisted(String contractorId) {
        return blacklistings.stream().anyMatch(b -> b.contractorId().equals(contractorId));
    }

    /**
     * Rewrites every entity reference through {@code ids}. Contract refs,
     * finding ids and family ids are not entity references and stay as they are.
     */
    public ProcurementFacts remap(UnaryOperator<String> ids) {
        Builder b = builder();
        contracts.forEach(c -> b.contract(c.remap(ids)));
        bids.forEach(x -> b.bid(x.remap(ids)));
        subcontracts.forEach(x -> b.subcontract(x.remap(ids)));
        donations.forEach(x -> b.donation(x.remap(ids)));
        auditFindings.forEach(x -> b.auditFinding(x.remap(ids)));
        ownerships.forEach(x -> b.ownership(x.remap(ids)));
        blacklistings.forEach(x -> b.blacklisting(x.remap(ids)));
        offices.forEach(x -> b.office(x.remap(ids)));
        families.forEach(b::family);
        contractorProfiles.values().forEach(x -> b.contractorProfile(x.remap(ids)));
        agencyProfiles.values().forEach(x -> b.agencyProfile(x.remap(ids)));
        return b.build();
    }

    // Two raw contractor records resolving to one entity each bring a profile; keep the fuller one.
    private static ContractorProfile preferRicher(ContractorProfile a, ContractorProfile b) {
        return richness(b) > richness(a) ? b : a;
    }

    private static int richness(ContractorProfile p) {
        int n = 0;
        if (p.address() != null) n++;
        if (p.registeredCapital() != null) n++;
        if (p.registeredOn() != null) n++;
        if (p.province() != null) n++;
        return n;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Contract> contracts = new ArrayList<>();
        private final List<Bid> bids = new ArrayList<>();
        private final List<Subcontract> subcontracts = new ArrayList<>();
        private final List<Donation> donations = new ArrayList<>();
        private final List<AuditFinding> auditFindings = new ArrayList<>();
        private final List<Ownership> ownerships = new ArrayList<>();
        private final List<Blacklisting> blacklistings = new ArrayList<>();
        private final List<Office> offices = new ArrayList<>();
        private final List<PoliticalFamily> families = new ArrayList<>();
        private final List<ContractorProfile> contractorProfiles = new ArrayList<>();
        private final List<AgencyProfile> agencyProfiles = new ArrayList<>();

        public Builder contract(Contract contract) {
            contracts.add(contract);
            return this;
        }

        public Builder bid(Bid bid) {
            bids.add(bid);
            return this;
        }

        public Builder subcontract(Subcontract subcontract) {
            subcontracts.add(subcontract);
            return this;
        }

        public Builder donation(Donation donation) {
            donations.add(donation);
            return this;
        }

        public Builder auditFinding(AuditFinding finding) {
            auditFindings.add(finding);
            return this;
        }

        public Builder ownership(Ownership ownership) {
            ownerships.add(ownership);
            return this;
        }

        public Builder blacklisting(Blacklisting blacklisting) {
            blacklistings.add(blacklisting);
            return this;
        }

        public Builder office(Office office) {
            offices.add(office);
            return this;
        }

        public Builder family(PoliticalFamily family) {
            families.add(family);
            return this;
        }

        public Builder contractorProfile(ContractorProfile profile) {
            contractorProfiles.add(profile);
            return this;
        }

        public Builder agencyProfile(AgencyProfile profile) {
            agencyProfiles.add(profile);
            return this;
        }

        public ProcurementFacts build() {
            return new ProcurementFacts(this);
        }
    }
}
