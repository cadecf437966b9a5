package com.papertrail.core.redflag.detectors;

import com.papertrail.core.facts.AgencyProfile;
import com.papertrail.core.facts.Contract;
import com.papertrail.core.facts.Donation;
import com.papertrail.core.facts.Office;
import com.papertrail.core.facts.ProcurementFacts;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;
import com.papertrail.core.redflag.DetectionContext;
import com.papertrail.core.redflag.RedFlagDetector;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A contractor that donated to a politician and later won a contract from an
 * agency in a municipality that politician governs. One {@code high} flag per
 * (donor, politician) pair.
 */
public class CampaignConnectionDetector implements RedFlagDetector {

    @Override
    public RedFlagType getType() {
        return RedFlagType.CAMPAIGN_CONNECTION;
    }

    @Override
    public List<RedFlag> detect(DetectionContext context) {
        ProcurementFacts facts = context.graph().getFacts();
        Map<String, Set<String>> governed = new TreeMap<>();
        for (Office office : facts.getOffices()) {
            if (office.municipalityId() != null) {
                governed.computeIfAbsent(office.politicianId(), k -> new HashSet<>()).add(office.municipalityId());
            }
        }

        Map<String, Match> matches = new TreeMap<>();
        for (Donation donation : facts.getDonations()) {
            Set<String> municipalities = governed.get(donation.recipientId());
            if (municipalities == null || donation.date() == null) {
                continue;
            }
            for (Contract contract : facts.getContracts()) {
                if (!contract.awardeeId().equals(donation.donorId())
                        || !contract.awardDate().isAfter(donation.date())) {
                    continue;
                }
                String municipality = facts.agencyProfile(contract.agencyId())
                        .map(AgencyProfile::municipalityId)
                        .orElse(null);
                if (municipality == null || !municipalities.contains(municipality)) {
                    continue;
                }
                Match match = matches.computeIfAbsent(donation.donorId() + "|" + donation.recipientId(),
                        k -> new Match(donation.donorId(), donation.recipientId()));
                match.donations.add(donation);
                match.contractRefs.add(contract.ref());
                match.municipalities.add(municipality);
            }
        }

        List<RedFlag> flags = new ArrayList<>();
        for (Match match : matches.values()) {
            double donated = 0;
            Set<Donation> distinct = new HashSet<>(match.donations);
            for (Donation d : distinct) {
                donated += d.amount();
            }
            double awarded = 0;
            for (String ref : match.contractRefs) {
                awarded += facts.contract(ref).map(Contract::amount).orElse(0.0);
            }
            flags.add(RedFlag.builder(RedFlagType.CAMPAIGN_CONNECTION)
                    .severity(Severity.HIGH)
                    .description(String.format("%s donated to %s and later won contracts in their jurisdiction",
                            context.graph().displayName(match.donorId),
                            context.graph().displayName(match.politicianId)))
                    .subjects(match.donorId, match.politicianId)
                    .evidence("donor_id", match.donorId)
                    .evidence("politician_id", match.politicianId)
                    .evidence("donated_amount", donated)
                    .evidence("contract_refs", new ArrayList<>(match.contractRefs))
                    .evidence("awarded_amount", awarded)
                    .evidence("municipality_ids", new ArrayList<>(match.municipalities))
                    .detectedAt(context.detectedAt())
                    .build());
        }
        return flags;
    }

    private static final class Match {
        final String donorId;
        final String politicianId;
        final List<Donation> donations = new ArrayList<>();
        final TreeSet<String> contractRefs = new TreeSet<>();
        final TreeSet<String> municipalities = new TreeSet<>();

        Match(String donorId, String politicianId) {
            this.donorId = donorId;
            this.politicianId = politicianId;
        }
    }
}
