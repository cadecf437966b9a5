package com.papertrail.core.derive;

import com.papertrail.core.config.DerivationOptions;
import com.papertrail.core.facts.ContractorProfile;
import com.papertrail.core.facts.Office;
import com.papertrail.core.facts.Ownership;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeEvidence;
import com.papertrail.core.model.EdgeType;
import com.papertrail.core.rules.Canonicalizer;
import com.papertrail.core.similarity.SimilarityScorer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Surname matches between contractor owners and politicians of the same province.
 *
 * <p>A match at or above the family threshold links the owner (when resolved to
 * a person) to the politician with FAMILY_OF. A weaker match, or a strong one
 * whose owner is known only by name, links the contractor itself to the
 * politician with ASSOCIATED_WITH. Both are heuristic and say so in their
 * evidence.</p>
 */
public class FamilyLinkDeriver implements EdgeDeriver {

    private final DerivationOptions options;
    private final SimilarityScorer scorer;

    public FamilyLinkDeriver(DerivationOptions options, SimilarityScorer scorer) {
        this.options = options;
        this.scorer = scorer;
    }

    @Override
    public String getName() {
        return "family-link";
    }

    @Override
    public List<DerivedEdge> derive(ResolvedGraph graph) {
        Canonicalizer canonicalizer = scorer.getCanonicalizer();

        // province -> politician id -> surname
        Map<String, Map<String, String>> politiciansByProvince = new TreeMap<>();
        for (Office office : graph.getFacts().getOffices()) {
            String province = canonicalizer.canonicalizeAddress(office.province());
            if (province.isEmpty()) {
                continue;
            }
            String name = graph.displayName(office.politicianId());
            String surname = Surnames.extract(name, canonicalizer);
            if (!surname.isEmpty()) {
                politiciansByProvince.computeIfAbsent(province, k -> new TreeMap<>())
                        .putIfAbsent(office.politicianId(), surname);
            }
        }

        Map<String, DerivedEdge> best = new LinkedHashMap<>();
        for (Ownership ownership : graph.getFacts().getOwnerships()) {
            Optional<ContractorProfile> profile = graph.getFacts().contractorProfile(ownership.contractorId());
            String province = canonicalizer.canonicalizeAddress(profile.map(ContractorProfile::province).orElse(null));
            Map<String, String> politicians = politiciansByProvince.get(province);
            if (province.isEmpty() || politicians == null) {
                continue;
            }
            String ownerSurname = Surnames.extract(ownership.personName(), canonicalizer);
            if (ownerSurname.isEmpty()) {
                continue;
            }
            for (Map.Entry<String, String> politician : politicians.entrySet()) {
                double confidence = scorer.score(ownerSurname, politician.getValue());
                if (confidence < options.getAssociationThreshold()) {
                    continue;
                }
                boolean family = confidence >= options.getFamilyThreshold() && ownership.personId() != null;
                EdgeType type = family ? EdgeType.FAMILY_OF : EdgeType.ASSOCIATED_WITH;
                String source = family ? ownership.personId() : ownership.contractorId();
                if (source.equals(politician.getKey())) {
                    continue;
                }
                EdgeEvidence evidence = new EdgeEvidence.FamilyMatch(politician.getValue(), province, confidence,
                        ownership.personName(), graph.displayName(politician.getKey()));
                DerivedEdge edge = new DerivedEdge(type, source, politician.getKey(), evidence);
                String key = type + "|" + source + "|" + politician.getKey();
                best.merge(key, edge, FamilyLinkDeriver::stronger);
            }
        }
        return new ArrayList<>(best.values());
    }

    private static DerivedEdge stronger(DerivedEdge current, DerivedEdge candidate) {
        double a = ((EdgeEvidence.FamilyMatch) current.evidence()).confidence();
        double b = ((EdgeEvidence.FamilyMatch) candidate.evidence()).confidence();
        return b > a ? candidate : current;
    }
}
