package com.papertrail.core.analytics;

import com.papertrail.core.config.DynastyWeights;
import com.papertrail.core.derive.ResolvedGraph;
import com.papertrail.core.facts.Office;
import com.papertrail.core.facts.Ownership;
import com.papertrail.core.facts.PoliticalFamily;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Dynasty score per political family: distinct positions held by members,
 * distinct municipalities governed, and whether any member is linked to a
 * contractor through a FAMILY_OF or ASSOCIATED_WITH edge.
 */
public class DynastyAnalyzer {

    private final DynastyWeights weights;

    public DynastyAnalyzer(DynastyWeights weights) {
        this.weights = weights;
    }

    public List<DynastyScore> analyze(ResolvedGraph graph, List<DerivedEdge> derivedEdges) {
        Map<String, String> names = new TreeMap<>();
        for (PoliticalFamily family : graph.getFacts().getFamilies()) {
            names.put(family.id(), family.surname());
        }
        Map<String, List<Office>> officesByFamily = new TreeMap<>();
        names.keySet().forEach(id -> officesByFamily.put(id, new ArrayList<>()));
        for (Office office : graph.getFacts().getOffices()) {
            if (office.familyId() != null) {
                officesByFamily.computeIfAbsent(office.familyId(), k -> new ArrayList<>()).add(office);
            }
        }

        Set<String> linkedPoliticians = linkedPoliticians(graph, derivedEdges);
        List<DynastyScore> scores = new ArrayList<>();
        officesByFamily.forEach((familyId, offices) ->
                scores.add(score(familyId, names.getOrDefault(familyId, familyId), offices, linkedPoliticians)));
        return scores;
    }

    DynastyScore score(String familyId, String familyName, List<Office> offices, Set<String> linkedPoliticians) {
        TreeSet<String> members = new TreeSet<>();
        Set<String> positions = new HashSet<>();
        Set<String> municipalities = new HashSet<>();
        for (Office office : offices) {
            members.add(office.politicianId());
            positions.add(office.position().trim().toLowerCase(Locale.ROOT));
            if (office.municipalityId() != null) {
                municipalities.add(office.municipalityId());
            }
        }
        int linked = (int) members.stream().filter(linkedPoliticians::contains).count();

        double positionsComponent = Math.min(1.0, (double) positions.size() / weights.positionSaturation());
        double municipalitiesComponent = Math.min(1.0,
                (double) municipalities.size() / weights.municipalitySaturation());
        double ownershipComponent = linked > 0 ? 1.0 : 0.0;
        double score = weights.positions() * positionsComponent
                + weights.municipalities() * municipalitiesComponent
                + weights.ownership() * ownershipComponent;

        return new DynastyScore(familyId, familyName, new ArrayList<>(members), positions.size(),
                municipalities.size(), linked, positionsComponent, municipalitiesComponent, ownershipComponent,
                Math.min(1.0, Math.max(0.0, score)));
    }

    private static Set<String> linkedPoliticians(ResolvedGraph graph, List<DerivedEdge> edges) {
        Set<String> owners = new HashSet<>();
        for (Ownership o : graph.getFacts().getOwnerships()) {
            if (o.personId() != null) {
                owners.add(o.personId());
            }
        }
        Set<String> linked = new HashSet<>();
        for (DerivedEdge edge : edges) {
            if (edge.type() == EdgeType.ASSOCIATED_WITH
                    || (edge.type() == EdgeType.FAMILY_OF && owners.contains(edge.sourceId()))) {
                linked.add(edge.targetId());
            }
        }
        return linked;
    }
}
