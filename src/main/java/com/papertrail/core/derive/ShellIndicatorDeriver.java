package com.papertrail.core.derive;

import com.papertrail.core.facts.Blacklisting;
import com.papertrail.core.facts.ContractorProfile;
import com.papertrail.core.facts.Ownership;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeEvidence;
import com.papertrail.core.model.EdgeType;
import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.RecordPair;
import com.papertrail.core.rules.Canonicalizer;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Shell and phoenix indicators between contractors.
 * <ul>
 *   <li>SAME_ADDRESS_AS: identical canonical registered address.</li>
 *   <li>SHARES_DIRECTOR_WITH: a common owner or director, matched by person id
 *       when resolved, otherwise by canonical name.</li>
 *   <li>RE_REGISTERED_AS: from a blacklisted contractor to a more recently
 *       registered one sharing both its address and a director.</li>
 * </ul>
 */
public class ShellIndicatorDeriver implements EdgeDeriver {

    private final Canonicalizer canonicalizer;

    public ShellIndicatorDeriver(Canonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    @Override
    public String getName() {
        return "shell-indicators";
    }

    @Override
    public List<DerivedEdge> derive(ResolvedGraph graph) {
        Map<RecordPair, String> sharedAddress = sharedAddresses(graph);
        Map<RecordPair, Set<String>> sharedDirectors = sharedDirectors(graph);

        List<DerivedEdge> edges = new ArrayList<>();
        sharedAddress.forEach((pair, address) -> edges.add(new DerivedEdge(EdgeType.SAME_ADDRESS_AS,
                pair.first(), pair.second(), new EdgeEvidence.SharedAttribute("address", List.of(address)))));
        sharedDirectors.forEach((pair, names) -> edges.add(new DerivedEdge(EdgeType.SHARES_DIRECTOR_WITH,
                pair.first(), pair.second(), new EdgeEvidence.SharedAttribute("director", List.copyOf(names)))));

        Map<String, LocalDate> blacklisted = new TreeMap<>();
        for (Blacklisting b : graph.getFacts().getBlacklistings()) {
            blacklisted.merge(b.contractorId(), b.blacklistedOn() != null ? b.blacklistedOn() : LocalDate.MIN,
                    (x, y) -> x.isBefore(y) ? x : y);
        }
        for (Map.Entry<RecordPair, String> entry : sharedAddress.entrySet()) {
            RecordPair pair = entry.getKey();
            Set<String> directors = sharedDirectors.get(pair);
            if (directors == null) {
                continue;
            }
            for (String oldId : List.of(pair.first(), pair.second())) {
                if (!blacklisted.containsKey(oldId)) {
                    continue;
                }
                String newId = pair.other(oldId);
                LocalDate oldRegistered = registeredOn(graph, oldId);
                LocalDate newRegistered = registeredOn(graph, newId);
                if (newRegistered == null || (oldRegistered != null && !newRegistered.isAfter(oldRegistered))) {
                    continue;
                }
                LocalDate blacklistedOn = blacklisted.get(oldId);
                edges.add(new DerivedEdge(EdgeType.RE_REGISTERED_AS, oldId, newId,
                        new EdgeEvidence.ReRegistration(List.copyOf(directors), entry.getValue(),
                                LocalDate.MIN.equals(blacklistedOn) ? null : blacklistedOn, newRegistered)));
            }
        }
        return edges;
    }

    private Map<RecordPair, String> sharedAddresses(ResolvedGraph graph) {
        Map<String, TreeSet<String>> byAddress = new TreeMap<>();
        for (ContractorProfile profile : graph.getFacts().getContractorProfiles()) {
            String address = canonicalizer.canonicalizeAddress(profile.address());
            if (!address.isEmpty()) {
                byAddress.computeIfAbsent(address, k -> new TreeSet<>()).add(profile.contractorId());
            }
        }
        Map<RecordPair, String> pairs = new TreeMap<>();
        byAddress.forEach((address, ids) -> forEachPair(ids, pair -> pairs.putIfAbsent(pair, address)));
        return pairs;
    }

    private Map<RecordPair, Set<String>> sharedDirectors(ResolvedGraph graph) {
        List<Ownership> ownerships = graph.getFacts().getOwnerships();

        // a name-only owner takes the person id carried under the same name, unless several ids share it
        Map<String, Set<String>> idsByName = new TreeMap<>();
        for (Ownership ownership : ownerships) {
            String name = canonicalizer.canonicalize(ownership.personName(), EntityKind.PERSON);
            if (ownership.personId() != null && !name.isEmpty()) {
                idsByName.computeIfAbsent(name, k -> new TreeSet<>()).add(ownership.personId());
            }
        }

        // person identity -> contractors, and identity -> label used in evidence
        Map<String, TreeSet<String>> contractorsByPerson = new TreeMap<>();
        Map<String, String> labels = new TreeMap<>();
        for (Ownership ownership : ownerships) {
            String name = canonicalizer.canonicalize(ownership.personName(), EntityKind.PERSON);
            String personId = ownership.personId();
            if (personId == null) {
                Set<String> ids = idsByName.getOrDefault(name, Set.of());
                personId = ids.size() == 1 ? ids.iterator().next() : null;
            }
            if (name.isEmpty() && personId == null) {
                continue;
            }
            String identity = personId != null ? "id:" + personId : "name:" + name;
            contractorsByPerson.computeIfAbsent(identity, k -> new TreeSet<>()).add(ownership.contractorId());
            if (!name.isEmpty()) {
                labels.putIfAbsent(identity, name);
            }
        }
        Map<RecordPair, Set<String>> pairs = new TreeMap<>();
        contractorsByPerson.forEach((identity, ids) -> forEachPair(ids,
                pair -> pairs.computeIfAbsent(pair, k -> new TreeSet<>())
                        .add(labels.getOrDefault(identity, identity.substring(3)))));
        return pairs;
    }

    private static LocalDate registeredOn(ResolvedGraph graph, String contractorId) {
        Optional<ContractorProfile> profile = graph.getFacts().contractorProfile(contractorId);
        return profile.map(ContractorProfile::registeredOn).orElse(null);
    }

    private static void forEachPair(TreeSet<String> ids, Consumer<RecordPair> action) {
        List<String> ordered = new ArrayList<>(ids);
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                action.accept(RecordPair.of(ordered.get(i), ordered.get(j)));
            }
        }
    }
}
