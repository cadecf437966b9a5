package com.papertrail.core.derive;

import com.papertrail.core.facts.ProcurementFacts;
import com.papertrail.core.model.CanonicalEntity;
import com.papertrail.core.model.EntityKind;
import com.papertrail.core.resolution.ResolutionResult;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only snapshot of the resolved entities and the transactional history
 * keyed by canonical ids. Derivers and detectors only ever read it.
 */
public final class ResolvedGraph {

    private final Map<String, CanonicalEntity> entities;
    private final ProcurementFacts facts;

    public ResolvedGraph(Collection<CanonicalEntity> entities, ProcurementFacts facts) {
        Map<String, CanonicalEntity> byId = new LinkedHashMap<>();
        entities.stream()
                .sorted(Comparator.comparing(CanonicalEntity::getId))
                .forEach(e -> byId.put(e.getId(), e));
        this.entities = Collections.unmodifiableMap(byId);
        this.facts = facts;
    }

    /**
     * Snapshot of a resolution pass, with raw references in {@code rawFacts}
     * rewritten to canonical ids.
     */
    public static ResolvedGraph of(ResolutionResult result, ProcurementFacts rawFacts) {
        return new ResolvedGraph(result.entities(), rawFacts.remap(result::canonicalId));
    }

    public Collection<CanonicalEntity> getEntities() {
        return entities.values();
    }

    public Optional<CanonicalEntity> entity(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    public List<CanonicalEntity> entitiesOfKind(EntityKind kind) {
        return entities.values().stream().filter(e -> e.getKind() == kind).toList();
    }

    /**
     * Display name of an entity, or the id itself when the reference never resolved.
     */
    public String displayName(String id) {
        CanonicalEntity entity = entities.get(id);
        return entity != null ? entity.getDisplayName() : id;
    }

    public ProcurementFacts getFacts() {
        return facts;
    }
}
