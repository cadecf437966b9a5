package com.papertrail.core.derive;

import com.papertrail.core.model.DerivedEdge;

import java.util.List;

/**
 * Computes one family of derived edges. Implementations are pure functions
 * of the graph snapshot and must return the same edges for the same input.
 */
public interface EdgeDeriver {

    List<DerivedEdge> derive(ResolvedGraph graph);

    String getName();
}
