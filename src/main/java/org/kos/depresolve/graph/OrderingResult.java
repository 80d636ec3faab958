package org.kos.depresolve.graph;

import org.kos.depresolve.model.DependencyEdge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An installation order and how it was obtained
 *
 * A degraded order is the out-degree fallback used when cycles remained after
 * optional edges were removed. It lists every node once but is not a valid
 * topological order.
 */
public class OrderingResult {
    private final List<String> order;
    private final boolean degraded;
    private final List<List<String>> cycles;
    private final List<DependencyEdge> removedEdges;

    public OrderingResult(List<String> order, boolean degraded,
                          List<List<String>> cycles, List<DependencyEdge> removedEdges) {
        this.order = new ArrayList<>(order);
        this.degraded = degraded;
        this.cycles = new ArrayList<>(cycles);
        this.removedEdges = new ArrayList<>(removedEdges);
    }

    public List<String> getOrder() {
        return Collections.unmodifiableList(order);
    }

    public boolean isDegraded() {
        return degraded;
    }

    /**
     * Cycles found before any edge was removed.
     */
    public List<List<String>> getCycles() {
        return Collections.unmodifiableList(cycles);
    }

    /**
     * Optional edges removed to break cycles.
     */
    public List<DependencyEdge> getRemovedEdges() {
        return Collections.unmodifiableList(removedEdges);
    }
}
