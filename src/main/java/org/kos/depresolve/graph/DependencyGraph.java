package org.kos.depresolve.graph;

import org.kos.depresolve.model.DependencyEdge;
import org.kos.depresolve.model.PackageIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Graph representation of package dependencies.
 * Nodes are keyed by package name; an edge {@code source -> target} means the
 * source requires the target, so the target is installed first.
 *
 * Parallel edges between the same pair are kept as recorded (each may carry its
 * own constraint) but count once for ordering, degree and cycle purposes.
 * Created fresh per resolution; not thread-safe.
 */
public class DependencyGraph {
    private static final Logger logger = LoggerFactory.getLogger(DependencyGraph.class);

    private final Map<String, PackageIdentity> nodes;
    private final Map<String, List<DependencyEdge>> outgoing;
    private final Map<String, List<DependencyEdge>> incoming;
    private final Set<String> unresolved;

    public DependencyGraph() {
        this.nodes = new LinkedHashMap<>();
        this.outgoing = new HashMap<>();
        this.incoming = new HashMap<>();
        this.unresolved = new LinkedHashSet<>();
    }

    /**
     * Add a package node, or fill in the version of an existing one.
     * A version that is already known is never replaced.
     *
     * @param name package name
     * @param version package version (can be null)
     * @return the node for this name
     */
    public PackageIdentity addNode(String name, String version) {
        PackageIdentity node = nodes.get(name);
        if (node == null) {
            node = new PackageIdentity(name, version);
            nodes.put(name, node);
            outgoing.put(name, new ArrayList<>());
            incoming.put(name, new ArrayList<>());
        } else if (node.fillVersion(version)) {
            logger.debug("Recorded version {} for {}", version, name);
        }
        return node;
    }

    public PackageIdentity addNode(String name) {
        return addNode(name, null);
    }

    /**
     * Add a dependency edge, creating either endpoint if needed.
     *
     * @param sourceName the requiring package
     * @param targetName the required package
     * @param constraint version requirement on the target (can be null)
     * @param optional whether the dependency may be dropped
     * @return the recorded edge
     */
    public DependencyEdge addEdge(String sourceName, String targetName, String constraint, boolean optional) {
        PackageIdentity source = addNode(sourceName);
        PackageIdentity target = addNode(targetName);

        DependencyEdge edge = new DependencyEdge(source, target, constraint, optional);
        outgoing.get(sourceName).add(edge);
        incoming.get(targetName).add(edge);
        return edge;
    }

    /**
     * Remove every edge from source to target.
     *
     * @return the removed edges
     */
    public List<DependencyEdge> removeEdges(String sourceName, String targetName) {
        List<DependencyEdge> removed = new ArrayList<>();
        List<DependencyEdge> out = outgoing.get(sourceName);
        if (out == null) {
            return removed;
        }
        Iterator<DependencyEdge> it = out.iterator();
        while (it.hasNext()) {
            DependencyEdge edge = it.next();
            if (edge.getTarget().getName().equals(targetName)) {
                it.remove();
                removed.add(edge);
            }
        }
        List<DependencyEdge> in = incoming.get(targetName);
        if (in != null) {
            in.removeAll(removed);
        }
        return removed;
    }

    public PackageIdentity getNode(String name) {
        return nodes.get(name);
    }

    public boolean containsNode(String name) {
        return nodes.containsKey(name);
    }

    /**
     * Node names in insertion order.
     */
    public List<String> getNodeNames() {
        return new ArrayList<>(nodes.keySet());
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        int count = 0;
        for (List<DependencyEdge> edges : outgoing.values()) {
            count += edges.size();
        }
        return count;
    }

    /**
     * Edges leaving a node, in the order they were added.
     */
    public List<DependencyEdge> getOutgoing(String name) {
        List<DependencyEdge> edges = outgoing.get(name);
        return edges != null ? Collections.unmodifiableList(edges) : Collections.emptyList();
    }

    /**
     * Edges entering a node, in the order they were added.
     */
    public List<DependencyEdge> getIncoming(String name) {
        List<DependencyEdge> edges = incoming.get(name);
        return edges != null ? Collections.unmodifiableList(edges) : Collections.emptyList();
    }

    /**
     * Number of distinct packages this node depends on.
     */
    public int outDegree(String name) {
        return successors(name).size();
    }

    /**
     * Mark a package whose metadata could not be found.
     */
    public void markUnresolved(String name) {
        unresolved.add(name);
    }

    public boolean isUnresolved(String name) {
        return unresolved.contains(name);
    }

    /**
     * Packages whose metadata could not be found, in discovery order.
     */
    public Set<String> getUnresolved() {
        return Collections.unmodifiableSet(unresolved);
    }

    /**
     * Compute an installation order where every dependency precedes its dependents.
     * When several packages are ready at once, the smallest name goes first.
     *
     * @return every node exactly once, or empty if the graph has a cycle
     */
    public Optional<List<String>> topologicalOrder() {
        Map<String, Integer> remaining = new HashMap<>();
        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.naturalOrder());
        for (String name : nodes.keySet()) {
            int degree = outDegree(name);
            remaining.put(name, degree);
            if (degree == 0) {
                ready.add(name);
            }
        }

        List<String> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String name = ready.poll();
            order.add(name);
            for (String dependent : predecessors(name)) {
                int left = remaining.merge(dependent, -1, Integer::sum);
                if (left == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != nodes.size()) {
            return Optional.empty();
        }
        return Optional.of(order);
    }

    /**
     * Enumerate the simple cycles of the graph.
     *
     * @return each cycle as node names in edge order, starting at the earliest-added node
     */
    public List<List<String>> detectCycles() {
        Map<String, Set<String>> adjacency = new HashMap<>();
        for (String name : nodes.keySet()) {
            adjacency.put(name, successors(name));
        }
        return new CycleDetector(getNodeNames(), adjacency).findCycles();
    }

    /**
     * Detect cycles and break each by removing its first optional hop.
     *
     * @return the removed edges
     */
    public List<DependencyEdge> breakCycles() {
        return breakCycles(detectCycles());
    }

    /**
     * Break the given cycles. For each cycle, the first hop in cycle order whose
     * edges are all optional is removed. A cycle that already lost a hop to an
     * earlier removal is skipped, and a cycle with no optional hop stays unbroken.
     *
     * @param cycles cycles as returned by {@link #detectCycles()}
     * @return the removed edges
     */
    public List<DependencyEdge> breakCycles(List<List<String>> cycles) {
        List<DependencyEdge> removed = new ArrayList<>();
        for (List<String> cycle : cycles) {
            if (!isIntact(cycle)) {
                continue;
            }
            boolean broken = false;
            for (int i = 0; i < cycle.size() && !broken; i++) {
                String source = cycle.get(i);
                String target = cycle.get((i + 1) % cycle.size());
                if (isOptionalHop(source, target)) {
                    removed.addAll(removeEdges(source, target));
                    logger.info("Breaking cycle by removing optional dependency: {} -> {}", source, target);
                    broken = true;
                }
            }
            if (!broken) {
                logger.warn("Cycle has no optional dependency and stays unbroken: {}", cycle);
            }
        }
        return removed;
    }

    /**
     * Order the graph for installation, breaking cycles where possible.
     *
     * Tries a topological order first. On failure, detects cycles, removes one
     * optional edge per cycle and tries again. If cycles remain, falls back to
     * ordering nodes by out-degree (fewest dependencies first, ties in insertion
     * order) and flags the result as degraded. Never throws for cyclic graphs.
     *
     * @param breakCycles whether optional edges may be removed
     * @return the ordering outcome
     */
    public OrderingResult resolveOrdering(boolean breakCycles) {
        Optional<List<String>> order = topologicalOrder();
        if (order.isPresent()) {
            return new OrderingResult(order.get(), false, Collections.emptyList(), Collections.emptyList());
        }

        List<List<String>> cycles = detectCycles();
        logger.warn("Circular dependencies detected: {}", cycles);

        List<DependencyEdge> removed = breakCycles ? breakCycles(cycles) : Collections.emptyList();
        order = topologicalOrder();
        if (order.isPresent()) {
            return new OrderingResult(order.get(), false, cycles, removed);
        }

        List<String> fallback = bestEffortOrder();
        logger.warn("No valid installation order exists, using degraded order by dependency count: {}", fallback);
        return new OrderingResult(fallback, true, cycles, removed);
    }

    public OrderingResult resolveOrdering() {
        return resolveOrdering(true);
    }

    /**
     * All nodes sorted by out-degree ascending, ties kept in insertion order.
     */
    public List<String> bestEffortOrder() {
        List<String> names = getNodeNames();
        Map<String, Integer> degrees = new HashMap<>();
        for (String name : names) {
            degrees.put(name, outDegree(name));
        }
        names.sort(Comparator.comparingInt(degrees::get));
        return names;
    }

    private boolean isIntact(List<String> cycle) {
        for (int i = 0; i < cycle.size(); i++) {
            String source = cycle.get(i);
            String target = cycle.get((i + 1) % cycle.size());
            if (!successors(source).contains(target)) {
                return false;
            }
        }
        return true;
    }

    // A hop is breakable only if every parallel edge on it is optional
    private boolean isOptionalHop(String source, String target) {
        boolean any = false;
        for (DependencyEdge edge : getOutgoing(source)) {
            if (edge.getTarget().getName().equals(target)) {
                if (!edge.isOptional()) {
                    return false;
                }
                any = true;
            }
        }
        return any;
    }

    private Set<String> successors(String name) {
        Set<String> result = new LinkedHashSet<>();
        for (DependencyEdge edge : getOutgoing(name)) {
            result.add(edge.getTarget().getName());
        }
        return result;
    }

    private Set<String> predecessors(String name) {
        Set<String> result = new LinkedHashSet<>();
        for (DependencyEdge edge : getIncoming(name)) {
            result.add(edge.getSource().getName());
        }
        return result;
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
                "nodeCount=" + nodes.size() +
                ", edgeCount=" + getEdgeCount() +
                ", unresolved=" + unresolved +
                '}';
    }
}
