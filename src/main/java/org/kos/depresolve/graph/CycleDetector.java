package org.kos.depresolve.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates the simple cycles of a directed graph using Johnson's blocking
 * search.
 *
 * Each cycle is reported once, starting at its node that comes first in the
 * given node order and following edge direction, so {@code [a, b, c]} stands for
 * {@code a -> b -> c -> a}. A self-loop is the one-element cycle {@code [a]}.
 */
class CycleDetector {
    private final List<String> nodes;
    private final Map<String, ? extends Set<String>> adjacency;
    private final Map<String, Integer> index;

    private final Set<String> blocked = new HashSet<>();
    private final Map<String, Set<String>> blockedBy = new HashMap<>();
    private final List<String> path = new ArrayList<>();
    private final List<List<String>> cycles = new ArrayList<>();

    /**
     * @param nodes node names in a stable order
     * @param adjacency distinct successors per node
     */
    CycleDetector(List<String> nodes, Map<String, ? extends Set<String>> adjacency) {
        this.nodes = nodes;
        this.adjacency = adjacency;
        this.index = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i), i);
        }
    }

    List<List<String>> findCycles() {
        cycles.clear();
        for (int s = 0; s < nodes.size(); s++) {
            blocked.clear();
            blockedBy.clear();
            path.clear();
            circuit(nodes.get(s), s);
        }
        return new ArrayList<>(cycles);
    }

    private boolean circuit(String v, int start) {
        boolean found = false;
        path.add(v);
        blocked.add(v);

        for (String w : successors(v, start)) {
            if (index.get(w) == start) {
                cycles.add(new ArrayList<>(path));
                found = true;
            } else if (!blocked.contains(w) && circuit(w, start)) {
                found = true;
            }
        }

        if (found) {
            unblock(v);
        } else {
            for (String w : successors(v, start)) {
                blockedBy.computeIfAbsent(w, k -> new HashSet<>()).add(v);
            }
        }

        path.remove(path.size() - 1);
        return found;
    }

    private void unblock(String u) {
        blocked.remove(u);
        Set<String> waiting = blockedBy.remove(u);
        if (waiting == null) {
            return;
        }
        for (String w : waiting) {
            if (blocked.contains(w)) {
                unblock(w);
            }
        }
    }

    // Successors restricted to the subgraph of nodes at or after the start index
    private List<String> successors(String v, int start) {
        List<String> result = new ArrayList<>();
        Set<String> targets = adjacency.get(v);
        if (targets == null) {
            return result;
        }
        for (String w : targets) {
            Integer i = index.get(w);
            if (i != null && i >= start) {
                result.add(w);
            }
        }
        return result;
    }
}
