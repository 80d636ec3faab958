package org.kos.depresolve.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of resolving a set of requested packages
 *
 * When {@code degraded} is true the installation order is a best-effort
 * ordering by out-degree and does not respect the dependencies inside the
 * remaining cycles.
 */
public class ResolutionResult {
    private final List<String> installationOrder;
    private final List<String> missing;
    private final List<VersionConflict> conflicts;
    private final List<List<String>> cycles;
    private final boolean degraded;

    public ResolutionResult(List<String> installationOrder, List<String> missing,
                            List<VersionConflict> conflicts, List<List<String>> cycles,
                            boolean degraded) {
        this.installationOrder = new ArrayList<>(installationOrder);
        this.missing = new ArrayList<>(missing);
        this.conflicts = new ArrayList<>(conflicts);
        this.cycles = new ArrayList<>(cycles);
        this.degraded = degraded;
    }

    public List<String> getInstallationOrder() {
        return Collections.unmodifiableList(installationOrder);
    }

    public List<String> getMissing() {
        return Collections.unmodifiableList(missing);
    }

    public List<VersionConflict> getConflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    /**
     * Circular dependencies detected while ordering, empty if the graph was acyclic.
     */
    public List<List<String>> getCycles() {
        return Collections.unmodifiableList(cycles);
    }

    public boolean isDegraded() {
        return degraded;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
