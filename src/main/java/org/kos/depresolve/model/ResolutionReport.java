package org.kos.depresolve.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full dependency report for a set of requested packages
 */
public class ResolutionReport {
    private final List<String> requested;
    private final ResolutionResult result;
    private final Map<String, DependencyTreeNode> dependencyTree;

    public ResolutionReport(List<String> requested, ResolutionResult result,
                            Map<String, DependencyTreeNode> dependencyTree) {
        this.requested = new ArrayList<>(requested);
        this.result = result;
        this.dependencyTree = new LinkedHashMap<>(dependencyTree);
    }

    public List<String> getRequested() {
        return Collections.unmodifiableList(requested);
    }

    public List<String> getInstallationOrder() {
        return result.getInstallationOrder();
    }

    public List<String> getMissing() {
        return result.getMissing();
    }

    public List<VersionConflict> getVersionConflicts() {
        return result.getConflicts();
    }

    public List<List<String>> getCycles() {
        return result.getCycles();
    }

    public boolean isOrderingDegraded() {
        return result.isDegraded();
    }

    /**
     * Tree per requested package, keyed by requested name in request order.
     */
    public Map<String, DependencyTreeNode> getDependencyTree() {
        return Collections.unmodifiableMap(dependencyTree);
    }

    public int getTotalDependencies() {
        return result.getInstallationOrder().size();
    }

    public ResolutionResult getResult() {
        return result;
    }
}
