package org.kos.depresolve.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents a node in a report's dependency tree
 *
 * Unlike the graph, the tree repeats shared packages under every parent. A
 * package that reappears on its own path is a circular leaf, and a package with
 * no graph entry is a not-found leaf.
 */
public class DependencyTreeNode {
    private final String name;
    private final String version;
    private final List<DependencyTreeNode> dependencies;
    private final boolean circular;
    private final boolean notFound;
    private String requiredVersion;
    private boolean optional;
    private boolean truncated;

    private DependencyTreeNode(String name, String version, boolean circular, boolean notFound) {
        this.name = name;
        this.version = version;
        this.dependencies = new ArrayList<>();
        this.circular = circular;
        this.notFound = notFound;
    }

    public static DependencyTreeNode resolved(String name, String version) {
        return new DependencyTreeNode(name, version, false, false);
    }

    public static DependencyTreeNode circular(String name) {
        return new DependencyTreeNode(name, null, true, false);
    }

    public static DependencyTreeNode notFound(String name) {
        return new DependencyTreeNode(name, null, false, true);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public List<DependencyTreeNode> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    public void addDependency(DependencyTreeNode child) {
        dependencies.add(child);
    }

    public boolean isCircular() {
        return circular;
    }

    public boolean isNotFound() {
        return notFound;
    }

    /**
     * Whether this node is a full entry rather than a circular or not-found leaf.
     */
    public boolean isResolved() {
        return !circular && !notFound;
    }

    public String getRequiredVersion() {
        return requiredVersion;
    }

    public void setRequiredVersion(String requiredVersion) {
        this.requiredVersion = requiredVersion;
    }

    public boolean isOptional() {
        return optional;
    }

    public void setOptional(boolean optional) {
        this.optional = optional;
    }

    /**
     * Whether children were cut off by the tree depth limit.
     */
    public boolean isTruncated() {
        return truncated;
    }

    public void setTruncated(boolean truncated) {
        this.truncated = truncated;
    }

    /**
     * Count the nodes in this subtree, this node included.
     */
    public int size() {
        int count = 1;
        for (DependencyTreeNode child : dependencies) {
            count += child.size();
        }
        return count;
    }

    @Override
    public String toString() {
        return name + (version != null ? "-" + version : "")
                + (circular ? " (circular)" : "")
                + (notFound ? " (not found)" : "");
    }
}
