package org.kos.depresolve.service;

import org.kos.depresolve.graph.DependencyGraph;
import org.kos.depresolve.model.DependencyEdge;
import org.kos.depresolve.model.DependencyTreeNode;
import org.kos.depresolve.model.PackageIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Service to build dependency trees from a resolved dependency graph
 *
 * Each requested package is walked depth-first along its outgoing edges. The
 * visited set is per path, so a shared package is expanded under every parent,
 * and only a package that reappears on its own path becomes a circular leaf.
 */
public class DependencyTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(DependencyTreeBuilder.class);

    public static final int DEFAULT_MAX_DEPTH = 25;

    private int maxDepth = DEFAULT_MAX_DEPTH; // Default max depth to bound tree size

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Build a tree for each requested package
     *
     * @param requested the requested package names
     * @param graph the dependency graph
     * @return tree per requested name, in request order
     */
    public Map<String, DependencyTreeNode> buildDependencyTrees(List<String> requested, DependencyGraph graph) {
        Map<String, DependencyTreeNode> trees = new LinkedHashMap<>();
        for (String name : requested) {
            trees.put(name, buildTree(name, graph, new HashSet<>(), 0));
        }
        return trees;
    }

    /**
     * Build the tree for a single package
     *
     * @param name the package name
     * @param graph the dependency graph
     * @return the root of the tree
     */
    public DependencyTreeNode buildDependencyTree(String name, DependencyGraph graph) {
        return buildTree(name, graph, new HashSet<>(), 0);
    }

    private DependencyTreeNode buildTree(String name, DependencyGraph graph, Set<String> path, int depth) {
        if (path.contains(name)) {
            return DependencyTreeNode.circular(name);
        }

        PackageIdentity node = graph.getNode(name);
        if (node == null) {
            return DependencyTreeNode.notFound(name);
        }

        DependencyTreeNode result = DependencyTreeNode.resolved(name, node.getVersion());
        List<DependencyEdge> edges = graph.getOutgoing(name);
        if (edges.isEmpty()) {
            return result;
        }
        if (depth >= maxDepth) {
            logger.warn("Max tree depth reached for {}", name);
            result.setTruncated(true);
            return result;
        }

        path.add(name);
        for (DependencyEdge edge : edges) {
            DependencyTreeNode child = buildTree(edge.getTarget().getName(), graph, new HashSet<>(path), depth + 1);
            if (edge.hasConstraint()) {
                child.setRequiredVersion(edge.getConstraint());
            }
            if (edge.isOptional()) {
                child.setOptional(true);
            }
            result.addDependency(child);
        }
        return result;
    }
}
