package org.kos.depresolve.service;

import org.kos.depresolve.api.CachingMetadataProvider;
import org.kos.depresolve.api.MetadataProvider;
import org.kos.depresolve.constants.MetadataSource;
import org.kos.depresolve.graph.DependencyGraph;
import org.kos.depresolve.graph.OrderingResult;
import org.kos.depresolve.model.Dependency;
import org.kos.depresolve.model.DependencyTreeNode;
import org.kos.depresolve.model.PackageMetadata;
import org.kos.depresolve.model.ResolutionReport;
import org.kos.depresolve.model.ResolutionResult;
import org.kos.depresolve.model.VersionConflict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves package dependencies and detects conflicts
 *
 * Algorithm:
 * 1. Expand each requested package depth-first, looking metadata up in the live
 *    repositories first and in the installed packages second
 * 2. Record one edge per declared dependency; a package's own dependencies are
 *    expanded only the first time it is reached
 * 3. Check incoming constraints for conflicts, then order the graph, breaking
 *    cycles through optional dependencies where possible
 *
 * Packages that cannot be found, branches deeper than the configured limit and
 * unbreakable cycles are logged and reported, never thrown.
 */
public class DependencyResolver {
    private static final Logger logger = LoggerFactory.getLogger(DependencyResolver.class);

    private final MetadataProvider liveProvider;
    private final MetadataProvider installedProvider;
    private final ResolverConfig config;
    private final ConflictDetector conflictDetector;
    private final DependencyTreeBuilder treeBuilder;

    /**
     * One package being expanded, with its remaining declared dependencies.
     */
    private static final class Frame {
        final String name;
        final int depth;
        final Iterator<Dependency> dependencies;

        Frame(String name, int depth, Iterator<Dependency> dependencies) {
            this.name = name;
            this.depth = depth;
            this.dependencies = dependencies;
        }
    }

    public DependencyResolver(MetadataProvider liveProvider, MetadataProvider installedProvider) {
        this(liveProvider, installedProvider, ResolverConfig.load());
    }

    public DependencyResolver(MetadataProvider liveProvider, MetadataProvider installedProvider, ResolverConfig config) {
        Objects.requireNonNull(liveProvider, "liveProvider cannot be null");
        Objects.requireNonNull(installedProvider, "installedProvider cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        if (config.isCacheMetadata()) {
            this.liveProvider = new CachingMetadataProvider(liveProvider);
            this.installedProvider = new CachingMetadataProvider(installedProvider);
        } else {
            this.liveProvider = liveProvider;
            this.installedProvider = installedProvider;
        }
        this.conflictDetector = new ConflictDetector();
        this.treeBuilder = new DependencyTreeBuilder();
        logger.debug("Resolver created with {}", config);
    }

    public ResolverConfig getConfig() {
        return config;
    }

    public DependencyTreeBuilder getTreeBuilder() {
        return treeBuilder;
    }

    /**
     * Build a dependency graph for the given packages
     *
     * @param requested package names to resolve dependencies for
     * @param includeInstalled whether installed packages are consulted when repositories lack a package
     * @return the graph, with packages that could not be found marked unresolved
     */
    public DependencyGraph buildDependencyGraph(List<String> requested, boolean includeInstalled) {
        DependencyGraph graph = new DependencyGraph();
        Set<String> visited = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (String name : requested) {
            if (name == null || name.trim().isEmpty()) {
                continue;
            }
            push(stack, enter(name.trim(), 0, graph, visited, includeInstalled));

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (!frame.dependencies.hasNext()) {
                    stack.pop();
                    continue;
                }
                Dependency dep = frame.dependencies.next();
                if (!dep.hasName()) {
                    continue;
                }
                graph.addEdge(frame.name, dep.getName(), dep.getEffectiveConstraint(), dep.isOptional());
                push(stack, enter(dep.getName(), frame.depth + 1, graph, visited, includeInstalled));
            }
        }

        logger.info("Built dependency graph for {}: {} packages, {} dependencies, {} not found",
                requested, graph.getNodeCount(), graph.getEdgeCount(), graph.getUnresolved().size());
        return graph;
    }

    private static void push(Deque<Frame> stack, Frame frame) {
        if (frame != null) {
            stack.push(frame);
        }
    }

    private Frame enter(String name, int depth, DependencyGraph graph, Set<String> visited, boolean includeInstalled) {
        if (depth > config.getMaxDepth()) {
            logger.warn("Max dependency depth reached for {}, stopping recursion", name);
            return null;
        }
        if (!visited.add(name)) {
            return null;
        }

        Optional<PackageMetadata> metadata = lookup(name, includeInstalled);
        if (!metadata.isPresent()) {
            logger.warn("Package {} not found in repositories or installed packages", name);
            graph.markUnresolved(name);
            return null;
        }

        PackageMetadata pkg = metadata.get();
        graph.addNode(name, pkg.getVersion());
        logger.debug("Processing dependencies for {} at depth {}", name, depth);
        return new Frame(name, depth, pkg.getDependencies().iterator());
    }

    private Optional<PackageMetadata> lookup(String name, boolean includeInstalled) {
        Optional<PackageMetadata> found = lookup(liveProvider, MetadataSource.LIVE, name);
        if (!found.isPresent() && includeInstalled) {
            found = lookup(installedProvider, MetadataSource.INSTALLED, name);
        }
        return found;
    }

    private Optional<PackageMetadata> lookup(MetadataProvider provider, MetadataSource source, String name) {
        try {
            Optional<PackageMetadata> found = provider.lookup(name);
            if (found == null) {
                return Optional.empty();
            }
            if (found.isPresent()) {
                logger.debug("Found {} in {} packages", name, source);
            }
            return found;
        } catch (RuntimeException e) {
            logger.warn("Error looking up {} in {} packages: {}", name, source, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Resolve dependencies using the configured installed-package setting
     */
    public ResolutionResult resolve(List<String> requested) {
        return resolve(requested, config.isIncludeInstalled());
    }

    /**
     * Resolve dependencies for the given packages
     *
     * @param requested package names to resolve
     * @param includeInstalled whether installed packages are consulted when repositories lack a package
     * @return installation order, missing packages, conflicts and cycle information
     */
    public ResolutionResult resolve(List<String> requested, boolean includeInstalled) {
        DependencyGraph graph = buildDependencyGraph(requested, includeInstalled);
        return resolve(requested, graph);
    }

    /**
     * Check conflicts on a built graph and order it. Cycle breaking may remove
     * optional edges from the graph.
     */
    ResolutionResult resolve(List<String> requested, DependencyGraph graph) {
        List<VersionConflict> conflicts = conflictDetector.checkVersionConflicts(graph);
        ConflictDetector.logConflicts(conflicts);

        OrderingResult ordering = graph.resolveOrdering(config.isBreakCycles());
        List<String> order = ordering.getOrder();

        Set<String> missing = new LinkedHashSet<>();
        for (String name : order) {
            if (graph.isUnresolved(name)) {
                missing.add(name);
            }
        }
        for (String name : requested) {
            if (name != null && graph.isUnresolved(name.trim())) {
                missing.add(name.trim());
            }
        }
        if (!missing.isEmpty()) {
            logger.warn("Missing packages: {}", missing);
        }

        return new ResolutionResult(order, new ArrayList<>(missing), conflicts, ordering.getCycles(),
                ordering.isDegraded());
    }

    /**
     * Generate a report using the configured installed-package setting
     */
    public ResolutionReport generateReport(List<String> requested) {
        return generateReport(requested, config.isIncludeInstalled());
    }

    /**
     * Generate a detailed dependency report for the given packages
     *
     * @param requested package names to analyze
     * @param includeInstalled whether installed packages are consulted when repositories lack a package
     * @return order, missing packages, conflicts and a dependency tree per requested package
     */
    public ResolutionReport generateReport(List<String> requested, boolean includeInstalled) {
        List<String> names = normalizeRequested(requested);
        DependencyGraph graph = buildDependencyGraph(names, includeInstalled);
        // Trees are built before ordering so they show edges that cycle breaking removes
        Map<String, DependencyTreeNode> trees = treeBuilder.buildDependencyTrees(names, graph);
        ResolutionResult result = resolve(names, graph);
        return new ResolutionReport(names, result, trees);
    }

    /**
     * Trim requested names, dropping null, blank and repeated entries.
     */
    static List<String> normalizeRequested(List<String> requested) {
        Set<String> names = new LinkedHashSet<>();
        for (String name : requested) {
            if (name != null && !name.trim().isEmpty()) {
                names.add(name.trim());
            }
        }
        return new ArrayList<>(names);
    }
}
