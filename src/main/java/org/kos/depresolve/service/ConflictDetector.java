package org.kos.depresolve.service;

import org.kos.depresolve.graph.DependencyGraph;
import org.kos.depresolve.model.ConflictDetail;
import org.kos.depresolve.model.DependencyEdge;
import org.kos.depresolve.model.VersionConflict;
import org.kos.depresolve.version.ConstraintCompatibility;
import org.kos.depresolve.version.ConstraintParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds packages whose requirers ask for incompatible versions
 *
 * Every pair of constrained incoming edges is compared with
 * {@link ConstraintCompatibility}. A constraint that fails to parse cannot be
 * verified and is treated as compatible.
 */
public class ConflictDetector {
    private static final Logger logger = LoggerFactory.getLogger(ConflictDetector.class);

    /**
     * Check every node of the graph for conflicting incoming constraints.
     *
     * @param graph the dependency graph
     * @return one entry per conflicting package, in graph order
     */
    public List<VersionConflict> checkVersionConflicts(DependencyGraph graph) {
        List<VersionConflict> conflicts = new ArrayList<>();

        for (String name : graph.getNodeNames()) {
            List<DependencyEdge> requirements = new ArrayList<>();
            for (DependencyEdge edge : graph.getIncoming(name)) {
                if (edge.hasConstraint()) {
                    requirements.add(edge);
                }
            }
            if (requirements.size() <= 1) {
                continue;
            }

            List<ConflictDetail> firstSides = new ArrayList<>();
            List<ConflictDetail> secondSides = new ArrayList<>();
            for (int i = 0; i < requirements.size(); i++) {
                for (int j = i + 1; j < requirements.size(); j++) {
                    DependencyEdge first = requirements.get(i);
                    DependencyEdge second = requirements.get(j);
                    if (isCompatible(first.getConstraint(), second.getConstraint())) {
                        continue;
                    }
                    String description = "Incompatible requirements: "
                            + first.getConstraint() + " vs " + second.getConstraint();
                    firstSides.add(new ConflictDetail(first.getSource().getName(), first.getConstraint(), description));
                    secondSides.add(new ConflictDetail(second.getSource().getName(), second.getConstraint(), description));
                }
            }

            if (!firstSides.isEmpty()) {
                List<ConflictDetail> details = new ArrayList<>(firstSides);
                details.addAll(secondSides);
                conflicts.add(new VersionConflict(name, details));
            }
        }

        return conflicts;
    }

    /**
     * Compare two constraints, coercing parse failures to "compatible".
     */
    boolean isCompatible(String first, String second) {
        try {
            return ConstraintCompatibility.check(first, second);
        } catch (ConstraintParseException e) {
            logger.debug("Cannot compare {} with {}, assuming compatible: {}", first, second, e.getMessage());
            return true;
        }
    }

    /**
     * Log each conflict at WARN.
     */
    public static void logConflicts(List<VersionConflict> conflicts) {
        for (VersionConflict conflict : conflicts) {
            logger.warn("Version conflicts for {}:", conflict.getPackageName());
            for (ConflictDetail detail : conflict.getConflicts()) {
                logger.warn("  Required by {} with {}: {}", detail.getRequiringPackage(),
                        detail.getRequiredVersion(), detail.getDescription());
            }
        }
    }
}
