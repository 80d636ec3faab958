package org.kos.depresolve.model;

import java.util.Objects;

/**
 * Represents a dependency relationship: {@code source} requires {@code target}
 */
public class DependencyEdge {
    private final PackageIdentity source;
    private final PackageIdentity target;
    private final String constraint;
    private final boolean optional;

    public DependencyEdge(PackageIdentity source, PackageIdentity target, String constraint, boolean optional) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.constraint = constraint;
        this.optional = optional;
    }

    public PackageIdentity getSource() {
        return source;
    }

    public PackageIdentity getTarget() {
        return target;
    }

    /**
     * Version requirement placed on the target, null if unconstrained.
     */
    public String getConstraint() {
        return constraint;
    }

    public boolean hasConstraint() {
        return constraint != null && !constraint.trim().isEmpty();
    }

    public boolean isOptional() {
        return optional;
    }

    @Override
    public String toString() {
        return source.getName() + " -> " + target.getName()
                + (hasConstraint() ? " " + constraint : "")
                + (optional ? " (optional)" : "");
    }
}
