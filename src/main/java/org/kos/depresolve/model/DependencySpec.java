package org.kos.depresolve.model;

import java.util.Objects;

/**
 * A dependency as it appears in package metadata: either just a package name or
 * a structured entry. Both normalize to a {@link Dependency} before they reach
 * graph construction.
 */
public abstract class DependencySpec {

    private DependencySpec() {
    }

    public static DependencySpec named(String name) {
        return new Named(name);
    }

    public static DependencySpec structured(Dependency dependency) {
        return new Structured(dependency);
    }

    /**
     * @return the canonical dependency for this entry
     */
    public abstract Dependency normalize();

    /**
     * A dependency given by name only, with no version requirement.
     */
    public static final class Named extends DependencySpec {
        private final String name;

        private Named(String name) {
            this.name = Objects.requireNonNull(name, "name cannot be null");
        }

        public String getName() {
            return name;
        }

        @Override
        public Dependency normalize() {
            return new Dependency(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A dependency given as a full entry.
     */
    public static final class Structured extends DependencySpec {
        private final Dependency dependency;

        private Structured(Dependency dependency) {
            this.dependency = Objects.requireNonNull(dependency, "dependency cannot be null");
        }

        public Dependency getDependency() {
            return dependency;
        }

        @Override
        public Dependency normalize() {
            return dependency;
        }

        @Override
        public String toString() {
            return dependency.toString();
        }
    }
}
