package org.kos.depresolve.model;

import java.util.Objects;

/**
 * Represents a package node in a dependency graph
 *
 * The name is the identity. The version may be unknown when the node is first
 * created through an edge and is filled in once, when metadata for the package
 * is found; a known version is never overwritten.
 */
public class PackageIdentity {
    private final String name;
    private String version;

    public PackageIdentity(String name) {
        this(name, null);
    }

    public PackageIdentity(String name, String version) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.version = isBlank(version) ? null : version;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public boolean hasVersion() {
        return version != null;
    }

    /**
     * Record a version if none is known yet.
     *
     * @param newVersion the resolved version
     * @return true if the version was recorded
     */
    public boolean fillVersion(String newVersion) {
        if (version != null || isBlank(newVersion)) {
            return false;
        }
        version = newVersion;
        return true;
    }

    public String getFullName() {
        return version != null ? name + "-" + version : name;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageIdentity that = (PackageIdentity) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return getFullName();
    }
}
