package org.kos.depresolve.model;

import org.kos.depresolve.version.ConstraintParseException;
import org.kos.depresolve.version.VersionConstraint;

import java.util.Objects;

/**
 * A dependency declared by a package.
 *
 * {@code versionReq} is a version requirement such as {@code ^1.2.0}; it is
 * validated on construction. {@code version} is a bare minimum version used when
 * no requirement is given. Either may be null.
 */
public class Dependency {
    private final String name;
    private final String versionReq;
    private final String version;
    private final boolean optional;

    public Dependency(String name) {
        this(name, null, null, false);
    }

    public Dependency(String name, String versionReq) {
        this(name, versionReq, null, false);
    }

    /**
     * @throws IllegalArgumentException if {@code versionReq} is not a valid version requirement
     */
    public Dependency(String name, String versionReq, String version, boolean optional) {
        this.name = name != null ? name.trim() : "";
        this.versionReq = normalize(versionReq);
        this.version = normalize(version);
        this.optional = optional;

        if (this.versionReq != null) {
            try {
                VersionConstraint.parse(this.versionReq);
            } catch (ConstraintParseException e) {
                throw new IllegalArgumentException("Invalid version requirement for " + this.name
                        + ": " + e.getMessage(), e);
            }
        }
    }

    public String getName() {
        return name;
    }

    public String getVersionReq() {
        return versionReq;
    }

    public String getVersion() {
        return version;
    }

    public boolean isOptional() {
        return optional;
    }

    /**
     * A dependency with a blank name is ignored by graph construction.
     */
    public boolean hasName() {
        return !name.isEmpty();
    }

    /**
     * The constraint recorded on the graph edge: the requirement if present,
     * otherwise {@code >=version} if a bare version is present, otherwise null.
     */
    public String getEffectiveConstraint() {
        if (versionReq != null) {
            return versionReq;
        }
        if (version != null) {
            return ">=" + version;
        }
        return null;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Dependency that = (Dependency) o;
        return optional == that.optional &&
                name.equals(that.name) &&
                Objects.equals(versionReq, that.versionReq) &&
                Objects.equals(version, that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, versionReq, version, optional);
    }

    @Override
    public String toString() {
        String constraint = getEffectiveConstraint();
        return name + (constraint != null ? " " + constraint : "") + (optional ? " (optional)" : "");
    }
}
