package org.kos.depresolve.model;

import java.util.Objects;

/**
 * One side of a version conflict: who requires the package and with what constraint.
 */
public class ConflictDetail {
    private final String requiringPackage;
    private final String requiredVersion;
    private final String description;

    public ConflictDetail(String requiringPackage, String requiredVersion, String description) {
        this.requiringPackage = requiringPackage;
        this.requiredVersion = requiredVersion;
        this.description = description;
    }

    public String getRequiringPackage() {
        return requiringPackage;
    }

    public String getRequiredVersion() {
        return requiredVersion;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConflictDetail that = (ConflictDetail) o;
        return Objects.equals(requiringPackage, that.requiringPackage) &&
                Objects.equals(requiredVersion, that.requiredVersion) &&
                Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requiringPackage, requiredVersion, description);
    }

    @Override
    public String toString() {
        return requiringPackage + " requires " + requiredVersion + ": " + description;
    }
}
