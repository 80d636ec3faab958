package org.kos.depresolve.api;

import org.kos.depresolve.model.PackageMetadata;

import java.util.Optional;

/**
 * Source of package metadata consulted during resolution
 */
public interface MetadataProvider {

    /**
     * Look up a package by name.
     *
     * @param name the package name
     * @return the package's current version and declared dependencies, or empty if unknown
     */
    Optional<PackageMetadata> lookup(String name);

    /**
     * A provider that knows no packages.
     */
    static MetadataProvider none() {
        return name -> Optional.empty();
    }
}
