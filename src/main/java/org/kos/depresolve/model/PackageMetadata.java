package org.kos.depresolve.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Metadata returned by a metadata provider for one package: its current version
 * and the dependencies it declares.
 */
public class PackageMetadata {
    private final String name;
    private final String version;
    private final List<Dependency> dependencies;
    private final String repository;

    public PackageMetadata(String name, String version, List<Dependency> dependencies) {
        this(name, version, dependencies, null);
    }

    public PackageMetadata(String name, String version, List<Dependency> dependencies, String repository) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.version = version;
        this.dependencies = dependencies != null ? new ArrayList<>(dependencies) : new ArrayList<>();
        this.repository = repository;
    }

    /**
     * Build metadata from raw dependency entries, normalizing each.
     */
    public static PackageMetadata fromSpecs(String name, String version, List<DependencySpec> specs, String repository) {
        List<Dependency> dependencies = new ArrayList<>();
        if (specs != null) {
            for (DependencySpec spec : specs) {
                dependencies.add(spec.normalize());
            }
        }
        return new PackageMetadata(name, version, dependencies, repository);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public List<Dependency> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    /**
     * The repository this metadata came from, null for installed packages.
     */
    public String getRepository() {
        return repository;
    }

    @Override
    public String toString() {
        return name + (version != null ? "-" + version : "") + " " + dependencies;
    }
}
