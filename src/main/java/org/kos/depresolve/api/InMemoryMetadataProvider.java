package org.kos.depresolve.api;

import org.kos.depresolve.model.PackageMetadata;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Map-backed metadata provider, used for the installed-package database
 */
public class InMemoryMetadataProvider implements MetadataProvider {
    private final Map<String, PackageMetadata> packages;

    public InMemoryMetadataProvider() {
        this.packages = new LinkedHashMap<>();
    }

    public InMemoryMetadataProvider(Collection<PackageMetadata> packages) {
        this();
        for (PackageMetadata pkg : packages) {
            register(pkg);
        }
    }

    /**
     * Add or replace a package.
     *
     * @param metadata the package metadata
     * @return this provider
     */
    public InMemoryMetadataProvider register(PackageMetadata metadata) {
        packages.put(metadata.getName(), metadata);
        return this;
    }

    public boolean remove(String name) {
        return packages.remove(name) != null;
    }

    public boolean contains(String name) {
        return packages.containsKey(name);
    }

    public Set<String> getPackageNames() {
        return Collections.unmodifiableSet(packages.keySet());
    }

    @Override
    public Optional<PackageMetadata> lookup(String name) {
        return Optional.ofNullable(packages.get(name));
    }
}
