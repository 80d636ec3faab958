package org.kos.depresolve.model;

import org.kos.depresolve.constants.RepositoryPriority;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named package repository index
 */
public class Repository {
    private final String name;
    private final RepositoryPriority priority;
    private final Map<String, PackageMetadata> packages;
    private boolean enabled;

    public Repository(String name) {
        this(name, RepositoryPriority.NORMAL);
    }

    public Repository(String name, RepositoryPriority priority) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.priority = priority != null ? priority : RepositoryPriority.NORMAL;
        this.packages = new LinkedHashMap<>();
        this.enabled = true;
    }

    public String getName() {
        return name;
    }

    public RepositoryPriority getPriority() {
        return priority;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Add or replace a package in this repository.
     */
    public void addPackage(PackageMetadata metadata) {
        packages.put(metadata.getName(), metadata);
    }

    public void addPackages(Collection<PackageMetadata> metadata) {
        for (PackageMetadata pkg : metadata) {
            addPackage(pkg);
        }
    }

    public PackageMetadata getPackage(String packageName) {
        return packages.get(packageName);
    }

    public List<PackageMetadata> getPackages() {
        return Collections.unmodifiableList(new ArrayList<>(packages.values()));
    }

    public int size() {
        return packages.size();
    }

    @Override
    public String toString() {
        return "Repository{" +
                "name='" + name + '\'' +
                ", priority=" + priority +
                ", enabled=" + enabled +
                ", packages=" + packages.size() +
                '}';
    }
}
