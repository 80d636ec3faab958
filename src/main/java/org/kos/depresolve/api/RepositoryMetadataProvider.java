package org.kos.depresolve.api;

import org.kos.depresolve.model.PackageMetadata;
import org.kos.depresolve.model.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Looks packages up across configured repositories
 *
 * Repositories are searched by priority (registration order within the same
 * priority) and the first enabled repository that has the package wins.
 */
public class RepositoryMetadataProvider implements MetadataProvider {
    private static final Logger logger = LoggerFactory.getLogger(RepositoryMetadataProvider.class);

    private final List<Repository> repositories;

    public RepositoryMetadataProvider() {
        this.repositories = new ArrayList<>();
    }

    public RepositoryMetadataProvider(List<Repository> repositories) {
        this();
        for (Repository repository : repositories) {
            addRepository(repository);
        }
    }

    public void addRepository(Repository repository) {
        repositories.add(repository);
        // List.sort is stable, equal priorities keep registration order
        repositories.sort(Comparator.comparingInt(r -> r.getPriority().getRank()));
        logger.debug("Added repository {} with {} packages", repository.getName(), repository.size());
    }

    /**
     * Repositories in search order.
     */
    public List<Repository> getRepositories() {
        return Collections.unmodifiableList(repositories);
    }

    @Override
    public Optional<PackageMetadata> lookup(String name) {
        for (Repository repository : repositories) {
            if (!repository.isEnabled()) {
                continue;
            }
            PackageMetadata metadata = repository.getPackage(name);
            if (metadata != null) {
                logger.debug("Found {} in repository {}", name, repository.getName());
                return Optional.of(metadata);
            }
        }
        return Optional.empty();
    }
}
