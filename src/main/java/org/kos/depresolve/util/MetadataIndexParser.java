package org.kos.depresolve.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.kos.depresolve.constants.RepositoryPriority;
import org.kos.depresolve.model.Dependency;
import org.kos.depresolve.model.DependencySpec;
import org.kos.depresolve.model.PackageMetadata;
import org.kos.depresolve.model.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses JSON repository indexes into package metadata.
 *
 * Accepted shapes:
 * <pre>
 * { "repository": "main", "priority": "high", "packages": [ ... ] }
 * [ ... ]
 * </pre>
 * Each package is {@code {"name", "version", "dependencies": [...]}}, and each
 * dependency is either a bare name string or an object with {@code name} and
 * optional {@code version_req}, {@code version} and {@code optional}.
 *
 * Packages or dependencies that are malformed are skipped with a warning; an
 * index whose overall shape is wrong is rejected.
 */
public class MetadataIndexParser {
    private static final Logger logger = LoggerFactory.getLogger(MetadataIndexParser.class);

    public static final String DEFAULT_REPOSITORY = "default";

    /**
     * Parse an index from a string.
     *
     * @param json the index content
     * @return the repository with its packages
     * @throws MetadataParseException if the content is not a valid index
     */
    public Repository parseRepository(String json) {
        try {
            return parseRepository(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            throw new MetadataParseException("Invalid repository index JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Parse an index from a reader. The reader is not closed.
     *
     * @param reader the index content
     * @return the repository with its packages
     * @throws MetadataParseException if the content is not a valid index
     */
    public Repository parseRepository(Reader reader) {
        try {
            return parseRepository(JsonParser.parseReader(reader));
        } catch (JsonParseException e) {
            throw new MetadataParseException("Invalid repository index JSON: " + e.getMessage(), e);
        }
    }

    private Repository parseRepository(JsonElement root) {
        if (root.isJsonArray()) {
            Repository repository = new Repository(DEFAULT_REPOSITORY);
            repository.addPackages(parsePackages(root.getAsJsonArray(), repository.getName()));
            return repository;
        }
        if (!root.isJsonObject()) {
            throw new MetadataParseException("Repository index must be a JSON object or array");
        }

        JsonObject index = root.getAsJsonObject();
        String name = getString(index, "repository");
        if (name == null) {
            name = DEFAULT_REPOSITORY;
        }

        RepositoryPriority priority = RepositoryPriority.NORMAL;
        String priorityValue = getString(index, "priority");
        if (priorityValue != null) {
            RepositoryPriority parsed = RepositoryPriority.fromString(priorityValue);
            if (parsed != null) {
                priority = parsed;
            } else {
                logger.warn("Unknown priority '{}' for repository {}, using {}", priorityValue, name, priority);
            }
        }

        Repository repository = new Repository(name, priority);
        JsonElement enabled = index.get("enabled");
        if (enabled != null && enabled.isJsonPrimitive() && enabled.getAsJsonPrimitive().isBoolean()) {
            repository.setEnabled(enabled.getAsBoolean());
        }

        JsonElement packages = index.get("packages");
        if (packages == null || packages.isJsonNull()) {
            logger.warn("Repository index {} has no packages", name);
            return repository;
        }
        if (!packages.isJsonArray()) {
            throw new MetadataParseException("'packages' must be an array in repository " + name);
        }
        repository.addPackages(parsePackages(packages.getAsJsonArray(), name));
        logger.info("Parsed {} packages from repository index {}", repository.size(), name);
        return repository;
    }

    /**
     * Parse an array of package entries.
     *
     * @param packages the JSON array
     * @param repositoryName recorded on each package (can be null)
     * @return the packages that parsed
     */
    public List<PackageMetadata> parsePackages(JsonArray packages, String repositoryName) {
        List<PackageMetadata> result = new ArrayList<>();
        int position = 0;
        for (JsonElement element : packages) {
            position++;
            if (!element.isJsonObject()) {
                logger.warn("Skipping package entry {} in {}: not an object", position, repositoryName);
                continue;
            }
            JsonObject pkg = element.getAsJsonObject();
            String name = getString(pkg, "name");
            if (name == null || name.trim().isEmpty()) {
                logger.warn("Skipping package entry {} in {}: missing name", position, repositoryName);
                continue;
            }
            String version = getString(pkg, "version");

            List<DependencySpec> specs = new ArrayList<>();
            JsonElement deps = pkg.get("dependencies");
            if (deps != null && deps.isJsonArray()) {
                for (JsonElement dep : deps.getAsJsonArray()) {
                    DependencySpec spec = parseDependency(dep, name);
                    if (spec != null) {
                        specs.add(spec);
                    }
                }
            } else if (deps != null && !deps.isJsonNull()) {
                logger.warn("Ignoring non-array dependencies of {}", name);
            }

            result.add(PackageMetadata.fromSpecs(name.trim(), version, specs, repositoryName));
        }
        return result;
    }

    /**
     * Parse one dependency entry.
     *
     * @param element a string or an object
     * @param owner the declaring package, for log messages
     * @return the entry, or null if it is malformed
     */
    public DependencySpec parseDependency(JsonElement element, String owner) {
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
            String name = element.getAsString().trim();
            if (name.isEmpty()) {
                logger.warn("Skipping blank dependency of {}", owner);
                return null;
            }
            return DependencySpec.named(name);
        }

        if (element.isJsonObject()) {
            JsonObject obj = element.getAsJsonObject();
            String name = getString(obj, "name");
            if (name == null || name.trim().isEmpty()) {
                logger.warn("Skipping dependency of {} without a name", owner);
                return null;
            }
            boolean optional = false;
            JsonElement optionalElement = obj.get("optional");
            if (optionalElement != null && optionalElement.isJsonPrimitive()
                    && optionalElement.getAsJsonPrimitive().isBoolean()) {
                optional = optionalElement.getAsBoolean();
            }
            try {
                return DependencySpec.structured(new Dependency(name,
                        getString(obj, "version_req"), getString(obj, "version"), optional));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping dependency {} of {}: {}", name, owner, e.getMessage());
                return null;
            }
        }

        logger.warn("Skipping unrecognized dependency entry of {}: {}", owner, element);
        return null;
    }

    private static String getString(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || element.isJsonNull() || !element.isJsonPrimitive()) {
            return null;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        return primitive.getAsString();
    }
}
