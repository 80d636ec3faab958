package org.kos.depresolve.version;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parser for dotted numeric package versions.
 *
 * Format: {@code <n>[.<n>...][-<pre-release>]}
 * Examples: {@code 1}, {@code 1.2}, {@code 1.2.3}, {@code 1.0.0-beta1}
 *
 * Everything after the first hyphen is the pre-release suffix and never takes
 * part in numeric comparison.
 */
public class VersionParser {

    /**
     * Versions used inside a requirement are limited to major.minor.patch.
     */
    public static final int MAX_REQUIREMENT_COMPONENTS = 3;

    private static final Pattern NUMERIC = Pattern.compile("[0-9]+");

    private VersionParser() {
    }

    /**
     * Parse a concrete version string, any number of numeric components.
     *
     * @param version The version string to parse
     * @return VersionInfo padded to at least three components
     * @throws ConstraintParseException if the string is empty or a component is not numeric
     */
    public static VersionInfo parse(String version) throws ConstraintParseException {
        return parse(version, Integer.MAX_VALUE);
    }

    /**
     * Parse the version part of a requirement such as {@code >=1.2.3}.
     *
     * @param version The version string to parse
     * @return VersionInfo padded to three components
     * @throws ConstraintParseException if there are more than three components or one is not numeric
     */
    public static VersionInfo parseRequirementVersion(String version) throws ConstraintParseException {
        return parse(version, MAX_REQUIREMENT_COMPONENTS);
    }

    /**
     * Lenient variant of {@link #parse(String)}.
     *
     * @param version The version string to parse
     * @return The parsed version, or empty if it is not a dotted numeric version
     */
    public static Optional<VersionInfo> tryParse(String version) {
        try {
            return Optional.of(parse(version));
        } catch (ConstraintParseException e) {
            return Optional.empty();
        }
    }

    private static VersionInfo parse(String version, int maxComponents) throws ConstraintParseException {
        if (version == null || version.trim().isEmpty()) {
            throw new ConstraintParseException("Empty version", String.valueOf(version));
        }
        String trimmed = version.trim();

        String base = trimmed;
        String preRelease = null;
        int hyphen = trimmed.indexOf('-');
        if (hyphen >= 0) {
            base = trimmed.substring(0, hyphen);
            preRelease = trimmed.substring(hyphen + 1);
        }

        String[] parts = base.split("\\.", -1);
        if (parts.length < 1 || parts.length > maxComponents) {
            throw new ConstraintParseException("Invalid version format", version);
        }

        int[] components = new int[Math.max(parts.length, 3)];
        for (int i = 0; i < parts.length; i++) {
            if (!NUMERIC.matcher(parts[i]).matches()) {
                throw new ConstraintParseException("Invalid version number", version);
            }
            try {
                components[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new ConstraintParseException("Version component out of range", version, e);
            }
        }

        return new VersionInfo(components, preRelease, trimmed);
    }
}
