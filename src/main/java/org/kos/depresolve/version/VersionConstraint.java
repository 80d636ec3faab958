package org.kos.depresolve.version;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed version requirement.
 *
 * Supported forms:
 * - {@code latest} matches any version
 * - {@code 1.2.3} exact match
 * - {@code ==1.2.3} or {@code =1.2.3} exact match
 * - {@code >1.2.3}, {@code >=1.2.3}, {@code <1.2.3}, {@code <=1.2.3}
 * - {@code ^1.2.3} compatible release (same as {@code >=1.2.3 <2.0.0})
 * - {@code ~1.2.3} approximately equivalent (same as {@code >=1.2.3 <1.3.0})
 * - {@code 1.2.3 - 2.3.4} inclusive range
 *
 * Requirement versions have one to three numeric components; missing components
 * are zero. Pre-release suffixes are ignored by every numeric comparison.
 * Exact matches ({@code 1.2.3}, {@code =1.2.3}, {@code ==1.2.3}) compare the
 * numeric components and also require the same pre-release suffix.
 */
public final class VersionConstraint {

    public static final String LATEST = "latest";

    private static final String RANGE_SEPARATOR = " - ";

    // Two-character operators first so ">=" is never read as ">"
    private static final Map<String, ConstraintOperator> OPERATOR_PREFIXES = new LinkedHashMap<>();

    static {
        OPERATOR_PREFIXES.put(">=", ConstraintOperator.GREATER_OR_EQUAL);
        OPERATOR_PREFIXES.put("<=", ConstraintOperator.LESS_OR_EQUAL);
        OPERATOR_PREFIXES.put("==", ConstraintOperator.EQUAL);
        OPERATOR_PREFIXES.put(">", ConstraintOperator.GREATER);
        OPERATOR_PREFIXES.put("<", ConstraintOperator.LESS);
        OPERATOR_PREFIXES.put("=", ConstraintOperator.EQUAL);
        OPERATOR_PREFIXES.put("^", ConstraintOperator.CARET);
        OPERATOR_PREFIXES.put("~", ConstraintOperator.TILDE);
    }

    private final String expression;
    private final ConstraintOperator operator;
    private final VersionInfo version;
    private final VersionInfo upperBound;

    private VersionConstraint(String expression, ConstraintOperator operator,
                              VersionInfo version, VersionInfo upperBound) {
        this.expression = expression;
        this.operator = operator;
        this.version = version;
        this.upperBound = upperBound;
    }

    /**
     * Parse a version requirement.
     *
     * @param spec The requirement string
     * @return The parsed constraint
     * @throws ConstraintParseException if the operator, a version component or the range is malformed
     */
    public static VersionConstraint parse(String spec) throws ConstraintParseException {
        if (spec == null || spec.trim().isEmpty()) {
            throw new ConstraintParseException("Empty version requirement", String.valueOf(spec));
        }
        String trimmed = spec.trim();

        if (LATEST.equals(trimmed)) {
            return new VersionConstraint(trimmed, ConstraintOperator.LATEST, null, null);
        }

        if (trimmed.contains(RANGE_SEPARATOR)) {
            String[] parts = trimmed.split(RANGE_SEPARATOR, -1);
            if (parts.length != 2) {
                throw new ConstraintParseException("Invalid version range format", spec);
            }
            VersionInfo lower = VersionParser.parseRequirementVersion(parts[0]);
            VersionInfo upper = VersionParser.parseRequirementVersion(parts[1]);
            return new VersionConstraint(trimmed, ConstraintOperator.RANGE, lower, upper);
        }

        for (Map.Entry<String, ConstraintOperator> prefix : OPERATOR_PREFIXES.entrySet()) {
            if (trimmed.startsWith(prefix.getKey())) {
                String versionPart = trimmed.substring(prefix.getKey().length()).trim();
                VersionInfo parsed = VersionParser.parseRequirementVersion(versionPart);
                return new VersionConstraint(trimmed, prefix.getValue(), parsed, null);
            }
        }

        // No operator, so it should be a bare version
        VersionInfo parsed = VersionParser.parseRequirementVersion(trimmed);
        return new VersionConstraint(trimmed, ConstraintOperator.EXACT, parsed, null);
    }

    /**
     * Lenient variant of {@link #parse(String)}.
     *
     * @param spec The requirement string
     * @return The constraint, or empty if it does not parse
     */
    public static Optional<VersionConstraint> tryParse(String spec) {
        try {
            return Optional.of(parse(spec));
        } catch (ConstraintParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Check a requirement string against a concrete version.
     *
     * @param constraint The requirement string
     * @param concreteVersion The version to test
     * @return true if the version satisfies the requirement
     * @throws ConstraintParseException if the requirement is malformed
     */
    public static boolean isSatisfiedBy(String constraint, String concreteVersion) throws ConstraintParseException {
        return parse(constraint).isSatisfiedBy(concreteVersion);
    }

    /**
     * Check whether a concrete version satisfies this requirement.
     *
     * A concrete version that is not a dotted numeric version only satisfies
     * {@code latest} or an exact requirement with identical text.
     *
     * @param concreteVersion The version to test
     * @return true if the version satisfies this requirement
     */
    public boolean isSatisfiedBy(String concreteVersion) {
        if (operator == ConstraintOperator.LATEST) {
            return true;
        }
        if (concreteVersion == null) {
            return false;
        }
        if (isExactMatch() && version.getOriginalString().equals(concreteVersion.trim())) {
            return true;
        }
        Optional<VersionInfo> parsed = VersionParser.tryParse(concreteVersion);
        return parsed.isPresent() && isSatisfiedBy(parsed.get());
    }

    /**
     * Check whether a parsed version satisfies this requirement.
     *
     * @param actual The version to test
     * @return true if the version satisfies this requirement
     */
    public boolean isSatisfiedBy(VersionInfo actual) {
        switch (operator) {
            case LATEST:
                return true;
            case EXACT:
            case EQUAL:
                return actual.numericallyEquals(version)
                        && Objects.equals(actual.getPreRelease(), version.getPreRelease());
            case RANGE:
                return version.compareTo(actual) <= 0 && actual.compareTo(upperBound) <= 0;
            case CARET:
                return satisfiesCaret(actual);
            case TILDE:
                return actual.compareTo(version) >= 0
                        && actual.getMajor() == version.getMajor()
                        && actual.getMinor() == version.getMinor();
            case GREATER_OR_EQUAL:
                return actual.compareTo(version) >= 0;
            case LESS_OR_EQUAL:
                return actual.compareTo(version) <= 0;
            case GREATER:
                return actual.compareTo(version) > 0;
            case LESS:
                return actual.compareTo(version) < 0;
            default:
                throw new IllegalStateException("Unhandled operator " + operator);
        }
    }

    private boolean satisfiesCaret(VersionInfo actual) {
        if (version.getMajor() > 0) {
            // ^1.2.3 means >=1.2.3 <2.0.0
            return actual.compareTo(version) >= 0 && actual.getMajor() == version.getMajor();
        }
        if (version.getMinor() > 0) {
            // ^0.2.3 means >=0.2.3 <0.3.0
            return actual.compareTo(version) >= 0
                    && actual.getMajor() == 0
                    && actual.getMinor() == version.getMinor();
        }
        // ^0.0.3 means exactly 0.0.3
        return actual.numericallyEquals(version);
    }

    private boolean isExactMatch() {
        return operator == ConstraintOperator.EXACT || operator == ConstraintOperator.EQUAL;
    }

    public String getExpression() {
        return expression;
    }

    public ConstraintOperator getOperator() {
        return operator;
    }

    /**
     * The requirement's version, or the lower bound of a range. Null for {@code latest}.
     */
    public VersionInfo getVersion() {
        return version;
    }

    /**
     * The inclusive upper bound of a range. Null for every other operator.
     */
    public VersionInfo getUpperBound() {
        return upperBound;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionConstraint that = (VersionConstraint) o;
        return expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
