package org.kos.depresolve.version;

import java.util.Objects;

/**
 * Conservative pairwise compatibility check between two version requirements.
 *
 * Only the unambiguous cases are reported as incompatible:
 * - {@code >=X} with {@code <=Y} where X is above Y
 * - {@code >X} with {@code <Y} where the open ranges cannot overlap (X at or above Y)
 * - {@code ==X} with {@code ==Y} where the pins differ, pre-release suffix included
 *
 * Any other combination, including bare versions, carets, tildes, ranges and
 * {@code latest}, is reported as compatible.
 */
public final class ConstraintCompatibility {

    private ConstraintCompatibility() {
    }

    /**
     * Check two requirement strings.
     *
     * @param first First requirement
     * @param second Second requirement
     * @return false only if the two requirements provably cannot both hold
     * @throws ConstraintParseException if either requirement is malformed
     */
    public static boolean check(String first, String second) throws ConstraintParseException {
        return check(VersionConstraint.parse(first), VersionConstraint.parse(second));
    }

    /**
     * Check two parsed requirements.
     *
     * @param first First requirement
     * @param second Second requirement
     * @return false only if the two requirements provably cannot both hold
     */
    public static boolean check(VersionConstraint first, VersionConstraint second) {
        ConstraintOperator op1 = first.getOperator();
        ConstraintOperator op2 = second.getOperator();
        if (!op1.isComparison() || !op2.isComparison()) {
            return true;
        }

        VersionInfo v1 = first.getVersion();
        VersionInfo v2 = second.getVersion();

        if (op1 == ConstraintOperator.EQUAL && op2 == ConstraintOperator.EQUAL) {
            return v1.numericallyEquals(v2)
                    && Objects.equals(v1.getPreRelease(), v2.getPreRelease());
        }
        if (op1 == ConstraintOperator.GREATER_OR_EQUAL && op2 == ConstraintOperator.LESS_OR_EQUAL) {
            return v1.compareTo(v2) <= 0;
        }
        if (op1 == ConstraintOperator.LESS_OR_EQUAL && op2 == ConstraintOperator.GREATER_OR_EQUAL) {
            return v1.compareTo(v2) >= 0;
        }
        if (op1 == ConstraintOperator.GREATER && op2 == ConstraintOperator.LESS) {
            return v1.compareTo(v2) < 0;
        }
        if (op1 == ConstraintOperator.LESS && op2 == ConstraintOperator.GREATER) {
            return v1.compareTo(v2) > 0;
        }
        return true;
    }
}
