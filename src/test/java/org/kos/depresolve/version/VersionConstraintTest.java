package org.kos.depresolve.version;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the VersionConstraint class
 */
public class VersionConstraintTest {

    private static boolean satisfied(String constraint, String version) throws ConstraintParseException {
        return VersionConstraint.isSatisfiedBy(constraint, version);
    }

    @Test
    public void testLatestMatchesAnything() throws ConstraintParseException {
        assertTrue(satisfied("latest", "1.0.0"));
        assertTrue(satisfied("latest", "0.0.1-alpha"));
        assertTrue(satisfied("latest", "not-a-version"));
        assertEquals(ConstraintOperator.LATEST, VersionConstraint.parse("latest").getOperator());
    }

    @Test
    public void testCaret() throws ConstraintParseException {
        assertTrue(satisfied("^1.2.3", "1.9.9"));
        assertTrue(satisfied("^1.2.3", "1.2.3"));
        assertFalse(satisfied("^1.2.3", "2.0.0"));
        assertFalse(satisfied("^1.2.3", "1.2.2"));
    }

    @Test
    public void testCaretWithZeroMajor() throws ConstraintParseException {
        assertTrue(satisfied("^0.2.3", "0.2.9"));
        assertFalse(satisfied("^0.2.3", "0.3.0"));
        assertFalse(satisfied("^0.2.3", "0.2.2"));
    }

    @Test
    public void testCaretWithZeroMajorAndMinor() throws ConstraintParseException {
        assertTrue(satisfied("^0.0.3", "0.0.3"));
        assertFalse(satisfied("^0.0.3", "0.0.4"));
    }

    @Test
    public void testTilde() throws ConstraintParseException {
        assertTrue(satisfied("~1.2.3", "1.2.9"));
        assertTrue(satisfied("~1.2.3", "1.2.3"));
        assertFalse(satisfied("~1.2.3", "1.3.0"));
        assertFalse(satisfied("~1.2.3", "1.2.2"));
    }

    @Test
    public void testComparisonOperators() throws ConstraintParseException {
        assertTrue(satisfied(">=1.0.0", "1.0.0"));
        assertFalse(satisfied(">=1.0.0", "0.9.9"));
        assertTrue(satisfied(">1", "1.0.1"));
        assertFalse(satisfied(">1", "1.0.0"));
        assertTrue(satisfied("<2", "1.9.9"));
        assertFalse(satisfied("<2", "2.0"));
        assertTrue(satisfied("<=1.2", "1.2.0"));
        assertFalse(satisfied("<=1.2", "1.2.1"));
    }

    @Test
    public void testOperatorMayBeFollowedBySpace() throws ConstraintParseException {
        VersionConstraint constraint = VersionConstraint.parse(">= 1.4");

        assertEquals(ConstraintOperator.GREATER_OR_EQUAL, constraint.getOperator());
        assertTrue(constraint.isSatisfiedBy("1.5.0"));
    }

    @Test
    public void testRangeIsInclusive() throws ConstraintParseException {
        assertTrue(satisfied("1.0.0 - 2.0.0", "1.5.0"));
        assertTrue(satisfied("1.0.0 - 2.0.0", "1.0.0"));
        assertTrue(satisfied("1.0.0 - 2.0.0", "2.0.0"));
        assertFalse(satisfied("1.0.0 - 2.0.0", "2.0.1"));
        assertFalse(satisfied("1.0.0 - 2.0.0", "0.9.0"));
    }

    @Test
    public void testRangeIgnoresPreRelease() throws ConstraintParseException {
        assertTrue(satisfied("1.0 - 2.0", "2.0.0-rc1"));

        VersionConstraint range = VersionConstraint.parse("1.0 - 2");
        assertEquals(ConstraintOperator.RANGE, range.getOperator());
        assertEquals(2, range.getUpperBound().getMajor());
    }

    @Test
    public void testExactMatchIsNumeric() throws ConstraintParseException {
        assertTrue(satisfied("1.0.0", "1.0.0"));
        assertTrue(satisfied("1.0", "1.0.0"));
        assertFalse(satisfied("1.0.0", "1.0.1"));
        assertTrue(satisfied("=1.2.3", "1.2.3"));
        assertTrue(satisfied("==1.2", "1.2.0"));
        assertFalse(satisfied("==1.2", "1.3.0"));
    }

    @Test
    public void testExactMatchRequiresSamePreRelease() throws ConstraintParseException {
        assertFalse(satisfied("1.0.0-beta", "1.0.0"));
        assertTrue(satisfied("1.0.0-beta", "1.0.0-beta"));
        assertFalse(satisfied("=1.0.0", "1.0.0-beta"));
    }

    @Test
    public void testUnparseableConcreteVersion() throws ConstraintParseException {
        assertFalse(satisfied(">=1.0", "abc"));
        assertFalse(satisfied("^1.0", null));
    }

    @Test
    public void testMalformedRequirementsRejected() {
        assertThrows(ConstraintParseException.class, () -> VersionConstraint.parse(""));
        assertThrows(ConstraintParseException.class, () -> VersionConstraint.parse(null));
        assertThrows(ConstraintParseException.class, () -> VersionConstraint.parse(">="));
        assertThrows(ConstraintParseException.class, () -> VersionConstraint.parse(">=abc"));
        assertThrows(ConstraintParseException.class, () -> VersionConstraint.parse("!=1.0"));
        assertThrows(ConstraintParseException.class, () -> VersionConstraint.parse("1.2.3.4"));
        assertThrows(ConstraintParseException.class, () -> VersionConstraint.parse("1.0 - 2.0 - 3.0"));
        assertThrows(ConstraintParseException.class, () -> VersionConstraint.parse("1.0 - x"));
    }

    @Test
    public void testTryParse() {
        assertTrue(VersionConstraint.tryParse("~2.1").isPresent());
        assertFalse(VersionConstraint.tryParse("~two").isPresent());
    }

    @Test
    public void testExpressionIsTrimmed() throws ConstraintParseException {
        VersionConstraint constraint = VersionConstraint.parse("  ^1.2.0 ");

        assertEquals("^1.2.0", constraint.getExpression());
        assertEquals(ConstraintOperator.CARET, constraint.getOperator());
        assertEquals(VersionConstraint.parse("^1.2.0"), constraint);
    }
}
