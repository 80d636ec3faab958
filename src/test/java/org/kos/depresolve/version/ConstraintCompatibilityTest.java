package org.kos.depresolve.version;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ConstraintCompatibility class
 */
public class ConstraintCompatibilityTest {

    @Test
    public void testLowerBoundAboveUpperBound() throws ConstraintParseException {
        assertFalse(ConstraintCompatibility.check(">=2.0.0", "<=1.0.0"));
        assertFalse(ConstraintCompatibility.check("<=1.0.0", ">=2.0.0"));
    }

    @Test
    public void testOverlappingInclusiveBounds() throws ConstraintParseException {
        assertTrue(ConstraintCompatibility.check(">=1.0.0", "<=2.0.0"));
        assertTrue(ConstraintCompatibility.check(">=1.0.0", "<=1.0.0"));
    }

    @Test
    public void testExclusiveBounds() throws ConstraintParseException {
        assertFalse(ConstraintCompatibility.check(">2.0", "<2.0"));
        assertFalse(ConstraintCompatibility.check("<1.0", ">3.0"));
        assertTrue(ConstraintCompatibility.check(">1.0", "<2.0"));
    }

    @Test
    public void testPins() throws ConstraintParseException {
        assertTrue(ConstraintCompatibility.check("==1.0", "==1.0.0"));
        assertFalse(ConstraintCompatibility.check("==1.0", "==2.0"));
        assertFalse(ConstraintCompatibility.check("=1.0", "==2.0"));
    }

    @Test
    public void testPinsWithDifferentPreReleases() throws ConstraintParseException {
        assertFalse(ConstraintCompatibility.check("==1.0.0-beta", "==1.0.0-rc"));
        assertFalse(ConstraintCompatibility.check("==1.0.0-beta", "==1.0.0"));
        assertTrue(ConstraintCompatibility.check("==1.0-beta", "==1.0.0-beta"));
    }

    @Test
    public void testOtherCombinationsAssumedCompatible() throws ConstraintParseException {
        assertTrue(ConstraintCompatibility.check(">1.0", ">2.0"));
        assertTrue(ConstraintCompatibility.check("^1.0", "<=0.5"));
        assertTrue(ConstraintCompatibility.check("1.0", "2.0"));
        assertTrue(ConstraintCompatibility.check("latest", "==1.0"));
        assertTrue(ConstraintCompatibility.check("==3.0", ">=1.0"));
        assertTrue(ConstraintCompatibility.check("1.0 - 2.0", "3.0 - 4.0"));
    }

    @Test
    public void testMalformedRequirementPropagates() {
        assertThrows(ConstraintParseException.class, () -> ConstraintCompatibility.check(">=x", "<=1.0"));
        assertThrows(ConstraintParseException.class, () -> ConstraintCompatibility.check("!=1.0", "==1.0"));
    }
}
