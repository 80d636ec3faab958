package org.kos.depresolve.version;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the VersionParser class
 */
public class VersionParserTest {

    @Test
    public void testParseFullVersion() throws ConstraintParseException {
        VersionInfo info = VersionParser.parse("1.2.3");

        assertEquals(1, info.getMajor());
        assertEquals(2, info.getMinor());
        assertEquals(3, info.getPatch());
        assertFalse(info.hasPreRelease());
        assertEquals("1.2.3", info.getOriginalString());
    }

    @Test
    public void testParsePadsMissingComponents() throws ConstraintParseException {
        VersionInfo info = VersionParser.parse("4");

        assertEquals(4, info.getMajor());
        assertEquals(0, info.getMinor());
        assertEquals(0, info.getPatch());
        assertArrayEquals(new int[]{4, 0, 0}, info.getComponents());
    }

    @Test
    public void testParsePreRelease() throws ConstraintParseException {
        VersionInfo info = VersionParser.parse("1.0.0-beta1");

        assertTrue(info.hasPreRelease());
        assertEquals("beta1", info.getPreRelease());
        assertEquals(1, info.getMajor());
    }

    @Test
    public void testPreReleaseKeepsLaterHyphens() throws ConstraintParseException {
        VersionInfo info = VersionParser.parse("2.1-rc-2");

        assertEquals("rc-2", info.getPreRelease());
        assertEquals(1, info.getMinor());
    }

    @Test
    public void testConcreteVersionMayHaveMoreComponents() throws ConstraintParseException {
        VersionInfo info = VersionParser.parse("1.2.3.4");

        assertArrayEquals(new int[]{1, 2, 3, 4}, info.getComponents());
        assertTrue(info.compareTo(VersionParser.parse("1.2.3")) > 0);
    }

    @Test
    public void testRequirementVersionLimitedToThreeComponents() {
        assertThrows(ConstraintParseException.class, () -> VersionParser.parseRequirementVersion("1.2.3.4"));
    }

    @Test
    public void testNonNumericComponentRejected() {
        ConstraintParseException e = assertThrows(ConstraintParseException.class,
                () -> VersionParser.parse("1.x"));
        assertEquals("1.x", e.getInput());
    }

    @Test
    public void testEmptyVersionRejected() {
        assertThrows(ConstraintParseException.class, () -> VersionParser.parse(""));
        assertThrows(ConstraintParseException.class, () -> VersionParser.parse(null));
        assertThrows(ConstraintParseException.class, () -> VersionParser.parse("1..2"));
    }

    @Test
    public void testTryParse() {
        assertTrue(VersionParser.tryParse("3.1").isPresent());
        assertFalse(VersionParser.tryParse("not-a-version").isPresent());
    }

    @Test
    public void testNumericComparisonIgnoresPaddingAndPreRelease() throws ConstraintParseException {
        assertTrue(VersionParser.parse("1.0").numericallyEquals(VersionParser.parse("1.0.0")));
        assertTrue(VersionParser.parse("1.0.0-beta").numericallyEquals(VersionParser.parse("1.0.0")));
        assertTrue(VersionParser.parse("1.10.0").compareTo(VersionParser.parse("1.9.9")) > 0);
        assertTrue(VersionParser.parse("0.9.9").compareTo(VersionParser.parse("1.0.0")) < 0);
    }

    @Test
    public void testOrderingIgnoresPreReleaseSuffix() throws ConstraintParseException {
        VersionInfo beta = VersionParser.parse("2.0.0-beta");
        VersionInfo rc = VersionParser.parse("2.0.0-rc");

        assertEquals(0, beta.compareTo(rc));
        assertNotEquals(beta.getPreRelease(), rc.getPreRelease());
    }
}
