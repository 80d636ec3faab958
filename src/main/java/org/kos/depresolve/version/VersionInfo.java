package org.kos.depresolve.version;

import java.util.Arrays;

/**
 * Parsed version information.
 *
 * Holds the numeric release components of a dotted version (always padded to at
 * least three: major, minor, patch), the optional pre-release suffix that followed
 * the first {@code -}, and the original string as provided.
 *
 * Ordering and {@link #numericallyEquals(VersionInfo)} consider the numeric
 * components only; the pre-release suffix is carried for exact-match checks.
 */
public class VersionInfo implements Comparable<VersionInfo> {
    private final int[] components;
    private final String preRelease;
    private final String originalString;

    /**
     * Create a new VersionInfo.
     *
     * @param components Numeric release components, at least three
     * @param preRelease Pre-release suffix without the leading hyphen (can be null)
     * @param originalString The original version string
     */
    public VersionInfo(int[] components, String preRelease, String originalString) {
        if (components.length < 3) {
            components = Arrays.copyOf(components, 3);
        }
        this.components = components.clone();
        this.preRelease = preRelease;
        this.originalString = originalString;
    }

    public int getMajor() {
        return components[0];
    }

    public int getMinor() {
        return components[1];
    }

    public int getPatch() {
        return components[2];
    }

    /**
     * Get a copy of all numeric components (at least three).
     *
     * @return The release components
     */
    public int[] getComponents() {
        return components.clone();
    }

    /**
     * Get the pre-release suffix.
     *
     * @return The suffix after the first hyphen, or null if there is none
     */
    public String getPreRelease() {
        return preRelease;
    }

    public boolean hasPreRelease() {
        return preRelease != null;
    }

    /**
     * Get the original version string as provided.
     *
     * @return The original version string
     */
    public String getOriginalString() {
        return originalString;
    }

    /**
     * Compare numeric components only, missing trailing components count as zero.
     */
    public boolean numericallyEquals(VersionInfo other) {
        return compareTo(other) == 0;
    }

    /**
     * Orders by numeric components only. The pre-release suffix is ignored, so
     * this ordering is inconsistent with equals; do not use VersionInfo as a key
     * in sorted sets or maps.
     */
    @Override
    public int compareTo(VersionInfo other) {
        int length = Math.max(components.length, other.components.length);
        for (int i = 0; i < length; i++) {
            int left = i < components.length ? components[i] : 0;
            int right = i < other.components.length ? other.components[i] : 0;
            if (left != right) {
                return Integer.compare(left, right);
            }
        }
        return 0;
    }

    @Override
    public String toString() {
        return "VersionInfo{" +
                "components=" + Arrays.toString(components) +
                ", preRelease='" + preRelease + '\'' +
                ", originalString='" + originalString + '\'' +
                '}';
    }
}
