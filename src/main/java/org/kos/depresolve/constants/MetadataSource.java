package org.kos.depresolve.constants;

/**
 * Where package metadata was found during resolution.
 */
public enum MetadataSource {
    LIVE("repository"),
    INSTALLED("installed");

    private final String value;

    MetadataSource(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
