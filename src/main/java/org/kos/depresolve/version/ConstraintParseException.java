package org.kos.depresolve.version;

/**
 * Thrown when a version or version-requirement string is syntactically invalid.
 */
public class ConstraintParseException extends Exception {

    private final String input;

    public ConstraintParseException(String message, String input) {
        super(message + ": '" + input + "'");
        this.input = input;
    }

    public ConstraintParseException(String message, String input, Throwable cause) {
        super(message + ": '" + input + "'", cause);
        this.input = input;
    }

    /**
     * The string that failed to parse.
     */
    public String getInput() {
        return input;
    }
}
