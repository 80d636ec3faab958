package org.kos.depresolve.version;

/**
 * Kinds of version requirement.
 */
public enum ConstraintOperator {
    LATEST("latest"),
    EXACT(""),
    EQUAL("=="),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    LESS("<"),
    CARET("^"),
    TILDE("~"),
    RANGE(" - ");

    private final String symbol;

    ConstraintOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Whether this operator bounds or pins a version the way the conflict
     * detector understands.
     */
    public boolean isComparison() {
        return this == EQUAL || this == GREATER_OR_EQUAL || this == LESS_OR_EQUAL
                || this == GREATER || this == LESS;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
