package org.pep2rpm.translator.marker.ast;

/**
 * Comparison operators allowed in a marker leaf.
 */
public enum MarkerOperator {
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    GREATER_OR_EQUAL(">="),
    COMPATIBLE("~="),
    ARBITRARY_EQUAL("==="),
    IN("in"),
    NOT_IN("not in");

    private final String symbol;

    MarkerOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return true for {@code <, <=, >, >=}.
     */
    public boolean isOrdering() {
        return this == LESS || this == LESS_OR_EQUAL || this == GREATER || this == GREATER_OR_EQUAL;
    }

    /**
     * Returns the operator that gives the same result with swapped operands.
     * Only ordering operators change.
     */
    public MarkerOperator mirrored() {
        return switch (this) {
            case LESS -> GREATER;
            case GREATER -> LESS;
            case LESS_OR_EQUAL -> GREATER_OR_EQUAL;
            case GREATER_OR_EQUAL -> LESS_OR_EQUAL;
            default -> this;
        };
    }

    /**
     * Looks up a comparison operator by symbol.
     * @param symbol One of {@code == != < <= > >= ~= ===}.
     * @return The operator, or null if the symbol is not a comparison operator.
     */
    public static MarkerOperator fromSymbol(String symbol) {
        for (MarkerOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
