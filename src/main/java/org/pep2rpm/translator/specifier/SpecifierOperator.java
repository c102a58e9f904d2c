package org.pep2rpm.translator.specifier;

import org.pep2rpm.translator.InvalidSpecifierOperatorException;

/**
 * The comparison operators of PEP 440 version specifiers.
 */
public enum SpecifierOperator {
    COMPATIBLE("~="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS_OR_EQUAL("<="),
    GREATER_OR_EQUAL(">="),
    LESS("<"),
    GREATER(">"),
    ARBITRARY_EQUAL("===");

    private final String symbol;

    SpecifierOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return true for the operators that accept a trailing {@code .*} wildcard.
     */
    public boolean allowsWildcard() {
        return this == EQUAL || this == NOT_EQUAL;
    }

    /**
     * @return true for {@code <, <=, >, >=}, whose PEP 440 symbol is also a valid RPM operator.
     */
    public boolean isOrdering() {
        return this == LESS || this == LESS_OR_EQUAL || this == GREATER || this == GREATER_OR_EQUAL;
    }

    /**
     * Returns the operator that gives the same result with swapped operands,
     * e.g. {@code <} for {@code >}.
     */
    public SpecifierOperator mirrored() {
        return switch (this) {
            case LESS -> GREATER;
            case GREATER -> LESS;
            case LESS_OR_EQUAL -> GREATER_OR_EQUAL;
            case GREATER_OR_EQUAL -> LESS_OR_EQUAL;
            default -> this;
        };
    }

    /**
     * Looks up an operator by its PEP 440 symbol.
     * @param symbol The symbol, e.g. {@code ~=}.
     * @return The operator.
     * @throws InvalidSpecifierOperatorException if the symbol is not a PEP 440 operator.
     */
    public static SpecifierOperator fromSymbol(String symbol) {
        for (SpecifierOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new InvalidSpecifierOperatorException("Unknown version operator '" + symbol + "'", symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
