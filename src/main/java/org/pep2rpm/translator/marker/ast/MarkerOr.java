package org.pep2rpm.translator.marker.ast;

/**
 * Disjunction of two marker expressions.
 */
public record MarkerOr(MarkerExpression left, MarkerExpression right) implements MarkerExpression {

    @Override
    public String toString() {
        return left + " or " + right;
    }
}
