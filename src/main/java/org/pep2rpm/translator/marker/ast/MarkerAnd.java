package org.pep2rpm.translator.marker.ast;

/**
 * Conjunction of two marker expressions.
 */
public record MarkerAnd(MarkerExpression left, MarkerExpression right) implements MarkerExpression {

    @Override
    public String toString() {
        return wrap(left) + " and " + wrap(right);
    }

    private static String wrap(MarkerExpression expression) {
        return expression instanceof MarkerOr ? "(" + expression + ")" : expression.toString();
    }
}
