package org.pep2rpm.translator.marker.ast;

/**
 * A marker leaf comparing one environment variable with one string literal.
 *
 * @param variable     The marker variable, e.g. {@code os_name}.
 * @param operator     The comparison operator.
 * @param literal      The string literal, without quotes.
 * @param literalFirst Whether the literal was written on the left, as in {@code "linux" in sys_platform}.
 */
public record MarkerComparison(
        String variable,
        MarkerOperator operator,
        String literal,
        boolean literalFirst
) implements MarkerExpression {

    @Override
    public String toString() {
        String quoted = '"' + literal + '"';
        return literalFirst
                ? quoted + " " + operator + " " + variable
                : variable + " " + operator + " " + quoted;
    }
}
