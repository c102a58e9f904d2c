package org.pep2rpm.translator.marker.ast;

/**
 * A node of a parsed environment marker: either a comparison leaf or a binary
 * {@code and}/{@code or} node.
 */
public sealed interface MarkerExpression permits MarkerComparison, MarkerAnd, MarkerOr {
}
