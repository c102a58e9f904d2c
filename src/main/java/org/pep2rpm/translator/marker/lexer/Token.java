package org.pep2rpm.translator.marker.lexer;

/**
 * A token of a marker expression.
 *
 * @param type   The token type.
 * @param text   The token text; for strings, the content without quotes.
 * @param column The zero-based column where the token starts.
 */
public record Token(TokenType type, String text, int column) {
}
