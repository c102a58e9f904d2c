package org.pep2rpm.translator.marker.lexer;

/**
 * Token types of the PEP 508 marker language.
 */
public enum TokenType {
    IDENTIFIER,
    STRING,
    OPERATOR,
    IN,
    NOT,
    AND,
    OR,
    LEFT_PAREN,
    RIGHT_PAREN,
    END
}
