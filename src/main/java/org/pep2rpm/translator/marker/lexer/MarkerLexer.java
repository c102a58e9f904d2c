package org.pep2rpm.translator.marker.lexer;

import org.pep2rpm.translator.MalformedMarkerException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a PEP 508 marker into tokens. Strings may use single or double quotes and have no
 * escape sequences; the keywords {@code and}, {@code or}, {@code in} and {@code not} are
 * case-sensitive.
 */
public class MarkerLexer {

    private static final String[] OPERATORS = {"===", "==", "!=", "<=", ">=", "~=", "<", ">"};

    private final String source;
    private int current = 0;

    public MarkerLexer(String source) {
        this.source = source;
    }

    /**
     * Scans the whole source.
     * @return The tokens, terminated by an {@link TokenType#END} token.
     * @throws MalformedMarkerException on an unterminated string or an unexpected character.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (isAtEnd()) break;

            int start = current;
            char c = source.charAt(current);
            if (c == '(') {
                current++;
                tokens.add(new Token(TokenType.LEFT_PAREN, "(", start));
            } else if (c == ')') {
                current++;
                tokens.add(new Token(TokenType.RIGHT_PAREN, ")", start));
            } else if (c == '"' || c == '\'') {
                tokens.add(string(c));
            } else if (isIdentifierStart(c)) {
                tokens.add(identifierOrKeyword());
            } else {
                tokens.add(operator());
            }
        }
        tokens.add(new Token(TokenType.END, "", source.length()));
        return tokens;
    }

    private Token string(char quote) {
        int start = current;
        int close = source.indexOf(quote, current + 1);
        if (close < 0) {
            throw new MalformedMarkerException("Unterminated string", source, start);
        }
        current = close + 1;
        return new Token(TokenType.STRING, source.substring(start + 1, close), start);
    }

    private Token identifierOrKeyword() {
        int start = current;
        while (!isAtEnd() && isIdentifierPart(source.charAt(current))) {
            current++;
        }
        String text = source.substring(start, current);
        TokenType type = switch (text) {
            case "and" -> TokenType.AND;
            case "or" -> TokenType.OR;
            case "in" -> TokenType.IN;
            case "not" -> TokenType.NOT;
            default -> TokenType.IDENTIFIER;
        };
        return new Token(type, text, start);
    }

    private Token operator() {
        int start = current;
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, current)) {
                current += operator.length();
                return new Token(TokenType.OPERATOR, operator, start);
            }
        }
        throw new MalformedMarkerException("Unexpected character '" + source.charAt(current) + "'", source, start);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(source.charAt(current))) {
            current++;
        }
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
