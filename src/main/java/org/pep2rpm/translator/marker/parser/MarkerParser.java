package org.pep2rpm.translator.marker.parser;

import org.pep2rpm.translator.MalformedMarkerException;
import org.pep2rpm.translator.marker.ast.MarkerAnd;
import org.pep2rpm.translator.marker.ast.MarkerComparison;
import org.pep2rpm.translator.marker.ast.MarkerExpression;
import org.pep2rpm.translator.marker.ast.MarkerOperator;
import org.pep2rpm.translator.marker.ast.MarkerOr;
import org.pep2rpm.translator.marker.lexer.MarkerLexer;
import org.pep2rpm.translator.marker.lexer.Token;
import org.pep2rpm.translator.marker.lexer.TokenType;

import java.util.List;

/**
 * Recursive descent parser for PEP 508 environment markers.
 * <pre>
 *   marker     := and_expr ( "or" and_expr )*
 *   and_expr   := atom ( "and" atom )*
 *   atom       := "(" marker ")" | value op value
 *   op         := "==" | "!=" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=" | "~=" | "===" | "in" | "not" "in"
 *   value      := IDENTIFIER | STRING
 * </pre>
 * {@code and} binds tighter than {@code or}; both associate to the left. Each comparison must
 * have exactly one variable and one string literal.
 */
public class MarkerParser {

    private final String source;
    private final List<Token> tokens;
    private int current = 0;

    public MarkerParser(String source) {
        this.source = source;
        this.tokens = new MarkerLexer(source).scanTokens();
    }

    /**
     * Parses a marker.
     * @param marker The marker text, e.g. {@code os_name == "nt" and extra == "test"}.
     * @return The expression tree.
     * @throws MalformedMarkerException if the marker is not well formed.
     */
    public static MarkerExpression parse(String marker) {
        return new MarkerParser(marker).parseMarker();
    }

    /**
     * Parses the whole token stream as one marker.
     * @return The expression tree.
     */
    public MarkerExpression parseMarker() {
        if (check(TokenType.END)) {
            throw error("Empty marker", peek());
        }
        MarkerExpression expression = disjunction();
        if (!check(TokenType.END)) {
            throw error("Unexpected '" + peek().text() + "'", peek());
        }
        return expression;
    }

    private MarkerExpression disjunction() {
        MarkerExpression left = conjunction();
        while (match(TokenType.OR)) {
            left = new MarkerOr(left, conjunction());
        }
        return left;
    }

    private MarkerExpression conjunction() {
        MarkerExpression left = atom();
        while (match(TokenType.AND)) {
            left = new MarkerAnd(left, atom());
        }
        return left;
    }

    private MarkerExpression atom() {
        if (match(TokenType.LEFT_PAREN)) {
            MarkerExpression inner = disjunction();
            consume(TokenType.RIGHT_PAREN, "Expected ')'");
            return inner;
        }
        return comparison();
    }

    private MarkerExpression comparison() {
        Token left = value();
        MarkerOperator operator = operator();
        Token right = value();

        if (left.type() == right.type()) {
            throw error("A comparison needs one marker variable and one quoted string", left);
        }
        boolean literalFirst = left.type() == TokenType.STRING;
        Token variable = literalFirst ? right : left;
        Token literal = literalFirst ? left : right;
        return new MarkerComparison(variable.text(), operator, literal.text(), literalFirst);
    }

    private Token value() {
        if (check(TokenType.IDENTIFIER) || check(TokenType.STRING)) {
            return advance();
        }
        throw error("Expected a marker variable or a quoted string", peek());
    }

    private MarkerOperator operator() {
        if (match(TokenType.IN)) {
            return MarkerOperator.IN;
        }
        if (match(TokenType.NOT)) {
            consume(TokenType.IN, "Expected 'in' after 'not'");
            return MarkerOperator.NOT_IN;
        }
        Token token = consume(TokenType.OPERATOR, "Expected a comparison operator");
        return MarkerOperator.fromSymbol(token.text());
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (token.type() != TokenType.END) {
            current++;
        }
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) {
            return advance();
        }
        throw error(errorMessage, peek());
    }

    private MalformedMarkerException error(String message, Token token) {
        return new MalformedMarkerException(message, source, token.column());
    }
}
