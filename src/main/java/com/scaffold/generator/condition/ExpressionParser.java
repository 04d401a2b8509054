package com.scaffold.generator.condition;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.scaffold.generator.condition.ExpressionToken.TokenType;

/**
 * Recursive-descent parser for condition expressions.
 *
 * <pre>
 * or         := and ("or" and)*
 * and        := not ("and" not)*
 * not        := "not" not | comparison
 * comparison := primary ((== | != | &lt; | &lt;= | &gt; | &gt;= | in | not in) primary)?
 * primary    := literal | identifier | "(" or ")" | "[" (or ("," or)*)? "]"
 * </pre>
 */
public class ExpressionParser {

    private final List<ExpressionToken> tokens;
    private final String source;
    private int pos = 0;

    public ExpressionParser(List<ExpressionToken> tokens, String source) {
        this.tokens = tokens;
        this.source = source;
    }

    public static Expression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ExpressionException("Empty expression");
        }
        List<ExpressionToken> tokens = new ExpressionTokenizer(source).tokenize();
        return new ExpressionParser(tokens, source).parseExpression();
    }

    public Expression parseExpression() {
        Expression expression = parseOr();
        if (!isAtEnd()) {
            throw error("Unexpected '" + peek().getValue() + "'");
        }
        return expression;
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (check(TokenType.OR)) {
            advance();
            left = new Expression.Logical(TokenType.OR, left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseNot();
        while (check(TokenType.AND)) {
            advance();
            left = new Expression.Logical(TokenType.AND, left, parseNot());
        }
        return left;
    }

    private Expression parseNot() {
        if (check(TokenType.NOT)) {
            advance();
            return new Expression.Not(parseNot());
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parsePrimary();

        if (peek().isComparison()) {
            TokenType operator = advance().getType();
            return new Expression.Comparison(operator, false, left, parsePrimary());
        }
        if (check(TokenType.IN)) {
            advance();
            return new Expression.Comparison(TokenType.IN, false, left, parsePrimary());
        }
        if (check(TokenType.NOT) && peekAhead(1).getType() == TokenType.IN) {
            advance();
            advance();
            return new Expression.Comparison(TokenType.IN, true, left, parsePrimary());
        }
        return left;
    }

    private Expression parsePrimary() {
        ExpressionToken token = peek();
        switch (token.getType()) {
            case TRUE:
                advance();
                return new Expression.Literal(Boolean.TRUE);
            case FALSE:
                advance();
                return new Expression.Literal(Boolean.FALSE);
            case NONE:
                advance();
                return new Expression.Literal(null);
            case STRING_LITERAL:
                advance();
                return new Expression.Literal(token.getValue());
            case NUMERIC_LITERAL:
                advance();
                return new Expression.Literal(parseNumber(token));
            case IDENTIFIER:
                advance();
                return new Expression.VariableRef(token.getValue());
            case LPAREN:
                advance();
                Expression inner = parseOr();
                expect(TokenType.RPAREN);
                return inner;
            case LBRACKET:
                return parseList();
            default:
                throw error(token.getType() == TokenType.EOF
                        ? "Unexpected end of expression"
                        : "Unexpected '" + token.getValue() + "'");
        }
    }

    private Expression parseList() {
        expect(TokenType.LBRACKET);
        List<Expression> items = new ArrayList<>();
        if (!check(TokenType.RBRACKET)) {
            items.add(parseOr());
            while (check(TokenType.COMMA)) {
                advance();
                items.add(parseOr());
            }
        }
        expect(TokenType.RBRACKET);
        return new Expression.ListLiteral(items);
    }

    private Object parseNumber(ExpressionToken token) {
        String text = token.getValue();
        try {
            if (text.contains(".")) {
                return new BigDecimal(text).doubleValue();
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'");
        }
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private ExpressionToken peek() {
        return tokens.get(pos);
    }

    private ExpressionToken peekAhead(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private ExpressionToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().getType() == type;
    }

    private ExpressionToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    private ExpressionToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw error("Expected " + type + " but found " + peek().getType());
    }

    private ExpressionException error(String message) {
        return new ExpressionException(message + " at position " + peek().getPosition() + " in: " + source);
    }
}
