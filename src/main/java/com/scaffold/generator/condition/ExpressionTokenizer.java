package com.scaffold.generator.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.scaffold.generator.condition.ExpressionToken.TokenType;

/**
 * Tokenizer for boolean condition expressions such as
 * {@code use_docker and license != 'MIT'}.
 */
public class ExpressionTokenizer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "and", TokenType.AND,
            "or", TokenType.OR,
            "not", TokenType.NOT,
            "in", TokenType.IN,
            "true", TokenType.TRUE,
            "false", TokenType.FALSE,
            "none", TokenType.NONE,
            "null", TokenType.NONE);

    private final String source;
    private int pos = 0;

    public ExpressionTokenizer(String source) {
        this.source = source;
    }

    public List<ExpressionToken> tokenize() {
        List<ExpressionToken> tokens = new ArrayList<>();

        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new ExpressionToken(TokenType.EOF, "", pos));
        return tokens;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private ExpressionToken nextToken() {
        char c = source.charAt(pos);
        int start = pos;

        switch (c) {
            case '(':
                pos++;
                return new ExpressionToken(TokenType.LPAREN, "(", start);
            case ')':
                pos++;
                return new ExpressionToken(TokenType.RPAREN, ")", start);
            case '[':
                pos++;
                return new ExpressionToken(TokenType.LBRACKET, "[", start);
            case ']':
                pos++;
                return new ExpressionToken(TokenType.RBRACKET, "]", start);
            case ',':
                pos++;
                return new ExpressionToken(TokenType.COMMA, ",", start);
            case '\'':
            case '"':
                return readStringLiteral(c);
            case '=':
                return readOperator("==", TokenType.EQ);
            case '!':
                return readOperator("!=", TokenType.NE);
            case '<':
                return peekNext('=') ? readOperator("<=", TokenType.LE) : readOperator("<", TokenType.LT);
            case '>':
                return peekNext('=') ? readOperator(">=", TokenType.GE) : readOperator(">", TokenType.GT);
            default:
                break;
        }

        if (Character.isDigit(c) || (c == '-' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
            return readNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            return readIdentifierOrKeyword();
        }
        throw new ExpressionException("Unexpected character '" + c + "' at position " + start + " in: " + source);
    }

    private boolean peekNext(char expected) {
        return pos + 1 < source.length() && source.charAt(pos + 1) == expected;
    }

    private ExpressionToken readOperator(String operator, TokenType type) {
        int start = pos;
        if (!source.startsWith(operator, pos)) {
            throw new ExpressionException("Expected '" + operator + "' at position " + start + " in: " + source);
        }
        pos += operator.length();
        return new ExpressionToken(type, operator, start);
    }

    private ExpressionToken readStringLiteral(char quote) {
        int start = pos;
        StringBuilder sb = new StringBuilder();
        pos++; // opening quote

        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new ExpressionToken(TokenType.STRING_LITERAL, sb.toString(), start);
            }
            if (c == '\\' && pos < source.length()) {
                c = source.charAt(pos++);
            }
            sb.append(c);
        }
        throw new ExpressionException("Unterminated string starting at position " + start + " in: " + source);
    }

    private ExpressionToken readNumber() {
        int start = pos;
        pos++;
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            pos++;
        }
        return new ExpressionToken(TokenType.NUMERIC_LITERAL, source.substring(start, pos), start);
    }

    private ExpressionToken readIdentifierOrKeyword() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        String word = source.substring(start, pos);
        TokenType keyword = KEYWORDS.get(word.toLowerCase(Locale.ROOT));
        if (keyword != null) {
            return new ExpressionToken(keyword, word, start);
        }
        return new ExpressionToken(TokenType.IDENTIFIER, word, start);
    }
}
