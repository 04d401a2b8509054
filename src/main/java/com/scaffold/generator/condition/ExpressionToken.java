package com.scaffold.generator.condition;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Token of a boolean condition expression.
 */
@Data
@AllArgsConstructor
public class ExpressionToken {
    private TokenType type;
    private String value;
    private int position;

    public enum TokenType {
        IDENTIFIER,
        STRING_LITERAL,
        NUMERIC_LITERAL,
        TRUE,
        FALSE,
        NONE,
        AND,
        OR,
        NOT,
        IN,
        EQ,
        NE,
        LT,
        LE,
        GT,
        GE,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        COMMA,
        EOF
    }

    public boolean isComparison() {
        return type == TokenType.EQ || type == TokenType.NE
                || type == TokenType.LT || type == TokenType.LE
                || type == TokenType.GT || type == TokenType.GE;
    }
}
