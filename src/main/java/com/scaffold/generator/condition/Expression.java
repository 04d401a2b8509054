package com.scaffold.generator.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.scaffold.generator.condition.ExpressionToken.TokenType;

/**
 * Node of a parsed condition expression. Evaluation only reads the variable
 * map; nothing is executed.
 */
public abstract class Expression {

    /**
     * @param strict when {@code true} an unknown variable is an error, otherwise it evaluates to {@code null}
     */
    public abstract Object evaluate(Map<String, ?> variables, boolean strict);

    /**
     * Adds the names of the variables this expression reads.
     */
    public abstract void collectVariables(Set<String> names);

    public boolean test(Map<String, ?> variables) {
        return ValueComparator.isTruthy(evaluate(variables, false));
    }

    public static final class Literal extends Expression {
        private final Object value;

        Literal(Object value) {
            this.value = value;
        }

        @Override
        public Object evaluate(Map<String, ?> variables, boolean strict) {
            return value;
        }

        @Override
        public void collectVariables(Set<String> names) {
            // no variables
        }

        @Override
        public String toString() {
            return value instanceof String ? "'" + value + "'" : String.valueOf(value);
        }
    }

    public static final class VariableRef extends Expression {
        private final String name;

        VariableRef(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public Object evaluate(Map<String, ?> variables, boolean strict) {
            if (!variables.containsKey(name) && strict) {
                throw new ExpressionException("Undefined variable '" + name + "'");
            }
            return variables.get(name);
        }

        @Override
        public void collectVariables(Set<String> names) {
            names.add(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class ListLiteral extends Expression {
        private final List<Expression> items;

        ListLiteral(List<Expression> items) {
            this.items = List.copyOf(items);
        }

        @Override
        public Object evaluate(Map<String, ?> variables, boolean strict) {
            List<Object> values = new ArrayList<>(items.size());
            for (Expression item : items) {
                values.add(item.evaluate(variables, strict));
            }
            return values;
        }

        @Override
        public void collectVariables(Set<String> names) {
            items.forEach(item -> item.collectVariables(names));
        }

        @Override
        public String toString() {
            return items.toString();
        }
    }

    public static final class Not extends Expression {
        private final Expression operand;

        Not(Expression operand) {
            this.operand = operand;
        }

        @Override
        public Object evaluate(Map<String, ?> variables, boolean strict) {
            return !ValueComparator.isTruthy(operand.evaluate(variables, strict));
        }

        @Override
        public void collectVariables(Set<String> names) {
            operand.collectVariables(names);
        }

        @Override
        public String toString() {
            return "not " + operand;
        }
    }

    /**
     * {@code and}/{@code or}; short-circuits and yields a boolean.
     */
    public static final class Logical extends Expression {
        private final TokenType operator;
        private final Expression left;
        private final Expression right;

        Logical(TokenType operator, Expression left, Expression right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public Object evaluate(Map<String, ?> variables, boolean strict) {
            boolean leftValue = ValueComparator.isTruthy(left.evaluate(variables, strict));
            if (operator == TokenType.AND) {
                return leftValue && ValueComparator.isTruthy(right.evaluate(variables, strict));
            }
            return leftValue || ValueComparator.isTruthy(right.evaluate(variables, strict));
        }

        @Override
        public void collectVariables(Set<String> names) {
            left.collectVariables(names);
            right.collectVariables(names);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.name().toLowerCase() + " " + right + ")";
        }
    }

    /**
     * Comparison or membership test. Incomparable operands yield {@code false}.
     */
    public static final class Comparison extends Expression {
        private final TokenType operator;
        private final boolean negated;
        private final Expression left;
        private final Expression right;

        Comparison(TokenType operator, boolean negated, Expression left, Expression right) {
            this.operator = operator;
            this.negated = negated;
            this.left = left;
            this.right = right;
        }

        @Override
        public Object evaluate(Map<String, ?> variables, boolean strict) {
            Object a = left.evaluate(variables, strict);
            Object b = right.evaluate(variables, strict);
            return switch (operator) {
                case EQ -> ValueComparator.looselyEquals(a, b);
                case NE -> !ValueComparator.looselyEquals(a, b);
                case LT -> ValueComparator.compare(a, b).map(c -> c < 0).orElse(false);
                case LE -> ValueComparator.compare(a, b).map(c -> c <= 0).orElse(false);
                case GT -> ValueComparator.compare(a, b).map(c -> c > 0).orElse(false);
                case GE -> ValueComparator.compare(a, b).map(c -> c >= 0).orElse(false);
                case IN -> negated != ValueComparator.contains(b, a);
                default -> throw new ExpressionException("Unsupported comparison operator " + operator);
            };
        }

        @Override
        public void collectVariables(Set<String> names) {
            left.collectVariables(names);
            right.collectVariables(names);
        }

        @Override
        public String toString() {
            String symbol = operator == TokenType.IN ? (negated ? "not in" : "in") : operator.name();
            return "(" + left + " " + symbol + " " + right + ")";
        }
    }
}
