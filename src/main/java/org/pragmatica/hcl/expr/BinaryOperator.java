package org.pragmatica.hcl.expr;

import java.util.Optional;

/**
 * Binary operators with their precedence; higher binds tighter.
 */
public enum BinaryOperator {
    OR("||", 1),
    AND("&&", 2),
    EQ("==", 3),
    NOT_EQ("!=", 3),
    LESS("<", 4),
    LESS_EQ("<=", 4),
    GREATER(">", 4),
    GREATER_EQ(">=", 4),
    PLUS("+", 5),
    MINUS("-", 5),
    MUL("*", 6),
    DIV("/", 6),
    MOD("%", 6);

    public static final int LOWEST_PRECEDENCE = 1;

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public static Optional<BinaryOperator> fromSymbol(String symbol) {
        for (var operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
