package com.rnfa.regex;

public sealed interface ExpressionNode {
    record Operand(Symbol symbol) implements ExpressionNode {}
    record Unary(Symbol operator, ExpressionNode child) implements ExpressionNode {}      // Kleene star
    record Binary(Symbol operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {}
}
