package work.agentflow.engine.condition;

import java.util.List;

/**
 * Whitelisted syntax tree of a restricted expression. There is no node for calls, attribute access or
 * subscripts, so the interpreter cannot reach anything outside these shapes.
 */
public sealed interface ExpressionNode {

    record Literal(Object value) implements ExpressionNode {}

    /** A {@code ${namespace.path}} reference, looked up when evaluated. */
    record Variable(String reference) implements ExpressionNode {}

    record ListLiteral(List<ExpressionNode> elements) implements ExpressionNode {
        public ListLiteral {
            elements = List.copyOf(elements);
        }
    }

    record Unary(Operator operator, ExpressionNode operand) implements ExpressionNode {}

    record Binary(Operator operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {}

    enum Operator {
        NEGATE("-"),
        PLUS("+"),
        NOT("not"),
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        AND("and"),
        OR("or"),
        IN("in"),
        NOT_IN("not in");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        boolean isComparison() {
            return switch (this) {
                case EQ, NE, LT, LE, GT, GE, IN, NOT_IN -> true;
                default -> false;
            };
        }
    }
}
