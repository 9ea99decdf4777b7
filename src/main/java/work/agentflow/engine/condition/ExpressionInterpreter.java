package work.agentflow.engine.condition;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.agentflow.engine.condition.ExpressionNode.Binary;
import work.agentflow.engine.condition.ExpressionNode.ListLiteral;
import work.agentflow.engine.condition.ExpressionNode.Literal;
import work.agentflow.engine.condition.ExpressionNode.Operator;
import work.agentflow.engine.condition.ExpressionNode.Unary;
import work.agentflow.engine.condition.ExpressionNode.Variable;
import work.agentflow.engine.shared.MissingVariableException;
import work.agentflow.engine.variables.VariableResolver;

/**
 * Pure evaluator for {@link ExpressionNode} trees. Numbers are evaluated as {@link BigDecimal}; a
 * string operand that parses as a number is coerced when the other side is numeric.
 */
public final class ExpressionInterpreter {
    private final String source;
    private final VariableResolver resolver;
    private final String field;

    public ExpressionInterpreter(String source, VariableResolver resolver, String field) {
        this.source = source;
        this.resolver = resolver;
        this.field = field;
    }

    public Object evaluate(ExpressionNode node) {
        return evaluate(node, 0);
    }

    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof BigDecimal d) return d.signum() != 0;
        if (value instanceof Number n) return n.doubleValue() != 0 && !Double.isNaN(n.doubleValue());
        if (value instanceof String s) return !s.isEmpty();
        if (value instanceof List<?> list) return !list.isEmpty();
        if (value instanceof Map<?, ?> map) return !map.isEmpty();
        return true;
    }

    private Object evaluate(ExpressionNode node, int depth) {
        if (depth > ExpressionParser.MAX_DEPTH) {
            throw failure("Expression nesting exceeds " + ExpressionParser.MAX_DEPTH + " levels");
        }
        if (node instanceof Literal literal) {
            return literal.value();
        }
        if (node instanceof Variable variable) {
            return lookup(variable.reference());
        }
        if (node instanceof ListLiteral list) {
            var values = new ArrayList<>(list.elements().size());
            for (var element : list.elements()) {
                values.add(evaluate(element, depth + 1));
            }
            return values;
        }
        if (node instanceof Unary unary) {
            var operand = evaluate(unary.operand(), depth + 1);
            return switch (unary.operator()) {
                case NOT -> !isTruthy(operand);
                case NEGATE -> requireNumber(operand, unary.operator()).negate();
                case PLUS -> requireNumber(operand, unary.operator());
                default -> throw failure("Unsupported unary operator " + unary.operator().symbol());
            };
        }
        var binary = (Binary) node;
        if (binary.operator() == Operator.AND) {
            return isTruthy(evaluate(binary.left(), depth + 1)) && isTruthy(evaluate(binary.right(), depth + 1));
        }
        if (binary.operator() == Operator.OR) {
            return isTruthy(evaluate(binary.left(), depth + 1)) || isTruthy(evaluate(binary.right(), depth + 1));
        }
        var left = evaluate(binary.left(), depth + 1);
        var right = evaluate(binary.right(), depth + 1);
        return switch (binary.operator()) {
            case ADD -> add(left, right);
            case SUBTRACT -> requireNumber(left, Operator.SUBTRACT).subtract(requireNumber(right, Operator.SUBTRACT));
            case MULTIPLY -> requireNumber(left, Operator.MULTIPLY).multiply(requireNumber(right, Operator.MULTIPLY));
            case DIVIDE -> divide(left, right, false);
            case MODULO -> divide(left, right, true);
            case EQ -> looseEquals(left, right);
            case NE -> !looseEquals(left, right);
            case LT -> compare(left, right, binary.operator()) < 0;
            case LE -> compare(left, right, binary.operator()) <= 0;
            case GT -> compare(left, right, binary.operator()) > 0;
            case GE -> compare(left, right, binary.operator()) >= 0;
            case IN -> contains(right, left);
            case NOT_IN -> !contains(right, left);
            default -> throw failure("Unsupported operator " + binary.operator().symbol());
        };
    }

    private Object lookup(String reference) {
        var value = resolver.lookup(reference);
        if (value.isPresent()) {
            return value.get();
        }
        if (resolver.allowsMissing(field)) {
            return "";
        }
        throw new MissingVariableException(reference, field);
    }

    private Object add(Object left, Object right) {
        if (left instanceof List<?> l && right instanceof List<?> r) {
            var joined = new ArrayList<Object>(l);
            joined.addAll(r);
            return joined;
        }
        if (left instanceof String && right instanceof String) {
            return (String) left + right;
        }
        return requireNumber(left, Operator.ADD).add(requireNumber(right, Operator.ADD));
    }

    private Object divide(Object left, Object right, boolean remainder) {
        var operator = remainder ? Operator.MODULO : Operator.DIVIDE;
        var dividend = requireNumber(left, operator);
        var divisor = requireNumber(right, operator);
        if (divisor.signum() == 0) {
            throw failure("Division by zero");
        }
        return remainder ? dividend.remainder(divisor) : dividend.divide(divisor, MathContext.DECIMAL64);
    }

    private BigDecimal requireNumber(Object value, Operator operator) {
        var number = toNumber(value);
        if (number == null) {
            throw failure("Operator '" + operator.symbol() + "' needs a number, got " + describe(value));
        }
        return number;
    }

    private int compare(Object left, Object right, Operator operator) {
        var l = toNumber(left);
        var r = toNumber(right);
        if (l != null && r != null && (isNumeric(left) || isNumeric(right))) {
            return l.compareTo(r);
        }
        if (left instanceof String ls && right instanceof String rs) {
            return ls.compareTo(rs);
        }
        throw failure("Cannot apply '" + operator.symbol() + "' to " + describe(left) + " and " + describe(right));
    }

    static boolean looseEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (isNumeric(left) || isNumeric(right)) {
            var l = toNumber(left);
            var r = toNumber(right);
            return l != null && r != null && l.compareTo(r) == 0;
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            return String.valueOf(left).equalsIgnoreCase(String.valueOf(right));
        }
        if (left instanceof List<?> l && right instanceof List<?> r) {
            if (l.size() != r.size()) {
                return false;
            }
            for (var i = 0; i < l.size(); i++) {
                if (!looseEquals(l.get(i), r.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    private boolean contains(Object haystack, Object needle) {
        if (haystack instanceof List<?> list) {
            for (var element : list) {
                if (looseEquals(element, needle)) {
                    return true;
                }
            }
            return false;
        }
        if (haystack instanceof String text) {
            return text.contains(VariableResolver.stringify(needle));
        }
        if (haystack instanceof Map<?, ?> map) {
            return map.containsKey(VariableResolver.stringify(needle));
        }
        throw failure("Operator 'in' needs a list, string or object, got " + describe(haystack));
    }

    private static boolean isNumeric(Object value) {
        return value instanceof Number;
    }

    private static BigDecimal toNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        if (value instanceof String text) {
            var trimmed = text.trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(trimmed);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String text) {
            return "string '" + text + "'";
        }
        if (value instanceof Number) {
            return "number " + VariableResolver.stringify(value);
        }
        if (value instanceof Boolean) {
            return "boolean " + value;
        }
        return value instanceof List<?> ? "list" : "object";
    }

    private ExpressionException failure(String message) {
        return new ExpressionException(message, source, -1);
    }
}
