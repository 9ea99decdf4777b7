package work.agentflow.engine.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Recursive predicate tree used for {@code when} gating and {@code while} continuation.
 * String operands are variable-substituted before comparison.
 */
public sealed interface Condition {

    record StepOk(String step) implements Condition {}

    record FileExists(String path) implements Condition {}

    record EnvSet(String name) implements Condition {}

    record Equals(String left, String right) implements Condition {}

    record Contains(String haystack, String needle) implements Condition {}

    record Matches(String value, String pattern) implements Condition {}

    record Compare(String left, CompareOp op, String right) implements Condition {
        public Compare {
            Objects.requireNonNull(op, "op");
        }
    }

    record All(List<Condition> conditions) implements Condition {
        public All {
            conditions = List.copyOf(conditions);
        }
    }

    record Any(List<Condition> conditions) implements Condition {
        public Any {
            conditions = List.copyOf(conditions);
        }
    }

    record Not(Condition condition) implements Condition {
        public Not {
            Objects.requireNonNull(condition, "condition");
        }
    }

    /** Restricted expression, parsed by the condition evaluator. */
    record Expression(String source) implements Condition {
        public Expression {
            Objects.requireNonNull(source, "source");
        }
    }

    enum CompareOp {
        LT,
        LE,
        GT,
        GE,
        EQ,
        NE;

        public static CompareOp from(String value) {
            if (value == null) {
                throw new IllegalArgumentException("compare op is required");
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "lt", "<" -> LT;
                case "le", "<=" -> LE;
                case "gt", ">" -> GT;
                case "ge", ">=" -> GE;
                case "eq", "==" -> EQ;
                case "ne", "!=" -> NE;
                default -> throw new IllegalArgumentException("Unsupported compare op: " + value);
            };
        }

        public boolean test(int comparison) {
            return switch (this) {
                case LT -> comparison < 0;
                case LE -> comparison <= 0;
                case GT -> comparison > 0;
                case GE -> comparison >= 0;
                case EQ -> comparison == 0;
                case NE -> comparison != 0;
            };
        }
    }
}
