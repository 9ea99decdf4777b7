package work.agentflow.engine.condition;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import work.agentflow.engine.model.Condition;
import work.agentflow.engine.model.Condition.CompareOp;
import work.agentflow.engine.shared.WorkflowConfigException;
import work.agentflow.engine.shared.WorkspacePaths;
import work.agentflow.engine.state.StepStatus;
import work.agentflow.engine.variables.VariableResolver;

/**
 * Evaluates {@link Condition} trees without side effects. Used for {@code when} gating and for the
 * continuation check of {@code while} loops.
 */
public final class ConditionEvaluator {
    public static final int MAX_DEPTH = ExpressionParser.MAX_DEPTH;

    private final WorkspacePaths workspace;
    private final Map<String, String> environment;

    public ConditionEvaluator(WorkspacePaths workspace, Map<String, String> environment) {
        this.workspace = workspace;
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    /**
     * @param field step field the condition belongs to, used for missing-variable allowlisting
     */
    public boolean evaluate(Condition condition, VariableResolver resolver, String field) {
        return evaluate(condition, resolver, field, 0);
    }

    private boolean evaluate(Condition condition, VariableResolver resolver, String field, int depth) {
        if (depth > MAX_DEPTH) {
            throw new WorkflowConfigException("Condition nesting exceeds " + MAX_DEPTH + " levels");
        }
        if (condition instanceof Condition.StepOk stepOk) {
            var result = resolver.scope().stepResult(resolver.resolve(stepOk.step(), field));
            return result != null
                && result.status() != StepStatus.RUNNING
                && result.exitCode() != null
                && result.exitCode() == 0;
        }
        if (condition instanceof Condition.FileExists fileExists) {
            return Files.exists(workspace.resolve(resolver.resolve(fileExists.path(), field)));
        }
        if (condition instanceof Condition.EnvSet envSet) {
            var value = environment.get(resolver.resolve(envSet.name(), field));
            return value != null && !value.isEmpty();
        }
        if (condition instanceof Condition.Equals equals) {
            return resolver.resolve(equals.left(), field).equals(resolver.resolve(equals.right(), field));
        }
        if (condition instanceof Condition.Contains contains) {
            return resolver.resolve(contains.haystack(), field).contains(resolver.resolve(contains.needle(), field));
        }
        if (condition instanceof Condition.Matches matches) {
            var pattern = resolver.resolve(matches.pattern(), field);
            try {
                return Pattern.compile(pattern).matcher(resolver.resolve(matches.value(), field)).find();
            } catch (PatternSyntaxException ex) {
                throw new WorkflowConfigException("Invalid regular expression '" + pattern + "'", ex);
            }
        }
        if (condition instanceof Condition.Compare compare) {
            return compare(resolver.resolve(compare.left(), field), compare.op(), resolver.resolve(compare.right(), field));
        }
        if (condition instanceof Condition.All all) {
            for (var child : all.conditions()) {
                if (!evaluate(child, resolver, field, depth + 1)) {
                    return false;
                }
            }
            return true;
        }
        if (condition instanceof Condition.Any any) {
            for (var child : any.conditions()) {
                if (evaluate(child, resolver, field, depth + 1)) {
                    return true;
                }
            }
            return false;
        }
        if (condition instanceof Condition.Not not) {
            return !evaluate(not.condition(), resolver, field, depth + 1);
        }
        var expression = (Condition.Expression) condition;
        var tree = ExpressionParser.parse(expression.source());
        var value = new ExpressionInterpreter(expression.source(), resolver, field).evaluate(tree);
        return ExpressionInterpreter.isTruthy(value);
    }

    private static boolean compare(String left, CompareOp op, String right) {
        BigDecimal l;
        BigDecimal r;
        try {
            l = new BigDecimal(left.trim());
            r = new BigDecimal(right.trim());
        } catch (NumberFormatException ex) {
            if (op == CompareOp.EQ || op == CompareOp.NE) {
                return op.test(left.equals(right) ? 0 : 1);
            }
            throw new WorkflowConfigException("compare needs numeric operands, got '" + left + "' and '" + right + "'", ex);
        }
        return op.test(l.compareTo(r));
    }
}
