package work.agentflow.engine.condition;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.agentflow.engine.model.Condition;
import work.agentflow.engine.shared.PathSafetyException;
import work.agentflow.engine.shared.WorkflowConfigException;
import work.agentflow.engine.shared.WorkspacePaths;
import work.agentflow.engine.state.StepResult;
import work.agentflow.engine.state.StepStatus;
import work.agentflow.engine.variables.VariableResolver;
import work.agentflow.engine.variables.VariableScope;

class ConditionEvaluatorTest {
    @TempDir
    Path workspace;

    private ConditionEvaluator evaluator;
    private VariableResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(workspace.resolve("done.flag"), "");
        evaluator = new ConditionEvaluator(new WorkspacePaths(workspace), Map.of("TOKEN", "abc", "EMPTY", ""));
        var ok = new StepResult(StepStatus.COMPLETED, 0, "ready 42", null, null, false, false, null, null, 0L, 1, null, null, null, null);
        var bad = new StepResult(StepStatus.FAILED, 3, "", null, null, false, false, null, null, 0L, 1, null, null, null, null);
        resolver = new VariableResolver(VariableScope.of(Map.of(), Map.of("mode", "fast", "limit", "10"), Map.of("ok", ok, "bad", bad)));
    }

    private boolean check(Condition condition) {
        return evaluator.evaluate(condition, resolver, "when");
    }

    @Test
    void stepOkRequiresZeroExit() {
        assertTrue(check(new Condition.StepOk("ok")));
        assertFalse(check(new Condition.StepOk("bad")));
        assertFalse(check(new Condition.StepOk("never-ran")));
    }

    @Test
    void fileAndEnvironmentPredicates() {
        assertTrue(check(new Condition.FileExists("done.flag")));
        assertFalse(check(new Condition.FileExists("missing.flag")));
        assertThrows(PathSafetyException.class, () -> check(new Condition.FileExists("../escape")));
        assertTrue(check(new Condition.EnvSet("TOKEN")));
        assertFalse(check(new Condition.EnvSet("EMPTY")));
    }

    @Test
    void stringPredicatesUseSubstitutedValues() {
        assertTrue(check(new Condition.Equals("${context.mode}", "fast")));
        assertTrue(check(new Condition.Contains("${steps.ok.output}", "ready")));
        assertTrue(check(new Condition.Matches("${steps.ok.output}", "\\d+")));
        assertThrows(WorkflowConfigException.class, () -> check(new Condition.Matches("x", "(")));
    }

    @Test
    void numericCompareAndCombinators() {
        assertTrue(check(new Condition.Compare("9", Condition.CompareOp.LT, "${context.limit}")));
        assertFalse(check(new Condition.Compare("11", Condition.CompareOp.LE, "${context.limit}")));
        var combined = new Condition.All(List.of(
            new Condition.Any(List.of(new Condition.StepOk("bad"), new Condition.StepOk("ok"))),
            new Condition.Not(new Condition.FileExists("missing.flag"))
        ));
        assertTrue(check(combined));
    }

    @Test
    void expressionForm() {
        assertTrue(check(new Condition.Expression("${steps.ok.exit_code} == 0 and ${context.limit} > 5")));
    }
}
