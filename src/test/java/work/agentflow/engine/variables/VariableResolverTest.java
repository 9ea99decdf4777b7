package work.agentflow.engine.variables;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.agentflow.engine.shared.MissingVariableException;
import work.agentflow.engine.state.StepResult;
import work.agentflow.engine.state.StepStatus;

class VariableResolverTest {
    private static StepResult completed(String output, Object json) {
        return new StepResult(StepStatus.COMPLETED, 0, output, null, json, false, false, null, null, 1500L, 1, null, null, null, null);
    }

    private static VariableScope scope() {
        return VariableScope.of(
            Map.of("id", "run-1", "timestamp_utc", "2024-01-01T00:00:00Z"),
            Map.of("mode", "fast", "nested", Map.of("level", 3)),
            Map.of(
                "one", completed("hello", null),
                "list", completed(null, Map.of("files", List.of("a.md", "b.md"), "count", 2))
            )
        );
    }

    @Test
    void substitutesEveryNamespace() {
        var resolver = new VariableResolver(scope());
        assertEquals("say hello", resolver.resolve("say ${steps.one.output}", "command"));
        assertEquals("fast/3", resolver.resolve("${context.mode}/${context.nested.level}", "command"));
        assertEquals("run-1", resolver.resolve("${run.id}", "command"));
        assertEquals("0", resolver.resolve("${steps.one.exit_code}", "command"));
        assertEquals("1.5", resolver.resolve("${steps.one.duration}", "command"));
        assertEquals("2", resolver.resolve("${steps.list.json.count}", "command"));
    }

    @Test
    void rendersCollectionsAsJson() {
        var resolver = new VariableResolver(scope());
        assertEquals("[\"a.md\",\"b.md\"]", resolver.resolve("${steps.list.json.files}", "prompt"));
    }

    @Test
    void handlesEscapesAndPassThroughTemplates() {
        var resolver = new VariableResolver(scope());
        assertEquals("cost: $5", resolver.resolve("cost: $$5", "command"));
        assertEquals("${{ matrix.os }} fast", resolver.resolve("${{ matrix.os }} ${context.mode}", "command"));
        assertEquals("price $ and ${unterminated", resolver.resolve("price $ and ${unterminated", "command"));
    }

    @Test
    void missingVariableFailsUnlessFieldAllowlisted() {
        var strict = new VariableResolver(scope());
        var ex = assertThrows(MissingVariableException.class, () -> strict.resolve("${context.absent}", "command"));
        assertEquals("context.absent", ex.variable());
        assertEquals("command", ex.details().get("field"));

        var lenient = new VariableResolver(scope(), Set.of("command"));
        assertEquals("[]", lenient.resolve("[${context.absent}]", "command"));
        assertThrows(MissingVariableException.class, () -> lenient.resolve("${context.absent}", "prompt"));
    }

    @Test
    void loopScopeShadowsNothingAndIteratesLocally() {
        var base = scope();
        var inner = base
            .withLoop("file", "a.md", Map.of("index", 0, "iteration", 1))
            .withSteps(Map.of("one", completed("inner", null)));
        var resolver = new VariableResolver(inner);
        assertEquals("a.md#0#1", resolver.resolve("${file}#${loop.index}#${loop.iteration}", "command"));
        assertEquals("inner", resolver.resolve("${steps.one.output}", "command"));
        assertEquals("hello", new VariableResolver(base).resolve("${steps.one.output}", "command"));
    }

    @Test
    void pointerReturnsRawValues() {
        var resolver = new VariableResolver(scope());
        assertEquals(List.of("a.md", "b.md"), resolver.pointer("steps.list.json.files", "items_from"));
        assertEquals(List.of("a.md", "b.md"), resolver.pointer("${steps.list.json.files}", "items_from"));
        assertThrows(MissingVariableException.class, () -> resolver.pointer("steps.list.json.missing", "items_from"));
    }

    @Test
    void resolvesNestedValuesRecursively() {
        var resolver = new VariableResolver(scope());
        var resolved = resolver.resolveValue(Map.of("args", List.of("${context.mode}", 7)), "provider_params");
        assertEquals(Map.of("args", List.of("fast", 7)), resolved);
        assertTrue(VariableScope.isReservedNamespace("steps"));
    }
}
