package work.agentflow.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import work.agentflow.engine.model.JoinPolicy;
import work.agentflow.engine.model.ItemFailurePolicy;
import work.agentflow.engine.model.RetryPolicy;
import work.agentflow.engine.model.StepAction;
import work.agentflow.engine.model.Transition;
import work.agentflow.engine.shared.WorkflowConfigException;

class WorkflowLoaderTest {
    @TempDir
    Path dir;

    @Test
    void parsesFullWorkflow() {
        var workflow = WorkflowLoader.parse("""
            version: "1"
            name: review
            strict_flow: false
            secrets: [API_TOKEN]
            context:
              branch: main
            providers:
              claude:
                command: ["claude", "-p", "${PROMPT}", "--model", "${model}"]
                defaults: {model: sonnet}
            steps:
              - name: plan
                provider: claude
                input_file: prompts/plan.md
                timeout: 90
                retries: {max_attempts: 3, backoff: exponential, delay: 500ms, retry_on: [1, 75]}
                on:
                  success: fan-out
                  failure: {error: "planning failed"}
              - name: fan-out
                for_each:
                  items_from: steps.plan.json.files
                  as: file
                  parallel: true
                  max_workers: 2
                  join: majority
                  on_item_failure: continue
                  steps:
                    - name: lint
                      command: ["lint", "${file}"]
                      on: {failure: _loop_continue}
              - name: done
                wait_for: {glob: "out/*.json", min_count: 2, timeout: 1m}
                on: {always: {end: true}}
            """);
        assertEquals("review", workflow.name());
        assertFalse(workflow.strictFlow());
        assertEquals(List.of("API_TOKEN"), workflow.secrets());
        assertEquals("main", workflow.context().get("branch"));

        var plan = workflow.steps().get(0);
        assertEquals(Duration.ofSeconds(90), plan.timeout());
        assertEquals(new RetryPolicy(3, RetryPolicy.Backoff.EXPONENTIAL, Duration.ofMillis(500), Set.of(1, 75), true), plan.retry());
        assertEquals(Transition.Type.GOTO, plan.on().success().type());
        assertEquals("planning failed", plan.on().failure().message());

        var loop = assertInstanceOf(StepAction.ForEach.class, workflow.steps().get(1).action());
        assertEquals("file", loop.alias());
        assertEquals(JoinPolicy.MAJORITY, loop.join());
        assertEquals(ItemFailurePolicy.CONTINUE, loop.onItemFailure());
        assertEquals(Transition.Type.LOOP_CONTINUE, loop.body().get(0).on().failure().type());

        var wait = assertInstanceOf(StepAction.WaitFor.class, workflow.steps().get(2).action());
        assertEquals(2, wait.minCount());
        assertEquals(Duration.ofMinutes(1), wait.timeout());
        assertEquals(Transition.Type.END, workflow.steps().get(2).on().always().type());
    }

    @Test
    void checksumTracksFileBytes() throws IOException {
        var file = dir.resolve("flow.yaml");
        Files.writeString(file, "steps:\n  - name: a\n    command: [echo]\n");
        var first = WorkflowLoader.load(file);
        assertEquals("flow", first.name());
        assertEquals(file.toAbsolutePath().normalize(), first.source());
        Files.writeString(file, "steps:\n  - name: a\n    command: [echo, changed]\n");
        assertNotEquals(first.checksum(), WorkflowLoader.load(file).checksum());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "steps: []",
        "name: x",
        "steps:\n  - name: a\n    command: \"echo hi\"",
        "steps:\n  - name: a\n    command: [echo]\n    colour: red",
        "steps:\n  - name: a\n    command: [echo]\n  - name: a\n    command: [echo]",
        "steps:\n  - name: a.b\n    command: [echo]",
        "steps:\n  - name: a\n    command: [echo]\n    on: {success: nowhere}",
        "steps:\n  - name: a\n    command: [echo]\n    on: {success: _loop_break}",
        "steps:\n  - name: a\n    command: [echo]\n    on: {success: _bogus}",
        "steps:\n  - name: a\n    provider: missing",
        "steps:\n  - name: a\n    command: [echo]\n    prompt: hi",
        "steps:\n  - name: a\n    command: [echo]\n    wait_for: {glob: x}",
        "steps:\n  - name: a\n    command: [echo]\n    timeout: -1",
        "steps:\n  - name: a\n    command: [echo]\n    retries: {max_attempts: 0}",
        "steps:\n  - name: a\n    for_each: {items: [1], items_from: context.x, steps: [{name: b, command: [echo]}]}",
        "steps:\n  - name: a\n    while: {max_iterations: 2, steps: [{name: b, command: [echo]}]}",
        "providers:\n  p: {command: [tool]}\nsteps:\n  - name: a\n    provider: p",
        "providers:\n  p: {command: [tool, \"${PROMPT}\"], input: stdin}\nsteps:\n  - name: a\n    provider: p",
        "steps:\n  - name: a\n    command: [echo]\n    when: {unknown: x}",
        "[1, 2]"
    })
    void rejectsInvalidWorkflows(String yaml) {
        assertThrows(WorkflowConfigException.class, () -> WorkflowLoader.parse(yaml));
    }

    @Test
    void durationsAcceptSecondsAndSuffixes() {
        var workflow = WorkflowLoader.parse("""
            steps:
              - name: a
                command: [echo]
                timeout: 1.5
              - name: b
                command: [echo]
                timeout: 2m
            """);
        assertEquals(Duration.ofMillis(1500), workflow.steps().get(0).timeout());
        assertEquals(Duration.ofMinutes(2), workflow.steps().get(1).timeout());
    }

    @Test
    void shortDependencyFormAndInjectionObject() {
        var workflow = WorkflowLoader.parse("""
            providers:
              p: {command: [tool], input: stdin}
            steps:
              - name: a
                command: [echo]
                depends_on: ["a.txt", "b/*.md"]
              - name: b
                provider: p
                depends_on:
                  optional: ["notes/**"]
                  inject: {mode: content, position: append}
            """);
        assertEquals(List.of("a.txt", "b/*.md"), workflow.steps().get(0).dependsOn().required());
        var spec = workflow.steps().get(1).dependsOn();
        assertEquals(List.of("notes/**"), spec.optional());
        assertTrue(spec.effectiveInstruction().startsWith("The following file contents"));
    }
}
