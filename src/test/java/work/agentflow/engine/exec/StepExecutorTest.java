package work.agentflow.engine.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.agentflow.engine.deps.DependencyResolver;
import work.agentflow.engine.deps.GlobMatcher;
import work.agentflow.engine.deps.PromptComposer;
import work.agentflow.engine.model.Step;
import work.agentflow.engine.model.Workflow;
import work.agentflow.engine.runtime.CancellationToken;
import work.agentflow.engine.runtime.WorkflowLoader;
import work.agentflow.engine.shared.ErrorKind;
import work.agentflow.engine.shared.WorkspacePaths;
import work.agentflow.engine.state.StepResult;
import work.agentflow.engine.state.StepStatus;
import work.agentflow.engine.support.EngineTestSupport;
import work.agentflow.engine.support.EngineTestSupport.RecordingSleeper;
import work.agentflow.engine.support.ScriptedProcessRunner;
import work.agentflow.engine.variables.VariableResolver;
import work.agentflow.engine.variables.VariableScope;

class StepExecutorTest {
    private static final Map<String, String> ENV = Map.of("PATH", "/bin", "API_TOKEN", "s3cr3t-value");

    @TempDir
    Path root;

    private final ScriptedProcessRunner processes = new ScriptedProcessRunner();
    private final RecordingSleeper sleeper = new RecordingSleeper();

    private StepResult execute(String yaml, String stepName) {
        var workflow = WorkflowLoader.parse(yaml);
        var step = find(workflow, stepName);
        var paths = new WorkspacePaths(root);
        var commands = new CommandBuilder(workflow, paths, new DependencyResolver(new GlobMatcher(paths)), new PromptComposer(paths, 1024));
        var executor = new StepExecutor(EngineTestSupport.fastConfig(), paths, processes, sleeper, commands, new SecretsPolicy(workflow, ENV), Clock.systemUTC());
        var resolver = new VariableResolver(VariableScope.of(Map.of("id", "r1"), Map.of("who", "world"), Map.of()), step.allowMissing());
        return executor.execute(step, resolver, stepName, root.resolve("logs"), new CancellationToken());
    }

    private static Step find(Workflow workflow, String name) {
        for (var step : workflow.steps()) {
            if (step.name().equals(name)) {
                return step;
            }
        }
        throw new IllegalArgumentException(name);
    }

    @Test
    void runsCommandWithSubstitutedArgv() {
        var result = execute("""
            name: t
            steps:
              - name: greet
                command: ["echo", "hello ${context.who}"]
            """, "greet");
        assertEquals(StepStatus.COMPLETED, result.status());
        assertEquals("hello world\n", result.output());
        assertEquals(1, result.attempts());
        assertEquals(List.of(List.of("echo", "hello world")), processes.invocations());
    }

    @Test
    void retriesRetryableExitWithExponentialBackoff() {
        var calls = new AtomicInteger();
        processes.on("flaky", request -> calls.incrementAndGet() < 3
            ? ScriptedProcessRunner.exit(1, "", "busy")
            : ScriptedProcessRunner.ok("fine"));
        var result = execute("""
            name: t
            steps:
              - name: flaky
                command: ["flaky"]
                retries: {max_attempts: 3, backoff: exponential, delay: 1s}
            """, "flaky");
        assertEquals(StepStatus.COMPLETED, result.status());
        assertEquals(3, result.attempts());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.pauses());
    }

    @Test
    void nonRetryableExitFailsOnce() {
        var result = execute("""
            name: t
            steps:
              - name: broken
                command: ["exit", "3"]
                retries: {max_attempts: 5}
            """, "broken");
        assertEquals(StepStatus.FAILED, result.status());
        assertEquals(3, result.exitCode());
        assertEquals(1, processes.requests().size());
        assertEquals(ErrorKind.EXECUTION.code(), result.error().kind());
        assertEquals(3, result.error().details().get("exit_code"));
    }

    @Test
    void timeoutIsRetriedThenReported() {
        var result = execute("""
            name: t
            steps:
              - name: slow
                command: ["hang"]
                timeout: 2s
                retries: 2
            """, "slow");
        assertEquals(StepStatus.TIMEOUT, result.status());
        assertEquals(ProcessRunner.TIMEOUT_EXIT_CODE, result.exitCode());
        assertEquals(2, result.attempts());
        assertEquals(Duration.ofSeconds(2), processes.requests().get(0).timeout());
        assertEquals(ErrorKind.TIMEOUT.code(), result.error().kind());
    }

    @Test
    void malformedJsonFailsWithoutRetry() {
        var result = execute("""
            name: t
            steps:
              - name: parse
                command: ["print", "{not json"]
                output_capture: json
                retries: {max_attempts: 3}
            """, "parse");
        assertEquals(StepStatus.FAILED, result.status());
        assertEquals(ErrorKind.OUTPUT_PARSE.code(), result.error().kind());
        assertEquals(0, result.exitCode());
        assertEquals(1, processes.requests().size());
    }

    @Test
    void missingRequiredDependencySpawnsNothing() {
        var result = execute("""
            name: t
            steps:
              - name: needs
                command: ["echo", "x"]
                depends_on:
                  required: ["missing.txt"]
            """, "needs");
        assertEquals(StepStatus.FAILED, result.status());
        assertEquals(ErrorKind.MISSING_DEPENDENCY.code(), result.error().kind());
        assertTrue(processes.requests().isEmpty());
    }

    @Test
    void missingVariableFailsBeforeSpawnUnlessAllowlisted() {
        var strict = execute("""
            name: t
            steps:
              - name: strict
                command: ["echo", "${context.nope}"]
            """, "strict");
        assertEquals(ErrorKind.MISSING_VARIABLE.code(), strict.error().kind());
        assertTrue(processes.requests().isEmpty());

        var lenient = execute("""
            name: t
            steps:
              - name: lenient
                command: ["echo", "[${context.nope}]"]
                allow_missing: [command]
            """, "lenient");
        assertEquals("[]\n", lenient.output());
    }

    @Test
    void providerPromptTravelsAsSingleArgvElement() throws IOException {
        Files.createDirectories(root.resolve("prompts"));
        Files.writeString(root.resolve("prompts/ask.md"), "Keep ${context.who} literal");
        Files.writeString(root.resolve("notes.md"), "n");
        var result = execute("""
            name: t
            providers:
              fake:
                command: ["print", "${PROMPT}", "--model", "${model}"]
                defaults: {model: small}
            steps:
              - name: ask
                provider: fake
                provider_params: {model: large}
                input_file: prompts/ask.md
                depends_on:
                  required: ["*.md"]
                  inject: list
            """, "ask");
        var argv = processes.requests().get(0).argv();
        assertEquals(4, argv.size());
        assertTrue(argv.get(1).startsWith("The following files are available for this task:\n- notes.md"));
        assertTrue(argv.get(1).endsWith("Keep ${context.who} literal"));
        assertEquals("large", argv.get(3));
        assertEquals("list", result.injection().get("mode"));
        assertFalse(Files.readString(root.resolve("prompts/ask.md")).contains("notes.md"));
    }

    @Test
    void stdinTransportAndProviderExitCodes() {
        processes.on("shim", request -> ScriptedProcessRunner.exit(2, "", "bad prompt"));
        var result = execute("""
            name: t
            providers:
              shim:
                command: ["shim"]
                input: stdin
            steps:
              - name: ask
                provider: shim
                prompt: "hi ${context.who}"
                retries: {max_attempts: 3}
            """, "ask");
        assertEquals("hi world", processes.requests().get(0).stdin());
        assertEquals(1, processes.requests().size());
        assertEquals(StepStatus.FAILED, result.status());
        assertTrue(result.error().message().contains("Provider rejected its input"));
    }

    @Test
    void secretsAreAllowlistedAndMasked() {
        processes.on("leak", request -> ScriptedProcessRunner.exit(5, "", "token=" + request.environment().get("API_TOKEN")));
        var withoutSecret = execute("""
            name: t
            steps:
              - name: plain
                command: ["echo", "x"]
              - name: leak
                command: ["leak"]
                secrets: [API_TOKEN]
            """, "plain");
        assertEquals(StepStatus.COMPLETED, withoutSecret.status());
        assertNull(processes.requests().get(0).environment().get("API_TOKEN"));
        assertEquals("/bin", processes.requests().get(0).environment().get("PATH"));

        var leaking = execute("""
            name: t
            steps:
              - name: leak
                command: ["leak"]
                secrets: [API_TOKEN]
            """, "leak");
        assertEquals("s3cr3t-value", processes.requests().get(1).environment().get("API_TOKEN"));
        var stderr = String.valueOf(leaking.error().details().get("stderr"));
        assertFalse(stderr.contains("s3cr3t-value"));
        assertTrue(stderr.contains(SecretMasker.MASK));
    }

    @Test
    void outputFileReceivesFullStdout() throws IOException {
        var result = execute("""
            name: t
            steps:
              - name: save
                command: ["print", "payload"]
                output_file: out/save.txt
            """, "save");
        assertEquals(StepStatus.COMPLETED, result.status());
        assertEquals("payload", Files.readString(root.resolve("out/save.txt")));
    }
}
