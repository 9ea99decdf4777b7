package work.agentflow.engine.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.agentflow.engine.runtime.CancellationToken;
import work.agentflow.engine.runtime.WorkflowLoader;

@CommandLine.Command(
    name = "run",
    description = "Start a new run of a workflow.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class RunCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @CommandLine.Mixin
    private EngineOptions engine = new EngineOptions();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "WORKFLOW", description = "Workflow YAML file.")
    private Path workflow;

    @CommandLine.Option(
        names = {"-i", "--context"},
        paramLabel = "PATH|-",
        description = "JSON object merged into the initial context; use '-' to read from stdin.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String contextFile;

    @CommandLine.Option(
        names = {"-s", "--set"},
        paramLabel = "KEY=VALUE",
        description = "Context value, applied after --context. Repeatable."
    )
    private Map<String, String> values = new LinkedHashMap<>();

    @Override
    public Integer call() {
        var file = workflow.toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Workflow file not found: " + file);
        }
        var context = loadContext();
        context.putAll(values);
        var token = new CancellationToken();
        var runner = engine.runner(token);
        var definition = WorkflowLoader.load(file);
        return Interrupts.whileRunning(token, spec.commandLine().getOut(), () -> runner.run(definition, context));
    }

    private Map<String, Object> loadContext() {
        if (contextFile == null || contextFile.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            String payload = "-".equals(contextFile)
                ? new String(System.in.readAllBytes(), StandardCharsets.UTF_8)
                : Files.readString(Paths.get(contextFile));
            if (payload.isBlank()) {
                return new LinkedHashMap<>();
            }
            return new LinkedHashMap<>(JSON.readValue(payload, MAP_TYPE));
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid --context payload: " + ex.getMessage(), ex);
        }
    }
}
