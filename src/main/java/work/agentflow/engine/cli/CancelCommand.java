package work.agentflow.engine.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.agentflow.engine.runtime.CancellationToken;

@CommandLine.Command(
    name = "cancel",
    description = "Ask a running run to stop at its next step boundary.",
    mixinStandardHelpOptions = true
)
final class CancelCommand implements Callable<Integer> {
    @CommandLine.Mixin
    private EngineOptions engine = new EngineOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "RUN_ID", description = "Run identifier.")
    private String runId;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        engine.runner(new CancellationToken()).cancel(runId);
        spec.commandLine().getOut().println("Cancellation requested for run " + runId);
        return 0;
    }
}
