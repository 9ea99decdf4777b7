package work.agentflow.engine.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.agentflow.engine.runtime.CancellationToken;

@CommandLine.Command(
    name = "resume",
    description = "Continue a stopped run from its last recorded step.",
    mixinStandardHelpOptions = true
)
final class ResumeCommand implements Callable<Integer> {
    @CommandLine.Mixin
    private EngineOptions engine = new EngineOptions();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "RUN_ID", description = "Run identifier.")
    private String runId;

    @CommandLine.Option(names = "--force", description = "Resume even though the workflow file changed since the run started.")
    private boolean force;

    @CommandLine.Option(names = "--repair", description = "Restore the newest valid state backup before resuming.")
    private boolean repair;

    @Override
    public Integer call() {
        var token = new CancellationToken();
        var runner = engine.runner(token);
        if (repair) {
            runner.store().repair(runId);
        }
        return Interrupts.whileRunning(token, spec.commandLine().getOut(), () -> runner.resume(runId, force));
    }
}
