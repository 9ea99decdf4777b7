package work.agentflow.engine.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "agentflow",
    description = "Run, resume and cancel file-based agent workflows.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {RunCommand.class, ResumeCommand.class, CancelCommand.class}
)
final class AgentflowCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: run, resume or cancel.");
    }
}
