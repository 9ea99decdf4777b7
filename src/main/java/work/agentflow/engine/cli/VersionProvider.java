package work.agentflow.engine.cli;

import picocli.CommandLine;
import work.agentflow.engine.state.RunState;

/**
 * Reports the jar's implementation version, the state document schema it writes and the JVM.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String UNRELEASED = "development";

    @Override
    public String[] getVersion() {
        var implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "agentflow " + (implementationVersion != null ? implementationVersion : UNRELEASED),
            "state schema " + RunState.SCHEMA_VERSION,
            "JVM ${java.version} (${java.vendor} ${java.vm.name})"
        };
    }
}
