package work.agentflow.engine.exec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One process spawn: argv executed without a shell, full child environment, optional stdin payload.
 *
 * @param stdoutSpill file receiving the complete stdout once it outgrows {@code memoryLimit}
 */
public record ProcessRequest(
    List<String> argv,
    Path workingDirectory,
    Map<String, String> environment,
    String stdin,
    Duration timeout,
    Duration killGrace,
    Path stdoutSpill,
    int memoryLimit
) {
    public ProcessRequest {
        argv = List.copyOf(argv);
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(killGrace, "killGrace");
    }
}
