package work.agentflow.engine.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import work.agentflow.engine.exec.ProcessOutcome;
import work.agentflow.engine.exec.ProcessRequest;
import work.agentflow.engine.exec.ProcessRunner;
import work.agentflow.engine.output.RawOutput;

/**
 * In-memory {@link ProcessRunner} for engine tests. {@code argv[0]} picks a tiny built-in program:
 * <ul>
 *   <li>{@code echo ARGS...}: prints the arguments joined by spaces plus a newline</li>
 *   <li>{@code print TEXT}: prints TEXT verbatim</li>
 *   <li>{@code exit CODE [TEXT]}: exits with CODE, optionally printing TEXT</li>
 *   <li>{@code stdin}: prints the stdin payload</li>
 *   <li>{@code touch PATH}: creates a workspace file</li>
 *   <li>{@code block MILLIS}: sleeps, interruptibly, then succeeds</li>
 *   <li>{@code hang}: reports a timeout</li>
 * </ul>
 * Programs registered with {@link #on(String, Program)} take precedence.
 */
public final class ScriptedProcessRunner implements ProcessRunner {
    private final List<ProcessRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Program> programs = new ConcurrentHashMap<>();

    @FunctionalInterface
    public interface Program {
        ProcessOutcome run(ProcessRequest request) throws InterruptedException;
    }

    public ScriptedProcessRunner on(String name, Program program) {
        programs.put(name, program);
        return this;
    }

    public List<ProcessRequest> requests() {
        return List.copyOf(requests);
    }

    public List<List<String>> invocations() {
        var argvs = new ArrayList<List<String>>();
        for (var request : requests) {
            argvs.add(request.argv());
        }
        return argvs;
    }

    public static ProcessOutcome ok(String stdout) {
        return new ProcessOutcome(0, false, RawOutput.of(stdout), "", 1L);
    }

    public static ProcessOutcome exit(int code, String stdout, String stderr) {
        return new ProcessOutcome(code, false, RawOutput.of(stdout), stderr, 1L);
    }

    @Override
    public ProcessOutcome run(ProcessRequest request) throws InterruptedException {
        requests.add(request);
        var argv = request.argv();
        var name = argv.get(0);
        var custom = programs.get(name);
        if (custom != null) {
            return custom.run(request);
        }
        var args = argv.subList(1, argv.size());
        switch (name) {
            case "echo":
                return ok(String.join(" ", args) + "\n");
            case "print":
                return ok(args.isEmpty() ? "" : args.get(0));
            case "exit":
                return exit(Integer.parseInt(args.get(0)), args.size() > 1 ? args.get(1) : "", "exit requested");
            case "stdin":
                return ok(request.stdin() == null ? "" : request.stdin());
            case "touch":
                try {
                    var file = request.workingDirectory().resolve(args.get(0));
                    Files.createDirectories(file.getParent());
                    Files.writeString(file, "");
                } catch (IOException ex) {
                    throw new UncheckedIOException(ex);
                }
                return ok("");
            case "block":
                Thread.sleep(Long.parseLong(args.get(0)));
                return ok("done\n");
            case "hang":
                return new ProcessOutcome(TIMEOUT_EXIT_CODE, true, RawOutput.empty(), "", request.timeout().toMillis());
            default:
                return exit(127, "", name + ": command not found");
        }
    }
}
