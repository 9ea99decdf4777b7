package work.agentflow.engine.cli;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Map;
import picocli.CommandLine;
import work.agentflow.engine.shared.EngineException;

/**
 * Prints engine failures as {@code <kind>: <message>} plus their details, one per line. Stack traces
 * only appear with {@code -Dagentflow.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "agentflow.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        var colors = commandLine.getColorScheme();
        Throwable cause = ex instanceof UncheckedIOException unchecked && unchecked.getCause() != null ? unchecked.getCause() : ex;
        if (cause instanceof EngineException engine) {
            err.println(colors.errorText(engine.kind().code() + ": " + engine.getMessage()));
            printDetails(err, engine.details());
        } else {
            var message = cause.getMessage();
            err.println(colors.errorText(message == null || message.isBlank() ? cause.getClass().getSimpleName() : message));
        }
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(err);
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    private static void printDetails(PrintWriter err, Map<String, Object> details) {
        for (var entry : details.entrySet()) {
            err.println("  " + entry.getKey() + ": " + entry.getValue());
        }
    }
}
