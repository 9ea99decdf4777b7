package work.agentflow.engine.cli;

import java.io.PrintWriter;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.api.RunResult;
import work.agentflow.engine.runtime.CancellationToken;

/**
 * Turns Ctrl-C into cooperative cancellation: the shutdown hook flips the run's token and waits
 * briefly for the engine to record the cancelled state.
 */
final class Interrupts {
    private static final Logger log = LoggerFactory.getLogger(Interrupts.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private Interrupts() {}

    static int whileRunning(CancellationToken token, PrintWriter out, Supplier<RunResult> run) {
        var finished = new CountDownLatch(1);
        var hook = new Thread(() -> {
            token.cancel();
            try {
                finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "agentflow-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            var result = run.get();
            out.println(result.toPrettyJson());
            out.flush();
            return result.exitCode();
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            log.debug("Shutdown in progress; leaving the interrupt hook registered");
        }
    }
}
