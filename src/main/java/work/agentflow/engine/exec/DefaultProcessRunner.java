package work.agentflow.engine.exec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.output.CaptureBuffer;
import work.agentflow.engine.shared.EngineException;
import work.agentflow.engine.shared.ErrorKind;

/**
 * {@link ProcessBuilder}-based runner. Streams are drained on helper threads; on timeout the process
 * tree gets a terminate signal, then a kill after the grace period.
 */
public final class DefaultProcessRunner implements ProcessRunner {
    private static final Logger log = LoggerFactory.getLogger(DefaultProcessRunner.class);
    private static final int STDERR_LIMIT = 64 * 1024;
    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

    @Override
    public ProcessOutcome run(ProcessRequest request) throws InterruptedException {
        var builder = new ProcessBuilder(request.argv()).directory(request.workingDirectory().toFile());
        builder.environment().clear();
        builder.environment().putAll(request.environment());
        var started = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new EngineException(
                ErrorKind.EXECUTION,
                "Failed to start '" + request.argv().get(0) + "': " + ex.getMessage(),
                Map.of("program", request.argv().get(0)),
                ex
            );
        }
        var stdout = new CaptureBuffer(request.memoryLimit(), request.stdoutSpill());
        ExecutorService executor = Executors.newFixedThreadPool(3, runnable -> {
            var thread = new Thread(runnable, "agentflow-process-io");
            thread.setDaemon(true);
            return thread;
        });
        try {
            Future<?> stdoutFuture = executor.submit(() -> {
                try (InputStream input = process.getInputStream(); stdout) {
                    input.transferTo(stdout);
                }
                return null;
            });
            Future<String> stderrFuture = executor.submit(() -> readBounded(process.getErrorStream()));
            Future<?> stdinFuture = executor.submit(() -> {
                writeStdin(process, request.stdin());
                return null;
            });
            var timedOut = false;
            if (!process.waitFor(request.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                timedOut = true;
                log.warn("Process {} exceeded timeout {}; terminating", request.argv().get(0), request.timeout());
                terminate(process, request.killGrace());
            }
            var exitCode = timedOut ? TIMEOUT_EXIT_CODE : process.exitValue();
            await(stdoutFuture, "stdout");
            var stderr = await(stderrFuture, "stderr");
            await(stdinFuture, "stdin");
            closeCapture(stdout);
            var elapsed = Duration.ofNanos(System.nanoTime() - started).toMillis();
            return new ProcessOutcome(exitCode, timedOut, stdout.result(), stderr, elapsed);
        } catch (InterruptedException ex) {
            killTree(process);
            throw ex;
        } finally {
            executor.shutdownNow();
        }
    }

    private static void writeStdin(Process process, String payload) {
        try (var output = process.getOutputStream()) {
            if (payload != null) {
                output.write(payload.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException ex) {
            log.debug("Process closed stdin early: {}", ex.getMessage());
        }
    }

    private static String readBounded(InputStream stream) throws IOException {
        try (InputStream input = stream) {
            var buffer = new ByteArrayOutputStream();
            var chunk = new byte[8192];
            int read;
            while ((read = input.read(chunk)) >= 0) {
                var room = STDERR_LIMIT - buffer.size();
                if (room > 0) {
                    buffer.write(chunk, 0, Math.min(room, read));
                }
            }
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }

    private static void terminate(Process process, Duration grace) throws InterruptedException {
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        process.destroy();
        descendants.forEach(ProcessHandle::destroy);
        if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Process {} ignored terminate signal; killing", process.pid());
            process.destroyForcibly();
            descendants.forEach(ProcessHandle::destroyForcibly);
            process.waitFor();
        } else {
            descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        }
    }

    private static void closeCapture(CaptureBuffer stdout) {
        try {
            stdout.close();
        } catch (IOException ex) {
            throw new EngineException(ErrorKind.EXECUTION, "Failed to store process stdout: " + ex.getMessage(), Map.of(), ex);
        }
    }

    private static void killTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static <T> T await(Future<T> future, String stream) throws InterruptedException {
        try {
            return future.get(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Gave up draining {} after {}; a child process may still hold it open", stream, DRAIN_TIMEOUT);
            return null;
        } catch (ExecutionException ex) {
            throw new EngineException(ErrorKind.EXECUTION, "Failed to capture process " + stream + ": " + ex.getCause().getMessage(), Map.of("stream", stream), ex.getCause());
        }
    }
}
