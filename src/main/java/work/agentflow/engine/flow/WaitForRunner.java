package work.agentflow.engine.flow;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.exec.ProcessRunner;
import work.agentflow.engine.model.Step;
import work.agentflow.engine.model.StepAction;
import work.agentflow.engine.runtime.RunContext;
import work.agentflow.engine.shared.DurationParser;
import work.agentflow.engine.shared.ErrorKind;
import work.agentflow.engine.state.ErrorInfo;
import work.agentflow.engine.state.StepResult;
import work.agentflow.engine.state.StepStatus;
import work.agentflow.engine.variables.VariableResolver;

/**
 * Polls a workspace glob until enough files exist. Spawns no process.
 */
final class WaitForRunner {
    private static final Logger log = LoggerFactory.getLogger(WaitForRunner.class);

    private final RunContext ctx;

    WaitForRunner(RunContext ctx) {
        this.ctx = ctx;
    }

    StepResult run(Step step, StepAction.WaitFor wait, Frame frame, VariableResolver resolver) {
        var started = ctx.now();
        var pattern = resolver.resolve(wait.glob(), "wait_for");
        var interval = wait.interval() != null ? wait.interval() : ctx.config().waitPollInterval();
        var timeout = wait.timeout() != null ? wait.timeout() : step.timeout() != null ? step.timeout() : ctx.config().defaultTimeout();
        log.info("Step {} waiting for {} file(s) matching {}", frame.key(step), wait.minCount(), pattern);
        while (true) {
            var matches = ctx.globs().match(pattern);
            var now = ctx.now();
            var waited = Duration.between(started, now);
            if (matches.size() >= wait.minCount()) {
                var json = new LinkedHashMap<String, Object>();
                json.put("matched", matches.size());
                json.put("files", matches.stream().map(ctx.workspace()::relativize).toList());
                json.put("waited_ms", Math.max(0L, waited.toMillis()));
                return new StepResult(StepStatus.COMPLETED, 0, null, null, json, false, false, null, null, 0L, 1, null, null, null, null)
                    .finishedAt(started, now);
            }
            if (waited.compareTo(timeout) >= 0) {
                var error = new ErrorInfo(ErrorKind.TIMEOUT.code(), "Timed out after " + DurationParser.format(timeout) + " waiting for " + wait.minCount() + " file(s) matching " + pattern,
                    Map.of("matched", matches.size()));
                return StepResult.failure(StepStatus.TIMEOUT, error, started, now).withExitCode(ProcessRunner.TIMEOUT_EXIT_CODE).withAttempts(1);
            }
            var remaining = timeout.minus(waited);
            if (!ctx.pause(remaining.compareTo(interval) < 0 ? remaining : interval)) {
                return StepResult.failure(StepStatus.CANCELLED, ErrorInfo.of(ErrorKind.CANCELLED, "Wait cancelled"), started, ctx.now());
            }
        }
    }
}
