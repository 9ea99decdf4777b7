package work.agentflow.engine.flow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.model.ItemFailurePolicy;
import work.agentflow.engine.model.JoinPolicy;
import work.agentflow.engine.model.Step;
import work.agentflow.engine.model.StepAction;
import work.agentflow.engine.runtime.RunContext;
import work.agentflow.engine.shared.DurationParser;
import work.agentflow.engine.shared.ErrorKind;
import work.agentflow.engine.shared.WorkflowConfigException;
import work.agentflow.engine.state.ErrorInfo;
import work.agentflow.engine.state.IterationRecord;
import work.agentflow.engine.state.LoopState;
import work.agentflow.engine.state.StepResult;
import work.agentflow.engine.state.StepStatus;
import work.agentflow.engine.state.TerminationReason;
import work.agentflow.engine.variables.VariableResolver;

/**
 * Runs {@code for_each} steps sequentially or on a bounded worker pool. Every item ends with exactly
 * one iteration record, so completed + failed + skipped always equals the item count.
 */
final class ForEachRunner {
    private static final Logger log = LoggerFactory.getLogger(ForEachRunner.class);
    private static final Duration SHUTDOWN_SLACK = Duration.ofSeconds(5);

    private final RunContext ctx;
    private final SequenceRunner sequence;

    ForEachRunner(RunContext ctx, SequenceRunner sequence) {
        this.ctx = ctx;
        this.sequence = sequence;
    }

    StepResult run(Step step, StepAction.ForEach loop, Frame frame, VariableResolver resolver) {
        var started = ctx.now();
        var items = items(loop, resolver);
        var loopKey = frame.key(step);
        var previous = ctx.resuming() ? ctx.state().loop(loopKey) : null;
        ctx.state().putLoop(loopKey, LoopState.forEach(items));
        var results = new ConcurrentHashMap<Integer, IterationRecord>();
        if (previous != null && Objects.equals(previous.items(), items)) {
            for (var record : previous.iterations()) {
                if (record.status() == StepStatus.COMPLETED) {
                    results.put(record.index(), record);
                    ctx.state().recordIteration(loopKey, record);
                }
            }
            log.info("Loop {} resumes with {} completed iteration(s) reused", loopKey, results.size());
        }
        ctx.persist();
        log.info("Loop {} starts over {} item(s){}", loopKey, items.size(), loop.parallel() ? " with " + loop.maxWorkers() + " worker(s)" : "");

        var control = loop.parallel()
            ? runParallel(loop, frame, loopKey, items, results, started)
            : runSequential(loop, frame, loopKey, items, results, started);

        for (var i = 0; i < items.size(); i++) {
            if (!results.containsKey(i)) {
                var record = new IterationRecord(i, items.get(i), StepStatus.SKIPPED, Map.of(), 0L);
                results.put(i, record);
                ctx.state().recordIteration(loopKey, record);
            }
        }
        return finish(loop, loopKey, items.size(), results, control, started);
    }

    private List<Object> items(StepAction.ForEach loop, VariableResolver resolver) {
        Object source = loop.items() != null
            ? resolver.resolveValue(loop.items(), "for_each")
            : resolver.pointer(loop.itemsFrom(), "items_from");
        if (!(source instanceof List<?> list)) {
            throw new WorkflowConfigException("for_each items_from '" + loop.itemsFrom() + "' does not reference a list");
        }
        return new ArrayList<>(list);
    }

    private LoopControl runSequential(StepAction.ForEach loop, Frame frame, String loopKey, List<Object> items, Map<Integer, IterationRecord> results, Instant started) {
        var control = new LoopControl();
        for (var i = 0; i < items.size(); i++) {
            if (results.containsKey(i)) {
                continue;
            }
            if (ctx.cancelRequested()) {
                control.reason = TerminationReason.CANCELLED;
                break;
            }
            var iteration = frame.iteration(loopKey, i, loop.alias(), items.get(i), LoopSupport.loopVars(i, items.size(), started, ctx.now()), ctx.now());
            var result = sequence.runIteration(loop.body(), iteration);
            results.put(i, result.record());
            if (control.observe(loop, result)) {
                break;
            }
        }
        return control;
    }

    private LoopControl runParallel(StepAction.ForEach loop, Frame frame, String loopKey, List<Object> items, Map<Integer, IterationRecord> results, Instant started) {
        var control = new LoopControl();
        var pending = new ArrayList<Integer>();
        for (var i = 0; i < items.size(); i++) {
            if (!results.containsKey(i)) {
                pending.add(i);
            }
        }
        if (pending.isEmpty()) {
            return control;
        }
        var succeeded = (int) results.values().stream().filter(r -> r.status() == StepStatus.COMPLETED).count();
        var stop = new AtomicBoolean();
        var frames = new ConcurrentHashMap<Integer, Frame>();
        var threads = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(loop.maxWorkers(), pending.size()), runnable -> {
            var thread = new Thread(runnable, "agentflow-" + loopKey.replace('/', '-') + "-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        CompletionService<IterationResult> completion = new ExecutorCompletionService<>(pool);
        for (var index : pending) {
            completion.submit(() -> {
                if (stop.get() || ctx.cancelRequested()) {
                    return null;
                }
                var iteration = frame.iteration(loopKey, index, loop.alias(), items.get(index), LoopSupport.loopVars(index, items.size(), started, ctx.now()), ctx.now());
                frames.put(index, iteration);
                if (stop.get()) {
                    iteration.abandon();
                    return null;
                }
                return sequence.runIteration(loop.body(), iteration);
            });
        }
        var deadline = loop.joinTimeout() == null ? Long.MAX_VALUE : System.nanoTime() + loop.joinTimeout().toNanos();
        var abandon = false;
        try {
            for (var received = 0; received < pending.size(); received++) {
                Future<IterationResult> done = loop.joinTimeout() == null
                    ? completion.take()
                    : completion.poll(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                if (done == null) {
                    log.warn("Loop {} join timed out after {}", loopKey, DurationParser.format(loop.joinTimeout()));
                    control.reason = TerminationReason.TIMEOUT;
                    control.timedOut = true;
                    abandon = true;
                    break;
                }
                var result = await(done);
                if (result == null) {
                    continue;
                }
                results.put(result.record().index(), result.record());
                if (result.record().status() == StepStatus.COMPLETED) {
                    succeeded++;
                }
                if (control.observe(loop, result)) {
                    stop.set(true);
                }
                if (loop.join() != JoinPolicy.ALL && loop.join().satisfied(succeeded, items.size())) {
                    log.info("Loop {} join policy {} satisfied", loopKey, loop.join().name().toLowerCase(Locale.ROOT));
                    abandon = true;
                    break;
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            control.reason = TerminationReason.CANCELLED;
            abandon = true;
        } finally {
            stop.set(true);
            if (abandon) {
                frames.forEach((index, iteration) -> {
                    if (!results.containsKey(index)) {
                        iteration.abandon();
                    }
                });
                pool.shutdownNow();
            } else {
                pool.shutdown();
            }
            awaitTermination(pool, loopKey);
        }
        frames.forEach((index, iteration) -> {
            if (!results.containsKey(index)) {
                var record = new IterationRecord(index, items.get(index), StepStatus.CANCELLED, iteration.results(), 0L);
                results.put(index, record);
                ctx.state().recordIteration(loopKey, record);
            }
        });
        return control;
    }

    private static IterationResult await(Future<IterationResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Loop iteration failed", ex.getCause());
        }
    }

    private void awaitTermination(ExecutorService pool, String loopKey) {
        var limit = ctx.config().killGrace().plus(SHUTDOWN_SLACK);
        try {
            if (!pool.awaitTermination(limit.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Loop {} workers still busy after {}", loopKey, limit);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private StepResult finish(StepAction.ForEach loop, String loopKey, int total, Map<Integer, IterationRecord> results, LoopControl control, Instant started) {
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        int cancelled = 0;
        for (var record : results.values()) {
            switch (record.status()) {
                case COMPLETED -> completed++;
                case SKIPPED -> skipped++;
                case CANCELLED -> {
                    cancelled++;
                    failed++;
                }
                default -> failed++;
            }
        }
        var finished = ctx.now();
        var summary = new LinkedHashMap<String, Object>();
        summary.put("total", total);
        summary.put("completed", completed);
        summary.put("failed", failed);
        summary.put("skipped", skipped);
        summary.put("cancelled", cancelled);
        summary.put("success_rate", LoopSupport.successRate(completed, total));
        summary.put("duration_ms", Math.max(0L, finished.toEpochMilli() - started.toEpochMilli()));
        if (loop.parallel()) {
            summary.put("join", loop.join().name().toLowerCase(Locale.ROOT));
        }
        if (control.reason != null) {
            summary.put("termination_reason", control.reason.key());
            ctx.state().terminateLoop(loopKey, control.reason);
        }
        ctx.state().loopSummary(loopKey, summary);

        StepStatus status;
        ErrorInfo error = null;
        if (control.reason == TerminationReason.CANCELLED) {
            status = StepStatus.CANCELLED;
            error = ErrorInfo.of(ErrorKind.CANCELLED, "Loop cancelled");
        } else if (control.timedOut) {
            status = StepStatus.TIMEOUT;
            error = ErrorInfo.of(ErrorKind.TIMEOUT, "Loop join timed out after " + DurationParser.format(loop.joinTimeout()));
        } else if (succeeded(loop, completed, failed, total)) {
            status = StepStatus.COMPLETED;
        } else {
            status = StepStatus.FAILED;
            error = new ErrorInfo(ErrorKind.EXECUTION.code(), failed + " of " + total + " iterations failed", Map.of("failed", failed, "total", total));
        }
        log.info("Loop {} finished: {} completed, {} failed, {} skipped", loopKey, completed, failed, skipped);
        return LoopSupport.loopResult(status, summary, error, started, finished);
    }

    private static boolean succeeded(StepAction.ForEach loop, int completed, int failed, int total) {
        if (loop.parallel() && loop.join() != JoinPolicy.ALL) {
            return total == 0 || loop.join().satisfied(completed, total);
        }
        return loop.onItemFailure() == ItemFailurePolicy.IGNORE || failed == 0;
    }

    /** Why iteration stopped early, filled in as results arrive. */
    private static final class LoopControl {
        private TerminationReason reason;
        private boolean timedOut;

        /**
         * @return true when no further iterations should start
         */
        boolean observe(StepAction.ForEach loop, IterationResult result) {
            var outcome = result.outcome();
            if (outcome.kind() == SequenceOutcome.Kind.CANCELLED) {
                reason = TerminationReason.CANCELLED;
                return true;
            }
            if (outcome.isSignal(FlowSignal.BREAK)) {
                if (reason == null) {
                    reason = TerminationReason.EXPLICIT_BREAK;
                }
                return true;
            }
            return result.record().status() != StepStatus.COMPLETED && loop.onItemFailure() == ItemFailurePolicy.STOP;
        }
    }
}
