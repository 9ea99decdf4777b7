package work.agentflow.engine.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Closed set of execution kinds a step can declare. The engine dispatches on the concrete record.
 */
public sealed interface StepAction {

    StepKind kind();

    /** Raw argv, executed without a shell. */
    record Command(List<String> argv) implements StepAction {
        public Command {
            argv = List.copyOf(argv);
            if (argv.isEmpty()) {
                throw new IllegalArgumentException("command must not be empty");
            }
        }

        @Override
        public StepKind kind() {
            return StepKind.COMMAND;
        }
    }

    /**
     * Invocation of a named provider template. The prompt comes from {@code inputFile} (read verbatim)
     * or from the inline {@code prompt} string (variable-substituted).
     */
    record Provider(String provider, Map<String, Object> params, String inputFile, String prompt) implements StepAction {
        public Provider {
            Objects.requireNonNull(provider, "provider");
            params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        }

        @Override
        public StepKind kind() {
            return StepKind.PROVIDER;
        }
    }

    /**
     * Iterates over {@code items} or the list found at the {@code itemsFrom} pointer.
     */
    record ForEach(
        List<Object> items,
        String itemsFrom,
        String alias,
        StepList body,
        boolean parallel,
        int maxWorkers,
        JoinPolicy join,
        Duration joinTimeout,
        ItemFailurePolicy onItemFailure
    ) implements StepAction {
        public static final String DEFAULT_ALIAS = "item";

        public ForEach {
            if ((items == null) == (itemsFrom == null)) {
                throw new IllegalArgumentException("for_each needs exactly one of items or items_from");
            }
            items = items == null ? null : Collections.unmodifiableList(new ArrayList<>(items));
            alias = alias == null || alias.isBlank() ? DEFAULT_ALIAS : alias;
            body = body == null ? StepList.empty() : body;
            maxWorkers = Math.max(1, maxWorkers);
            join = join == null ? JoinPolicy.ALL : join;
            onItemFailure = onItemFailure == null ? ItemFailurePolicy.STOP : onItemFailure;
        }

        @Override
        public StepKind kind() {
            return StepKind.FOR_EACH;
        }
    }

    /**
     * Repeats {@code body} while {@code condition} holds, bounded by iteration count and wall time.
     */
    record While(Condition condition, int maxIterations, Duration maxDuration, Duration delay, StepList body) implements StepAction {
        public static final int DEFAULT_MAX_ITERATIONS = 100;

        public While {
            Objects.requireNonNull(condition, "condition");
            maxIterations = maxIterations <= 0 ? DEFAULT_MAX_ITERATIONS : maxIterations;
            delay = delay == null ? Duration.ZERO : delay;
            body = body == null ? StepList.empty() : body;
        }

        @Override
        public StepKind kind() {
            return StepKind.WHILE;
        }
    }

    /** Blocks until {@code minCount} files match {@code glob} or the timeout elapses. */
    record WaitFor(String glob, int minCount, Duration interval, Duration timeout) implements StepAction {
        public WaitFor {
            Objects.requireNonNull(glob, "glob");
            minCount = Math.max(1, minCount);
        }

        @Override
        public StepKind kind() {
            return StepKind.WAIT_FOR;
        }
    }
}
