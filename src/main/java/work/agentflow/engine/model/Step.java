package work.agentflow.engine.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A single workflow step. Exactly one {@link StepAction} describes what it executes.
 *
 * @param timeout       process timeout, {@code null} for the engine default
 * @param allowMissing  fields whose undefined variables resolve to the empty string
 */
public record Step(
    String name,
    StepAction action,
    Condition when,
    Transitions on,
    DependencySpec dependsOn,
    RetryPolicy retry,
    Duration timeout,
    OutputSpec output,
    Map<String, String> env,
    List<String> secrets,
    Set<String> allowMissing
) {
    public Step {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(action, "action");
        on = on == null ? Transitions.none() : on;
        retry = retry == null ? RetryPolicy.none() : retry;
        output = output == null ? OutputSpec.defaults() : output;
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
        secrets = secrets == null ? List.of() : List.copyOf(secrets);
        allowMissing = allowMissing == null ? Set.of() : Set.copyOf(allowMissing);
    }

    public static Step of(String name, StepAction action) {
        return new Step(name, action, null, null, null, null, null, null, null, null, null);
    }

    public Step withWhen(Condition condition) {
        return new Step(name, action, condition, on, dependsOn, retry, timeout, output, env, secrets, allowMissing);
    }

    public Step withOn(Transitions transitions) {
        return new Step(name, action, when, transitions, dependsOn, retry, timeout, output, env, secrets, allowMissing);
    }

    public Step withDependsOn(DependencySpec spec) {
        return new Step(name, action, when, on, spec, retry, timeout, output, env, secrets, allowMissing);
    }

    public Step withRetry(RetryPolicy policy) {
        return new Step(name, action, when, on, dependsOn, policy, timeout, output, env, secrets, allowMissing);
    }

    public Step withTimeout(Duration value) {
        return new Step(name, action, when, on, dependsOn, retry, value, output, env, secrets, allowMissing);
    }

    public Step withOutput(OutputSpec spec) {
        return new Step(name, action, when, on, dependsOn, retry, timeout, spec, env, secrets, allowMissing);
    }

    public Step withEnv(Map<String, String> values) {
        return new Step(name, action, when, on, dependsOn, retry, timeout, output, values, secrets, allowMissing);
    }

    public Step withSecrets(List<String> names) {
        return new Step(name, action, when, on, dependsOn, retry, timeout, output, env, names, allowMissing);
    }

    public Step withAllowMissing(Set<String> fields) {
        return new Step(name, action, when, on, dependsOn, retry, timeout, output, env, secrets, fields);
    }

    public boolean allowsMissing(String field) {
        return allowMissing.contains(field);
    }
}
