package work.agentflow.engine.exec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import work.agentflow.engine.model.Step;
import work.agentflow.engine.model.StepAction;
import work.agentflow.engine.model.StepList;
import work.agentflow.engine.model.Workflow;
import work.agentflow.engine.shared.WorkflowConfigException;

/**
 * Builds child environments. The parent environment is inherited minus every secret the workflow
 * declares anywhere; only secrets allowlisted at workflow or step scope are copied back in.
 */
public final class SecretsPolicy {
    private final Map<String, String> parentEnvironment;
    private final Set<String> workflowAllowed;
    private final Set<String> declared;

    public SecretsPolicy(Workflow workflow, Map<String, String> parentEnvironment) {
        this.parentEnvironment = Map.copyOf(parentEnvironment);
        this.workflowAllowed = new LinkedHashSet<>(workflow.secrets());
        this.declared = new LinkedHashSet<>(workflow.secrets());
        collect(workflow.steps(), declared);
    }

    public Map<String, String> environment(Step step, Map<String, String> stepEnvironment) {
        var environment = new HashMap<>(parentEnvironment);
        environment.keySet().removeAll(declared);
        var allowed = new LinkedHashSet<>(workflowAllowed);
        allowed.addAll(step.secrets());
        for (var name : allowed) {
            var value = parentEnvironment.get(name);
            if (value == null) {
                throw new WorkflowConfigException("Secret '" + name + "' is allowlisted for step '" + step.name() + "' but not set", Map.of("secret", name));
            }
            environment.put(name, value);
        }
        for (var entry : stepEnvironment.entrySet()) {
            if (declared.contains(entry.getKey())) {
                throw new WorkflowConfigException("env of step '" + step.name() + "' may not set secret '" + entry.getKey() + "'", Map.of("secret", entry.getKey()));
            }
            environment.put(entry.getKey(), entry.getValue());
        }
        return environment;
    }

    /** Masks the value of every declared secret present in the parent environment. */
    public SecretMasker masker() {
        var values = new ArrayList<String>();
        for (var name : declared) {
            var value = parentEnvironment.get(name);
            if (value != null) {
                values.add(value);
            }
        }
        return new SecretMasker(values);
    }

    public Map<String, String> parentEnvironment() {
        return parentEnvironment;
    }

    private static void collect(StepList steps, Set<String> names) {
        for (var step : steps) {
            names.addAll(step.secrets());
            if (step.action() instanceof StepAction.ForEach forEach) {
                collect(forEach.body(), names);
            } else if (step.action() instanceof StepAction.While loop) {
                collect(loop.body(), names);
            }
        }
    }
}
