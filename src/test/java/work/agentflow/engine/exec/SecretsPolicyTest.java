package work.agentflow.engine.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.agentflow.engine.model.Step;
import work.agentflow.engine.model.StepAction;
import work.agentflow.engine.runtime.WorkflowLoader;
import work.agentflow.engine.shared.WorkflowConfigException;

class SecretsPolicyTest {
    private static final Map<String, String> PARENT = Map.of("PATH", "/bin", "API_TOKEN", "tok", "DB_PASS", "pw", "HOME", "/home/u");

    private static final String WORKFLOW = """
        name: secrets
        secrets: [API_TOKEN]
        steps:
          - name: plain
            command: ["echo"]
          - name: db
            command: ["echo"]
            secrets: [DB_PASS]
          - name: loop
            while:
              condition: {equals: ["a", "b"]}
              max_iterations: 1
              steps:
                - name: inner
                  command: ["echo"]
                  secrets: [NESTED_KEY]
        """;

    private final SecretsPolicy policy = new SecretsPolicy(WorkflowLoader.parse(WORKFLOW), PARENT);

    private static Step step(String name, String... secrets) {
        return Step.of(name, new StepAction.Command(List.of("echo"))).withSecrets(List.of(secrets));
    }

    @Test
    void workflowSecretsAreInheritedStepSecretsOnlyWhereListed() {
        var plain = policy.environment(step("plain"), Map.of());
        assertEquals("tok", plain.get("API_TOKEN"));
        assertFalse(plain.containsKey("DB_PASS"));
        assertEquals("/home/u", plain.get("HOME"));

        var db = policy.environment(step("db", "DB_PASS"), Map.of("EXTRA", "1"));
        assertEquals("pw", db.get("DB_PASS"));
        assertEquals("1", db.get("EXTRA"));
    }

    @Test
    void unsetAllowlistedSecretIsAConfigurationError() {
        assertThrows(WorkflowConfigException.class, () -> policy.environment(step("inner", "NESTED_KEY"), Map.of()));
    }

    @Test
    void envMayNotOverrideASecret() {
        assertThrows(WorkflowConfigException.class, () -> policy.environment(step("plain"), Map.of("DB_PASS", "x")));
    }

    @Test
    void maskerCoversEveryDeclaredSecret() {
        var masked = policy.masker().mask("tok and pw and /home/u");
        assertEquals("*** and *** and /home/u", masked);
    }
}
