package work.agentflow.engine.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable in-memory representation of a validated workflow document.
 */
public record Workflow(
    String name,
    String version,
    boolean strictFlow,
    Map<String, ProviderTemplate> providers,
    Map<String, Object> context,
    List<String> secrets,
    StepList steps,
    Path source,
    String checksum
) {
    public Workflow {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(steps, "steps");
        providers = providers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        secrets = secrets == null ? List.of() : List.copyOf(secrets);
    }

    public ProviderTemplate provider(String providerName) {
        return providers.get(providerName);
    }
}
