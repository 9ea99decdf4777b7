package work.agentflow.engine.deps;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Files matched by a step's required and optional patterns, in pattern order.
 */
public record ResolvedDependencies(List<Path> required, List<Path> optional) {
    private static final ResolvedDependencies NONE = new ResolvedDependencies(List.of(), List.of());

    public ResolvedDependencies {
        required = List.copyOf(required);
        optional = List.copyOf(optional);
    }

    public static ResolvedDependencies none() {
        return NONE;
    }

    /** Required then optional matches, without duplicates. */
    public List<Path> all() {
        var merged = new LinkedHashSet<Path>(required);
        merged.addAll(optional);
        return new ArrayList<>(merged);
    }

    public boolean isEmpty() {
        return required.isEmpty() && optional.isEmpty();
    }
}
