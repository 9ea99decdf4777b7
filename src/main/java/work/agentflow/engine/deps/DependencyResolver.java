package work.agentflow.engine.deps;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.model.DependencySpec;
import work.agentflow.engine.shared.DependencyException;
import work.agentflow.engine.variables.VariableResolver;

/**
 * Validates a step's {@code depends_on} block. A required pattern without matches fails the step
 * before anything is spawned; an empty optional pattern is accepted.
 */
public final class DependencyResolver {
    public static final String FIELD = "depends_on";
    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final GlobMatcher globs;

    public DependencyResolver(GlobMatcher globs) {
        this.globs = globs;
    }

    public ResolvedDependencies resolve(DependencySpec spec, VariableResolver resolver) {
        if (spec == null) {
            return ResolvedDependencies.none();
        }
        var required = new ArrayList<Path>();
        for (var pattern : spec.required()) {
            var resolved = resolver.resolve(pattern, FIELD);
            var matches = globs.match(resolved);
            if (matches.isEmpty()) {
                throw new DependencyException(pattern, resolved);
            }
            log.debug("Required dependency '{}' matched {} file(s)", resolved, matches.size());
            required.addAll(matches);
        }
        var optional = new ArrayList<Path>();
        for (var pattern : spec.optional()) {
            var resolved = resolver.resolve(pattern, FIELD);
            List<Path> matches = globs.match(resolved);
            log.debug("Optional dependency '{}' matched {} file(s)", resolved, matches.size());
            optional.addAll(matches);
        }
        return new ResolvedDependencies(required, optional);
    }
}
