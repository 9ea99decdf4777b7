package work.agentflow.engine.variables;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.agentflow.engine.shared.MissingVariableException;
import work.agentflow.engine.shared.WorkflowConfigException;
import work.agentflow.engine.state.StepResult;

/**
 * Substitutes {@code ${namespace.path}} references in user strings. {@code $$} yields a literal
 * {@code $} and {@code ${{...}}} is passed through untouched. Substituted values are not re-scanned.
 */
public final class VariableResolver {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final VariableScope scope;
    private final Set<String> allowMissing;

    public VariableResolver(VariableScope scope, Set<String> allowMissing) {
        this.scope = scope;
        this.allowMissing = allowMissing == null ? Set.of() : Set.copyOf(allowMissing);
    }

    public VariableResolver(VariableScope scope) {
        this(scope, Set.of());
    }

    public VariableScope scope() {
        return scope;
    }

    public boolean allowsMissing(String field) {
        return allowMissing.contains(field);
    }

    public VariableResolver withScope(VariableScope newScope) {
        return new VariableResolver(newScope, allowMissing);
    }

    /**
     * @param field name of the step field being resolved; undefined references fail unless it is allowlisted
     */
    public String resolve(String text, String field) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }
        var out = new StringBuilder(text.length());
        var length = text.length();
        var i = 0;
        while (i < length) {
            var ch = text.charAt(i);
            if (ch != '$' || i + 1 >= length) {
                out.append(ch);
                i++;
                continue;
            }
            var next = text.charAt(i + 1);
            if (next == '$') {
                out.append('$');
                i += 2;
                continue;
            }
            if (next != '{') {
                out.append(ch);
                i++;
                continue;
            }
            if (i + 2 < length && text.charAt(i + 2) == '{') {
                var close = text.indexOf("}}", i + 3);
                var end = close < 0 ? length : close + 2;
                out.append(text, i, end);
                i = end;
                continue;
            }
            var close = text.indexOf('}', i + 2);
            if (close < 0) {
                out.append(text, i, length);
                break;
            }
            var reference = text.substring(i + 2, close).trim();
            var value = lookup(reference);
            if (value.isPresent()) {
                out.append(stringify(value.get()));
            } else if (!allowMissing.contains(field)) {
                throw new MissingVariableException(reference, field);
            }
            i = close + 1;
        }
        return out.toString();
    }

    public List<String> resolveAll(List<String> values, String field) {
        var resolved = new ArrayList<String>(values.size());
        for (var value : values) {
            resolved.add(resolve(value, field));
        }
        return resolved;
    }

    /**
     * Recursively substitutes every string inside maps and lists. Map keys are left as written.
     */
    public Object resolveValue(Object value, String field) {
        if (value instanceof String str) {
            return resolve(str, field);
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), resolveValue(entry.getValue(), field));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(resolveValue(item, field));
            }
            return copy;
        }
        return value;
    }

    /**
     * Resolves a dot-notation pointer ({@code steps.X.json.files}, optionally wrapped in {@code ${}})
     * to its raw value, e.g. a loop item source.
     */
    public Object pointer(String reference, String field) {
        var trimmed = reference.trim();
        if (trimmed.startsWith("${") && trimmed.endsWith("}")) {
            trimmed = trimmed.substring(2, trimmed.length() - 1).trim();
        }
        var ref = trimmed;
        return lookup(ref).orElseThrow(() -> new MissingVariableException(ref, field));
    }

    /**
     * Typed lookup of a reference; empty when the variable is undefined.
     */
    public Optional<Object> lookup(String reference) {
        if (reference == null || reference.isEmpty()) {
            throw new WorkflowConfigException("Empty variable reference");
        }
        var segments = reference.split("\\.", -1);
        for (var segment : segments) {
            if (segment.isEmpty()) {
                return Optional.empty();
            }
        }
        var head = segments[0];
        if (scope.loop().containsKey(head)) {
            return navigate(scope.loop().get(head), segments, 1);
        }
        return switch (head) {
            case VariableScope.STEPS -> lookupStep(segments);
            case VariableScope.CONTEXT -> segments.length < 2 ? Optional.empty() : navigate(scope.context(), segments, 1);
            case VariableScope.RUN -> segments.length < 2 ? Optional.empty() : navigate(scope.run(), segments, 1);
            default -> Optional.empty();
        };
    }

    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String str) {
            return str;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Unable to render variable as JSON", ex);
            }
        }
        return String.valueOf(value);
    }

    private Optional<Object> lookupStep(String[] segments) {
        if (segments.length < 3) {
            return Optional.empty();
        }
        var result = scope.stepResult(segments[1]);
        if (result == null) {
            return Optional.empty();
        }
        var field = segments[2];
        if ("json".equals(field)) {
            return navigate(result.json(), segments, 3);
        }
        if (segments.length > 3) {
            return Optional.empty();
        }
        return Optional.ofNullable(stepField(result, field));
    }

    private static Object stepField(StepResult result, String field) {
        return switch (field) {
            case "exit_code" -> result.exitCode();
            case "status" -> result.status() == null ? null : result.status().key();
            case "output" -> outputText(result);
            case "lines" -> result.lines();
            case "duration" -> BigDecimal.valueOf(result.durationMs()).divide(BigDecimal.valueOf(1000), 3, RoundingMode.HALF_UP);
            case "duration_ms" -> result.durationMs();
            case "truncated" -> result.truncated();
            case "spill_path" -> result.spillPath();
            case "attempts" -> result.attempts();
            default -> null;
        };
    }

    private static Object outputText(StepResult result) {
        if (result.output() != null) {
            return result.output();
        }
        if (result.lines() != null) {
            return String.join("\n", result.lines());
        }
        return result.json() == null ? null : stringify(result.json());
    }

    private static Optional<Object> navigate(Object root, String[] segments, int from) {
        Object current = root;
        for (var i = from; i < segments.length; i++) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segments[i]);
        }
        return Optional.ofNullable(current);
    }
}
