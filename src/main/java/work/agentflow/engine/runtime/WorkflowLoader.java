package work.agentflow.engine.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import work.agentflow.engine.model.Condition;
import work.agentflow.engine.model.DependencySpec;
import work.agentflow.engine.model.ItemFailurePolicy;
import work.agentflow.engine.model.JoinPolicy;
import work.agentflow.engine.model.OutputSpec;
import work.agentflow.engine.model.ProviderTemplate;
import work.agentflow.engine.model.RetryPolicy;
import work.agentflow.engine.model.Step;
import work.agentflow.engine.model.StepAction;
import work.agentflow.engine.model.StepList;
import work.agentflow.engine.model.Transition;
import work.agentflow.engine.model.Transitions;
import work.agentflow.engine.model.Workflow;
import work.agentflow.engine.shared.DurationParser;
import work.agentflow.engine.shared.WorkflowConfigException;
import work.agentflow.engine.variables.VariableScope;

/**
 * Loads and validates workflow documents (YAML) into an immutable {@link Workflow}.
 */
public final class WorkflowLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Set<String> TOP_LEVEL_KEYS = Set.of("version", "name", "strict_flow", "secrets", "context", "providers", "steps");
    private static final Set<String> STEP_KEYS = Set.of(
        "name", "command", "provider", "provider_params", "input_file", "prompt", "output_capture", "allow_parse_error",
        "output_file", "timeout", "retries", "env", "secrets", "allow_missing", "when", "depends_on", "on",
        "for_each", "while", "wait_for"
    );
    private static final List<String> KIND_KEYS = List.of("command", "provider", "for_each", "while", "wait_for");
    private static final int MAX_CONDITION_DEPTH = 50;
    private static final Pattern STEP_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

    private WorkflowLoader() {}

    public static Workflow load(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new WorkflowConfigException("Failed to read workflow: " + path, ex);
        }
        return parse(bytes, path.toAbsolutePath().normalize());
    }

    public static Workflow parse(String yaml) {
        return parse(yaml.getBytes(StandardCharsets.UTF_8), null);
    }

    public static String checksum(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 unavailable", ex);
        }
    }

    private static Workflow parse(byte[] bytes, Path source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(bytes);
        } catch (JsonProcessingException ex) {
            throw new WorkflowConfigException("Invalid workflow YAML: " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new WorkflowConfigException("Failed to parse workflow", ex);
        }
        if (root == null || !root.isObject()) {
            throw new WorkflowConfigException("Workflow document must be a mapping");
        }
        checkKeys(root, TOP_LEVEL_KEYS, "workflow");
        var name = root.hasNonNull("name") ? text(root.get("name"), "name") : defaultName(source);
        var version = root.hasNonNull("version") ? root.get("version").asText() : "1";
        var strict = !root.hasNonNull("strict_flow") || bool(root.get("strict_flow"), "strict_flow");
        var secrets = strings(root.get("secrets"), "secrets");
        var context = root.hasNonNull("context") ? map(root.get("context"), "context") : Map.<String, Object>of();
        var providers = providers(root.get("providers"));
        if (!root.hasNonNull("steps")) {
            throw new WorkflowConfigException("Workflow must declare steps");
        }
        var steps = stepList(root.get("steps"), "steps", false, providers);
        if (steps.isEmpty()) {
            throw new WorkflowConfigException("Workflow must declare at least one step");
        }
        return new Workflow(name, version, strict, providers, context, secrets, steps, source, checksum(bytes));
    }

    private static String defaultName(Path source) {
        if (source == null) {
            return "workflow";
        }
        var file = source.getFileName().toString();
        var dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    private static Map<String, ProviderTemplate> providers(JsonNode node) {
        var providers = new LinkedHashMap<String, ProviderTemplate>();
        if (node == null || node.isNull()) {
            return providers;
        }
        requireObject(node, "providers");
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            var path = "providers." + entry.getKey();
            var body = entry.getValue();
            requireObject(body, path);
            checkKeys(body, Set.of("command", "defaults", "input"), path);
            var command = strings(body.get("command"), path + ".command");
            if (command.isEmpty()) {
                throw new WorkflowConfigException(path + ".command must be a non-empty list");
            }
            ProviderTemplate.PromptTransport transport;
            try {
                transport = ProviderTemplate.PromptTransport.from(body.hasNonNull("input") ? body.get("input").asText() : null);
            } catch (IllegalArgumentException ex) {
                throw new WorkflowConfigException(path + ": " + ex.getMessage(), ex);
            }
            var tokens = 0;
            for (var element : command) {
                if (element.equals(ProviderTemplate.PROMPT_TOKEN)) {
                    tokens++;
                } else if (element.contains(ProviderTemplate.PROMPT_TOKEN)) {
                    throw new WorkflowConfigException(path + ": " + ProviderTemplate.PROMPT_TOKEN + " must be a whole argument");
                }
            }
            if (transport == ProviderTemplate.PromptTransport.ARGV && tokens != 1) {
                throw new WorkflowConfigException(path + ": argv transport needs exactly one " + ProviderTemplate.PROMPT_TOKEN + " argument");
            }
            if (transport == ProviderTemplate.PromptTransport.STDIN && tokens != 0) {
                throw new WorkflowConfigException(path + ": " + ProviderTemplate.PROMPT_TOKEN + " is only allowed with argv transport");
            }
            var defaults = body.hasNonNull("defaults") ? map(body.get("defaults"), path + ".defaults") : Map.<String, Object>of();
            providers.put(entry.getKey(), new ProviderTemplate(entry.getKey(), command, defaults, transport));
        }
        return providers;
    }

    private static StepList stepList(JsonNode node, String path, boolean insideLoop, Map<String, ProviderTemplate> providers) {
        if (!node.isArray()) {
            throw new WorkflowConfigException(path + " must be a list of steps");
        }
        var steps = new ArrayList<Step>();
        var names = new LinkedHashSet<String>();
        for (var i = 0; i < node.size(); i++) {
            var step = step(node.get(i), path + "[" + i + "]", insideLoop, providers);
            if (!names.add(step.name())) {
                throw new WorkflowConfigException("Duplicate step name '" + step.name() + "' in " + path);
            }
            steps.add(step);
        }
        var list = new StepList(steps);
        for (var step : list) {
            for (var transition : new Transition[] {step.on().success(), step.on().failure(), step.on().always()}) {
                validateTarget(transition, step, list, insideLoop);
            }
        }
        return list;
    }

    private static void validateTarget(Transition transition, Step step, StepList list, boolean insideLoop) {
        if (transition == null) {
            return;
        }
        switch (transition.type()) {
            case GOTO -> {
                if (Transition.isReserved(transition.target())) {
                    throw new WorkflowConfigException("Step '" + step.name() + "' uses unknown reserved target '" + transition.target() + "'");
                }
                if (list.indexOf(transition.target()).isEmpty()) {
                    throw new WorkflowConfigException("Step '" + step.name() + "' jumps to unknown step '" + transition.target() + "'");
                }
            }
            case LOOP_BREAK, LOOP_CONTINUE -> {
                if (!insideLoop) {
                    throw new WorkflowConfigException("Step '" + step.name() + "' uses a loop target outside of a loop body");
                }
            }
            default -> {
            }
        }
    }

    private static Step step(JsonNode node, String path, boolean insideLoop, Map<String, ProviderTemplate> providers) {
        requireObject(node, path);
        checkKeys(node, STEP_KEYS, path);
        if (!node.hasNonNull("name")) {
            throw new WorkflowConfigException(path + " is missing a name");
        }
        var name = text(node.get("name"), path + ".name");
        if (!STEP_NAME.matcher(name).matches()) {
            throw new WorkflowConfigException(path + ": invalid step name '" + name + "'");
        }
        path = path + "(" + name + ")";
        var kinds = new ArrayList<String>();
        for (var key : KIND_KEYS) {
            if (node.has(key)) {
                kinds.add(key);
            }
        }
        if (kinds.size() != 1) {
            throw new WorkflowConfigException(path + " must declare exactly one of " + KIND_KEYS + (kinds.isEmpty() ? "" : ", found " + kinds));
        }
        var kind = kinds.get(0);
        if (!"provider".equals(kind)) {
            for (var key : List.of("provider_params", "input_file", "prompt")) {
                if (node.has(key)) {
                    throw new WorkflowConfigException(path + ": '" + key + "' requires a provider step");
                }
            }
        }
        var action = switch (kind) {
            case "command" -> command(node.get("command"), path);
            case "provider" -> provider(node, path, providers);
            case "for_each" -> forEach(node.get("for_each"), path + ".for_each", providers);
            case "while" -> whileLoop(node.get("while"), path + ".while", providers);
            default -> waitFor(node.get("wait_for"), path + ".wait_for");
        };
        var step = Step.of(name, action);
        if (node.hasNonNull("when")) {
            step = step.withWhen(condition(node.get("when"), path + ".when", 0));
        }
        if (node.hasNonNull("on")) {
            step = step.withOn(transitions(node.get("on"), path + ".on"));
        }
        if (node.hasNonNull("depends_on")) {
            step = step.withDependsOn(dependencies(node.get("depends_on"), path + ".depends_on"));
        }
        if (node.hasNonNull("retries")) {
            step = step.withRetry(retries(node.get("retries"), path + ".retries"));
        }
        if (node.hasNonNull("timeout")) {
            step = step.withTimeout(duration(node.get("timeout"), path + ".timeout"));
        }
        step = step.withOutput(output(node, path));
        if (node.hasNonNull("env")) {
            var env = new LinkedHashMap<String, String>();
            map(node.get("env"), path + ".env").forEach((key, value) -> env.put(key, value == null ? "" : String.valueOf(value)));
            step = step.withEnv(env);
        }
        step = step.withSecrets(strings(node.get("secrets"), path + ".secrets"));
        step = step.withAllowMissing(new LinkedHashSet<>(strings(node.get("allow_missing"), path + ".allow_missing")));
        return step;
    }

    private static StepAction command(JsonNode node, String path) {
        if (node.isTextual()) {
            throw new WorkflowConfigException(path + ".command must be a list of arguments; commands never run through a shell");
        }
        var argv = strings(node, path + ".command");
        if (argv.isEmpty()) {
            throw new WorkflowConfigException(path + ".command must not be empty");
        }
        return new StepAction.Command(argv);
    }

    private static StepAction provider(JsonNode node, String path, Map<String, ProviderTemplate> providers) {
        var name = text(node.get("provider"), path + ".provider");
        if (!providers.containsKey(name)) {
            throw new WorkflowConfigException(path + " references unknown provider '" + name + "'");
        }
        var params = node.hasNonNull("provider_params") ? map(node.get("provider_params"), path + ".provider_params") : Map.<String, Object>of();
        var inputFile = node.hasNonNull("input_file") ? text(node.get("input_file"), path + ".input_file") : null;
        var prompt = node.hasNonNull("prompt") ? text(node.get("prompt"), path + ".prompt") : null;
        return new StepAction.Provider(name, params, inputFile, prompt);
    }

    private static StepAction forEach(JsonNode node, String path, Map<String, ProviderTemplate> providers) {
        requireObject(node, path);
        checkKeys(node, Set.of("items", "items_from", "as", "parallel", "max_workers", "join", "join_timeout", "on_item_failure", "steps"), path);
        if (node.has("items") == node.has("items_from")) {
            throw new WorkflowConfigException(path + " needs exactly one of items or items_from");
        }
        List<Object> items = null;
        if (node.has("items")) {
            if (!node.get("items").isArray()) {
                throw new WorkflowConfigException(path + ".items must be a list");
            }
            items = list(node.get("items"));
        }
        var itemsFrom = node.has("items_from") ? text(node.get("items_from"), path + ".items_from") : null;
        var alias = node.hasNonNull("as") ? text(node.get("as"), path + ".as") : StepAction.ForEach.DEFAULT_ALIAS;
        if (VariableScope.isReservedNamespace(alias) || !alias.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new WorkflowConfigException(path + ": loop alias '" + alias + "' is not allowed");
        }
        var maxWorkers = node.hasNonNull("max_workers") ? integer(node.get("max_workers"), path + ".max_workers") : 4;
        if (maxWorkers < 1) {
            throw new WorkflowConfigException(path + ".max_workers must be >= 1");
        }
        JoinPolicy join;
        ItemFailurePolicy onFailure;
        try {
            join = JoinPolicy.from(node.hasNonNull("join") ? node.get("join").asText() : null);
            onFailure = ItemFailurePolicy.from(node.hasNonNull("on_item_failure") ? node.get("on_item_failure").asText() : null);
        } catch (IllegalArgumentException ex) {
            throw new WorkflowConfigException(path + ": " + ex.getMessage(), ex);
        }
        var joinTimeout = node.hasNonNull("join_timeout") ? duration(node.get("join_timeout"), path + ".join_timeout") : null;
        var parallel = node.hasNonNull("parallel") && bool(node.get("parallel"), path + ".parallel");
        var body = loopBody(node, path, providers);
        return new StepAction.ForEach(items, itemsFrom, alias, body, parallel, maxWorkers, join, joinTimeout, onFailure);
    }

    private static StepAction whileLoop(JsonNode node, String path, Map<String, ProviderTemplate> providers) {
        requireObject(node, path);
        checkKeys(node, Set.of("condition", "max_iterations", "max_duration", "delay", "steps"), path);
        if (!node.hasNonNull("condition")) {
            throw new WorkflowConfigException(path + " needs a condition");
        }
        var condition = condition(node.get("condition"), path + ".condition", 0);
        var maxIterations = StepAction.While.DEFAULT_MAX_ITERATIONS;
        if (node.hasNonNull("max_iterations")) {
            maxIterations = integer(node.get("max_iterations"), path + ".max_iterations");
            if (maxIterations < 1) {
                throw new WorkflowConfigException(path + ".max_iterations must be >= 1");
            }
        }
        var maxDuration = node.hasNonNull("max_duration") ? duration(node.get("max_duration"), path + ".max_duration") : null;
        var delay = node.hasNonNull("delay") ? duration(node.get("delay"), path + ".delay") : Duration.ZERO;
        return new StepAction.While(condition, maxIterations, maxDuration, delay, loopBody(node, path, providers));
    }

    private static StepList loopBody(JsonNode node, String path, Map<String, ProviderTemplate> providers) {
        if (!node.hasNonNull("steps")) {
            throw new WorkflowConfigException(path + " needs steps");
        }
        var body = stepList(node.get("steps"), path + ".steps", true, providers);
        if (body.isEmpty()) {
            throw new WorkflowConfigException(path + ".steps must not be empty");
        }
        return body;
    }

    private static StepAction waitFor(JsonNode node, String path) {
        requireObject(node, path);
        checkKeys(node, Set.of("glob", "min_count", "interval", "timeout"), path);
        if (!node.hasNonNull("glob")) {
            throw new WorkflowConfigException(path + " needs a glob");
        }
        var minCount = node.hasNonNull("min_count") ? integer(node.get("min_count"), path + ".min_count") : 1;
        if (minCount < 1) {
            throw new WorkflowConfigException(path + ".min_count must be >= 1");
        }
        var interval = node.hasNonNull("interval") ? duration(node.get("interval"), path + ".interval") : null;
        var timeout = node.hasNonNull("timeout") ? duration(node.get("timeout"), path + ".timeout") : null;
        return new StepAction.WaitFor(text(node.get("glob"), path + ".glob"), minCount, interval, timeout);
    }

    static Condition condition(JsonNode node, String path, int depth) {
        if (depth > MAX_CONDITION_DEPTH) {
            throw new WorkflowConfigException(path + " is nested deeper than " + MAX_CONDITION_DEPTH + " levels");
        }
        if (node.isTextual()) {
            return new Condition.Expression(node.asText());
        }
        if (!node.isObject() || node.size() != 1) {
            throw new WorkflowConfigException(path + " must be a single-key condition or an expression string");
        }
        var entry = node.fields().next();
        var key = entry.getKey();
        var value = entry.getValue();
        var child = path + "." + key;
        return switch (key) {
            case "step_ok" -> new Condition.StepOk(text(value, child));
            case "file_exists" -> new Condition.FileExists(text(value, child));
            case "env_set" -> new Condition.EnvSet(text(value, child));
            case "equals" -> {
                var pair = operands(value, child);
                yield new Condition.Equals(pair[0], pair[1]);
            }
            case "contains" -> {
                var pair = operands(value, child);
                yield new Condition.Contains(pair[0], pair[1]);
            }
            case "matches", "regex" -> {
                var pair = operands(value, child);
                yield new Condition.Matches(pair[0], pair[1]);
            }
            case "compare" -> {
                requireObject(value, child);
                var pair = operands(value, child);
                try {
                    yield new Condition.Compare(pair[0], Condition.CompareOp.from(value.path("op").asText(null)), pair[1]);
                } catch (IllegalArgumentException ex) {
                    throw new WorkflowConfigException(child + ": " + ex.getMessage(), ex);
                }
            }
            case "all", "any" -> {
                if (!value.isArray() || value.isEmpty()) {
                    throw new WorkflowConfigException(child + " must be a non-empty list");
                }
                var children = new ArrayList<Condition>();
                for (var i = 0; i < value.size(); i++) {
                    children.add(condition(value.get(i), child + "[" + i + "]", depth + 1));
                }
                yield "all".equals(key) ? new Condition.All(children) : new Condition.Any(children);
            }
            case "not" -> new Condition.Not(condition(value, child, depth + 1));
            case "expr" -> new Condition.Expression(text(value, child));
            default -> throw new WorkflowConfigException(path + ": unknown condition '" + key + "'");
        };
    }

    private static String[] operands(JsonNode node, String path) {
        if (node.isArray() && node.size() == 2) {
            return new String[] {scalar(node.get(0), path + "[0]"), scalar(node.get(1), path + "[1]")};
        }
        if (node.isObject() && node.has("left") && node.has("right")) {
            return new String[] {scalar(node.get("left"), path + ".left"), scalar(node.get("right"), path + ".right")};
        }
        throw new WorkflowConfigException(path + " needs left and right operands");
    }

    private static Transitions transitions(JsonNode node, String path) {
        requireObject(node, path);
        checkKeys(node, Set.of("success", "failure", "always"), path);
        return new Transitions(
            transition(node.get("success"), path + ".success"),
            transition(node.get("failure"), path + ".failure"),
            transition(node.get("always"), path + ".always")
        );
    }

    private static Transition transition(JsonNode node, String path) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return Transition.goTo(node.asText());
        }
        requireObject(node, path);
        if (node.size() != 1) {
            throw new WorkflowConfigException(path + " must contain exactly one of goto, error, end");
        }
        if (node.has("goto")) {
            return Transition.goTo(text(node.get("goto"), path + ".goto"));
        }
        if (node.has("error")) {
            var value = node.get("error");
            return Transition.error(value.isTextual() ? value.asText() : null);
        }
        if (node.has("end")) {
            if (!bool(node.get("end"), path + ".end")) {
                throw new WorkflowConfigException(path + ".end must be true when present");
            }
            return Transition.end();
        }
        throw new WorkflowConfigException(path + " must contain exactly one of goto, error, end");
    }

    private static DependencySpec dependencies(JsonNode node, String path) {
        if (node.isArray()) {
            return new DependencySpec(strings(node, path), List.of(), null, null, null);
        }
        requireObject(node, path);
        checkKeys(node, Set.of("required", "optional", "inject"), path);
        var required = strings(node.get("required"), path + ".required");
        var optional = strings(node.get("optional"), path + ".optional");
        var inject = node.get("inject");
        try {
            if (inject == null || inject.isNull()) {
                return new DependencySpec(required, optional, null, null, null);
            }
            if (inject.isTextual() || inject.isBoolean()) {
                var mode = inject.isBoolean() ? (inject.asBoolean() ? "list" : "none") : inject.asText();
                return new DependencySpec(required, optional, DependencySpec.InjectionMode.from(mode), null, null);
            }
            requireObject(inject, path + ".inject");
            checkKeys(inject, Set.of("mode", "instruction", "position"), path + ".inject");
            return new DependencySpec(
                required,
                optional,
                DependencySpec.InjectionMode.from(inject.hasNonNull("mode") ? inject.get("mode").asText() : "list"),
                inject.hasNonNull("instruction") ? inject.get("instruction").asText() : null,
                DependencySpec.InjectPosition.from(inject.hasNonNull("position") ? inject.get("position").asText() : null)
            );
        } catch (IllegalArgumentException ex) {
            throw new WorkflowConfigException(path + ": " + ex.getMessage(), ex);
        }
    }

    private static RetryPolicy retries(JsonNode node, String path) {
        if (node.isIntegralNumber()) {
            return new RetryPolicy(node.asInt(), null, null, null, true);
        }
        requireObject(node, path);
        checkKeys(node, Set.of("max_attempts", "backoff", "delay", "retry_on", "retry_on_timeout"), path);
        var attempts = node.hasNonNull("max_attempts") ? integer(node.get("max_attempts"), path + ".max_attempts") : 1;
        if (attempts < 1) {
            throw new WorkflowConfigException(path + ".max_attempts must be >= 1");
        }
        RetryPolicy.Backoff backoff;
        try {
            backoff = RetryPolicy.Backoff.from(node.hasNonNull("backoff") ? node.get("backoff").asText() : null);
        } catch (IllegalArgumentException ex) {
            throw new WorkflowConfigException(path + ": " + ex.getMessage(), ex);
        }
        var delay = node.hasNonNull("delay") ? duration(node.get("delay"), path + ".delay") : Duration.ZERO;
        Set<Integer> codes = null;
        if (node.hasNonNull("retry_on")) {
            var values = node.get("retry_on");
            if (!values.isArray()) {
                throw new WorkflowConfigException(path + ".retry_on must be a list of exit codes");
            }
            codes = new LinkedHashSet<>();
            for (var i = 0; i < values.size(); i++) {
                codes.add(integer(values.get(i), path + ".retry_on[" + i + "]"));
            }
        }
        var onTimeout = !node.hasNonNull("retry_on_timeout") || bool(node.get("retry_on_timeout"), path + ".retry_on_timeout");
        return new RetryPolicy(attempts, backoff, delay, codes, onTimeout);
    }

    private static OutputSpec output(JsonNode node, String path) {
        OutputSpec.CaptureMode mode;
        try {
            mode = OutputSpec.CaptureMode.from(node.hasNonNull("output_capture") ? node.get("output_capture").asText() : null);
        } catch (IllegalArgumentException ex) {
            throw new WorkflowConfigException(path + ": " + ex.getMessage(), ex);
        }
        var allowParseError = node.hasNonNull("allow_parse_error") && bool(node.get("allow_parse_error"), path + ".allow_parse_error");
        var outputFile = node.hasNonNull("output_file") ? text(node.get("output_file"), path + ".output_file") : null;
        return new OutputSpec(mode, allowParseError, outputFile);
    }

    /** YAML numbers are seconds; strings use the {@link DurationParser} suffixes. */
    static Duration duration(JsonNode node, String path) {
        if (node.isNumber()) {
            if (node.asDouble() < 0) {
                throw new WorkflowConfigException(path + " must not be negative");
            }
            return Duration.ofMillis(Math.round(node.asDouble() * 1000));
        }
        if (!node.isTextual()) {
            throw new WorkflowConfigException(path + " must be a duration");
        }
        try {
            return DurationParser.parse(node.asText()).orElseThrow(() -> new WorkflowConfigException(path + " must not be empty"));
        } catch (WorkflowConfigException ex) {
            throw new WorkflowConfigException(path + ": " + ex.getMessage(), ex);
        }
    }

    private static void checkKeys(JsonNode node, Set<String> allowed, String path) {
        var names = node.fieldNames();
        while (names.hasNext()) {
            var key = names.next();
            if (!allowed.contains(key)) {
                throw new WorkflowConfigException(path + ": unknown key '" + key + "'");
            }
        }
    }

    private static void requireObject(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new WorkflowConfigException(path + " must be a mapping");
        }
    }

    private static String text(JsonNode node, String path) {
        if (node == null || !node.isTextual()) {
            throw new WorkflowConfigException(path + " must be a string");
        }
        return node.asText();
    }

    private static String scalar(JsonNode node, String path) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (!node.isValueNode()) {
            throw new WorkflowConfigException(path + " must be a scalar");
        }
        return node.asText();
    }

    private static boolean bool(JsonNode node, String path) {
        if (!node.isBoolean()) {
            throw new WorkflowConfigException(path + " must be true or false");
        }
        return node.asBoolean();
    }

    private static int integer(JsonNode node, String path) {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new WorkflowConfigException(path + " must be an integer");
        }
        return node.asInt();
    }

    private static List<String> strings(JsonNode node, String path) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new WorkflowConfigException(path + " must be a list");
        }
        var values = new ArrayList<String>();
        for (var i = 0; i < node.size(); i++) {
            values.add(scalar(node.get(i), path + "[" + i + "]"));
        }
        return values;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(JsonNode node) {
        return YAML_MAPPER.convertValue(node, ArrayList.class);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(JsonNode node, String path) {
        requireObject(node, path);
        return YAML_MAPPER.convertValue(node, LinkedHashMap.class);
    }
}
