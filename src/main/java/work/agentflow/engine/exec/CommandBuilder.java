package work.agentflow.engine.exec;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.agentflow.engine.deps.DependencyResolver;
import work.agentflow.engine.deps.PromptComposer;
import work.agentflow.engine.model.ProviderTemplate;
import work.agentflow.engine.model.ProviderTemplate.PromptTransport;
import work.agentflow.engine.model.Step;
import work.agentflow.engine.model.StepAction;
import work.agentflow.engine.model.Workflow;
import work.agentflow.engine.shared.EngineException;
import work.agentflow.engine.shared.ErrorKind;
import work.agentflow.engine.shared.WorkflowConfigException;
import work.agentflow.engine.shared.WorkspacePaths;
import work.agentflow.engine.variables.VariableResolver;

/**
 * Turns a command or provider step into argv. Dependencies are validated first so a missing required
 * file fails the step before anything is spawned.
 */
public final class CommandBuilder {
    private static final Pattern TEMPLATE_PARAM = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final Workflow workflow;
    private final WorkspacePaths workspace;
    private final DependencyResolver dependencies;
    private final PromptComposer composer;

    public CommandBuilder(Workflow workflow, WorkspacePaths workspace, DependencyResolver dependencies, PromptComposer composer) {
        this.workflow = workflow;
        this.workspace = workspace;
        this.dependencies = dependencies;
        this.composer = composer;
    }

    public PreparedCommand build(Step step, VariableResolver resolver) {
        var resolved = dependencies.resolve(step.dependsOn(), resolver);
        if (step.action() instanceof StepAction.Command command) {
            return new PreparedCommand(resolver.resolveAll(command.argv(), "command"), null, null);
        }
        if (!(step.action() instanceof StepAction.Provider provider)) {
            throw new IllegalArgumentException("Step '" + step.name() + "' does not spawn a process");
        }
        var template = workflow.provider(provider.provider());
        if (template == null) {
            throw new WorkflowConfigException("Unknown provider '" + provider.provider() + "'", Map.of("provider", provider.provider()));
        }
        var prompt = composer.compose(readPrompt(provider, resolver), resolved, step.dependsOn());
        var params = new LinkedHashMap<String, Object>(template.defaults());
        @SuppressWarnings("unchecked")
        var overrides = (Map<String, Object>) resolver.resolveValue(provider.params(), "provider_params");
        params.putAll(overrides);
        var argv = new ArrayList<String>();
        for (var element : template.command()) {
            if (ProviderTemplate.PROMPT_TOKEN.equals(element)) {
                argv.add(prompt.text());
            } else {
                argv.add(interpolate(template, element, params));
            }
        }
        var stdin = template.transport() == PromptTransport.STDIN ? prompt.text() : null;
        return new PreparedCommand(argv, stdin, prompt.injection());
    }

    private String readPrompt(StepAction.Provider provider, VariableResolver resolver) {
        var prompt = new StringBuilder();
        if (provider.inputFile() != null) {
            var relative = resolver.resolve(provider.inputFile(), "input_file");
            var path = workspace.resolve(relative);
            try {
                prompt.append(Files.readString(path));
            } catch (IOException ex) {
                throw new EngineException(ErrorKind.MISSING_DEPENDENCY, "Unable to read input_file '" + relative + "'", Map.of("path", relative), ex);
            }
        }
        if (provider.prompt() != null) {
            if (prompt.length() > 0) {
                prompt.append("\n\n");
            }
            prompt.append(resolver.resolve(provider.prompt(), "prompt"));
        }
        return prompt.toString();
    }

    private static String interpolate(ProviderTemplate template, String element, Map<String, Object> params) {
        var escaped = element.replace("$$", "\u0000");
        var matcher = TEMPLATE_PARAM.matcher(escaped);
        var out = new StringBuilder();
        while (matcher.find()) {
            var name = matcher.group(1);
            if (!params.containsKey(name)) {
                throw new WorkflowConfigException(
                    "Provider '" + template.name() + "' uses parameter '" + name + "' which has no value",
                    Map.of("provider", template.name(), "parameter", name)
                );
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(VariableResolver.stringify(params.get(name))));
        }
        matcher.appendTail(out);
        return out.toString().replace('\u0000', '$');
    }
}
