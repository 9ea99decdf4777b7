package work.agentflow.engine.deps;

import java.util.Map;

/**
 * Prompt text after dependency injection. {@code injection} is {@code null} when nothing was injected.
 */
public record ComposedPrompt(String text, Map<String, Object> injection) {}
