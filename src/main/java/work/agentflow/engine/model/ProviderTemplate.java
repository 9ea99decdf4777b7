package work.agentflow.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Named argv template for an external provider shim. {@code ${PROMPT}} is the reserved prompt token;
 * other {@code ${param}} tokens come from {@link #defaults()} overridden by step parameters.
 */
public record ProviderTemplate(String name, List<String> command, Map<String, Object> defaults, PromptTransport transport) {
    public static final String PROMPT_TOKEN = "${PROMPT}";

    public ProviderTemplate {
        Objects.requireNonNull(name, "name");
        command = List.copyOf(command);
        defaults = defaults == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        transport = transport == null ? PromptTransport.ARGV : transport;
    }

    public enum PromptTransport {
        ARGV,
        STDIN;

        public static PromptTransport from(String value) {
            if (value == null || value.isBlank()) {
                return ARGV;
            }
            try {
                return PromptTransport.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported prompt transport: " + value);
            }
        }
    }
}
