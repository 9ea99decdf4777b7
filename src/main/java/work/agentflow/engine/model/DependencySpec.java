package work.agentflow.engine.model;

import java.util.List;
import java.util.Locale;

/**
 * Required/optional glob patterns plus how matched files are injected into a provider prompt.
 */
public record DependencySpec(
    List<String> required,
    List<String> optional,
    InjectionMode mode,
    String instruction,
    InjectPosition position
) {
    public static final String DEFAULT_LIST_INSTRUCTION = "The following files are available for this task:";
    public static final String DEFAULT_CONTENT_INSTRUCTION = "The following file contents are provided for this task:";

    public DependencySpec {
        required = required == null ? List.of() : List.copyOf(required);
        optional = optional == null ? List.of() : List.copyOf(optional);
        mode = mode == null ? InjectionMode.NONE : mode;
        position = position == null ? InjectPosition.PREPEND : position;
    }

    public String effectiveInstruction() {
        if (instruction != null && !instruction.isBlank()) {
            return instruction;
        }
        return mode == InjectionMode.CONTENT ? DEFAULT_CONTENT_INSTRUCTION : DEFAULT_LIST_INSTRUCTION;
    }

    public enum InjectionMode {
        NONE,
        LIST,
        CONTENT;

        public static InjectionMode from(String value) {
            if (value == null || value.isBlank()) {
                return NONE;
            }
            try {
                return InjectionMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported injection mode: " + value);
            }
        }
    }

    public enum InjectPosition {
        PREPEND,
        APPEND;

        public static InjectPosition from(String value) {
            if (value == null || value.isBlank()) {
                return PREPEND;
            }
            try {
                return InjectPosition.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported injection position: " + value);
            }
        }
    }
}
