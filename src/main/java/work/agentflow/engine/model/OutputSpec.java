package work.agentflow.engine.model;

import java.util.Locale;

/**
 * How a step's stdout is captured into the run state.
 *
 * @param outputFile optional workspace path receiving the full stdout
 */
public record OutputSpec(CaptureMode capture, boolean allowParseError, String outputFile) {
    private static final OutputSpec DEFAULTS = new OutputSpec(CaptureMode.TEXT, false, null);

    public OutputSpec {
        capture = capture == null ? CaptureMode.TEXT : capture;
    }

    public static OutputSpec defaults() {
        return DEFAULTS;
    }

    public static OutputSpec of(CaptureMode mode) {
        return new OutputSpec(mode, false, null);
    }

    public enum CaptureMode {
        TEXT,
        LINES,
        JSON;

        public static CaptureMode from(String value) {
            if (value == null || value.isBlank()) {
                return TEXT;
            }
            try {
                return CaptureMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported output_capture: " + value);
            }
        }
    }
}
