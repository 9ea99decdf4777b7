package work.agentflow.engine.output;

import java.util.List;
import work.agentflow.engine.model.OutputSpec.CaptureMode;

/**
 * Normalised stdout ready to be stored on a step result. Only the field matching {@code mode} is set.
 */
public record CapturedOutput(
    CaptureMode mode,
    String text,
    List<String> lines,
    Object json,
    boolean truncated,
    boolean parseError,
    String spillPath,
    long totalBytes
) {}
