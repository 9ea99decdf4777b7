package work.agentflow.engine.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.model.OutputSpec;
import work.agentflow.engine.model.OutputSpec.CaptureMode;
import work.agentflow.engine.shared.AtomicFiles;
import work.agentflow.engine.shared.OutputParseException;
import work.agentflow.engine.shared.Utf8;

/**
 * Turns raw stdout into the {@code text}, {@code lines} or {@code json} variant stored in run state.
 * Content that does not fit in state is spilled to a log file and only its path is recorded.
 */
public final class OutputProcessor {
    private static final Logger log = LoggerFactory.getLogger(OutputProcessor.class);
    private static final ObjectMapper JSON = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final int textLimit;
    private final int bufferLimit;
    private final int maxLines;

    public OutputProcessor(int textLimit, int bufferLimit, int maxLines) {
        this.textLimit = textLimit;
        this.bufferLimit = bufferLimit;
        this.maxLines = maxLines;
    }

    public int bufferLimit() {
        return bufferLimit;
    }

    /**
     * @param spillTarget where to write the full stream when it has to be spilled and is still in memory
     */
    public CapturedOutput process(RawOutput raw, OutputSpec spec, Path spillTarget) {
        return switch (spec.capture()) {
            case TEXT -> text(raw, spillTarget);
            case LINES -> lines(raw, spillTarget);
            case JSON -> json(raw, spec.allowParseError(), spillTarget);
        };
    }

    /** Best-effort text capture of a failed attempt, regardless of the declared mode. */
    public CapturedOutput text(RawOutput raw, Path spillTarget) {
        var text = Utf8.prefix(raw.head(), raw.head().length, textLimit);
        var truncated = raw.totalBytes() > textLimit;
        var spill = truncated ? spill(raw, spillTarget) : null;
        return new CapturedOutput(CaptureMode.TEXT, text, null, null, truncated, false, spill, raw.totalBytes());
    }

    private CapturedOutput lines(RawOutput raw, Path spillTarget) {
        var lines = new ArrayList<String>();
        var truncated = false;
        try (var reader = reader(raw)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (lines.size() == maxLines) {
                    truncated = true;
                    break;
                }
                lines.add(line);
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read captured output", ex);
        }
        var spill = raw.overflowed() || truncated ? spill(raw, spillTarget) : null;
        return new CapturedOutput(CaptureMode.LINES, null, List.copyOf(lines), null, truncated, false, spill, raw.totalBytes());
    }

    private CapturedOutput json(RawOutput raw, boolean allowParseError, Path spillTarget) {
        if (raw.overflowed() || raw.totalBytes() > bufferLimit) {
            var details = new LinkedHashMap<String, Object>();
            details.put("total_bytes", raw.totalBytes());
            details.put("limit_bytes", bufferLimit);
            return parseFailure(raw, allowParseError, spillTarget, "JSON output exceeds " + bufferLimit + " bytes", details, null);
        }
        try {
            var value = JSON.readValue(raw.head(), Object.class);
            return new CapturedOutput(CaptureMode.JSON, null, null, value, false, false, null, raw.totalBytes());
        } catch (JsonProcessingException ex) {
            var details = new LinkedHashMap<String, Object>();
            details.put("total_bytes", raw.totalBytes());
            details.put("reason", ex.getOriginalMessage());
            return parseFailure(raw, allowParseError, spillTarget, "Output is not valid JSON: " + ex.getOriginalMessage(), details, ex);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read captured output", ex);
        }
    }

    private CapturedOutput parseFailure(RawOutput raw, boolean allowParseError, Path spillTarget, String message, LinkedHashMap<String, Object> details, Exception cause) {
        if (!allowParseError) {
            throw new OutputParseException(message, details, cause);
        }
        var spill = spill(raw, spillTarget);
        log.warn("{}; tolerated, raw output kept at {}", message, spill);
        return new CapturedOutput(CaptureMode.JSON, null, null, null, raw.overflowed(), true, spill, raw.totalBytes());
    }

    /**
     * Writes {@code raw} in full to {@code target}, or copies an existing spill there.
     */
    public static void writeFull(RawOutput raw, Path target) throws IOException {
        if (raw.overflowed()) {
            var temp = AtomicFiles.tempFor(target);
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.copy(raw.spillFile(), temp, StandardCopyOption.REPLACE_EXISTING);
            AtomicFiles.move(temp, target);
            AtomicFiles.fsyncDirectory(target.toAbsolutePath().getParent());
        } else {
            AtomicFiles.write(target, raw.head());
        }
    }

    private static String spill(RawOutput raw, Path target) {
        if (raw.overflowed()) {
            return raw.spillFile().toString();
        }
        if (target == null) {
            return null;
        }
        try {
            AtomicFiles.write(target, raw.head());
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to spill output to " + target, ex);
        }
        return target.toString();
    }

    private static BufferedReader reader(RawOutput raw) throws IOException {
        if (raw.overflowed()) {
            return Files.newBufferedReader(raw.spillFile(), StandardCharsets.UTF_8);
        }
        return new BufferedReader(new StringReader(new String(raw.head(), StandardCharsets.UTF_8)));
    }
}
