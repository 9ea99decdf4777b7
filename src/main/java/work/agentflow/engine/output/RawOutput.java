package work.agentflow.engine.output;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Captured stdout of a finished process: the in-memory head and, when the stream outgrew the memory
 * buffer, the file holding the complete stream.
 *
 * @param spillFile {@code null} unless the whole stream did not fit into {@code head}
 */
public record RawOutput(byte[] head, long totalBytes, Path spillFile) {
    public RawOutput {
        head = head == null ? new byte[0] : head;
    }

    public static RawOutput of(String text) {
        var bytes = text.getBytes(StandardCharsets.UTF_8);
        return new RawOutput(bytes, bytes.length, null);
    }

    public static RawOutput empty() {
        return new RawOutput(new byte[0], 0, null);
    }

    public boolean overflowed() {
        return spillFile != null;
    }
}
