package work.agentflow.engine.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AtomicFilesTest {
    @TempDir
    Path temp;

    @Test
    void replacesTargetAndLeavesNoTempFile() throws IOException {
        var target = temp.resolve("nested/data.json");
        AtomicFiles.write(target, "one".getBytes(StandardCharsets.UTF_8));
        AtomicFiles.write(target, "two".getBytes(StandardCharsets.UTF_8));
        assertEquals("two", Files.readString(target));
        assertFalse(Files.exists(AtomicFiles.tempFor(target)));
    }

    @Test
    void failureBeforeRenameKeepsPreviousContent() throws IOException {
        var target = temp.resolve("data.json");
        AtomicFiles.write(target, "committed".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> AtomicFiles.write(target, "partial".getBytes(StandardCharsets.UTF_8), tempFile -> {
            throw new IOException("simulated crash");
        }));
        assertEquals("committed", Files.readString(target));
    }
}
