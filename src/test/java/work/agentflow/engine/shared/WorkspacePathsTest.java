package work.agentflow.engine.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkspacePathsTest {
    @TempDir
    Path temp;

    @Test
    void resolvesRelativePathsInsideTheRoot() throws IOException {
        var root = Files.createDirectories(temp.resolve("ws"));
        var paths = new WorkspacePaths(root);
        var resolved = paths.resolve("out/report.txt");
        assertTrue(resolved.startsWith(paths.root()));
        assertEquals("out/report.txt", paths.relativize(resolved));
    }

    @Test
    void rejectsAbsoluteAndEscapingPaths() throws IOException {
        var paths = new WorkspacePaths(Files.createDirectories(temp.resolve("ws")));
        var absolute = assertThrows(PathSafetyException.class, () -> paths.resolve(temp.toAbsolutePath().toString()));
        assertEquals(ErrorKind.PATH_SAFETY, absolute.kind());
        assertThrows(PathSafetyException.class, () -> paths.resolve("../outside.txt"));
        assertThrows(PathSafetyException.class, () -> paths.resolve("a/../../outside.txt"));
    }

    @Test
    void rejectsSymlinksLeavingTheRoot() throws IOException {
        var root = Files.createDirectories(temp.resolve("ws"));
        var outside = Files.createDirectories(temp.resolve("outside"));
        Files.writeString(outside.resolve("secret.txt"), "x");
        try {
            Files.createSymbolicLink(root.resolve("link"), outside);
        } catch (UnsupportedOperationException | IOException ex) {
            Assumptions.abort("symlinks not supported: " + ex.getMessage());
        }
        var paths = new WorkspacePaths(root);
        assertThrows(PathSafetyException.class, () -> paths.resolve("link/secret.txt"));
        assertThrows(PathSafetyException.class, () -> paths.resolve("link/new-file.txt"));
    }
}
