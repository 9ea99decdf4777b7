package work.agentflow.engine.deps;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.agentflow.engine.model.DependencySpec;
import work.agentflow.engine.model.DependencySpec.InjectPosition;
import work.agentflow.engine.model.DependencySpec.InjectionMode;
import work.agentflow.engine.shared.WorkspacePaths;

class PromptComposerTest {
    @TempDir
    Path root;

    @Test
    void listModePrependsInstructionAndPaths() throws IOException {
        var a = Files.writeString(root.resolve("a.md"), "alpha");
        var workspace = new WorkspacePaths(root);
        var spec = new DependencySpec(List.of("*.md"), List.of(), InjectionMode.LIST, "Read these", InjectPosition.PREPEND);
        var composed = new PromptComposer(workspace, 1024).compose("Do the task", new ResolvedDependencies(List.of(a.toRealPath()), List.of()), spec);
        assertEquals("Read these\n- a.md\n\nDo the task", composed.text());
        assertEquals("list", composed.injection().get("mode"));
    }

    @Test
    void contentModeCapsBytesAndRecordsSummary() throws IOException {
        var first = Files.writeString(root.resolve("first.txt"), "0123456789");
        var second = Files.writeString(root.resolve("second.txt"), "abcdef");
        var workspace = new WorkspacePaths(root);
        var spec = new DependencySpec(List.of("*.txt"), List.of(), InjectionMode.CONTENT, null, InjectPosition.APPEND);
        var deps = new ResolvedDependencies(List.of(first.toRealPath(), second.toRealPath()), List.of());
        var composed = new PromptComposer(workspace, 4).compose("Summarize", deps, spec);

        assertTrue(composed.text().startsWith("Summarize\n\n" + DependencySpec.DEFAULT_CONTENT_INSTRUCTION));
        assertTrue(composed.text().contains("=== first.txt ===\n0123"));
        assertTrue(composed.text().endsWith("[truncated: 12 bytes omitted, 1 files omitted]"));
        assertEquals(4L, composed.injection().get("bytes_shown"));
        assertEquals(12L, composed.injection().get("bytes_omitted"));
        assertEquals(1, composed.injection().get("files_omitted"));
        assertEquals(true, composed.injection().get("truncated"));
    }

    @Test
    void noInjectionLeavesPromptUntouched() {
        var composed = new PromptComposer(new WorkspacePaths(root), 10).compose("plain", ResolvedDependencies.none(), null);
        assertEquals("plain", composed.text());
        assertNull(composed.injection());
    }
}
