package work.agentflow.engine.deps;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.agentflow.engine.model.DependencySpec;
import work.agentflow.engine.shared.DependencyException;
import work.agentflow.engine.shared.ErrorKind;
import work.agentflow.engine.shared.PathSafetyException;
import work.agentflow.engine.shared.WorkspacePaths;
import work.agentflow.engine.variables.VariableResolver;
import work.agentflow.engine.variables.VariableScope;

class DependencyResolverTest {
    @TempDir
    Path temp;

    private Path root;
    private Path outside;
    private WorkspacePaths workspace;
    private DependencyResolver dependencies;
    private VariableResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(temp.resolve("workspace"));
        outside = Files.createDirectories(temp.resolve("outside"));
        Files.writeString(outside.resolve("secret.md"), "secret");
        Files.createDirectories(root.resolve("inbox/deep"));
        Files.writeString(root.resolve("inbox/b.md"), "b");
        Files.writeString(root.resolve("inbox/a.md"), "a");
        Files.writeString(root.resolve("inbox/deep/c.md"), "c");
        Files.writeString(root.resolve("inbox/notes.txt"), "n");
        workspace = new WorkspacePaths(root);
        dependencies = new DependencyResolver(new GlobMatcher(workspace));
        resolver = new VariableResolver(VariableScope.of(Map.of(), Map.of("dir", "inbox"), Map.of()));
    }

    private List<String> relative(List<Path> paths) {
        return paths.stream().map(workspace::relativize).toList();
    }

    @Test
    void matchesSubstitutedPatternsInSortedOrder() {
        var spec = new DependencySpec(List.of("${context.dir}/*.md"), List.of(), null, null, null);
        var resolved = dependencies.resolve(spec, resolver);
        assertEquals(List.of("inbox/a.md", "inbox/b.md"), relative(resolved.required()));
    }

    @Test
    void recursiveGlobIncludesTopLevelFiles() {
        var spec = new DependencySpec(List.of("inbox/**/*.md"), List.of(), null, null, null);
        assertEquals(List.of("inbox/a.md", "inbox/b.md", "inbox/deep/c.md"), relative(dependencies.resolve(spec, resolver).required()));
    }

    @Test
    void missingRequiredFailsButOptionalIsFine() {
        var optional = new DependencySpec(List.of(), List.of("nothing/*.md"), null, null, null);
        assertTrue(dependencies.resolve(optional, resolver).isEmpty());

        var required = new DependencySpec(List.of("missing.txt"), List.of(), null, null, null);
        var ex = assertThrows(DependencyException.class, () -> dependencies.resolve(required, resolver));
        assertEquals(ErrorKind.MISSING_DEPENDENCY, ex.kind());
        assertTrue(ex.getMessage().contains("missing.txt"));
    }

    @Test
    void patternsMayNotLeaveTheWorkspace() {
        var spec = new DependencySpec(List.of("../*.md"), List.of(), null, null, null);
        assertThrows(PathSafetyException.class, () -> dependencies.resolve(spec, resolver));
    }

    @Test
    void symlinkedFileLeavingTheWorkspaceIsRejected() throws IOException {
        Files.createSymbolicLink(root.resolve("inbox/leak.md"), outside.resolve("secret.md"));
        var spec = new DependencySpec(List.of("inbox/*.md"), List.of(), null, null, null);
        var ex = assertThrows(PathSafetyException.class, () -> dependencies.resolve(spec, resolver));
        assertTrue(ex.getMessage().contains("inbox/leak.md"), ex.getMessage());
    }

    @Test
    void symlinkedDirectoryLeavingTheWorkspaceIsRejected() throws IOException {
        Files.createSymbolicLink(root.resolve("inbox/linked"), outside);
        var recursive = new DependencySpec(List.of("inbox/**/*.md"), List.of(), null, null, null);
        assertThrows(PathSafetyException.class, () -> dependencies.resolve(recursive, resolver));

        var direct = new DependencySpec(List.of("inbox/linked/*.md"), List.of(), null, null, null);
        assertThrows(PathSafetyException.class, () -> dependencies.resolve(direct, resolver));

        var optional = new DependencySpec(List.of(), List.of("inbox/*/secret.md"), null, null, null);
        assertThrows(PathSafetyException.class, () -> dependencies.resolve(optional, resolver));
    }

    @Test
    void symlinkInsideTheWorkspaceIsAllowed() throws IOException {
        Files.createSymbolicLink(root.resolve("inbox/alias.md"), root.resolve("inbox/a.md"));
        var spec = new DependencySpec(List.of("inbox/alias.md"), List.of(), null, null, null);
        assertEquals(List.of("inbox/alias.md"), relative(dependencies.resolve(spec, resolver).required()));
    }
}
