package work.agentflow.engine.shared;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Resolves user-declared paths against the workspace root. Absolute paths and paths that leave the
 * root, directly or through a symlink, are rejected before the target is read or written.
 */
public final class WorkspacePaths {
    private final Path root;

    public WorkspacePaths(Path root) {
        try {
            this.root = root.toAbsolutePath().normalize().toRealPath();
        } catch (IOException ex) {
            throw new WorkflowConfigException("Workspace root does not exist: " + root, ex);
        }
    }

    public Path root() {
        return root;
    }

    public Path resolve(String userPath) {
        if (userPath == null || userPath.isBlank()) {
            throw new PathSafetyException(String.valueOf(userPath), "path is empty");
        }
        Path candidate;
        try {
            candidate = Path.of(userPath);
        } catch (InvalidPathException ex) {
            throw new PathSafetyException(userPath, "invalid path");
        }
        if (candidate.isAbsolute()) {
            throw new PathSafetyException(userPath, "absolute paths are not allowed");
        }
        var resolved = root.resolve(candidate).normalize();
        if (!resolved.startsWith(root)) {
            throw new PathSafetyException(userPath, "resolves outside the workspace root");
        }
        ensureInside(resolved, userPath);
        return resolved;
    }

    /**
     * Follows symlinks on the deepest existing ancestor of {@code path} and checks it stays under the root.
     */
    public void ensureInside(Path path, String display) {
        var normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(root)) {
            throw new PathSafetyException(display, "resolves outside the workspace root");
        }
        var existing = normalized;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return;
        }
        Path real;
        try {
            real = existing.toRealPath();
        } catch (IOException ex) {
            throw new PathSafetyException(display, "cannot resolve symlink target");
        }
        if (!real.startsWith(root)) {
            throw new PathSafetyException(display, "symlink resolves outside the workspace root");
        }
    }

    public String relativize(Path path) {
        var relative = root.relativize(path.toAbsolutePath().normalize());
        return relative.toString().replace('\\', '/');
    }
}
