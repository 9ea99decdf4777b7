package work.agentflow.engine.deps;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import work.agentflow.engine.shared.PathSafetyException;
import work.agentflow.engine.shared.WorkspacePaths;

/**
 * Expands a workspace-relative glob ({@code *}, {@code ?}, {@code [..]}, recursive {@code **}) into
 * the sorted list of matching regular files. Every match is checked against the workspace root after
 * following symlinks.
 */
public final class GlobMatcher {
    private final WorkspacePaths workspace;

    public GlobMatcher(WorkspacePaths workspace) {
        this.workspace = workspace;
    }

    public List<Path> match(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new PathSafetyException(String.valueOf(pattern), "pattern is empty");
        }
        var normalized = pattern.replace('\\', '/');
        if (normalized.startsWith("/")) {
            throw new PathSafetyException(pattern, "absolute paths are not allowed");
        }
        var segments = normalized.split("/");
        var literal = new ArrayList<String>();
        var index = 0;
        while (index < segments.length && !isGlob(segments[index])) {
            literal.add(segments[index]);
            index++;
        }
        if (index == segments.length) {
            var path = workspace.resolve(normalized);
            return Files.isRegularFile(path) ? List.of(path) : List.of();
        }
        var remainder = new ArrayList<String>();
        for (var i = index; i < segments.length; i++) {
            if ("..".equals(segments[i])) {
                throw new PathSafetyException(pattern, "parent segments are not allowed after a wildcard");
            }
            remainder.add(segments[i]);
        }
        var base = literal.isEmpty() ? workspace.root() : workspace.resolve(String.join("/", literal));
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        var glob = String.join("/", remainder);
        var matchers = new ArrayList<PathMatcher>();
        matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        if (glob.startsWith("**/")) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
        }
        List<Path> walked;
        try (var walk = Files.walk(base)) {
            walked = walk.filter(path -> !path.equals(base)).collect(Collectors.toList());
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to scan " + base + " for '" + pattern + "'", ex);
        } catch (UncheckedIOException ex) {
            throw new IllegalStateException("Unable to scan " + base + " for '" + pattern + "'", ex.getCause());
        }
        var matches = new ArrayList<Path>();
        for (var path : walked) {
            var relative = base.relativize(path);
            if (Files.isSymbolicLink(path) && Files.isDirectory(path) && canDescend(glob, remainder.size(), relative)) {
                // The walk does not enter linked directories, so check where they lead.
                workspace.ensureInside(path, workspace.relativize(path));
            }
            if (matchesAny(matchers, relative) && Files.isRegularFile(path)) {
                matches.add(path);
            }
        }
        for (var match : matches) {
            workspace.ensureInside(match, workspace.relativize(match));
        }
        matches.sort(Comparator.comparing(workspace::relativize));
        return matches;
    }

    static boolean isGlob(String segment) {
        for (var i = 0; i < segment.length(); i++) {
            var ch = segment.charAt(i);
            if (ch == '*' || ch == '?' || ch == '[' || ch == '{') {
                return true;
            }
        }
        return false;
    }

    private static boolean canDescend(String glob, int segments, Path relative) {
        return glob.contains("**") || relative.getNameCount() < segments;
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path relative) {
        for (var matcher : matchers) {
            if (matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }
}
