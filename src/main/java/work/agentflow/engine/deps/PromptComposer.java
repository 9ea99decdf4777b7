package work.agentflow.engine.deps;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.model.DependencySpec;
import work.agentflow.engine.model.DependencySpec.InjectPosition;
import work.agentflow.engine.model.DependencySpec.InjectionMode;
import work.agentflow.engine.shared.EngineException;
import work.agentflow.engine.shared.ErrorKind;
import work.agentflow.engine.shared.Utf8;
import work.agentflow.engine.shared.WorkspacePaths;

/**
 * Builds the in-memory prompt handed to a provider: {@code list} adds the instruction and the
 * matched paths, {@code content} embeds file bodies up to a byte cap. The prompt file on disk is
 * never modified.
 */
public final class PromptComposer {
    private static final Logger log = LoggerFactory.getLogger(PromptComposer.class);

    private final WorkspacePaths workspace;
    private final long contentLimitBytes;

    public PromptComposer(WorkspacePaths workspace, long contentLimitBytes) {
        this.workspace = workspace;
        this.contentLimitBytes = contentLimitBytes;
    }

    public ComposedPrompt compose(String prompt, ResolvedDependencies dependencies, DependencySpec spec) {
        var base = prompt == null ? "" : prompt;
        if (spec == null || spec.mode() == InjectionMode.NONE || dependencies.isEmpty()) {
            return new ComposedPrompt(base, null);
        }
        var files = dependencies.all();
        var summary = new LinkedHashMap<String, Object>();
        summary.put("mode", spec.mode().name().toLowerCase(Locale.ROOT));
        summary.put("files", files.size());
        String block = spec.mode() == InjectionMode.LIST
            ? listBlock(spec.effectiveInstruction(), files)
            : contentBlock(spec.effectiveInstruction(), files, summary);
        var text = base.isEmpty() ? block
            : spec.position() == InjectPosition.PREPEND ? block + "\n\n" + base : base + "\n\n" + block;
        return new ComposedPrompt(text, summary);
    }

    private String listBlock(String instruction, List<Path> files) {
        return instruction + "\n" + files.stream().map(path -> "- " + workspace.relativize(path)).collect(Collectors.joining("\n"));
    }

    private String contentBlock(String instruction, List<Path> files, Map<String, Object> summary) {
        var out = new StringBuilder(instruction).append('\n');
        long budget = contentLimitBytes;
        long shown = 0;
        long omitted = 0;
        var filesOmitted = 0;
        for (var file : files) {
            var relative = workspace.relativize(file);
            byte[] bytes;
            try {
                bytes = Files.readAllBytes(file);
            } catch (IOException ex) {
                throw new EngineException(ErrorKind.MISSING_DEPENDENCY, "Unable to read dependency " + relative, Map.of("path", relative), ex);
            }
            if (budget <= 0) {
                filesOmitted++;
                omitted += bytes.length;
                continue;
            }
            var take = (int) Math.min(bytes.length, budget);
            var text = Utf8.prefix(bytes, bytes.length, take);
            var used = text.getBytes(StandardCharsets.UTF_8).length;
            out.append("\n=== ").append(relative).append(" ===\n").append(text);
            if (used < bytes.length) {
                out.append("\n[... ").append(bytes.length - used).append(" bytes omitted]");
            }
            out.append('\n');
            shown += used;
            omitted += bytes.length - used;
            budget -= used;
            if (used < bytes.length) {
                budget = 0;
            }
        }
        var truncated = omitted > 0 || filesOmitted > 0;
        if (truncated) {
            out.append("\n[truncated: ").append(omitted).append(" bytes omitted, ").append(filesOmitted).append(" files omitted]");
            log.warn("Injected content capped at {} bytes ({} bytes omitted, {} files omitted)", contentLimitBytes, omitted, filesOmitted);
        }
        summary.put("bytes_shown", shown);
        summary.put("bytes_omitted", omitted);
        summary.put("files_omitted", filesOmitted);
        summary.put("truncated", truncated);
        return out.toString();
    }
}
