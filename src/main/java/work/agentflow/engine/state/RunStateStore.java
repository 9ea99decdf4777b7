package work.agentflow.engine.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.shared.AtomicFiles;
import work.agentflow.engine.shared.StateCorruptedException;
import work.agentflow.engine.shared.WorkflowConfigException;

/**
 * Atomic, versioned persistence of {@link RunState} documents under {@code <root>/<run_id>/}.
 */
public final class RunStateStore {
    public static final String STATE_FILE = "state.json";
    public static final String LOGS_DIR = "logs";
    public static final String CANCEL_MARKER = "CANCEL";
    static final String BACKUP_PREFIX = STATE_FILE + ".bak.";

    private static final Logger log = LoggerFactory.getLogger(RunStateStore.class);
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path root;
    private final int backups;
    private volatile AtomicFiles.CommitHook commitHook = temp -> {};

    public RunStateStore(Path root, int backups) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.backups = Math.max(0, backups);
    }

    public static String newRunId(Instant now) {
        return RUN_ID_FORMAT.format(now) + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public Path root() {
        return root;
    }

    public Path runDir(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new WorkflowConfigException("Invalid run id: " + runId);
        }
        return root.resolve(runId);
    }

    public Path logsDir(String runId) {
        return runDir(runId).resolve(LOGS_DIR);
    }

    public Path stateFile(String runId) {
        return runDir(runId).resolve(STATE_FILE);
    }

    public RunState create(RunState state) {
        var dir = runDir(state.runId());
        if (Files.exists(dir.resolve(STATE_FILE))) {
            throw new WorkflowConfigException("Run " + state.runId() + " already exists");
        }
        try {
            Files.createDirectories(dir.resolve(LOGS_DIR));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to create run directory " + dir, ex);
        }
        save(state);
        return state;
    }

    /**
     * Serializes and atomically replaces the committed state document.
     */
    public synchronized void save(RunState state) {
        byte[] bytes;
        synchronized (state) {
            try {
                bytes = JSON.writeValueAsBytes(state);
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Unable to serialize state of run " + state.runId(), ex);
            }
        }
        var target = stateFile(state.runId());
        try {
            AtomicFiles.write(target, bytes, commitHook);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to persist state " + target, ex);
        }
    }

    public RunState load(String runId) {
        var dir = runDir(runId);
        discardLeftoverTemp(dir);
        var file = dir.resolve(STATE_FILE);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException ex) {
            throw new WorkflowConfigException("Unknown run: " + runId);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read state " + file, ex);
        }
        return parse(file, bytes, runId);
    }

    /**
     * Copies the committed state into the rotating backup set ({@code .bak.1} is the newest).
     */
    public synchronized void backup(String runId) {
        if (backups == 0) {
            return;
        }
        var dir = runDir(runId);
        var current = dir.resolve(STATE_FILE);
        if (!Files.exists(current)) {
            return;
        }
        try {
            Files.deleteIfExists(dir.resolve(BACKUP_PREFIX + backups));
            for (var i = backups - 1; i >= 1; i--) {
                var source = dir.resolve(BACKUP_PREFIX + i);
                if (Files.exists(source)) {
                    AtomicFiles.move(source, dir.resolve(BACKUP_PREFIX + (i + 1)));
                }
            }
            AtomicFiles.write(dir.resolve(BACKUP_PREFIX + 1), Files.readAllBytes(current));
        } catch (IOException ex) {
            log.warn("Unable to rotate state backups for run {}: {}", runId, ex.getMessage());
        }
    }

    /**
     * Restores the newest backup that passes validation and returns it.
     */
    public synchronized RunState repair(String runId) {
        var dir = runDir(runId);
        discardLeftoverTemp(dir);
        for (var i = 1; i <= backups; i++) {
            var candidate = dir.resolve(BACKUP_PREFIX + i);
            if (!Files.exists(candidate)) {
                continue;
            }
            try {
                var bytes = Files.readAllBytes(candidate);
                var state = parse(candidate, bytes, runId);
                AtomicFiles.write(dir.resolve(STATE_FILE), bytes);
                log.warn("Run {} restored from backup {}", runId, candidate.getFileName());
                return state;
            } catch (StateCorruptedException ex) {
                log.warn("Skipping unusable backup {}: {}", candidate.getFileName(), ex.getMessage());
            } catch (IOException ex) {
                log.warn("Unable to read backup {}: {}", candidate.getFileName(), ex.getMessage());
            }
        }
        throw new StateCorruptedException(dir.resolve(STATE_FILE), "no valid backup available");
    }

    public RunLock lock(String runId, Duration staleAfter) {
        return RunLock.acquire(runDir(runId), runId, staleAfter);
    }

    public boolean cancelRequested(String runId) {
        return Files.exists(runDir(runId).resolve(CANCEL_MARKER));
    }

    public void requestCancel(String runId) {
        var dir = runDir(runId);
        if (!Files.isDirectory(dir)) {
            throw new WorkflowConfigException("Unknown run: " + runId);
        }
        try {
            AtomicFiles.write(dir.resolve(CANCEL_MARKER), Instant.now().toString().getBytes(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to write cancel marker for run " + runId, ex);
        }
    }

    public void clearCancel(String runId) {
        try {
            Files.deleteIfExists(runDir(runId).resolve(CANCEL_MARKER));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to clear cancel marker for run " + runId, ex);
        }
    }

    void commitHook(AtomicFiles.CommitHook hook) {
        this.commitHook = hook == null ? temp -> {} : hook;
    }

    private void discardLeftoverTemp(Path dir) {
        var temp = AtomicFiles.tempFor(dir.resolve(STATE_FILE));
        try {
            if (Files.deleteIfExists(temp)) {
                log.warn("Discarded leftover temporary state file {}", temp);
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to discard " + temp, ex);
        }
    }

    private static RunState parse(Path file, byte[] bytes, String runId) {
        JsonNode tree;
        try {
            tree = JSON.readTree(bytes);
        } catch (IOException ex) {
            throw new StateCorruptedException(file, "not valid JSON (" + ex.getMessage() + ")");
        }
        if (tree == null || !tree.isObject()) {
            throw new StateCorruptedException(file, "document is not a JSON object");
        }
        var version = tree.get("schema_version");
        if (version == null || !version.canConvertToInt()) {
            throw new StateCorruptedException(file, "missing schema_version");
        }
        if (version.intValue() != RunState.SCHEMA_VERSION) {
            throw new StateCorruptedException(file, "unsupported schema_version " + version.intValue());
        }
        for (var field : new String[] {"run_id", "workflow_checksum", "status", "started_at"}) {
            var node = tree.get(field);
            if (node == null || !node.isTextual() || node.asText().isBlank()) {
                throw new StateCorruptedException(file, "missing required field " + field);
            }
        }
        if (!runId.equals(tree.get("run_id").asText())) {
            throw new StateCorruptedException(file, "run_id does not match directory " + runId);
        }
        if (tree.has("steps") && !tree.get("steps").isObject()) {
            throw new StateCorruptedException(file, "steps must be an object");
        }
        try {
            return JSON.treeToValue(tree, RunState.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new StateCorruptedException(file, "invalid field value (" + ex.getMessage() + ")");
        }
    }
}
