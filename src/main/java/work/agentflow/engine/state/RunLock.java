package work.agentflow.engine.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.shared.RunLockedException;

/**
 * Exclusive per-run lock file. A lock whose owner process is gone, or that is older than the stale
 * threshold, is reclaimed instead of blocking.
 */
public final class RunLock implements AutoCloseable {
    public static final String LOCK_FILE = "run.lock";
    private static final Logger log = LoggerFactory.getLogger(RunLock.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final Path file;
    private final long pid;
    private boolean released;

    private RunLock(Path file, long pid) {
        this.file = file;
        this.pid = pid;
    }

    static RunLock acquire(Path runDir, String runId, Duration staleAfter) {
        var file = runDir.resolve(LOCK_FILE);
        var pid = ProcessHandle.current().pid();
        for (var attempt = 0; attempt < 2; attempt++) {
            try {
                var payload = new LinkedHashMap<String, Object>();
                payload.put("pid", pid);
                payload.put("acquired_at", Instant.now().toString());
                Files.write(file, JSON.writeValueAsBytes(payload), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return new RunLock(file, pid);
            } catch (FileAlreadyExistsException ex) {
                var owner = readOwner(file);
                if (!isStale(owner, staleAfter)) {
                    throw new RunLockedException(runId, owner.pid());
                }
                log.warn("Reclaiming stale lock for run {} (pid {}, acquired {})", runId, owner.pid(), owner.acquiredAt());
                deleteQuietly(file);
            } catch (IOException ex) {
                throw new IllegalStateException("Unable to create lock file " + file, ex);
            }
        }
        throw new RunLockedException(runId, -1L);
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized void close() {
        if (released) {
            return;
        }
        released = true;
        var owner = readOwner(file);
        if (owner.pid() == pid) {
            deleteQuietly(file);
        }
    }

    static boolean isStale(Owner owner, Duration staleAfter) {
        if (owner.pid() <= 0) {
            return true;
        }
        var alive = ProcessHandle.of(owner.pid()).map(ProcessHandle::isAlive).orElse(false);
        if (!alive) {
            return true;
        }
        if (owner.acquiredAt() == null) {
            return true;
        }
        return Duration.between(owner.acquiredAt(), Instant.now()).compareTo(staleAfter) > 0;
    }

    private static Owner readOwner(Path file) {
        try {
            var content = JSON.readValue(Files.readAllBytes(file), MAP_REF);
            var pid = content.get("pid") instanceof Number n ? n.longValue() : -1L;
            Instant acquired = null;
            if (content.get("acquired_at") instanceof String s) {
                acquired = Instant.parse(s);
            }
            return new Owner(pid, acquired);
        } catch (NoSuchFileException ex) {
            return new Owner(-1L, null);
        } catch (IOException | DateTimeParseException ex) {
            log.warn("Unreadable lock file {}: {}", file, ex.getMessage());
            return new Owner(-1L, null);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Unable to delete lock file {}: {}", file, ex.getMessage());
        }
    }

    record Owner(long pid, Instant acquiredAt) {}
}
