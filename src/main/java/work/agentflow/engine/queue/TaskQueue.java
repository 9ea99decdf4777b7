package work.agentflow.engine.queue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.shared.AtomicFiles;
import work.agentflow.engine.shared.WorkflowConfigException;

/**
 * File-queue handoff between steps: tasks appear in the inbox atomically and leave it into a
 * timestamped {@code processed} or {@code failed} directory next to the inbox.
 */
public final class TaskQueue {
    public static final String TASK_EXTENSION = ".task";
    public static final String PROCESSED_DIR = "processed";
    public static final String FAILED_DIR = "failed";
    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);
    private static final Pattern TASK_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path inbox;
    private final Clock clock;

    public TaskQueue(Path inbox) {
        this(inbox, Clock.systemUTC());
    }

    public TaskQueue(Path inbox, Clock clock) {
        this.inbox = inbox.toAbsolutePath().normalize();
        this.clock = clock;
    }

    public Path inbox() {
        return inbox;
    }

    /**
     * Writes {@code <name>.task.tmp} and renames it to {@code <name>.task}, so readers never see a
     * partial task.
     */
    public Path enqueue(String name, String content) {
        if (name == null || !TASK_NAME.matcher(name).matches()) {
            throw new WorkflowConfigException("Invalid task name: " + name);
        }
        var target = inbox.resolve(name + TASK_EXTENSION);
        try {
            AtomicFiles.write(target, content.getBytes(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to enqueue task " + target, ex);
        }
        log.debug("Enqueued task {}", target);
        return target;
    }

    /** Tasks currently waiting in the inbox, by file name. */
    public List<Path> pending() {
        if (!Files.isDirectory(inbox)) {
            return List.of();
        }
        try (var files = Files.list(inbox)) {
            return files
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(TASK_EXTENSION))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to list inbox " + inbox, ex);
        }
    }

    public Path complete(Path task) {
        return archive(task, PROCESSED_DIR);
    }

    public Path fail(Path task) {
        return archive(task, FAILED_DIR);
    }

    private Path archive(Path task, String bucket) {
        var source = task.toAbsolutePath().normalize();
        if (!inbox.equals(source.getParent())) {
            throw new WorkflowConfigException("Task " + task + " is not in inbox " + inbox);
        }
        var parent = inbox.getParent() != null ? inbox.getParent() : inbox;
        var directory = parent.resolve(bucket).resolve(STAMP.format(clock.instant()));
        var target = directory.resolve(source.getFileName());
        try {
            Files.createDirectories(directory);
            AtomicFiles.move(source, target);
            AtomicFiles.fsyncDirectory(directory);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to move task " + source + " to " + directory, ex);
        }
        log.info("Task {} moved to {}", source.getFileName(), parent.relativize(target));
        return target;
    }
}
