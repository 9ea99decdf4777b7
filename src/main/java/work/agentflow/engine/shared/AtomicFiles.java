package work.agentflow.engine.shared;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-temp-then-rename helper shared by the state store and every artifact writer.
 * The temp file lives next to the target so the rename never crosses filesystems.
 */
public final class AtomicFiles {
    public static final String TEMP_SUFFIX = ".tmp";
    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

    private AtomicFiles() {}

    public static void write(Path target, byte[] data) throws IOException {
        write(target, data, temp -> {});
    }

    /**
     * Writes {@code data} to {@code target}: temp file, fsync, {@code hook}, rename, fsync of the directory.
     */
    public static void write(Path target, byte[] data, CommitHook hook) throws IOException {
        var absolute = target.toAbsolutePath().normalize();
        var directory = absolute.getParent();
        Files.createDirectories(directory);
        var temp = tempFor(absolute);
        try (var channel = FileChannel.open(temp, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            var buffer = ByteBuffer.wrap(data);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        hook.beforeCommit(temp);
        move(temp, absolute);
        fsyncDirectory(directory);
    }

    public static Path tempFor(Path target) {
        return target.resolveSibling(target.getFileName().toString() + TEMP_SUFFIX);
    }

    public static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public static void fsyncDirectory(Path directory) {
        try (var channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException ex) {
            // Some filesystems refuse to open directories for reading.
            log.debug("Directory fsync not supported for {}: {}", directory, ex.getMessage());
        }
    }

    @FunctionalInterface
    public interface CommitHook {
        void beforeCommit(Path temp) throws IOException;
    }
}
