package work.agentflow.engine.output;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import work.agentflow.engine.shared.AtomicFiles;

/**
 * Stream sink that keeps up to {@code memoryLimit} bytes in memory and, once that is exceeded,
 * streams the complete output into a temp file that is renamed onto {@code spillTarget} on close.
 */
public final class CaptureBuffer extends OutputStream {
    private final int memoryLimit;
    private final Path spillTarget;
    private final ByteArrayOutputStream memory = new ByteArrayOutputStream();
    private OutputStream spill;
    private Path spillTemp;
    private long total;
    private boolean closed;

    public CaptureBuffer(int memoryLimit, Path spillTarget) {
        this.memoryLimit = memoryLimit;
        this.spillTarget = spillTarget;
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[] {(byte) b}, 0, 1);
    }

    @Override
    public synchronized void write(byte[] bytes, int offset, int length) throws IOException {
        total += length;
        if (spill == null && memory.size() + (long) length <= memoryLimit) {
            memory.write(bytes, offset, length);
            return;
        }
        if (spill == null) {
            openSpill();
        }
        spill.write(bytes, offset, length);
    }

    private void openSpill() throws IOException {
        if (spillTarget == null) {
            throw new IOException("Output exceeded " + memoryLimit + " bytes and no spill location is configured");
        }
        Files.createDirectories(spillTarget.toAbsolutePath().getParent());
        spillTemp = AtomicFiles.tempFor(spillTarget);
        spill = Files.newOutputStream(spillTemp);
        memory.writeTo(spill);
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (spill != null) {
            spill.close();
            AtomicFiles.move(spillTemp, spillTarget);
        }
    }

    /** Snapshot of what was captured; call after {@link #close()}. */
    public synchronized RawOutput result() {
        return new RawOutput(memory.toByteArray(), total, spill == null ? null : spillTarget);
    }
}
