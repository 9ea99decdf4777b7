package work.agentflow.engine.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.agentflow.engine.model.OutputSpec;
import work.agentflow.engine.model.OutputSpec.CaptureMode;
import work.agentflow.engine.shared.ErrorKind;
import work.agentflow.engine.shared.OutputParseException;

class OutputProcessorTest {
    @TempDir
    Path logs;

    private final OutputProcessor processor = new OutputProcessor(8, 32, 3);

    @Test
    void smallTextIsStoredWhole() {
        var captured = processor.process(RawOutput.of("hello"), OutputSpec.defaults(), logs.resolve("one.stdout"));
        assertEquals("hello", captured.text());
        assertFalse(captured.truncated());
        assertNull(captured.spillPath());
    }

    @Test
    void oversizedTextIsTruncatedAndSpilled() throws IOException {
        var spill = logs.resolve("big.stdout");
        var captured = processor.process(RawOutput.of("0123456789abcdef"), OutputSpec.defaults(), spill);
        assertEquals("01234567", captured.text());
        assertTrue(captured.truncated());
        assertEquals(spill.toString(), captured.spillPath());
        assertEquals("0123456789abcdef", Files.readString(spill));
    }

    @Test
    void streamBeyondMemoryLimitSpillsThroughCaptureBuffer() throws IOException {
        var spill = logs.resolve("stream.stdout");
        var buffer = new CaptureBuffer(32, spill);
        var payload = "x".repeat(100).getBytes(StandardCharsets.UTF_8);
        buffer.write(payload, 0, payload.length);
        buffer.close();
        var raw = buffer.result();
        assertTrue(raw.overflowed());
        assertEquals(100, raw.totalBytes());

        var captured = processor.process(raw, OutputSpec.defaults(), spill);
        assertTrue(captured.truncated());
        assertEquals(spill.toString(), captured.spillPath());
        assertEquals(100, Files.size(spill));
    }

    @Test
    void linesAreCappedAndOmitText() {
        var captured = processor.process(RawOutput.of("a\nb\nc\nd\n"), OutputSpec.of(CaptureMode.LINES), logs.resolve("lines.stdout"));
        assertEquals(List.of("a", "b", "c"), captured.lines());
        assertTrue(captured.truncated());
        assertNull(captured.text());
    }

    @Test
    void jsonIsParsed() {
        var captured = processor.process(RawOutput.of("{\"files\":[\"a\"]}"), OutputSpec.of(CaptureMode.JSON), null);
        assertEquals(Map.of("files", List.of("a")), captured.json());
        assertFalse(captured.parseError());
    }

    @Test
    void malformedJsonFailsUnlessTolerated() throws IOException {
        var ex = assertThrows(OutputParseException.class,
            () -> processor.process(RawOutput.of("{oops"), OutputSpec.of(CaptureMode.JSON), logs.resolve("bad.stdout")));
        assertEquals(ErrorKind.OUTPUT_PARSE, ex.kind());
        assertFalse(ex.kind().retryable());

        var spill = logs.resolve("tolerated.stdout");
        var tolerated = processor.process(RawOutput.of("{oops"), new OutputSpec(CaptureMode.JSON, true, null), spill);
        assertTrue(tolerated.parseError());
        assertNull(tolerated.json());
        assertEquals("{oops", Files.readString(spill));
    }

    @Test
    void jsonOverBufferLimitIsAParseError() {
        var big = "[" + "1,".repeat(20) + "1]";
        assertThrows(OutputParseException.class, () -> processor.process(RawOutput.of(big), OutputSpec.of(CaptureMode.JSON), logs.resolve("x")));
    }
}
