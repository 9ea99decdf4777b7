package work.agentflow.engine.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path workspace;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cli = Main.commandLine();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        return cli.execute(args);
    }

    private Map<String, Object> printedResult() throws IOException {
        return JSON.readValue(out.toString(), new TypeReference<Map<String, Object>>() {});
    }

    @Test
    void runPrintsResultJsonAndExitCode() throws IOException {
        var flow = workspace.resolve("flow.yaml");
        Files.writeString(flow, """
            name: cli
            steps:
              - name: present
                wait_for: {glob: "${context.file}", timeout: 1s}
            """);
        var code = execute("run", "-w", workspace.toString(), "--log-level", "warn", "-s", "file=flow.yaml", flow.toString());
        assertEquals(0, code, err.toString());
        var result = printedResult();
        assertEquals("completed", result.get("status"));
        assertTrue(Files.isRegularFile(Path.of((String) result.get("state_file"))));
    }

    @Test
    void cancelWritesMarkerForKnownRun() throws IOException {
        Files.createDirectories(workspace.resolve(".agentflow/runs/run-7"));
        var code = execute("cancel", "-w", workspace.toString(), "run-7");
        assertEquals(0, code);
        assertTrue(Files.exists(workspace.resolve(".agentflow/runs/run-7/CANCEL")));
        assertTrue(out.toString().contains("run-7"));
    }

    @Test
    void cancelOfUnknownRunReportsConfigurationError() {
        var code = execute("cancel", "-w", workspace.toString(), "nope");
        assertEquals(1, code);
        assertTrue(err.toString().contains("configuration: Unknown run: nope"), err.toString());
    }

    @Test
    void missingWorkflowFileIsAUsageError() {
        var code = execute("run", "-w", workspace.toString(), workspace.resolve("absent.yaml").toString());
        assertEquals(2, code);
        assertTrue(err.toString().contains("Workflow file not found"));
    }

    @Test
    void subcommandIsRequired() {
        assertEquals(2, execute());
    }

    @Test
    void versionNamesTheTool() {
        assertEquals(0, execute("--version"));
        assertTrue(out.toString().startsWith("agentflow "));
    }
}
