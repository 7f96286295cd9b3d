package tomo.ext.nxstack;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.JoinRequest;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NxStackCommandTest {

    @TempDir
    Path tempDir;

    private Path projDir;
    private Path outDir;

    @BeforeEach
    void setUp() throws IOException {
        projDir = Files.createDirectories(tempDir.resolve("proj"));
        outDir = tempDir.resolve("out");
    }

    private static int execute(String... args) {
        CommandLine cmd = new CommandLine(new NxStackCommand());
        cmd.setErr(new PrintWriter(new StringWriter()));
        cmd.setOut(new PrintWriter(new StringWriter()));
        return cmd.execute(args);
    }

    private String[] ptychoArgs(String... extra) {
        List<String> args = new ArrayList<>(List.of("-e", "ptycho", "--facility", "i14",
                "--proj-dir", projDir.toString(), "--nxtomo-dir", outDir.toString(), "--workers", "2"));
        args.addAll(List.of(extra));
        return args.toArray(new String[0]);
    }

    // ==================== Argument Parsing Tests ====================

    @Test
    void testBuildRequest() {
        NxStackCommand command = new NxStackCommand();
        new CommandLine(command).parseArgs("-e", "xrf", "--transition", "Pt-La,Fe-Ka", "--from-scan", "1-3",
                "--no-pad-to-max", "--sort-by-angle");
        JoinRequest request = command.buildRequest();

        assertEquals(ExperimentType.XRF, request.experiment());
        assertEquals(List.of("Pt-La", "Fe-Ka"), request.transitions());
        assertEquals("1-3", request.scanSpec());
        assertFalse(request.padToMax());
        assertTrue(request.sortByAngle());
        assertTrue(request.savePhase());
        assertEquals(Path.of("."), request.outputDir());
    }

    @Test
    void testMissingExperimentIsUsageError() {
        assertEquals(NxStackCommand.EXIT_ERROR, execute("--proj-dir", "."));
    }

    // ==================== Exit Code Tests ====================

    @Test
    @DisplayName("Successful run exits 0 and writes the JSON report")
    void testSuccessWithSummary() throws IOException {
        ProjectionFixtures.writePtypy(projDir, 1, 0.0, 2, 2, 0.1);
        ProjectionFixtures.writePtypy(projDir, 2, 90.0, 2, 2, 0.1);
        Path report = tempDir.resolve("reports/summary.json");

        assertEquals(NxStackCommand.EXIT_OK, execute(ptychoArgs("--summary-json", report.toString())));

        assertTrue(Files.isDirectory(outDir.resolve("tomo_ptycho_1_2_phase.n5")));
        JsonObject json = JsonParser.parseString(Files.readString(report, StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals(1, json.getAsJsonArray("outputs").size());
        JsonObject summary = json.getAsJsonObject("summary");
        assertEquals("ptycho", summary.get("experiment").getAsString());
        assertEquals(2, summary.get("loaded").getAsInt());
        assertEquals("phase", summary.getAsJsonArray("roles").get(0).getAsJsonObject().get("role").getAsString());
    }

    @Test
    void testMalformedSelectionExitsTwo() throws IOException {
        ProjectionFixtures.writePtypy(projDir, 1, 0.0, 2, 2, 0.1);
        assertEquals(NxStackCommand.EXIT_ERROR, execute(ptychoArgs("--from-scan", "5-1")));
    }

    @Test
    void testUnknownFacilityExitsTwo() {
        assertEquals(NxStackCommand.EXIT_ERROR, execute("-e", "ptycho", "--facility", "p99",
                "--proj-dir", projDir.toString()));
    }

    @Test
    void testNoProjectionsExitsTwo() {
        assertEquals(NxStackCommand.EXIT_ERROR, execute(ptychoArgs()));
    }

    @Test
    void testXrfWithoutTransitionExitsTwo() {
        assertEquals(NxStackCommand.EXIT_ERROR, execute("-e", "xrf", "--facility", "i14",
                "--proj-dir", projDir.toString()));
    }

    @Test
    @DisplayName("No stack written exits 1")
    void testTotalFailureExitsOne() throws IOException {
        ProjectionFixtures.writePtypy(projDir, 1, 0.0, 2, 2, 0.1);
        ProjectionFixtures.writePtypy(projDir, 2, 90.0, 3, 3, 0.1);
        assertEquals(NxStackCommand.EXIT_TOTAL_FAILURE, execute(ptychoArgs("--no-pad-to-max")));
    }

    @Test
    void testDryRunWithoutMatchesExitsZero() {
        assertEquals(NxStackCommand.EXIT_OK, execute(ptychoArgs("--dry-run")));
        assertFalse(Files.exists(outDir));
    }
}
