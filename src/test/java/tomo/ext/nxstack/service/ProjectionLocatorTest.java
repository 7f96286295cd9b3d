package tomo.ext.nxstack.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tomo.ext.nxstack.ProjectionFixtures;
import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.Facility;
import tomo.ext.nxstack.model.FacilitySchema;
import tomo.ext.nxstack.model.ProjectionRecord;
import tomo.ext.nxstack.model.SelectionFilter;
import tomo.ext.nxstack.service.container.ContainerWriter;
import tomo.ext.nxstack.service.container.N5ContainerStore;
import tomo.ext.nxstack.utilities.FacilityConfigManager;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionLocatorTest {

    private final N5ContainerStore store = new N5ContainerStore();
    private final ProjectionLocator locator = new ProjectionLocator(store, new ProjectionValidator(store));
    private final FacilitySchema i14 = FacilityConfigManager.getInstance().getSchema(Facility.I14);

    private ExecutorService pool;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        pool = Executors.newFixedThreadPool(2);
        for (int scan = 1; scan <= 3; scan++) {
            ProjectionFixtures.writePtypy(tempDir, scan, scan * 10.0, 2, 2, 0.1);
        }
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static SelectionFilter scans(Integer... ids) {
        return new SelectionFilter(new TreeSet<>(List.of(ids)), new TreeSet<>(), new TreeSet<>());
    }

    private static List<Integer> scanIds(LocatedProjections located) {
        return located.records().stream().map(ProjectionRecord::scan).toList();
    }

    private void writeForeignProjection(Path path) throws IOException {
        try (ContainerWriter writer = store.openWriter(path, false)) {
            writer.createGroup("/content/obj");
            writer.createGroup("/content/probe");
            writer.setAttribute("/content", "software", "SomethingElse");
        }
    }

    // ==================== Directory Scan Tests ====================

    @Test
    @DisplayName("Directory scan keeps the selected scans in ascending order")
    void testDirectoryScanWithSelection() {
        LocatedProjections located = locator.locate(i14, ExperimentType.PTYCHO, scans(3, 1), tempDir, null,
                false, false, pool);
        assertEquals(List.of(1, 3), scanIds(located));
        assertEquals(2, located.located());
        assertEquals(2, located.validated());
        assertEquals(0, located.skipped());
        assertEquals(Facility.I14, located.records().get(0).facility());
    }

    @Test
    @DisplayName("Invalid candidates are skipped and counted")
    void testInvalidCandidateIsSkipped() throws IOException {
        writeForeignProjection(tempDir.resolve("scan_4.ptyr"));
        Files.createDirectories(tempDir.resolve("notes"));
        Files.writeString(tempDir.resolve("notes/readme.txt"), "not a projection");

        LocatedProjections located = locator.locate(i14, ExperimentType.PTYCHO, SelectionFilter.unfiltered(),
                tempDir, null, false, false, pool);
        assertEquals(List.of(1, 2, 3), scanIds(located));
        assertEquals(4, located.located());
        assertEquals(3, located.validated());
        assertEquals(1, located.skipped());
    }

    @Test
    void testSkipCheckTrustsCandidates() throws IOException {
        writeForeignProjection(tempDir.resolve("scan_4.ptyr"));
        LocatedProjections located = locator.locate(i14, ExperimentType.PTYCHO, SelectionFilter.unfiltered(),
                tempDir, null, true, false, pool);
        assertEquals(List.of(1, 2, 3, 4), scanIds(located));
    }

    @Test
    @DisplayName("Scan number is read from the file when its name has none")
    void testScanFromAttribute() throws IOException {
        Path source = ProjectionFixtures.writePtypy(tempDir.resolve("tmp"), 42, 0.0, 2, 2, 0.1);
        Files.move(source, tempDir.resolve("reconstruction.ptyr"));
        LocatedProjections located = locator.locate(i14, ExperimentType.PTYCHO, scans(42), tempDir, null,
                false, false, pool);
        assertEquals(List.of(42), scanIds(located));
    }

    @Test
    void testDuplicateIdentifiersAreSkipped() throws IOException {
        ProjectionFixtures.writePtypy(Files.createDirectories(tempDir.resolve("again")), 2, 20.0, 2, 2, 0.1);
        LocatedProjections located = locator.locate(i14, ExperimentType.PTYCHO, SelectionFilter.unfiltered(),
                tempDir, null, false, false, pool);
        assertEquals(List.of(1, 2, 3), scanIds(located));
        assertEquals(1, located.skipped());
    }

    @Test
    void testMissingDirectory() {
        assertThrows(ProjectionNotFoundException.class, () -> locator.locate(i14, ExperimentType.PTYCHO,
                SelectionFilter.unfiltered(), tempDir.resolve("absent"), null, false, false, pool));
    }

    @Test
    @DisplayName("An empty selection fails unless tolerated")
    void testNothingFound() {
        assertThrows(ProjectionNotFoundException.class, () -> locator.locate(i14, ExperimentType.PTYCHO,
                scans(99), tempDir, null, false, false, pool));
        LocatedProjections tolerated = locator.locate(i14, ExperimentType.PTYCHO, scans(99), tempDir, null,
                false, true, pool);
        assertTrue(tolerated.records().isEmpty());
    }

    // ==================== Pattern Tests ====================

    @Test
    @DisplayName("Pattern substitution skips missing files")
    void testPatternSubstitution() {
        LocatedProjections located = locator.locate(i14, ExperimentType.PTYCHO, scans(1, 2, 9), tempDir,
                "scan_%(scan).ptyr", false, false, pool);
        assertEquals(List.of(1, 2), scanIds(located));
        assertEquals(1, located.skipped());
    }

    @Test
    void testAbsolutePatternIgnoresDirectory() {
        String pattern = tempDir.resolve("scan_%(scan).ptyr").toString();
        LocatedProjections located = locator.locate(i14, ExperimentType.PTYCHO, scans(3), Path.of("elsewhere"),
                pattern, false, false, pool);
        assertEquals(List.of(3), scanIds(located));
    }

    @Test
    void testPatternNeedsPlaceholder() {
        assertThrows(IllegalArgumentException.class, () -> locator.locate(i14, ExperimentType.PTYCHO, scans(1),
                tempDir, "scan_1.ptyr", false, false, pool));
    }

    @Test
    void testPatternNeedsIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> locator.locate(i14, ExperimentType.PTYCHO,
                SelectionFilter.unfiltered(), tempDir, "scan_%(scan).ptyr", false, false, pool));
    }

    // ==================== File Name Tests ====================

    @Test
    void testIdentifiersFromName() {
        var ptypy = i14.modality(ExperimentType.PTYCHO);
        assertArrayEquals(new Integer[]{12, null}, ProjectionLocator.identifiersFromName("scan_12.ptyr", ptypy));
        assertArrayEquals(new Integer[]{12, 3}, ProjectionLocator.identifiersFromName("scan_12_3.ptyr", ptypy));
        assertArrayEquals(new Integer[]{null, null}, ProjectionLocator.identifiersFromName("recon.ptyr", ptypy));

        var xrf = i14.modality(ExperimentType.XRF);
        assertArrayEquals(new Integer[]{1234, null}, ProjectionLocator.identifiersFromName("i14-1234_xrf.nxs", xrf));
    }
}
