package tomo.ext.nxstack.modality.ptycho;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tomo.ext.nxstack.ProjectionFixtures;
import tomo.ext.nxstack.modality.Extraction;
import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.Facility;
import tomo.ext.nxstack.model.JoinRequest;
import tomo.ext.nxstack.model.ModalitySchema;
import tomo.ext.nxstack.model.NdArray;
import tomo.ext.nxstack.model.Plane;
import tomo.ext.nxstack.model.ProjectionRecord;
import tomo.ext.nxstack.service.container.ContainerReader;
import tomo.ext.nxstack.service.container.ContainerWriter;
import tomo.ext.nxstack.service.container.N5ContainerStore;
import tomo.ext.nxstack.utilities.FacilityConfigManager;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PtychoModalityHandlerTest {

    private static final double EPS = 1e-9;

    private static ModalitySchema ptypy;
    private static ModalitySchema ptyrex;

    private final N5ContainerStore store = new N5ContainerStore();
    private final PtychoModalityHandler handler = new PtychoModalityHandler();

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadLayouts() {
        FacilityConfigManager config = FacilityConfigManager.getInstance();
        ptypy = config.getSchema(Facility.I14).modality(ExperimentType.PTYCHO);
        ptyrex = config.getSchema(Facility.I13_1).modality(ExperimentType.PTYCHO);
    }

    private JoinRequest.Builder request() {
        return JoinRequest.builder()
                .experiment(ExperimentType.PTYCHO)
                .outputDir(tempDir.resolve("out"))
                .projDir(tempDir);
    }

    private static ProjectionRecord record(Path path, int scan) {
        return new ProjectionRecord(path, Facility.I14, ExperimentType.PTYCHO, scan, null, 0.0);
    }

    // ==================== Role Selection Tests ====================

    @Test
    @DisplayName("Phase is the only role by default")
    void testDefaultRoles() {
        assertEquals(List.of(PtychoModalityHandler.PHASE), handler.roles(request().build()));
    }

    @Test
    void testRoleOrder() {
        JoinRequest all = request().saveComplex(true).saveModulus(true).build();
        assertEquals(List.of("complex", "modulus", "phase"), handler.roles(all));
    }

    @Test
    void testNoRoleIsRejected() {
        JoinRequest none = request().savePhase(false).build();
        assertThrows(IllegalArgumentException.class, () -> handler.roles(none));
    }

    // ==================== Complex Object Tests ====================

    @Test
    @DisplayName("Modulus and phase are derived from the complex object")
    void testExtractFromComplexObject() throws IOException {
        Path path = ProjectionFixtures.writePtypy(tempDir, 5, 30.0, 2, 3, 0.75);
        JoinRequest request = request().saveComplex(true).saveModulus(true).build();
        try (ContainerReader reader = store.openReader(path)) {
            Extraction extraction = handler.extract(reader, record(path, 5), ptypy, request);
            assertTrue(extraction.failures().isEmpty());
            Plane complex = extraction.planes().get(PtychoModalityHandler.COMPLEX);
            assertTrue(complex.isComplex());
            assertArrayEquals(new int[]{2, 3}, complex.shape());
            assertEquals(1.0, extraction.planes().get(PtychoModalityHandler.MODULUS).get(1, 2), EPS);
            assertEquals(0.75, extraction.planes().get(PtychoModalityHandler.PHASE).get(0, 1), EPS);
        }
    }

    @Test
    void testMedianNormalisationIsApplied() throws IOException {
        Path path = ProjectionFixtures.writePtypy(tempDir, 6, 30.0, 2, 2, 1.2);
        JoinRequest request = request().medianNorm(true).build();
        try (ContainerReader reader = store.openReader(path)) {
            Plane phase = handler.extract(reader, record(path, 6), ptypy, request).planes().get("phase");
            assertEquals(0.0, phase.get(1, 1), EPS);
        }
    }

    @Test
    @DisplayName("Phase corrections leave the complex role as stored")
    void testComplexRoleIgnoresCorrections() throws IOException {
        Path path = ProjectionFixtures.writePtypy(tempDir, 7, 30.0, 2, 2, 1.2);
        JoinRequest request = request().saveComplex(true).medianNorm(true).removeRamp(true).build();
        try (ContainerReader reader = store.openReader(path)) {
            Extraction extraction = handler.extract(reader, record(path, 7), ptypy, request);
            Plane complex = extraction.planes().get(PtychoModalityHandler.COMPLEX);
            for (int i = 0; i < 4; i++) {
                assertEquals(Math.cos(1.2), complex.real()[i], EPS);
                assertEquals(Math.sin(1.2), complex.imag()[i], EPS);
            }
            assertEquals(0.0, extraction.planes().get(PtychoModalityHandler.PHASE).get(0, 0), EPS);
        }
    }

    // ==================== Separate Modulus and Phase Tests ====================

    @Test
    @DisplayName("Separately stored modulus and phase are read directly")
    void testExtractSeparateArrays() throws IOException {
        Path path = tempDir.resolve("scan_281_0_recon.hdf");
        try (ContainerWriter writer = store.openWriter(path, false)) {
            writer.writeArray(ptyrex.modulusPath(), new NdArray(new int[]{1, 2, 2}, new double[]{1, 2, 3, 4}));
            writer.writeArray(ptyrex.phasePath(), new NdArray(new int[]{1, 2, 2}, new double[]{0.1, 0.2, 0.3, 0.4}));
        }
        JoinRequest request = request().saveModulus(true).build();
        try (ContainerReader reader = store.openReader(path)) {
            Extraction extraction = handler.extract(reader, record(path, 281), ptyrex, request);
            assertEquals(4.0, extraction.planes().get("modulus").get(1, 1), EPS);
            assertEquals(0.2, extraction.planes().get("phase").get(0, 1), EPS);
        }
    }

    @Test
    @DisplayName("A missing array fails only its own role")
    void testMissingRoleArray() throws IOException {
        Path path = tempDir.resolve("scan_282_0_recon.hdf");
        try (ContainerWriter writer = store.openWriter(path, false)) {
            writer.writeArray(ptyrex.phasePath(), new NdArray(new int[]{2, 2}, new double[]{0.1, 0.2, 0.3, 0.4}));
        }
        JoinRequest request = request().saveModulus(true).build();
        try (ContainerReader reader = store.openReader(path)) {
            Extraction extraction = handler.extract(reader, record(path, 282), ptyrex, request);
            assertTrue(extraction.planes().containsKey("phase"));
            assertTrue(extraction.failures().containsKey("modulus"));
        }
    }

    @Test
    void testNothingReadableIsAnError() throws IOException {
        Path path = tempDir.resolve("empty.hdf");
        try (ContainerWriter writer = store.openWriter(path, false)) {
            writer.createGroup("/entry_1");
        }
        try (ContainerReader reader = store.openReader(path)) {
            assertThrows(IOException.class, () -> handler.extract(reader, record(path, 1), ptyrex, request().build()));
        }
    }

    @Test
    void testDescribeTransforms() {
        assertEquals("none", handler.describeTransforms(request().build()));
        assertEquals("median normalisation, phase unwrapping",
                handler.describeTransforms(request().medianNorm(true).unwrapPhase(true).build()));
    }
}
