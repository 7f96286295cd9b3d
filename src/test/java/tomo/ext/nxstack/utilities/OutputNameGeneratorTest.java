package tomo.ext.nxstack.utilities;

import org.junit.jupiter.api.Test;
import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.Facility;
import tomo.ext.nxstack.model.ProjectionRecord;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputNameGeneratorTest {

    private static ProjectionRecord record(Integer scan, Integer proj) {
        return new ProjectionRecord(Path.of("p"), Facility.I13_1, ExperimentType.PTYCHO, scan, proj, null);
    }

    @Test
    void testScanRange() {
        String name = OutputNameGenerator.stackName(ExperimentType.PTYCHO, "phase",
                List.of(record(105, null), record(101, null), record(103, null)), ".n5");
        assertEquals("tomo_ptycho_101_105_phase.n5", name);
    }

    @Test
    void testSingleScanWithProjections() {
        String name = OutputNameGenerator.stackName(ExperimentType.PTYCHO, "modulus",
                List.of(record(281, 3), record(281, 0), record(281, 7)), ".n5");
        assertEquals("tomo_ptycho_281_0_7_modulus.n5", name);
    }

    @Test
    void testProjectionsOnly() {
        String name = OutputNameGenerator.stackName(ExperimentType.PTYCHO, "phase",
                List.of(record(null, 4), record(null, 9)), ".n5");
        assertEquals("tomo_ptycho_4_9_phase.n5", name);
    }

    @Test
    void testTransitionRoleIsSanitised() {
        String name = OutputNameGenerator.stackName(ExperimentType.XRF, "Pt La/2",
                List.of(record(10, null), record(12, null)), ".n5");
        assertEquals("tomo_xrf_10_12_Pt_La_2.n5", name);
    }

    @Test
    void testSanitizeForFilename() {
        assertEquals("a_b_c", OutputNameGenerator.sanitizeForFilename("a:b  c"));
        assertEquals("Pt-La", OutputNameGenerator.sanitizeForFilename("Pt-La"));
        assertNull(OutputNameGenerator.sanitizeForFilename(null));
    }
}
