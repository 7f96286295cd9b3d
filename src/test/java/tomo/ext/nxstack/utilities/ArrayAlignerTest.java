package tomo.ext.nxstack.utilities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.Facility;
import tomo.ext.nxstack.model.Plane;
import tomo.ext.nxstack.model.ProjectionRecord;
import tomo.ext.nxstack.model.StackEntry;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArrayAlignerTest {

    private static StackEntry entry(int scan, int rows, int cols) {
        double[] values = new double[rows * cols];
        Arrays.fill(values, scan);
        ProjectionRecord record = new ProjectionRecord(Path.of("scan_" + scan + ".ptyr"), Facility.I14,
                ExperimentType.PTYCHO, scan, null, null);
        return new StackEntry(record, "phase", Plane.real(rows, cols, values));
    }

    @Test
    void testMaxShapeIsElementWise() {
        int[] max = ArrayAligner.maxShape(List.of(entry(1, 4, 2), entry(2, 3, 5)));
        assertArrayEquals(new int[]{4, 5}, max);
        assertArrayEquals(new int[]{0, 0}, ArrayAligner.maxShape(List.of()));
    }

    @Test
    @DisplayName("Uniform entries are returned unchanged")
    void testUniformEntriesUnchanged() {
        List<StackEntry> entries = List.of(entry(1, 3, 3), entry(2, 3, 3));
        assertSame(entries, ArrayAligner.align(entries, false));
    }

    @Test
    @DisplayName("Padding grows every entry to the maximum shape with trailing zeros")
    void testPadToMax() {
        List<StackEntry> aligned = ArrayAligner.align(List.of(entry(1, 2, 2), entry(2, 3, 4)), true);
        for (StackEntry e : aligned) {
            assertArrayEquals(new int[]{3, 4}, e.shape());
        }
        Plane padded = aligned.get(0).plane();
        assertEquals(1.0, padded.get(1, 1));
        assertEquals(0.0, padded.get(1, 2));
        assertEquals(0.0, padded.get(2, 0));
        assertEquals(1, aligned.get(0).source().scan());
    }

    @Test
    @DisplayName("Without padding a mismatch names the offending projections")
    void testMismatchWithoutPadding() {
        ShapeMismatchException e = assertThrows(ShapeMismatchException.class,
                () -> ArrayAligner.align(List.of(entry(7, 2, 2), entry(8, 3, 3)), false));
        assertEquals("phase", e.getRole());
        assertTrue(e.getMessage().contains("scan 7"));
        assertFalse(e.getMessage().contains("scan 8"));
    }

    @Test
    void testEmptyEntries() {
        assertTrue(ArrayAligner.align(List.of(), false).isEmpty());
    }
}
