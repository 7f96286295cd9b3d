package tomo.ext.nxstack.modality.ptycho;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tomo.ext.nxstack.model.Plane;

import static org.junit.jupiter.api.Assertions.*;

class PhaseCorrectionsTest {

    private static final double EPS = 1e-9;

    // ==================== Median Tests ====================

    @Test
    void testMedian() {
        assertEquals(2.0, PhaseCorrections.median(new double[]{3, 1, 2}));
        assertEquals(2.5, PhaseCorrections.median(new double[]{4, 1, 3, 2}));
        assertEquals(0.0, PhaseCorrections.median(new double[0]));
    }

    @Test
    void testWrap() {
        assertEquals(0.5, PhaseCorrections.wrap(0.5 + 2 * Math.PI), EPS);
        assertEquals(Math.PI, PhaseCorrections.wrap(-Math.PI), EPS);
        assertEquals(-Math.PI / 2, PhaseCorrections.wrap(3 * Math.PI / 2), EPS);
    }

    @Test
    @DisplayName("Median normalisation centres a real phase on zero")
    void testMedianNormaliseRealPhase() {
        Plane phase = Plane.real(1, 3, new double[]{0.2, 0.5, 0.9});
        Plane centred = PhaseCorrections.medianNormalise(phase);
        assertEquals(-0.3, centred.get(0, 0), EPS);
        assertEquals(0.0, centred.get(0, 1), EPS);
        assertEquals(0.4, centred.get(0, 2), EPS);
    }

    @Test
    @DisplayName("Median normalisation does not wrap shifted samples")
    void testMedianNormaliseKeepsLargeOffsets() {
        Plane phase = Plane.real(1, 3, new double[]{-3.0, -2.5, 3.0});
        Plane centred = PhaseCorrections.medianNormalise(phase);
        assertEquals(5.5, centred.get(0, 2), EPS);
        assertEquals(-0.5, centred.get(0, 0), EPS);
    }

    @Test
    @DisplayName("Median normalisation of a complex object keeps its modulus")
    void testMedianNormaliseComplex() {
        double a = 1.0;
        Plane object = Plane.complex(1, 2,
                new double[]{2 * Math.cos(a), 3 * Math.cos(a)},
                new double[]{2 * Math.sin(a), 3 * Math.sin(a)});
        Plane centred = PhaseCorrections.medianNormalise(object);
        assertEquals(0.0, centred.phase().get(0, 0), EPS);
        assertEquals(0.0, centred.phase().get(0, 1), EPS);
        assertEquals(2.0, centred.modulus().get(0, 0), EPS);
        assertEquals(3.0, centred.modulus().get(0, 1), EPS);
    }

    // ==================== Unwrap Tests ====================

    @Test
    @DisplayName("Unwrapping removes 2 pi jumps along a row")
    void testUnwrapRow() {
        double step = 1.0;
        double[] wrapped = new double[8];
        for (int i = 0; i < wrapped.length; i++) {
            wrapped[i] = PhaseCorrections.wrap(i * step);
        }
        Plane unwrapped = PhaseCorrections.unwrap(Plane.real(1, 8, wrapped));
        for (int i = 1; i < 8; i++) {
            assertEquals(step, unwrapped.get(0, i) - unwrapped.get(0, i - 1), EPS);
        }
    }

    @Test
    void testUnwrapColumnThenRows() {
        double[] wrapped = new double[3 * 3];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                wrapped[r * 3 + c] = PhaseCorrections.wrap(2.0 * r + 1.5 * c + 0.1);
            }
        }
        Plane unwrapped = PhaseCorrections.unwrap(Plane.real(3, 3, wrapped));
        assertEquals(2.0, unwrapped.get(2, 0) - unwrapped.get(1, 0), EPS);
        assertEquals(1.5, unwrapped.get(2, 2) - unwrapped.get(2, 1), EPS);
    }

    @Test
    @DisplayName("A mostly negative surface is flipped")
    void testUnwrapSignFlip() {
        Plane unwrapped = PhaseCorrections.unwrap(Plane.real(1, 3, new double[]{-0.5, -0.4, -0.3}));
        assertEquals(0.5, unwrapped.get(0, 0), EPS);
        assertEquals(0.3, unwrapped.get(0, 2), EPS);
    }

    @Test
    void testUnwrapRejectsComplex() {
        Plane object = Plane.complex(1, 1, new double[]{1}, new double[]{0});
        assertThrows(IllegalArgumentException.class, () -> PhaseCorrections.unwrap(object));
    }

    // ==================== Placeholder Tests ====================

    @Test
    @DisplayName("Ramp removal and rescaling leave the data unchanged")
    void testNoOpCorrections() {
        Plane plane = Plane.real(1, 2, new double[]{1, 2});
        assertSame(plane, PhaseCorrections.removeRamp(plane));
        assertSame(plane, PhaseCorrections.rescale(plane));
    }
}
