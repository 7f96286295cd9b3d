package tomo.ext.nxstack.modality.ptycho;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.model.Plane;

import java.util.Arrays;

/**
 * Numeric corrections applied to ptychographic reconstructions before stacking.
 *
 * <p>Ramp removal and rescaling are accepted but have no numeric effect yet.</p>
 */
public final class PhaseCorrections {

    private static final Logger logger = LoggerFactory.getLogger(PhaseCorrections.class);

    private static final double TWO_PI = 2 * Math.PI;

    private PhaseCorrections() {
        // Utility class - no instantiation
    }

    /**
     * Phase ramp removal. Returns the plane unchanged.
     */
    public static Plane removeRamp(Plane plane) {
        logger.trace("Ramp removal is not implemented, {} left unchanged", plane);
        return plane;
    }

    /**
     * Rescaling. Returns the plane unchanged.
     */
    public static Plane rescale(Plane plane) {
        logger.trace("Rescaling is not implemented, {} left unchanged", plane);
        return plane;
    }

    /**
     * Centres the phase on its median.
     *
     * <p>For a complex plane every sample is rotated by minus the median of its argument,
     * which leaves the modulus unchanged. For a real phase plane the median is subtracted
     * from every sample; the result is not wrapped.</p>
     *
     * @param plane complex object or real phase
     * @return the centred plane
     */
    public static Plane medianNormalise(Plane plane) {
        if (plane.isComplex()) {
            double shift = -median(plane.phase().real());
            double cos = Math.cos(shift);
            double sin = Math.sin(shift);
            double[] re = plane.real();
            double[] im = plane.imag();
            double[] outRe = new double[re.length];
            double[] outIm = new double[re.length];
            for (int i = 0; i < re.length; i++) {
                outRe[i] = re[i] * cos - im[i] * sin;
                outIm[i] = re[i] * sin + im[i] * cos;
            }
            return Plane.complex(plane.rows(), plane.cols(), outRe, outIm);
        }
        double median = median(plane.real());
        double[] phase = plane.real();
        double[] out = new double[phase.length];
        for (int i = 0; i < phase.length; i++) {
            out[i] = phase[i] - median;
        }
        return Plane.real(plane.rows(), plane.cols(), out);
    }

    /**
     * Removes 2 pi discontinuities from a phase plane by integrating wrapped differences,
     * first down the first column and then along every row.
     *
     * <p>The unwrapped surface is negated when fewer than half of its samples are positive.</p>
     *
     * @param phase real phase plane
     * @return the unwrapped phase
     */
    public static Plane unwrap(Plane phase) {
        if (phase.isComplex()) {
            throw new IllegalArgumentException("Unwrapping needs a real phase plane, got " + phase);
        }
        int rows = phase.rows();
        int cols = phase.cols();
        double[] in = phase.real();
        double[] out = new double[in.length];
        if (in.length == 0) {
            return Plane.real(rows, cols, out);
        }

        out[0] = in[0];
        for (int r = 1; r < rows; r++) {
            int i = r * cols;
            out[i] = out[i - cols] + wrap(in[i] - in[i - cols]);
        }
        for (int r = 0; r < rows; r++) {
            int row = r * cols;
            for (int c = 1; c < cols; c++) {
                out[row + c] = out[row + c - 1] + wrap(in[row + c] - in[row + c - 1]);
            }
        }

        long positive = Arrays.stream(out).filter(v -> v > 0).count();
        if (positive < out.length / 2.0) {
            for (int i = 0; i < out.length; i++) {
                out[i] = -out[i];
            }
        }
        return Plane.real(rows, cols, out);
    }

    /**
     * Median with the midpoint convention for an even number of samples.
     *
     * @return the median, or 0 for no samples
     */
    public static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Wraps an angle into (-pi, pi].
     */
    public static double wrap(double angle) {
        double wrapped = angle - TWO_PI * Math.floor((angle + Math.PI) / TWO_PI);
        return wrapped == -Math.PI ? Math.PI : wrapped;
    }
}
