package tomo.ext.nxstack.model;

import java.util.Arrays;

/**
 * A two-dimensional slice, real or complex, stored row-major.
 *
 * <p>Planes are treated as immutable: every operation returns a new plane.</p>
 */
public final class Plane {

    private final int rows;
    private final int cols;
    private final double[] real;
    private final double[] imag;

    private Plane(int rows, int cols, double[] real, double[] imag) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Negative plane shape " + rows + "x" + cols);
        }
        if (real.length != rows * cols || (imag != null && imag.length != rows * cols)) {
            throw new IllegalArgumentException("Plane data does not match shape " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.real = real;
        this.imag = imag;
    }

    public static Plane real(int rows, int cols, double[] values) {
        return new Plane(rows, cols, values, null);
    }

    public static Plane complex(int rows, int cols, double[] real, double[] imag) {
        return new Plane(rows, cols, real, imag);
    }

    /**
     * Builds a plane from a real array of rank 2 or more, taking index 0 of every leading axis.
     */
    public static Plane fromReal(NdArray array) {
        if (array.rank() < 2) {
            throw new IllegalArgumentException("Expected at least 2 dimensions but got " + array);
        }
        NdArray plane = array.leadingFirst(2);
        int[] shape = plane.shape();
        return real(shape[0], shape[1], plane.values().clone());
    }

    /**
     * Builds a plane from a complex array stored with a trailing axis of length 2, taking
     * index 0 of every leading axis.
     */
    public static Plane fromInterleaved(NdArray array) {
        int[] shape = array.shape();
        if (shape.length < 3 || shape[shape.length - 1] != 2) {
            throw new IllegalArgumentException("Expected a complex array with trailing axis of 2 but got " + array);
        }
        NdArray plane = array.leadingFirst(3);
        int rows = shape[shape.length - 3];
        int cols = shape[shape.length - 2];
        double[] values = plane.values();
        double[] re = new double[rows * cols];
        double[] im = new double[rows * cols];
        for (int i = 0; i < re.length; i++) {
            re[i] = values[2 * i];
            im[i] = values[2 * i + 1];
        }
        return complex(rows, cols, re, im);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int[] shape() {
        return new int[]{rows, cols};
    }

    public boolean isComplex() {
        return imag != null;
    }

    /**
     * @return the real part, not copied
     */
    public double[] real() {
        return real;
    }

    /**
     * @return the imaginary part, or null for a real plane
     */
    public double[] imag() {
        return imag;
    }

    public double get(int row, int col) {
        return real[row * cols + col];
    }

    /**
     * @return the magnitude of every sample
     */
    public Plane modulus() {
        if (imag == null) {
            double[] out = new double[real.length];
            for (int i = 0; i < out.length; i++) {
                out[i] = Math.abs(real[i]);
            }
            return real(rows, cols, out);
        }
        double[] out = new double[real.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = Math.hypot(real[i], imag[i]);
        }
        return real(rows, cols, out);
    }

    /**
     * @return the argument of every sample in (-pi, pi]
     */
    public Plane phase() {
        double[] out = new double[real.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = Math.atan2(imag == null ? 0.0 : imag[i], real[i]);
        }
        return real(rows, cols, out);
    }

    /**
     * Zero-pads this plane at its trailing edges.
     *
     * @param newRows target row count, not smaller than {@link #rows()}
     * @param newCols target column count, not smaller than {@link #cols()}
     * @return the padded plane, or this plane when the shape already matches
     */
    public Plane padTo(int newRows, int newCols) {
        if (newRows < rows || newCols < cols) {
            throw new IllegalArgumentException("Cannot pad " + rows + "x" + cols + " down to " + newRows + "x" + newCols);
        }
        if (newRows == rows && newCols == cols) {
            return this;
        }
        double[] re = new double[newRows * newCols];
        double[] im = imag == null ? null : new double[newRows * newCols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(real, r * cols, re, r * newCols, cols);
            if (im != null) {
                System.arraycopy(imag, r * cols, im, r * newCols, cols);
            }
        }
        return new Plane(newRows, newCols, re, im);
    }

    /**
     * @return real and imaginary parts interleaved, as stored on disk for complex stacks
     */
    public double[] interleaved() {
        double[] out = new double[real.length * 2];
        for (int i = 0; i < real.length; i++) {
            out[2 * i] = real[i];
            out[2 * i + 1] = imag == null ? 0.0 : imag[i];
        }
        return out;
    }

    @Override
    public String toString() {
        return (imag == null ? "Plane" : "ComplexPlane") + Arrays.toString(shape());
    }
}
