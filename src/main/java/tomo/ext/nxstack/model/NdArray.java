package tomo.ext.nxstack.model;

import java.util.Arrays;

/**
 * Dense n-dimensional array of doubles in row-major order (last axis fastest).
 */
public final class NdArray {

    private final int[] shape;
    private final double[] values;

    public NdArray(int[] shape, double[] values) {
        long size = 1;
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
            size *= dim;
        }
        if (size != values.length) {
            throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " needs " + size
                    + " values but got " + values.length);
        }
        this.shape = shape.clone();
        this.values = values;
    }

    public static NdArray vector(double... values) {
        return new NdArray(new int[]{values.length}, values);
    }

    public int[] shape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    public int size() {
        return values.length;
    }

    /**
     * @return the backing values, not copied
     */
    public double[] values() {
        return values;
    }

    public double mean() {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Returns the first plane of the trailing {@code keep} axes, i.e. index 0 along every
     * leading axis.
     *
     * @param keep number of trailing axes to keep
     * @return the sub-array, or this array when there are no leading axes
     */
    public NdArray leadingFirst(int keep) {
        if (keep >= shape.length) {
            return this;
        }
        int[] kept = Arrays.copyOfRange(shape, shape.length - keep, shape.length);
        int n = 1;
        for (int dim : kept) {
            n *= dim;
        }
        return new NdArray(kept, Arrays.copyOf(values, n));
    }

    @Override
    public String toString() {
        return "NdArray" + Arrays.toString(shape);
    }
}
