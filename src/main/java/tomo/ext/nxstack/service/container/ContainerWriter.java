package tomo.ext.nxstack.service.container;

import tomo.ext.nxstack.model.NdArray;
import tomo.ext.nxstack.model.Plane;

import java.io.IOException;

/**
 * Write access to one container. Parent groups are created as needed.
 */
public interface ContainerWriter extends AutoCloseable {

    void createGroup(String path) throws IOException;

    /**
     * @param value a string, number, boolean or array of those
     */
    void setAttribute(String path, String key, Object value) throws IOException;

    void writeArray(String path, NdArray array) throws IOException;

    void writeIntArray(String path, int[] values) throws IOException;

    /**
     * Creates a stack dataset of shape {@code (count, rows, cols)}, or
     * {@code (count, rows, cols, 2)} for complex data, stored one slice per block.
     */
    StackWriter createStack(String path, int count, int rows, int cols, boolean complex) throws IOException;

    @Override
    void close();

    /**
     * Writes the slices of a stack created by {@link #createStack}. Each slice is an
     * independent block, so slices may be written in any order.
     */
    interface StackWriter {

        int count();

        void writeSlice(int index, Plane plane) throws IOException;
    }
}
