package tomo.ext.nxstack.service.container;

import com.google.gson.JsonElement;
import org.janelia.saalfeldlab.n5.Compression;
import org.janelia.saalfeldlab.n5.DataBlock;
import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.DoubleArrayDataBlock;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.IntArrayDataBlock;
import org.janelia.saalfeldlab.n5.N5Exception;
import org.janelia.saalfeldlab.n5.N5FSReader;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.janelia.saalfeldlab.n5.RawCompression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.model.NdArray;
import tomo.ext.nxstack.model.Plane;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * {@link ContainerStore} backed by N5 filesystem containers.
 *
 * <p>N5 orders dimensions fastest first, so a row-major array of shape {@code (n, rows, cols)}
 * is stored with N5 dimensions {@code {cols, rows, n}}. The flat element order is identical,
 * which lets blocks be copied without transposition.</p>
 *
 * <p>Every {@link N5Exception} is rethrown as an {@link IOException} naming the container.</p>
 */
public class N5ContainerStore implements ContainerStore {
    private static final Logger logger = LoggerFactory.getLogger(N5ContainerStore.class);

    public static final String EXTENSION = ".n5";
    static final String ROOT_ATTRIBUTES = "attributes.json";

    @Override
    public String extension() {
        return EXTENSION;
    }

    @Override
    public boolean isContainer(Path path) {
        return path != null && Files.isDirectory(path) && Files.isRegularFile(path.resolve(ROOT_ATTRIBUTES));
    }

    @Override
    public ContainerReader openReader(Path path) throws IOException {
        if (!isContainer(path)) {
            throw new IOException("Not a readable container: " + path);
        }
        try {
            return new Reader(path, new N5FSReader(path.toString()));
        } catch (N5Exception e) {
            throw new IOException("Cannot open container " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ContainerWriter openWriter(Path path, boolean compress) throws IOException {
        try {
            Compression compression = compress ? new GzipCompression() : new RawCompression();
            return new Writer(path, new N5FSWriter(path.toString()), compression);
        } catch (N5Exception e) {
            throw new IOException("Cannot create container " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        if (!isContainer(path)) {
            throw new IOException("Refusing to delete " + path + ": it is not a container");
        }
        try (N5Writer n5 = new N5FSWriter(path.toString())) {
            n5.remove("/");
        } catch (N5Exception e) {
            throw new IOException("Cannot delete container " + path + ": " + e.getMessage(), e);
        }
        if (Files.exists(path)) {
            throw new IOException("Container " + path + " still exists after deletion");
        }
        logger.debug("Deleted container {}", path);
    }

    static long[] toN5Dimensions(int[] shape) {
        long[] dims = new long[shape.length];
        for (int i = 0; i < shape.length; i++) {
            dims[i] = shape[shape.length - 1 - i];
        }
        return dims;
    }

    static int[] fromN5Dimensions(long[] dims) {
        int[] shape = new int[dims.length];
        for (int i = 0; i < dims.length; i++) {
            shape[i] = Math.toIntExact(dims[dims.length - 1 - i]);
        }
        return shape;
    }

    static double[] toDoubles(Object data) {
        if (data instanceof double[] d) {
            return d;
        } else if (data instanceof float[] f) {
            double[] out = new double[f.length];
            for (int i = 0; i < f.length; i++) out[i] = f[i];
            return out;
        } else if (data instanceof long[] l) {
            return Arrays.stream(l).asDoubleStream().toArray();
        } else if (data instanceof int[] n) {
            return Arrays.stream(n).asDoubleStream().toArray();
        } else if (data instanceof short[] s) {
            double[] out = new double[s.length];
            for (int i = 0; i < s.length; i++) out[i] = s[i];
            return out;
        } else if (data instanceof byte[] b) {
            double[] out = new double[b.length];
            for (int i = 0; i < b.length; i++) out[i] = b[i];
            return out;
        }
        throw new IllegalArgumentException("Unsupported block data type " + (data == null ? "null" : data.getClass()));
    }

    /**
     * Reader over an N5 container.
     */
    static final class Reader implements ContainerReader {
        private final Path root;
        private final N5Reader n5;

        Reader(Path root, N5Reader n5) {
            this.root = root;
            this.n5 = n5;
        }

        @Override
        public boolean exists(String path) {
            try {
                return n5.exists(path);
            } catch (N5Exception e) {
                logger.debug("Existence check failed for {} in {}", path, root, e);
                return false;
            }
        }

        @Override
        public boolean isDataset(String path) {
            try {
                return n5.datasetExists(path);
            } catch (N5Exception e) {
                logger.debug("Dataset check failed for {} in {}", path, root, e);
                return false;
            }
        }

        @Override
        public List<String> list(String path) throws IOException {
            try {
                String[] children = n5.list(path);
                Arrays.sort(children);
                return Arrays.asList(children);
            } catch (N5Exception e) {
                throw new IOException("Cannot list " + path + " in " + root + ": " + e.getMessage(), e);
            }
        }

        @Override
        public int[] shape(String dataset) throws IOException {
            return fromN5Dimensions(attributes(dataset).getDimensions());
        }

        @Override
        public NdArray readArray(String dataset) throws IOException {
            DatasetAttributes attributes = attributes(dataset);
            long[] dims = attributes.getDimensions();
            int[] blockSize = attributes.getBlockSize();
            int rank = dims.length;
            long total = 1;
            for (long d : dims) {
                total *= d;
            }
            if (total > Integer.MAX_VALUE) {
                throw new IOException("Dataset " + dataset + " in " + root + " is too large: " + Arrays.toString(dims));
            }
            double[] values = new double[(int) total];

            long[] gridDims = new long[rank];
            for (int d = 0; d < rank; d++) {
                gridDims[d] = (dims[d] + blockSize[d] - 1) / blockSize[d];
            }
            long[] grid = new long[rank];
            try {
                do {
                    DataBlock<?> block = n5.readBlock(dataset, attributes, grid.clone());
                    if (block != null) {
                        copyBlock(block, grid, blockSize, dims, values);
                    }
                } while (increment(grid, gridDims));
            } catch (N5Exception e) {
                throw new IOException("Cannot read " + dataset + " in " + root + ": " + e.getMessage(), e);
            }
            return new NdArray(fromN5Dimensions(dims), values);
        }

        @Override
        public JsonElement readAttribute(String path, String key) throws IOException {
            if (!exists(path)) {
                return null;
            }
            try {
                return n5.getAttribute(path, key, JsonElement.class);
            } catch (N5Exception e) {
                throw new IOException("Cannot read attribute " + path + "@" + key + " in " + root + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            n5.close();
        }

        private DatasetAttributes attributes(String dataset) throws IOException {
            try {
                DatasetAttributes attributes = n5.getDatasetAttributes(dataset);
                if (attributes == null) {
                    throw new IOException("No dataset " + dataset + " in " + root);
                }
                return attributes;
            } catch (N5Exception e) {
                throw new IOException("Cannot read dataset attributes of " + dataset + " in " + root + ": " + e.getMessage(), e);
            }
        }

        private static void copyBlock(DataBlock<?> block, long[] grid, int[] blockSize, long[] dims, double[] out) {
            double[] data = toDoubles(block.getData());
            int[] size = block.getSize();
            int rank = size.length;
            long[] offset = new long[rank];
            for (int d = 0; d < rank; d++) {
                offset[d] = grid[d] * blockSize[d];
            }
            long[] local = new long[rank];
            long[] sizeBound = Arrays.stream(size).asLongStream().toArray();
            int i = 0;
            do {
                long flat = 0;
                long stride = 1;
                boolean inside = true;
                for (int d = 0; d < rank; d++) {
                    long g = offset[d] + local[d];
                    if (g >= dims[d]) {
                        inside = false;
                        break;
                    }
                    flat += g * stride;
                    stride *= dims[d];
                }
                if (inside && i < data.length) {
                    out[(int) flat] = data[i];
                }
                i++;
            } while (increment(local, sizeBound));
        }
    }

    /**
     * Advances a fastest-first position; returns false after the last position.
     */
    static boolean increment(long[] position, long[] bounds) {
        for (int d = 0; d < position.length; d++) {
            if (++position[d] < bounds[d]) {
                return true;
            }
            position[d] = 0;
        }
        return false;
    }

    /**
     * Writer over an N5 container.
     */
    static final class Writer implements ContainerWriter {
        private final Path root;
        private final N5Writer n5;
        private final Compression compression;

        Writer(Path root, N5Writer n5, Compression compression) {
            this.root = root;
            this.n5 = n5;
            this.compression = compression;
        }

        @Override
        public void createGroup(String path) throws IOException {
            try {
                n5.createGroup(path);
            } catch (N5Exception e) {
                throw new IOException("Cannot create group " + path + " in " + root + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void setAttribute(String path, String key, Object value) throws IOException {
            try {
                n5.setAttribute(path, key, value);
            } catch (N5Exception e) {
                throw new IOException("Cannot set " + path + "@" + key + " in " + root + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void writeArray(String path, NdArray array) throws IOException {
            long[] dims = toN5Dimensions(array.shape());
            int[] blockSize = singleBlock(dims);
            try {
                n5.createDataset(path, dims, blockSize, DataType.FLOAT64, compression);
                DatasetAttributes attributes = n5.getDatasetAttributes(path);
                n5.writeBlock(path, attributes, new DoubleArrayDataBlock(blockSize, new long[dims.length], array.values()));
            } catch (N5Exception e) {
                throw new IOException("Cannot write " + path + " in " + root + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void writeIntArray(String path, int[] values) throws IOException {
            long[] dims = {values.length};
            int[] blockSize = singleBlock(dims);
            try {
                n5.createDataset(path, dims, blockSize, DataType.INT32, compression);
                DatasetAttributes attributes = n5.getDatasetAttributes(path);
                n5.writeBlock(path, attributes, new IntArrayDataBlock(blockSize, new long[1], values));
            } catch (N5Exception e) {
                throw new IOException("Cannot write " + path + " in " + root + ": " + e.getMessage(), e);
            }
        }

        @Override
        public StackWriter createStack(String path, int count, int rows, int cols, boolean complex) throws IOException {
            int[] shape = complex ? new int[]{count, rows, cols, 2} : new int[]{count, rows, cols};
            long[] dims = toN5Dimensions(shape);
            int[] blockSize = complex ? new int[]{2, cols, rows, 1} : new int[]{cols, rows, 1};
            DatasetAttributes attributes;
            try {
                n5.createDataset(path, dims, blockSize, DataType.FLOAT64, compression);
                attributes = n5.getDatasetAttributes(path);
            } catch (N5Exception e) {
                throw new IOException("Cannot create stack " + path + " in " + root + ": " + e.getMessage(), e);
            }
            return new N5StackWriter(path, count, rows, cols, complex, attributes, blockSize);
        }

        @Override
        public void close() {
            n5.close();
        }

        private static int[] singleBlock(long[] dims) {
            int[] blockSize = new int[dims.length];
            for (int d = 0; d < dims.length; d++) {
                blockSize[d] = (int) Math.max(1, dims[d]);
            }
            return blockSize;
        }

        private final class N5StackWriter implements StackWriter {
            private final String path;
            private final int count;
            private final int rows;
            private final int cols;
            private final boolean complex;
            private final DatasetAttributes attributes;
            private final int[] blockSize;

            N5StackWriter(String path, int count, int rows, int cols, boolean complex,
                          DatasetAttributes attributes, int[] blockSize) {
                this.path = path;
                this.count = count;
                this.rows = rows;
                this.cols = cols;
                this.complex = complex;
                this.attributes = attributes;
                this.blockSize = blockSize;
            }

            @Override
            public int count() {
                return count;
            }

            @Override
            public void writeSlice(int index, Plane plane) throws IOException {
                if (index < 0 || index >= count) {
                    throw new IndexOutOfBoundsException("Slice " + index + " outside stack of " + count);
                }
                if (plane.rows() != rows || plane.cols() != cols) {
                    throw new IllegalArgumentException("Slice " + index + " has shape " + Arrays.toString(plane.shape())
                            + " but stack expects [" + rows + ", " + cols + "]");
                }
                double[] data = complex ? plane.interleaved() : plane.real().clone();
                long[] grid = complex ? new long[]{0, 0, 0, index} : new long[]{0, 0, index};
                try {
                    n5.writeBlock(path, attributes, new DoubleArrayDataBlock(blockSize, grid, data));
                } catch (N5Exception e) {
                    throw new IOException("Cannot write slice " + index + " of " + path + " in " + root + ": " + e.getMessage(), e);
                }
            }
        }
    }
}
