package tomo.ext.nxstack.service.container;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Entry point to a hierarchical array container format: groups holding attributes and
 * n-dimensional datasets.
 */
public interface ContainerStore {

    /**
     * @return the file name extension of containers written by this store, e.g. {@code ".n5"}
     */
    String extension();

    /**
     * @param path a filesystem path
     * @return true if the path holds a container this store can read
     */
    boolean isContainer(Path path);

    /**
     * @throws IOException if the container does not exist or cannot be read
     */
    ContainerReader openReader(Path path) throws IOException;

    /**
     * Creates a container, or opens an existing one for writing.
     *
     * @param path     container path
     * @param compress apply block compression to datasets created through the writer
     * @throws IOException if the container cannot be created
     */
    ContainerWriter openWriter(Path path, boolean compress) throws IOException;

    /**
     * Deletes a container and everything in it. Does nothing if the path does not exist.
     *
     * @throws IOException if the path exists but is not a container, or cannot be deleted
     */
    void delete(Path path) throws IOException;

    /**
     * Moves a fully written container into place, replacing any container already there.
     *
     * @param source the written container
     * @param target the final path
     * @throws IOException if the target exists but is not a container, or the move fails
     */
    default void replace(Path source, Path target) throws IOException {
        if (Files.exists(target)) {
            delete(target);
        }
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }
}
