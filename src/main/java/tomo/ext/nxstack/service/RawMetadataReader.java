package tomo.ext.nxstack.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.model.AttributeRef;
import tomo.ext.nxstack.model.FacilitySchema;
import tomo.ext.nxstack.model.ModalitySchema;
import tomo.ext.nxstack.model.NdArray;
import tomo.ext.nxstack.model.ProjectionRecord;
import tomo.ext.nxstack.service.container.ContainerReader;
import tomo.ext.nxstack.service.container.ContainerStore;
import tomo.ext.nxstack.utilities.MinorFunctions;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads per-projection metadata that may live outside the projection file: the raw data
 * directory, the rotation angle and the pixel size.
 *
 * <p>Failures never abort a run; they leave the value unknown.</p>
 */
public class RawMetadataReader {
    private static final Logger logger = LoggerFactory.getLogger(RawMetadataReader.class);

    private final ContainerStore store;

    public RawMetadataReader(ContainerStore store) {
        this.store = store;
    }

    /**
     * Infers the raw data directory of a projection.
     *
     * <p>An override wins. Otherwise the directory the file was saved to (when the layout
     * records it) or the projection path itself is truncated to the facility's raw
     * directory depth, which is deeper inside the staging area.</p>
     *
     * @return the raw directory, or empty if it cannot be inferred
     */
    public Optional<Path> rawDir(ProjectionRecord record, ContainerReader reader, ModalitySchema modality,
                                 FacilitySchema facility, Path override) {
        if (override != null) {
            return Optional.of(override);
        }
        Path base = record.path();
        if (modality.saveDirAttribute() != null) {
            try {
                String saveDir = reader.readString(modality.saveDirAttribute());
                if (saveDir != null && !saveDir.isBlank()) {
                    base = Paths.get(saveDir.trim());
                }
            } catch (IOException | InvalidPathException e) {
                logger.debug("No save directory in {}: {}", record.path(), e.getMessage());
            }
        }
        if (!base.isAbsolute()) {
            return Optional.empty();
        }
        int depth = MinorFunctions.isStagingArea(base) ? facility.stagingRawDirDepth() : facility.rawDirDepth();
        Path raw = MinorFunctions.topLevelDir(base, depth);
        logger.trace("Raw directory of {} is {}", record.label(), raw);
        return Optional.of(raw);
    }

    /**
     * Reads the rotation angle of a projection, first from the projection file, then from
     * the facility's raw metadata files.
     *
     * @param rawDir raw data directory, may be null
     * @return the angle in degrees, or empty when no source provides it
     */
    public Optional<Double> angle(ProjectionRecord record, ContainerReader reader, ModalitySchema modality,
                                  FacilitySchema facility, Path rawDir) {
        Optional<Double> fromProjection = firstAngle(reader, modality.angleAttributes(), record);
        if (fromProjection.isPresent() || rawDir == null) {
            return fromProjection;
        }
        for (Path candidate : rawMetadataCandidates(record, facility, rawDir)) {
            if (!store.isContainer(candidate)) {
                continue;
            }
            try (ContainerReader raw = store.openReader(candidate)) {
                Optional<Double> angle = firstAngle(raw, facility.rawAngleAttributes(), record);
                if (angle.isPresent()) {
                    logger.trace("Angle of {} read from {}", record.label(), candidate);
                    return angle;
                }
            } catch (IOException e) {
                logger.debug("Cannot read raw metadata {}: {}", candidate, e.getMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * @return the mean of the layout's pixel size array, or empty
     */
    public Optional<Double> pixelSize(ContainerReader reader, ModalitySchema modality) {
        if (modality.pixelSizePath() == null) {
            return Optional.empty();
        }
        try {
            String path = reader.resolvePath(modality.pixelSizePath());
            if (!reader.isDataset(path)) {
                return Optional.empty();
            }
            double mean = reader.readArray(path).mean();
            return Double.isNaN(mean) ? Optional.empty() : Optional.of(mean);
        } catch (IOException e) {
            logger.debug("No pixel size: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Expands the raw metadata templates, each followed by its staging area mirror.
     */
    List<Path> rawMetadataCandidates(ProjectionRecord record, FacilitySchema facility, Path rawDir) {
        Map<String, String> values = new HashMap<>();
        values.put("raw", rawDir.toString());
        values.put("scan", record.scan() == null ? null : record.scan().toString());
        values.put("proj", record.proj() == null ? null : record.proj().toString());
        List<Path> candidates = new ArrayList<>();
        for (String template : facility.rawMetadataFiles()) {
            String filled = MinorFunctions.fillTemplate(template, values);
            if (filled.contains("{")) {
                continue;
            }
            Path path = Paths.get(filled);
            candidates.add(path);
            Path staging = MinorFunctions.asStagingArea(path);
            if (!staging.equals(path)) {
                candidates.add(staging);
            }
        }
        return candidates;
    }

    private static Optional<Double> firstAngle(ContainerReader reader, List<AttributeRef> refs, ProjectionRecord record) {
        for (AttributeRef ref : refs) {
            try {
                NdArray values = reader.readNumbers(ref);
                if (values != null && values.size() > 0) {
                    return Optional.of(pick(values, record.proj()));
                }
            } catch (IOException e) {
                logger.debug("Angle attribute {} unusable for {}: {}", ref, record.label(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * Picks the angle of one projection: a scalar as-is, the element (or row mean) at the
     * projection number when it is in range, otherwise the mean of all values.
     */
    static double pick(NdArray values, Integer proj) {
        int[] shape = values.shape();
        double[] flat = values.values();
        if (shape.length == 0 || flat.length == 1) {
            return flat[0];
        }
        if (proj != null && proj >= 0 && proj < shape[0]) {
            int rowLength = flat.length / shape[0];
            double sum = 0;
            for (int i = 0; i < rowLength; i++) {
                sum += flat[proj * rowLength + i];
            }
            return sum / rowLength;
        }
        return values.mean();
    }
}
