package tomo.ext.nxstack.controller.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.modality.Extraction;
import tomo.ext.nxstack.modality.ModalityHandler;
import tomo.ext.nxstack.modality.xrf.TransitionNotFoundException;
import tomo.ext.nxstack.model.FacilitySchema;
import tomo.ext.nxstack.model.JoinRequest;
import tomo.ext.nxstack.model.ModalitySchema;
import tomo.ext.nxstack.model.Plane;
import tomo.ext.nxstack.model.ProjectionRecord;
import tomo.ext.nxstack.model.SelectionFilter;
import tomo.ext.nxstack.model.StackEntry;
import tomo.ext.nxstack.service.RawMetadataReader;
import tomo.ext.nxstack.service.container.ContainerReader;
import tomo.ext.nxstack.service.container.ContainerStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Loads located projections in parallel and collects their planes per role.
 *
 * <p>Each projection is read independently on the worker pool: its rotation angle is looked
 * up, the angle filter applied, and the modality handler extracts and transforms its planes.
 * All tasks are joined before returning, since alignment needs every member of a role.</p>
 *
 * <p>When padding is disabled, a role is doomed as soon as two of its planes differ in shape.
 * Once every role is doomed the remaining loads are abandoned.</p>
 */
public class ProjectionLoadHelper {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionLoadHelper.class);

    private final ContainerStore store;
    private final RawMetadataReader metadata;

    public ProjectionLoadHelper(ContainerStore store, RawMetadataReader metadata) {
        this.store = store;
        this.metadata = metadata;
    }

    /**
     * @param records  located projections, in identifier order
     * @param roles    requested roles, in output order
     * @param facility facility layout
     * @param handler  modality handler
     * @param request  the run request
     * @param filter   selection; only the angle axis is applied here
     * @param pool     worker pool
     * @return entries per role in {@code records} order
     * @throws TransitionNotFoundException if transitions are strict and one is missing
     */
    public LoadedProjections load(List<ProjectionRecord> records, List<String> roles, FacilitySchema facility,
                                  ModalityHandler handler, JoinRequest request, SelectionFilter filter,
                                  ExecutorService pool) throws TransitionNotFoundException {
        ModalitySchema schema = facility.modality(request.experiment());
        AtomicBoolean abort = new AtomicBoolean(false);
        Map<String, int[]> firstShapes = new ConcurrentHashMap<>();
        Set<String> mismatched = ConcurrentHashMap.newKeySet();
        boolean angleRequired = filter.filtersAngles() || request.sortByAngle();

        List<Future<FileOutcome>> futures = new ArrayList<>(records.size());
        for (ProjectionRecord record : records) {
            futures.add(pool.submit(() -> {
                if (abort.get()) {
                    return FileOutcome.abandoned(record);
                }
                FileOutcome outcome = loadOne(record, facility, schema, handler, request, filter, angleRequired);
                if (!request.padToMax() && outcome.extraction() != null) {
                    trackShapes(outcome, roles, firstShapes, mismatched, abort);
                }
                return outcome;
            }));
        }

        Map<String, List<StackEntry>> entries = new LinkedHashMap<>();
        Map<String, Integer> skippedByRole = new LinkedHashMap<>();
        for (String role : roles) {
            entries.put(role, new ArrayList<>());
            skippedByRole.put(role, 0);
        }
        List<ProjectionRecord> loaded = new ArrayList<>();
        int skippedFiles = 0;
        int notLoaded = 0;
        Double pixelSize = null;

        for (int i = 0; i < futures.size(); i++) {
            FileOutcome outcome = join(futures.get(i), records.get(i));
            if (outcome.abandoned()) {
                notLoaded++;
                continue;
            }
            if (outcome.filteredOut()) {
                continue;
            }
            if (outcome.failure() != null) {
                logger.warn("Skipping {}: {}", outcome.record().path(), outcome.failure());
                skippedFiles++;
                roles.forEach(role -> skippedByRole.merge(role, 1, Integer::sum));
                continue;
            }
            loaded.add(outcome.record());
            if (pixelSize == null) {
                pixelSize = outcome.pixelSize();
            }
            Extraction extraction = outcome.extraction();
            for (String role : roles) {
                Plane plane = extraction.planes().get(role);
                if (plane != null) {
                    entries.get(role).add(new StackEntry(outcome.record(), role, plane));
                    continue;
                }
                IOException failure = extraction.failures().get(role);
                if (failure instanceof TransitionNotFoundException missing && request.strictTransitions()) {
                    throw missing;
                }
                logger.warn("Excluding {} from '{}': {}", outcome.record().label(), role,
                        failure == null ? "no data" : failure.getMessage());
                skippedByRole.merge(role, 1, Integer::sum);
            }
        }
        if (notLoaded > 0) {
            logger.warn("Stopped early: every role has inconsistent shapes and padding is disabled; {} projections not read",
                    notLoaded);
        }
        return new LoadedProjections(entries, skippedByRole, loaded, skippedFiles, notLoaded, pixelSize);
    }

    private FileOutcome loadOne(ProjectionRecord record, FacilitySchema facility, ModalitySchema schema,
                                ModalityHandler handler, JoinRequest request, SelectionFilter filter,
                                boolean angleRequired) {
        try (ContainerReader reader = store.openReader(record.path())) {
            Path rawDir = metadata.rawDir(record, reader, schema, facility, request.rawDir()).orElse(null);
            Double angle = metadata.angle(record, reader, schema, facility, rawDir).orElse(null);
            if (angle == null && angleRequired) {
                return FileOutcome.failed(record, "no rotation angle found"
                        + (rawDir == null ? " and the raw directory is unknown" : " (raw directory " + rawDir + ")"));
            }
            if (!filter.acceptsAngle(angle)) {
                logger.debug("{} at {} degrees is outside the angle selection", record.label(), angle);
                return FileOutcome.filtered(record);
            }
            ProjectionRecord withAngle = record.withAngle(angle);
            Extraction extraction = handler.extract(reader, withAngle, schema, request);
            Optional<Double> pixelSize = metadata.pixelSize(reader, schema);
            return FileOutcome.loaded(withAngle, extraction, pixelSize.orElse(null));
        } catch (IOException | IllegalArgumentException e) {
            return FileOutcome.failed(record, e.getMessage());
        }
    }

    private static void trackShapes(FileOutcome outcome, List<String> roles, Map<String, int[]> firstShapes,
                                    Set<String> mismatched, AtomicBoolean abort) {
        for (Map.Entry<String, Plane> entry : outcome.extraction().planes().entrySet()) {
            int[] shape = entry.getValue().shape();
            int[] first = firstShapes.putIfAbsent(entry.getKey(), shape);
            if (first != null && !Arrays.equals(first, shape) && mismatched.add(entry.getKey())) {
                logger.warn("Role '{}' has inconsistent shapes {} and {} with padding disabled",
                        entry.getKey(), Arrays.toString(first), Arrays.toString(shape));
            }
        }
        if (mismatched.containsAll(roles) && abort.compareAndSet(false, true)) {
            logger.warn("All roles have inconsistent shapes, abandoning remaining loads");
        }
    }

    private static FileOutcome join(Future<FileOutcome> future, ProjectionRecord record) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while loading projections", e);
        } catch (ExecutionException e) {
            return FileOutcome.failed(record, String.valueOf(e.getCause()));
        }
    }

    private record FileOutcome(ProjectionRecord record, Extraction extraction, Double pixelSize, String failure,
                               boolean filteredOut, boolean abandoned) {

        static FileOutcome loaded(ProjectionRecord record, Extraction extraction, Double pixelSize) {
            return new FileOutcome(record, extraction, pixelSize, null, false, false);
        }

        static FileOutcome failed(ProjectionRecord record, String failure) {
            return new FileOutcome(record, null, null, failure, false, false);
        }

        static FileOutcome filtered(ProjectionRecord record) {
            return new FileOutcome(record, null, null, null, true, false);
        }

        static FileOutcome abandoned(ProjectionRecord record) {
            return new FileOutcome(record, null, null, null, false, true);
        }
    }
}
