package tomo.ext.nxstack.controller.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.model.NdArray;
import tomo.ext.nxstack.model.ProjectionRecord;
import tomo.ext.nxstack.model.RoleReport;
import tomo.ext.nxstack.model.StackEntry;
import tomo.ext.nxstack.service.container.ContainerStore;
import tomo.ext.nxstack.service.container.ContainerWriter;
import tomo.ext.nxstack.utilities.OutputNameGenerator;

import java.io.IOException;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Writes one NXtomo-style container per role.
 *
 * <p>Entries are ordered by identifier, or by rotation angle with identifier as tie-break.
 * Each container holds a stack whose leading axis has one slice per entry, the rotation
 * angles, identifiers and image keys, and the facility and light source description.</p>
 *
 * <p>A container is written under a temporary name and moved into place when complete,
 * replacing any previous output of the same name. Roles are written concurrently; a failure
 * affects only its own role. In a dry run the names are computed and nothing is written.</p>
 */
public class StackAssembler {
    private static final Logger logger = LoggerFactory.getLogger(StackAssembler.class);

    public static final String PARTIAL_SUFFIX = ".partial";
    public static final String CREATOR = "nxstack";

    static final String ENTRY = "/entry";
    static final String DETECTOR = ENTRY + "/instrument/detector";
    static final String DATA = DETECTOR + "/data";
    static final String IMAGE_KEY = DETECTOR + "/image_key";
    static final String SAMPLE = ENTRY + "/sample";
    static final String ROTATION_ANGLE = SAMPLE + "/rotation_angle";
    static final String NXDATA = ENTRY + "/data";

    private static final Comparator<StackEntry> BY_IDENTIFIER =
            Comparator.comparing(StackEntry::source, ProjectionRecord.BY_IDENTIFIER);
    private static final Comparator<StackEntry> BY_ANGLE =
            Comparator.comparing((StackEntry e) -> e.source().angle(), Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(BY_IDENTIFIER);

    private final ContainerStore store;

    public StackAssembler(ContainerStore store) {
        this.store = store;
    }

    /**
     * @param roleEntries aligned entries per role, roles in output order
     * @param options     run-wide settings
     * @param pool        workers; one task per role
     * @return one report per role, in input order
     */
    public List<RoleReport> assemble(Map<String, List<StackEntry>> roleEntries, AssemblyOptions options,
                                     ExecutorService pool) {
        Map<String, Future<RoleReport>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, List<StackEntry>> entry : roleEntries.entrySet()) {
            Callable<RoleReport> task = () -> assembleRole(entry.getKey(), entry.getValue(), options);
            futures.put(entry.getKey(), pool.submit(task));
        }
        List<RoleReport> reports = new ArrayList<>();
        for (Map.Entry<String, Future<RoleReport>> entry : futures.entrySet()) {
            String role = entry.getKey();
            try {
                reports.add(entry.getValue().get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while writing stacks", e);
            } catch (ExecutionException e) {
                logger.error("Writing '{}' failed", role, e.getCause());
                reports.add(RoleReport.failed(role, skipped(options, role), String.valueOf(e.getCause())));
            }
        }
        return reports;
    }

    /**
     * Orders the entries of one role for stacking.
     */
    public static List<StackEntry> order(List<StackEntry> entries, boolean sortByAngle) {
        List<StackEntry> ordered = new ArrayList<>(entries);
        ordered.sort(sortByAngle ? BY_ANGLE : BY_IDENTIFIER);
        return ordered;
    }

    /**
     * @return the output path for a role
     */
    public Path outputPath(String role, AssemblyOptions options) {
        String name = OutputNameGenerator.stackName(options.experiment(), role, options.runRecords(), store.extension());
        return options.outputDir().resolve(name);
    }

    RoleReport assembleRole(String role, List<StackEntry> entries, AssemblyOptions options) {
        int skipped = skipped(options, role);
        if (entries.isEmpty()) {
            logger.error("No projection provides '{}', nothing to write", role);
            return RoleReport.failed(role, skipped, "no projection provides " + role);
        }
        int[] shape = entries.get(0).shape();
        for (StackEntry entry : entries) {
            if (!Arrays.equals(shape, entry.shape())) {
                return RoleReport.failed(role, skipped, "entries are not aligned: " + Arrays.toString(shape)
                        + " vs " + Arrays.toString(entry.shape()) + " for " + entry.source().label());
            }
        }

        List<StackEntry> ordered = order(entries, options.sortByAngle());
        Path target = outputPath(role, options);
        if (options.dryRun()) {
            logger.info("Dry run: would write {} slices of {} to {}", ordered.size(), Arrays.toString(shape), target);
            return new RoleReport(role, target.toString(), ordered.size(), skipped, null);
        }

        Path partial = target.resolveSibling(target.getFileName() + PARTIAL_SUFFIX);
        try {
            store.delete(partial);
            try (ContainerWriter writer = store.openWriter(partial, options.compress())) {
                write(writer, role, ordered, options, target);
            }
            store.replace(partial, target);
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to write '{}' to {}", role, target, e);
            discard(partial);
            return RoleReport.failed(role, skipped, e.getMessage());
        }
        logger.info("Wrote {} slices of {} to {}", ordered.size(), Arrays.toString(shape), target);
        return new RoleReport(role, target.toString(), ordered.size(), skipped, null);
    }

    private void write(ContainerWriter writer, String role, List<StackEntry> ordered, AssemblyOptions options,
                       Path target) throws IOException {
        int n = ordered.size();
        int rows = ordered.get(0).plane().rows();
        int cols = ordered.get(0).plane().cols();
        boolean complex = ordered.get(0).plane().isComplex();
        String title = target.getFileName().toString();
        if (title.endsWith(store.extension())) {
            title = title.substring(0, title.length() - store.extension().length());
        }

        writer.setAttribute("/", "creator", CREATOR);
        writer.setAttribute("/", "creator_version", version());
        writer.setAttribute("/", "file_time", ZonedDateTime.now().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        writer.setAttribute("/", "facility", options.facility().id());
        writer.setAttribute("/", "experiment", options.experiment().shortName());
        writer.setAttribute("/", "role", role);
        writer.setAttribute("/", "default", "entry");

        writer.createGroup(ENTRY);
        writer.setAttribute(ENTRY, "NX_class", "NXentry");
        writer.setAttribute(ENTRY, "default", "data");
        writer.setAttribute(ENTRY, "definition", "NXtomo");
        writer.setAttribute(ENTRY, "title", title);

        writer.createGroup(ENTRY + "/instrument");
        writer.setAttribute(ENTRY + "/instrument", "NX_class", "NXinstrument");
        String sourcePath = ENTRY + "/instrument/SOURCE";
        writer.createGroup(sourcePath);
        writer.setAttribute(sourcePath, "NX_class", "NXsource");
        for (Map.Entry<String, String> field : options.source().entrySet()) {
            writer.setAttribute(sourcePath, field.getKey(), field.getValue());
        }

        writer.createGroup(DETECTOR);
        writer.setAttribute(DETECTOR, "NX_class", "NXdetector");
        ContainerWriter.StackWriter stack = writer.createStack(DATA, n, rows, cols, complex);
        for (int i = 0; i < n; i++) {
            stack.writeSlice(i, ordered.get(i).plane());
        }
        writer.setAttribute(DATA, "interpretation", "image");
        if (complex) {
            writer.setAttribute(DATA, "complex_axis", "last");
        }
        writer.writeIntArray(IMAGE_KEY, new int[n]);
        if (options.pixelSize() != null) {
            writeScalar(writer, DETECTOR + "/x_pixel_size", options.pixelSize(), "m");
            writeScalar(writer, DETECTOR + "/y_pixel_size", options.pixelSize(), "m");
        }
        if (options.detectorDistance() != null) {
            writeScalar(writer, DETECTOR + "/distance", options.detectorDistance(), "m");
        }

        double[] angles = new double[n];
        int[] scans = new int[n];
        int[] projs = new int[n];
        for (int i = 0; i < n; i++) {
            ProjectionRecord source = ordered.get(i).source();
            angles[i] = source.angle() != null ? source.angle() : i;
            scans[i] = source.scan() != null ? source.scan() : -1;
            projs[i] = source.proj() != null ? source.proj() : -1;
        }
        writer.createGroup(SAMPLE);
        writer.setAttribute(SAMPLE, "NX_class", "NXsample");
        writer.setAttribute(SAMPLE, "name", title);
        writer.writeArray(ROTATION_ANGLE, NdArray.vector(angles));
        writer.setAttribute(ROTATION_ANGLE, "units", "degrees");
        writer.writeIntArray(SAMPLE + "/scan_id", scans);
        writer.writeIntArray(SAMPLE + "/proj_id", projs);

        writer.createGroup(NXDATA);
        writer.setAttribute(NXDATA, "NX_class", "NXdata");
        writer.setAttribute(NXDATA, "signal", "data");
        writer.setAttribute(NXDATA, "axes", new String[]{"rotation_angle", ".", "."});
        writer.setAttribute(NXDATA, "data_target", DATA);
        writer.setAttribute(NXDATA, "rotation_angle_target", ROTATION_ANGLE);
        writer.setAttribute(NXDATA, "image_key_target", IMAGE_KEY);
    }

    private static void writeScalar(ContainerWriter writer, String path, double value, String units) throws IOException {
        writer.writeArray(path, NdArray.vector(value));
        writer.setAttribute(path, "units", units);
    }

    private void discard(Path partial) {
        try {
            store.delete(partial);
        } catch (IOException e) {
            logger.warn("Could not remove incomplete output {}: {}", partial, e.getMessage());
        }
    }

    private static int skipped(AssemblyOptions options, String role) {
        return options.skippedByRole().getOrDefault(role, 0);
    }

    private static String version() {
        String version = StackAssembler.class.getPackage().getImplementationVersion();
        return version == null ? "dev" : version;
    }
}
