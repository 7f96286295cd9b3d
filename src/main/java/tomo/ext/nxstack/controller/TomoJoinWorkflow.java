package tomo.ext.nxstack.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.controller.workflow.AssemblyOptions;
import tomo.ext.nxstack.controller.workflow.LoadedProjections;
import tomo.ext.nxstack.controller.workflow.ProjectionLoadHelper;
import tomo.ext.nxstack.controller.workflow.StackAssembler;
import tomo.ext.nxstack.modality.ModalityHandler;
import tomo.ext.nxstack.modality.ModalityRegistry;
import tomo.ext.nxstack.modality.xrf.TransitionNotFoundException;
import tomo.ext.nxstack.model.Facility;
import tomo.ext.nxstack.model.FacilitySchema;
import tomo.ext.nxstack.model.JoinRequest;
import tomo.ext.nxstack.model.JoinResult;
import tomo.ext.nxstack.model.JoinSummary;
import tomo.ext.nxstack.model.RoleReport;
import tomo.ext.nxstack.model.SelectionFilter;
import tomo.ext.nxstack.model.StackEntry;
import tomo.ext.nxstack.service.LocatedProjections;
import tomo.ext.nxstack.service.ProjectionLocator;
import tomo.ext.nxstack.service.ProjectionValidator;
import tomo.ext.nxstack.service.RawMetadataReader;
import tomo.ext.nxstack.service.container.ContainerStore;
import tomo.ext.nxstack.utilities.ArrayAligner;
import tomo.ext.nxstack.utilities.FacilityConfigManager;
import tomo.ext.nxstack.utilities.FacilityDetector;
import tomo.ext.nxstack.utilities.IdentifierRangeResolver;
import tomo.ext.nxstack.utilities.RunLogger;
import tomo.ext.nxstack.utilities.ShapeMismatchException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one join from request to written containers:
 * <ol>
 *   <li>Resolve the scan, projection and angle selections</li>
 *   <li>Determine the facility and its layout</li>
 *   <li>Locate and validate the projection files</li>
 *   <li>Load every projection through the modality handler</li>
 *   <li>Align each role to a common shape</li>
 *   <li>Write one container per role</li>
 * </ol>
 * Per-file faults are logged and counted; a role that cannot be written is reported without
 * affecting the other roles. Selection, facility and pattern errors stop the run before any
 * file is opened.
 */
public class TomoJoinWorkflow {

    private static final Logger logger = LoggerFactory.getLogger(TomoJoinWorkflow.class);

    private final FacilityConfigManager config;
    private final ContainerStore store;
    private final FacilityDetector detector;

    public TomoJoinWorkflow(FacilityConfigManager config, ContainerStore store, FacilityDetector detector) {
        this.config = config;
        this.store = store;
        this.detector = detector;
    }

    public TomoJoinWorkflow(FacilityConfigManager config, ContainerStore store) {
        this(config, store, new FacilityDetector(config));
    }

    /**
     * @param request the run request
     * @return written outputs and run counters
     * @throws tomo.ext.nxstack.utilities.SpecSyntaxException      for a malformed selection
     * @throws tomo.ext.nxstack.utilities.FacilityUndeterminedException if the facility cannot be determined
     * @throws tomo.ext.nxstack.service.ProjectionNotFoundException if no projection is selected
     * @throws TransitionNotFoundException if transitions are strict and a projection lacks one
     */
    public JoinResult run(JoinRequest request) throws TransitionNotFoundException {
        SelectionFilter filter = new SelectionFilter(
                IdentifierRangeResolver.resolveIntegers(request.scanSpec(), request.scanListFile(), request.scanExclude()),
                IdentifierRangeResolver.resolveIntegers(request.projSpec(), request.projListFile(), request.projExclude()),
                IdentifierRangeResolver.resolveAngles(request.angleSpec(), request.angleListFile(), request.angleExclude()));
        logger.debug("Selection: {} scans, {} projections, {} angles",
                describe(filter.filtersScans(), filter.scans().size()),
                describe(filter.filtersProjs(), filter.projs().size()),
                describe(filter.filtersAngles(), filter.angles().size()));

        Facility facility = detector.detect(request.facility(), candidatePaths(request));
        FacilitySchema schema = config.getSchema(facility);
        ModalityHandler handler = ModalityRegistry.getHandler(request.experiment());
        List<String> roles = handler.roles(request);
        logger.info("Joining {} projections from {} into roles {}",
                request.experiment().description(), facility.id(), roles);
        logger.info("Transforms: {}", handler.describeTransforms(request));
        if (request.removeRamp() || request.rescale()) {
            logger.warn("Ramp removal and rescaling are not implemented and leave the data unchanged");
        }

        ExecutorService pool = newPool(request.workers());
        try {
            ProjectionLocator locator = new ProjectionLocator(store, new ProjectionValidator(store));
            LocatedProjections located = locator.locate(schema, request.experiment(), filter,
                    request.projDir(), request.projFilePattern(), request.skipCheck(), request.dryRun(), pool);

            if (located.records().isEmpty()) {
                logger.info("Dry run: no projection matches the selection, nothing would be written");
                JoinSummary summary = new JoinSummary(request.experiment().shortName(), facility.id(),
                        located.located(), located.validated(), located.skipped(), 0, true, List.of());
                logSummary(summary, request.quiet());
                return new JoinResult(List.of(), summary);
            }

            ProjectionLoadHelper loader = new ProjectionLoadHelper(store, new RawMetadataReader(store));
            LoadedProjections loaded = loader.load(located.records(), roles, schema, handler, request, filter, pool);

            Map<String, List<StackEntry>> aligned = new LinkedHashMap<>();
            List<RoleReport> failedRoles = new ArrayList<>();
            for (String role : roles) {
                List<StackEntry> entries = loaded.entries().getOrDefault(role, List.of());
                try {
                    aligned.put(role, ArrayAligner.align(entries, request.padToMax()));
                } catch (ShapeMismatchException e) {
                    logger.error("Cannot stack '{}': {}", role, e.getMessage());
                    failedRoles.add(RoleReport.failed(role, loaded.skipped(role), e.getMessage()));
                }
            }

            AssemblyOptions options = new AssemblyOptions(request.experiment(), facility, request.outputDir(),
                    request.sortByAngle(), request.compress(), request.dryRun(), loaded.records(),
                    loaded.skippedByRole(), loaded.pixelSize(), schema.detectorDistance(), config.getSource());
            List<RoleReport> reports = assemble(new StackAssembler(store), aligned, failedRoles, roles, options,
                    request, pool);

            int skipped = located.skipped() + loaded.skippedFiles();
            JoinSummary summary = new JoinSummary(request.experiment().shortName(), facility.id(),
                    located.located(), located.validated(), skipped, loaded.records().size(),
                    request.dryRun(), reports);
            List<Path> outputs = reports.stream()
                    .filter(RoleReport::succeeded)
                    .map(r -> Path.of(r.output()))
                    .toList();
            logSummary(summary, request.quiet());
            return new JoinResult(outputs, summary);
        } finally {
            shutdown(pool);
        }
    }

    private List<RoleReport> assemble(StackAssembler assembler, Map<String, List<StackEntry>> aligned,
                                      List<RoleReport> failedRoles, List<String> roles, AssemblyOptions options,
                                      JoinRequest request, ExecutorService pool) {
        List<RoleReport> written;
        if (request.dryRun()) {
            written = assembler.assemble(aligned, options, pool);
        } else {
            try {
                Files.createDirectories(request.outputDir());
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create output directory " + request.outputDir(), e);
            }
            try (RunLogger.Session ignored = RunLogger.start(request.outputDir())) {
                written = assembler.assemble(aligned, options, pool);
            }
        }
        // Restore role order across written and unalignable roles
        Map<String, RoleReport> byRole = new LinkedHashMap<>();
        for (RoleReport report : written) {
            byRole.put(report.role(), report);
        }
        for (RoleReport report : failedRoles) {
            byRole.put(report.role(), report);
        }
        List<RoleReport> ordered = new ArrayList<>();
        for (String role : roles) {
            RoleReport report = byRole.get(role);
            if (report != null) {
                ordered.add(report);
            }
        }
        return ordered;
    }

    static List<String> candidatePaths(JoinRequest request) {
        List<String> paths = new ArrayList<>();
        if (request.projDir() != null) {
            paths.add(request.projDir().toAbsolutePath().toString());
        }
        if (request.projFilePattern() != null) {
            paths.add(request.projFilePattern());
        }
        if (request.rawDir() != null) {
            paths.add(request.rawDir().toAbsolutePath().toString());
        }
        paths.add(Path.of("").toAbsolutePath().toString());
        return paths;
    }

    private static void logSummary(JoinSummary summary, boolean quiet) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s join at %s: %d located, %d validated, %d skipped, %d loaded%s",
                summary.experiment(), summary.facility(), summary.located(), summary.validated(),
                summary.skipped(), summary.loaded(), summary.dryRun() ? " (dry run)" : ""));
        for (RoleReport report : summary.roles()) {
            sb.append(System.lineSeparator()).append("  ").append(report.role()).append(": ");
            if (report.succeeded()) {
                sb.append(report.slices()).append(" slices -> ").append(report.output());
            } else {
                sb.append("FAILED (").append(report.failure()).append(")");
            }
            if (report.skipped() > 0) {
                sb.append(", ").append(report.skipped()).append(" skipped");
            }
        }
        if (quiet) {
            logger.debug(sb.toString());
        } else {
            logger.info(sb.toString());
        }
    }

    private static String describe(boolean filtered, int size) {
        return filtered ? String.valueOf(size) : "all";
    }

    private static ExecutorService newPool(int workers) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "nxstack-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Worker pool did not terminate");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
