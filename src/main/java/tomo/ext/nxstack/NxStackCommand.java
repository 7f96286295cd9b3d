package tomo.ext.nxstack;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import tomo.ext.nxstack.controller.TomoJoinWorkflow;
import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.JoinRequest;
import tomo.ext.nxstack.model.JoinResult;
import tomo.ext.nxstack.model.JoinSummary;
import tomo.ext.nxstack.modality.xrf.TransitionNotFoundException;
import tomo.ext.nxstack.service.container.ContainerStore;
import tomo.ext.nxstack.service.container.N5ContainerStore;
import tomo.ext.nxstack.utilities.FacilityConfigManager;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line entry point. Joins ptychography or XRF projections into one NXtomo-style
 * container per output role.
 *
 * <p>Exit codes: {@value #EXIT_OK} when at least one output was written (or would be, in a dry
 * run) or nothing was selected in a dry run, {@value #EXIT_TOTAL_FAILURE} when no output could be
 * produced, {@value #EXIT_ERROR} for usage errors and run-level failures.</p>
 */
@Command(name = "nxstack", mixinStandardHelpOptions = true, versionProvider = NxStackCommand.Version.class,
        description = "Select, align and stack tomography projections.")
public class NxStackCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(NxStackCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_TOTAL_FAILURE = 1;
    public static final int EXIT_ERROR = 2;

    @Option(names = {"-e", "--experiment"}, required = true,
            description = "Experiment type: ptycho or xrf")
    String experiment;

    @Option(names = "--proj-dir", defaultValue = ".",
            description = "Directory holding the projection files (default: ${DEFAULT-VALUE})")
    Path projDir;

    @Option(names = "--proj-file",
            description = "Projection file pattern with %%(scan) and/or %%(proj) placeholders")
    String projFilePattern;

    @Option(names = "--nxtomo-dir", defaultValue = ".",
            description = "Output directory (default: ${DEFAULT-VALUE})")
    Path outputDir;

    @Option(names = "--raw-dir", description = "Raw data directory, inferred when omitted")
    Path rawDir;

    @Option(names = "--facility", description = "Facility name, detected from the paths when omitted")
    String facility;

    @Option(names = "--facility-config", description = "YAML facility table replacing the bundled one")
    Path facilityConfig;

    @Option(names = "--from-scan", description = "Scan identifiers, e.g. 100-110:2,120")
    String scanSpec;
    @Option(names = "--scan-list", description = "File listing scan identifiers in its first column")
    Path scanList;
    @Option(names = "--exclude-scan", description = "Scan identifiers to exclude")
    String scanExclude;

    @Option(names = "--from-proj", description = "Projection identifiers")
    String projSpec;
    @Option(names = "--proj-list", description = "File listing projection identifiers")
    Path projList;
    @Option(names = "--exclude-proj", description = "Projection identifiers to exclude")
    String projExclude;

    @Option(names = "--from-angle", description = "Rotation angles in degrees")
    String angleSpec;
    @Option(names = "--angle-list", description = "File listing rotation angles")
    Path angleList;
    @Option(names = "--exclude-angle", description = "Rotation angles to exclude")
    String angleExclude;

    @Option(names = "--sort-by-angle", description = "Order slices by rotation angle")
    boolean sortByAngle;

    @Option(names = "--pad-to-max", negatable = true, defaultValue = "true",
            description = "Zero-pad projections to the largest shape (default: ${DEFAULT-VALUE})")
    boolean padToMax;

    @Option(names = "--compress", description = "Compress the output datasets")
    boolean compress;

    @Option(names = {"-q", "--quiet"}, description = "Log the run summary at debug level only")
    boolean quiet;

    @Option(names = "--dry-run", description = "Report what would be written without writing")
    boolean dryRun;

    @Option(names = "--skip-check", description = "Skip structural validation of projection files")
    boolean skipCheck;

    @Option(names = "--workers", description = "Worker threads (default: available processors)")
    Integer workers;

    @Option(names = "--save-complex", description = "Ptychography: write the complex object")
    boolean saveComplex;
    @Option(names = "--save-modulus", description = "Ptychography: write the modulus")
    boolean saveModulus;
    @Option(names = "--save-phase", negatable = true, defaultValue = "true",
            description = "Ptychography: write the phase (default: ${DEFAULT-VALUE})")
    boolean savePhase;
    @Option(names = "--remove-ramp", description = "Ptychography: remove phase ramp (not implemented)")
    boolean removeRamp;
    @Option(names = "--median-norm", description = "Ptychography: subtract the median phase")
    boolean medianNorm;
    @Option(names = "--unwrap-phase", description = "Ptychography: unwrap the phase")
    boolean unwrapPhase;
    @Option(names = "--rescale", description = "Ptychography: rescale (not implemented)")
    boolean rescale;

    @Option(names = "--transition", description = "XRF: comma-separated transitions, e.g. Pt-La,Fe-Ka")
    String transitions;
    @Option(names = "--strict-transitions",
            description = "XRF: abort when a projection lacks a requested transition")
    boolean strictTransitions;

    @Option(names = "--summary-json", description = "Write the run report as JSON to this file")
    Path summaryJson;

    @Override
    public Integer call() {
        JoinResult result;
        try {
            JoinRequest request = buildRequest();
            FacilityConfigManager config = facilityConfig == null
                    ? FacilityConfigManager.getInstance()
                    : FacilityConfigManager.fromFile(facilityConfig);
            ContainerStore store = new N5ContainerStore();
            result = new TomoJoinWorkflow(config, store).run(request);
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error("{}", e.getMessage());
            return EXIT_ERROR;
        } catch (TransitionNotFoundException e) {
            logger.error("Aborting, transition '{}' is missing: {}", e.getTransition(), e.getMessage());
            return EXIT_ERROR;
        } catch (IOException | UncheckedIOException e) {
            logger.error("Run failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }

        if (summaryJson != null) {
            try {
                writeSummary(result, summaryJson);
            } catch (IOException e) {
                logger.error("Could not write summary to {}: {}", summaryJson, e.getMessage());
            }
        }
        return result.isTotalFailure() ? EXIT_TOTAL_FAILURE : EXIT_OK;
    }

    JoinRequest buildRequest() {
        JoinRequest.Builder builder = JoinRequest.builder()
                .experiment(ExperimentType.fromName(experiment))
                .outputDir(outputDir)
                .facility(facility)
                .projDir(projDir)
                .projFilePattern(projFilePattern)
                .rawDir(rawDir)
                .scans(scanSpec, scanList, scanExclude)
                .projs(projSpec, projList, projExclude)
                .angles(angleSpec, angleList, angleExclude)
                .sortByAngle(sortByAngle)
                .padToMax(padToMax)
                .compress(compress)
                .quiet(quiet)
                .dryRun(dryRun)
                .skipCheck(skipCheck)
                .saveComplex(saveComplex)
                .saveModulus(saveModulus)
                .savePhase(savePhase)
                .removeRamp(removeRamp)
                .medianNorm(medianNorm)
                .unwrapPhase(unwrapPhase)
                .rescale(rescale)
                .transitions(transitions)
                .strictTransitions(strictTransitions);
        if (workers != null) {
            builder.workers(workers);
        }
        return builder.build();
    }

    static void writeSummary(JoinResult result, Path target) throws IOException {
        Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
        SummaryJson json = new SummaryJson(result.outputs().stream().map(Path::toString).toList(), result.summary());
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            gson.toJson(json, writer);
        }
        logger.info("Run report written to {}", target);
    }

    private record SummaryJson(List<String> outputs, JoinSummary summary) {
    }

    static class Version implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = NxStackCommand.class.getPackage().getImplementationVersion();
            return new String[]{"nxstack " + (version == null ? "dev" : version)};
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new NxStackCommand()).execute(args));
    }
}
