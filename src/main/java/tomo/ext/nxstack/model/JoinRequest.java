package tomo.ext.nxstack.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable description of one stacking run.
 *
 * <p>Instances are created with {@link #builder()}. Defaults: pad to the largest shape,
 * save the phase, one worker per available processor, every other flag off.</p>
 */
public final class JoinRequest {

    // Required
    private final ExperimentType experiment;
    private final Path outputDir;

    // Location
    private final String facility;
    private final Path projDir;
    private final String projFilePattern;
    private final Path rawDir;

    // Selection axes
    private final String scanSpec;
    private final Path scanListFile;
    private final String scanExclude;
    private final String projSpec;
    private final Path projListFile;
    private final String projExclude;
    private final String angleSpec;
    private final Path angleListFile;
    private final String angleExclude;

    // Run behaviour
    private final boolean sortByAngle;
    private final boolean padToMax;
    private final boolean compress;
    private final boolean quiet;
    private final boolean dryRun;
    private final boolean skipCheck;
    private final int workers;

    // Ptychography
    private final boolean saveComplex;
    private final boolean saveModulus;
    private final boolean savePhase;
    private final boolean removeRamp;
    private final boolean medianNorm;
    private final boolean unwrapPhase;
    private final boolean rescale;

    // XRF
    private final List<String> transitions;
    private final boolean strictTransitions;

    private JoinRequest(Builder b) {
        this.experiment = b.experiment;
        this.outputDir = b.outputDir;
        this.facility = b.facility;
        this.projDir = b.projDir;
        this.projFilePattern = b.projFilePattern;
        this.rawDir = b.rawDir;
        this.scanSpec = b.scanSpec;
        this.scanListFile = b.scanListFile;
        this.scanExclude = b.scanExclude;
        this.projSpec = b.projSpec;
        this.projListFile = b.projListFile;
        this.projExclude = b.projExclude;
        this.angleSpec = b.angleSpec;
        this.angleListFile = b.angleListFile;
        this.angleExclude = b.angleExclude;
        this.sortByAngle = b.sortByAngle;
        this.padToMax = b.padToMax;
        this.compress = b.compress;
        this.quiet = b.quiet;
        this.dryRun = b.dryRun;
        this.skipCheck = b.skipCheck;
        this.workers = b.workers;
        this.saveComplex = b.saveComplex;
        this.saveModulus = b.saveModulus;
        this.savePhase = b.savePhase;
        this.removeRamp = b.removeRamp;
        this.medianNorm = b.medianNorm;
        this.unwrapPhase = b.unwrapPhase;
        this.rescale = b.rescale;
        this.transitions = List.copyOf(b.transitions);
        this.strictTransitions = b.strictTransitions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExperimentType experiment() { return experiment; }
    public Path outputDir() { return outputDir; }
    public String facility() { return facility; }
    public Path projDir() { return projDir; }
    public String projFilePattern() { return projFilePattern; }
    public Path rawDir() { return rawDir; }
    public String scanSpec() { return scanSpec; }
    public Path scanListFile() { return scanListFile; }
    public String scanExclude() { return scanExclude; }
    public String projSpec() { return projSpec; }
    public Path projListFile() { return projListFile; }
    public String projExclude() { return projExclude; }
    public String angleSpec() { return angleSpec; }
    public Path angleListFile() { return angleListFile; }
    public String angleExclude() { return angleExclude; }
    public boolean sortByAngle() { return sortByAngle; }
    public boolean padToMax() { return padToMax; }
    public boolean compress() { return compress; }
    public boolean quiet() { return quiet; }
    public boolean dryRun() { return dryRun; }
    public boolean skipCheck() { return skipCheck; }
    public int workers() { return workers; }
    public boolean saveComplex() { return saveComplex; }
    public boolean saveModulus() { return saveModulus; }
    public boolean savePhase() { return savePhase; }
    public boolean removeRamp() { return removeRamp; }
    public boolean medianNorm() { return medianNorm; }
    public boolean unwrapPhase() { return unwrapPhase; }
    public boolean rescale() { return rescale; }
    public List<String> transitions() { return transitions; }
    public boolean strictTransitions() { return strictTransitions; }

    /**
     * Builder for {@link JoinRequest}.
     */
    public static final class Builder {
        private ExperimentType experiment;
        private Path outputDir;
        private String facility;
        private Path projDir;
        private String projFilePattern;
        private Path rawDir;
        private String scanSpec;
        private Path scanListFile;
        private String scanExclude;
        private String projSpec;
        private Path projListFile;
        private String projExclude;
        private String angleSpec;
        private Path angleListFile;
        private String angleExclude;
        private boolean sortByAngle;
        private boolean padToMax = true;
        private boolean compress;
        private boolean quiet;
        private boolean dryRun;
        private boolean skipCheck;
        private int workers = Runtime.getRuntime().availableProcessors();
        private boolean saveComplex;
        private boolean saveModulus;
        private boolean savePhase = true;
        private boolean removeRamp;
        private boolean medianNorm;
        private boolean unwrapPhase;
        private boolean rescale;
        private List<String> transitions = new ArrayList<>();
        private boolean strictTransitions;

        private Builder() {}

        public Builder experiment(ExperimentType experiment) { this.experiment = experiment; return this; }
        public Builder outputDir(Path outputDir) { this.outputDir = outputDir; return this; }
        public Builder facility(String facility) { this.facility = facility; return this; }
        public Builder projDir(Path projDir) { this.projDir = projDir; return this; }
        public Builder projFilePattern(String projFilePattern) { this.projFilePattern = projFilePattern; return this; }
        public Builder rawDir(Path rawDir) { this.rawDir = rawDir; return this; }

        public Builder scans(String spec, Path listFile, String exclude) {
            this.scanSpec = spec;
            this.scanListFile = listFile;
            this.scanExclude = exclude;
            return this;
        }

        public Builder projs(String spec, Path listFile, String exclude) {
            this.projSpec = spec;
            this.projListFile = listFile;
            this.projExclude = exclude;
            return this;
        }

        public Builder angles(String spec, Path listFile, String exclude) {
            this.angleSpec = spec;
            this.angleListFile = listFile;
            this.angleExclude = exclude;
            return this;
        }

        public Builder sortByAngle(boolean sortByAngle) { this.sortByAngle = sortByAngle; return this; }
        public Builder padToMax(boolean padToMax) { this.padToMax = padToMax; return this; }
        public Builder compress(boolean compress) { this.compress = compress; return this; }
        public Builder quiet(boolean quiet) { this.quiet = quiet; return this; }
        public Builder dryRun(boolean dryRun) { this.dryRun = dryRun; return this; }
        public Builder skipCheck(boolean skipCheck) { this.skipCheck = skipCheck; return this; }
        public Builder workers(int workers) { this.workers = workers; return this; }
        public Builder saveComplex(boolean saveComplex) { this.saveComplex = saveComplex; return this; }
        public Builder saveModulus(boolean saveModulus) { this.saveModulus = saveModulus; return this; }
        public Builder savePhase(boolean savePhase) { this.savePhase = savePhase; return this; }
        public Builder removeRamp(boolean removeRamp) { this.removeRamp = removeRamp; return this; }
        public Builder medianNorm(boolean medianNorm) { this.medianNorm = medianNorm; return this; }
        public Builder unwrapPhase(boolean unwrapPhase) { this.unwrapPhase = unwrapPhase; return this; }
        public Builder rescale(boolean rescale) { this.rescale = rescale; return this; }
        public Builder strictTransitions(boolean strictTransitions) { this.strictTransitions = strictTransitions; return this; }

        public Builder transitions(List<String> transitions) {
            this.transitions = new ArrayList<>(transitions);
            return this;
        }

        /**
         * Splits a comma-delimited list such as {@code "Pt-La, Fe-Ka"}.
         */
        public Builder transitions(String commaDelimited) {
            List<String> parsed = new ArrayList<>();
            if (commaDelimited != null) {
                for (String token : commaDelimited.split(",")) {
                    if (!token.isBlank() && !parsed.contains(token.trim())) {
                        parsed.add(token.trim());
                    }
                }
            }
            this.transitions = parsed;
            return this;
        }

        /**
         * Validates required fields and builds the request.
         *
         * @throws IllegalArgumentException naming every missing or invalid field
         */
        public JoinRequest build() {
            List<String> problems = new ArrayList<>();
            if (experiment == null) problems.add("experiment");
            if (outputDir == null) problems.add("outputDir");
            if (projDir == null && (projFilePattern == null || projFilePattern.isBlank())) {
                problems.add("projDir or projFilePattern");
            }
            if (workers < 1) problems.add("workers (must be at least 1, got " + workers + ")");
            if (experiment == ExperimentType.XRF && transitions.isEmpty()) problems.add("transitions");
            if (!problems.isEmpty()) {
                throw new IllegalArgumentException("Invalid join request, missing or invalid: " + String.join(", ", problems));
            }
            return new JoinRequest(this);
        }
    }
}
