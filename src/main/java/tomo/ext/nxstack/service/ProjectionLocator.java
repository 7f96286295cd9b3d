package tomo.ext.nxstack.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.FacilitySchema;
import tomo.ext.nxstack.model.ModalitySchema;
import tomo.ext.nxstack.model.NdArray;
import tomo.ext.nxstack.model.ProjectionRecord;
import tomo.ext.nxstack.model.SelectionFilter;
import tomo.ext.nxstack.service.container.ContainerReader;
import tomo.ext.nxstack.service.container.ContainerStore;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the projection files matching a selection.
 *
 * <p>Two modes are supported:</p>
 * <ul>
 *   <li><b>Pattern</b>: {@code %(scan)} and {@code %(proj)} in a file pattern are replaced by
 *       every resolved identifier (the cartesian product when both are present). No directory
 *       is scanned.</li>
 *   <li><b>Directory scan</b>: the projection directory is walked for files with an accepted
 *       extension; identifiers come from the file name, or from attributes inside the file
 *       when the name does not carry them. Containers are not descended into.</li>
 * </ul>
 *
 * <p>Each candidate is validated unless validation is skipped. Candidates are inspected in
 * parallel on the supplied pool; the result is ordered by scan, then projection number.</p>
 */
public class ProjectionLocator {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionLocator.class);

    public static final String SCAN_PLACEHOLDER = "%(scan)";
    public static final String PROJ_PLACEHOLDER = "%(proj)";

    private final ContainerStore store;
    private final ProjectionValidator validator;

    public ProjectionLocator(ContainerStore store, ProjectionValidator validator) {
        this.store = store;
        this.validator = validator;
    }

    /**
     * @param facility        facility layout
     * @param experiment      experiment type
     * @param filter          scan and projection selection; angles are filtered later
     * @param projDir         directory to scan, or base for a relative pattern; may be null with a pattern
     * @param projFilePattern file pattern with placeholders, or null for a directory scan
     * @param skipCheck       trust every candidate without validation
     * @param allowEmpty      return an empty result instead of failing
     * @param pool            workers for candidate inspection
     * @return the selected projections
     * @throws ProjectionNotFoundException if nothing matches and {@code allowEmpty} is false
     * @throws IllegalArgumentException    if the pattern needs identifiers that were not given
     */
    public LocatedProjections locate(FacilitySchema facility, ExperimentType experiment, SelectionFilter filter,
                                     Path projDir, String projFilePattern, boolean skipCheck, boolean allowEmpty,
                                     ExecutorService pool) {
        ModalitySchema schema = facility.modality(experiment);
        List<Candidate> candidates = new ArrayList<>();
        int missing = 0;

        if (projFilePattern != null && !projFilePattern.isBlank()) {
            for (Candidate candidate : expandPattern(projFilePattern, projDir, filter, schema)) {
                if (Files.exists(candidate.path())) {
                    candidates.add(candidate);
                } else {
                    logger.warn("Projection file {} does not exist, skipping", candidate.path());
                    missing++;
                }
            }
        } else {
            candidates.addAll(scanDirectory(projDir, filter, schema));
        }
        int located = candidates.size();
        logger.info("Located {} candidate {} files for {}", located, experiment.description(), facility.facility());

        List<Outcome> outcomes = inspectAll(candidates, facility, experiment, schema, skipCheck, pool);

        List<ProjectionRecord> records = new ArrayList<>();
        int validated = 0;
        int skipped = missing;
        for (Outcome outcome : outcomes) {
            if (outcome.failure() != null) {
                logger.warn("Skipping {}: {}", outcome.path(), outcome.failure());
                skipped++;
                continue;
            }
            validated++;
            ProjectionRecord record = outcome.record();
            if (filter.acceptsScan(record.scan()) && filter.acceptsProj(record.proj())) {
                records.add(record);
            } else {
                logger.debug("{} is outside the selection", outcome.path());
            }
        }
        records.sort(ProjectionRecord.BY_IDENTIFIER);
        skipped += removeDuplicates(records);

        if (records.isEmpty() && !allowEmpty) {
            throw new ProjectionNotFoundException("No " + experiment.description() + " projection found in "
                    + (projFilePattern != null && !projFilePattern.isBlank() ? "pattern " + projFilePattern : "directory " + projDir)
                    + describe(filter) + " (" + located + " candidates, " + skipped + " skipped)");
        }
        return new LocatedProjections(records, located, validated, skipped);
    }

    /**
     * Substitutes identifiers into a file pattern.
     */
    List<Candidate> expandPattern(String pattern, Path projDir, SelectionFilter filter, ModalitySchema schema) {
        boolean hasScan = pattern.contains(SCAN_PLACEHOLDER);
        boolean hasProj = pattern.contains(PROJ_PLACEHOLDER);
        if (!hasScan && !hasProj) {
            throw new IllegalArgumentException("File pattern " + pattern + " contains neither "
                    + SCAN_PLACEHOLDER + " nor " + PROJ_PLACEHOLDER);
        }
        if (hasScan && !filter.filtersScans()) {
            throw new IllegalArgumentException("File pattern " + pattern + " needs scan identifiers");
        }
        if (hasProj && !filter.filtersProjs()) {
            throw new IllegalArgumentException("File pattern " + pattern + " needs projection identifiers");
        }
        List<Integer> scans = hasScan ? new ArrayList<>(filter.scans()) : Collections.singletonList(null);
        List<Integer> projs = hasProj ? new ArrayList<>(filter.projs()) : Collections.singletonList(null);

        List<Candidate> candidates = new ArrayList<>(scans.size() * projs.size());
        for (Integer scan : scans) {
            for (Integer proj : projs) {
                String name = pattern;
                if (scan != null) name = name.replace(SCAN_PLACEHOLDER, pad(scan, schema.scanPadding()));
                if (proj != null) name = name.replace(PROJ_PLACEHOLDER, pad(proj, schema.projPadding()));
                Path path;
                try {
                    path = Paths.get(name);
                } catch (InvalidPathException e) {
                    throw new IllegalArgumentException("File pattern " + pattern + " gives an invalid path " + name, e);
                }
                if (!path.isAbsolute() && projDir != null) {
                    path = projDir.resolve(path);
                }
                candidates.add(new Candidate(path, scan, proj));
            }
        }
        return candidates;
    }

    /**
     * Walks the projection directory for files with an accepted extension whose file-name
     * identifiers, when present, fall within the selection.
     */
    List<Candidate> scanDirectory(Path projDir, SelectionFilter filter, ModalitySchema schema) {
        if (projDir == null || !Files.isDirectory(projDir)) {
            throw new ProjectionNotFoundException("Projection directory " + projDir + " does not exist");
        }
        List<Candidate> candidates = new ArrayList<>();
        try {
            Files.walkFileTree(projDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(projDir) && schema.acceptsExtension(dir.getFileName().toString())) {
                        consider(dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (schema.acceptsExtension(file.getFileName().toString())) {
                        consider(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.warn("Cannot inspect {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }

                private void consider(Path path) {
                    Integer[] ids = identifiersFromName(path.getFileName().toString(), schema);
                    if ((ids[0] != null && !filter.acceptsScan(ids[0])) || (ids[1] != null && !filter.acceptsProj(ids[1]))) {
                        return;
                    }
                    candidates.add(new Candidate(path, ids[0], ids[1]));
                }
            });
        } catch (IOException e) {
            throw new ProjectionNotFoundException("Cannot scan projection directory " + projDir + ": " + e.getMessage());
        }
        candidates.sort((a, b) -> a.path().compareTo(b.path()));
        return candidates;
    }

    /**
     * Extracts {@code scan} and {@code proj} named groups with the first matching pattern.
     *
     * @return {scan, proj}, either of which may be null
     */
    static Integer[] identifiersFromName(String fileName, ModalitySchema schema) {
        for (Pattern pattern : schema.filenamePatterns()) {
            Matcher m = pattern.matcher(fileName);
            if (m.find()) {
                return new Integer[]{group(m, pattern, "scan"), group(m, pattern, "proj")};
            }
        }
        return new Integer[]{null, null};
    }

    private static Integer group(Matcher m, Pattern pattern, String name) {
        if (!pattern.pattern().contains("(?<" + name + ">")) {
            return null;
        }
        String value = m.group(name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            logger.debug("Ignoring out-of-range {} identifier {}", name, value);
            return null;
        }
    }

    private List<Outcome> inspectAll(List<Candidate> candidates, FacilitySchema facility, ExperimentType experiment,
                                     ModalitySchema schema, boolean skipCheck, ExecutorService pool) {
        List<Future<Outcome>> futures = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            Callable<Outcome> task = () -> inspect(candidate, facility, experiment, schema, skipCheck);
            futures.add(pool.submit(task));
        }
        List<Outcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while inspecting projections", e);
            } catch (ExecutionException e) {
                outcomes.add(new Outcome(candidates.get(i).path(), null, String.valueOf(e.getCause())));
            }
        }
        return outcomes;
    }

    private Outcome inspect(Candidate candidate, FacilitySchema facility, ExperimentType experiment,
                            ModalitySchema schema, boolean skipCheck) {
        Path path = candidate.path();
        try {
            if (!skipCheck) {
                validator.validate(path, schema);
            }
            Integer scan = candidate.scan();
            Integer proj = candidate.proj();
            boolean needScan = scan == null && schema.scanAttribute() != null;
            boolean needProj = proj == null && schema.projAttribute() != null;
            if (needScan || needProj) {
                try (ContainerReader reader = store.openReader(path)) {
                    if (needScan) scan = scanFromAttribute(reader, schema);
                    if (needProj) proj = projFromAttribute(reader, schema);
                }
            }
            return new Outcome(path, new ProjectionRecord(path, facility.facility(), experiment, scan, proj, null), null);
        } catch (IOException e) {
            return new Outcome(path, null, e.getMessage());
        }
    }

    private static Integer scanFromAttribute(ContainerReader reader, ModalitySchema schema) throws IOException {
        String value = reader.readString(schema.scanAttribute());
        if (value == null) {
            return null;
        }
        for (Pattern pattern : schema.scanAttributePatterns()) {
            Matcher m = pattern.matcher(value);
            if (m.find()) {
                return group(m, pattern, "scan");
            }
        }
        throw new IOException("Cannot deduce the scan number from " + schema.scanAttribute() + " = " + value);
    }

    private static Integer projFromAttribute(ContainerReader reader, ModalitySchema schema) throws IOException {
        NdArray value = reader.readNumbers(schema.projAttribute());
        if (value == null || value.size() == 0) {
            return null;
        }
        return (int) Math.round(value.values()[0]);
    }

    /**
     * Keeps the first file of every (scan, proj) pair.
     *
     * @return number of files removed
     */
    private static int removeDuplicates(List<ProjectionRecord> sorted) {
        Set<List<Integer>> seen = new HashSet<>();
        int removed = 0;
        for (int i = 0; i < sorted.size(); ) {
            ProjectionRecord record = sorted.get(i);
            boolean identified = record.scan() != null || record.proj() != null;
            if (identified && !seen.add(Arrays.asList(record.scan(), record.proj()))) {
                logger.warn("Skipping {}: {} is already provided by another file", record.path(), record.label());
                sorted.remove(i);
                removed++;
            } else {
                i++;
            }
        }
        return removed;
    }

    private static String pad(int id, int width) {
        return width > 0 ? String.format("%0" + width + "d", id) : Integer.toString(id);
    }

    private static String describe(SelectionFilter filter) {
        StringBuilder sb = new StringBuilder();
        if (filter.filtersScans()) sb.append(" for scans ").append(filter.scans());
        if (filter.filtersProjs()) sb.append(" for projections ").append(filter.projs());
        return sb.toString();
    }

    record Candidate(Path path, Integer scan, Integer proj) {}

    private record Outcome(Path path, ProjectionRecord record, String failure) {}
}
