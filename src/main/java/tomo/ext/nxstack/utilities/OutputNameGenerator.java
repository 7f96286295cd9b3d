package tomo.ext.nxstack.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.ProjectionRecord;

import java.util.Collection;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * OutputNameGenerator
 *
 * <p>Derives deterministic output names from the experiment type, the output role and the
 * identifiers that contributed to the run:
 * <ul>
 *   <li>several scans: {@code tomo_<experiment>_<firstScan>_<lastScan>_<role><ext>}
 *   <li>one scan with numbered projections: {@code tomo_<experiment>_<scan>_<firstProj>_<lastProj>_<role><ext>}
 * </ul>
 *
 * <p>Names depend only on the inputs, so a dry run and a real run agree.
 */
public class OutputNameGenerator {
    private static final Logger logger = LoggerFactory.getLogger(OutputNameGenerator.class);

    private OutputNameGenerator() {
        // Utility class - no instantiation
    }

    /**
     * @param experiment the experiment type
     * @param role       the role tag, sanitised before use
     * @param records    the projections contributing to the run
     * @param extension  container extension including the dot, e.g. ".n5"
     * @return the file name, without directory
     */
    public static String stackName(ExperimentType experiment, String role, Collection<ProjectionRecord> records,
                                   String extension) {
        TreeSet<Integer> scans = records.stream().map(ProjectionRecord::scan).filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));
        TreeSet<Integer> projs = records.stream().map(ProjectionRecord::proj).filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));

        StringBuilder nameBuilder = new StringBuilder("tomo_").append(experiment.shortName());
        if (scans.size() == 1 && !projs.isEmpty()) {
            nameBuilder.append("_").append(scans.first())
                    .append("_").append(projs.first())
                    .append("_").append(projs.last());
        } else if (!scans.isEmpty()) {
            nameBuilder.append("_").append(scans.first()).append("_").append(scans.last());
        } else if (!projs.isEmpty()) {
            nameBuilder.append("_").append(projs.first()).append("_").append(projs.last());
        }
        nameBuilder.append("_").append(sanitizeForFilename(role)).append(extension);

        String name = nameBuilder.toString();
        logger.debug("Generated output name {} for role {} from {} projections", name, role, records.size());
        return name;
    }

    /**
     * Replaces characters that are invalid in file names, and whitespace, with underscores.
     */
    public static String sanitizeForFilename(String input) {
        if (input == null || input.isEmpty()) {
            return input;
        }
        return input.replaceAll("[\\\\/:\"*?<>|\\s]+", "_");
    }
}
