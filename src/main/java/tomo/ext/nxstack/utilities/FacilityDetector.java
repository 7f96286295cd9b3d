package tomo.ext.nxstack.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.model.Facility;
import tomo.ext.nxstack.model.FacilitySchema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Infers which facility produced a set of projections.
 *
 * <p>Resolution order:</p>
 * <ol>
 *   <li>an explicit facility name, used verbatim without checking it against any path</li>
 *   <li>the {@code BEAMLINE} environment variable, when it names a known facility</li>
 *   <li>the directory naming convention of each configured facility, applied to the candidate
 *       paths in order; the first path that matches exactly one facility decides</li>
 * </ol>
 *
 * <p>Detection is advisory: validation of the located files is the authoritative check.</p>
 */
public class FacilityDetector {
    private static final Logger logger = LoggerFactory.getLogger(FacilityDetector.class);

    public static final String BEAMLINE_VARIABLE = "BEAMLINE";

    private final FacilityConfigManager config;
    private final Supplier<String> beamlineSupplier;

    public FacilityDetector(FacilityConfigManager config) {
        this(config, () -> System.getenv(BEAMLINE_VARIABLE));
    }

    /**
     * @param config           facility table
     * @param beamlineSupplier source of the {@code BEAMLINE} value, may return null
     */
    public FacilityDetector(FacilityConfigManager config, Supplier<String> beamlineSupplier) {
        this.config = config;
        this.beamlineSupplier = beamlineSupplier;
    }

    /**
     * @param explicitOverride facility name or alias, may be null
     * @param candidatePaths   paths or naming patterns to inspect, nulls ignored
     * @return the facility
     * @throws FacilityUndeterminedException if no facility or more than one facility matches
     */
    public Facility detect(String explicitOverride, String... candidatePaths) {
        return detect(explicitOverride, Arrays.asList(candidatePaths));
    }

    public Facility detect(String explicitOverride, List<String> candidatePaths) {
        if (explicitOverride != null && !explicitOverride.isBlank()) {
            Facility facility = Facility.fromName(explicitOverride)
                    .orElseThrow(() -> new FacilityUndeterminedException("Unknown facility '" + explicitOverride
                            + "'. Known facilities: " + Arrays.toString(Facility.values())));
            logger.debug("Using explicitly requested facility {}", facility);
            return facility;
        }

        String beamline = beamlineSupplier.get();
        if (beamline != null && !beamline.isBlank()) {
            Facility fromEnv = Facility.fromName(beamline).orElse(null);
            if (fromEnv != null) {
                logger.info("Facility {} taken from {} environment variable", fromEnv, BEAMLINE_VARIABLE);
                return fromEnv;
            }
            logger.warn("Ignoring {}={} which is not a known facility", BEAMLINE_VARIABLE, beamline);
        }

        for (String path : candidatePaths) {
            if (path == null || path.isBlank()) {
                continue;
            }
            List<Facility> matches = matchingFacilities(path);
            if (matches.size() == 1) {
                logger.info("Facility {} deduced from {}", matches.get(0), path);
                return matches.get(0);
            }
            if (matches.size() > 1) {
                throw new FacilityUndeterminedException("Path " + path + " matches several facilities "
                        + matches + "; specify the facility explicitly");
            }
        }

        throw new FacilityUndeterminedException("Cannot deduce the facility from "
                + MinorFunctions.quoteIterable(candidatePaths.stream().filter(Objects::nonNull).toList())
                + "; specify the facility explicitly");
    }

    /**
     * @return every configured facility whose directory convention matches the path
     */
    public List<Facility> matchingFacilities(String path) {
        List<Facility> matches = new ArrayList<>();
        for (FacilitySchema schema : config.getSchemas().values()) {
            if (schema.matchesDirectory(path)) {
                matches.add(schema.facility());
            }
        }
        return matches;
    }
}
