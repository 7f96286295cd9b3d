package tomo.ext.nxstack.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import tomo.ext.nxstack.model.AttributeRef;
import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.Facility;
import tomo.ext.nxstack.model.FacilitySchema;
import tomo.ext.nxstack.model.ModalitySchema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * FacilityConfigManager
 *
 * <p>Loads the facility layout table from YAML and exposes it as immutable
 * {@link FacilitySchema} records:
 *   - Parses nested YAML into a Map&lt;String,Object&gt;.
 *   - Offers type safe getters (getString, getInteger, getList, getSection) over key paths.
 *   - Builds one schema per known facility, failing fast on malformed patterns.
 *
 * <p>The bundled table lives at {@value #BUNDLED_RESOURCE} on the classpath and is loaded once
 * per JVM through {@link #getInstance()}. A replacement table can be read with
 * {@link #fromFile(Path)}.</p>
 */
public class FacilityConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(FacilityConfigManager.class);

    public static final String BUNDLED_RESOURCE = "tomo/ext/nxstack/facilities.yml";

    private static FacilityConfigManager instance;

    private final Map<String, Object> configData;
    private final Map<Facility, FacilitySchema> schemas;
    private final String origin;

    FacilityConfigManager(Map<String, Object> configData, String origin) {
        this.configData = configData;
        this.origin = origin;
        this.schemas = buildSchemas();
    }

    /**
     * @return the shared manager for the bundled facility table
     * @throws IllegalStateException if the bundled table is missing or unreadable
     */
    public static synchronized FacilityConfigManager getInstance() {
        if (instance == null) {
            ClassLoader loader = FacilityConfigManager.class.getClassLoader();
            try (InputStream in = loader.getResourceAsStream(BUNDLED_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Bundled facility table not found: " + BUNDLED_RESOURCE);
                }
                instance = new FacilityConfigManager(loadConfig(in, BUNDLED_RESOURCE), BUNDLED_RESOURCE);
            } catch (IOException e) {
                throw new IllegalStateException("Cannot read bundled facility table " + BUNDLED_RESOURCE, e);
            }
        }
        return instance;
    }

    /**
     * Loads a facility table from the filesystem, replacing the bundled one for this manager.
     *
     * @param path YAML file
     * @return a new manager
     * @throws IOException if the file cannot be read
     */
    public static FacilityConfigManager fromFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return new FacilityConfigManager(loadConfig(in, path.toString()), path.toString());
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> loadConfig(InputStream in, String origin) {
        Object loaded = new Yaml().load(in);
        if (loaded instanceof Map) {
            return new LinkedHashMap<>((Map<String, Object>) loaded);
        }
        logger.error("YAML root is not a map: {}", origin);
        return new LinkedHashMap<>();
    }

    public Map<String, Object> getAllConfig() {
        return Collections.unmodifiableMap(configData);
    }

    /**
     * Retrieve a nested value following a sequence of keys.
     *
     * @param keys key path, e.g. "facilities", "i14", "raw_dir_depth"
     * @return the value, or null if any key is missing
     */
    @SuppressWarnings("unchecked")
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (String key : keys) {
            if (!(current instanceof Map<?, ?>)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(key);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return (v != null && !(v instanceof Map) && !(v instanceof List)) ? v.toString() : null;
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return (v != null) ? Integer.parseInt(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected number at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    /**
     * @return the list at the key path converted to strings, or an empty list
     */
    public List<String> getList(String... keys) {
        Object v = getConfigItem(keys);
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    out.add(item.toString());
                }
            }
        } else if (v != null) {
            logger.warn("Expected list at {} but got {}", String.join("/", keys), v);
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof Map<?, ?>) ? (Map<String, Object>) v : Collections.emptyMap();
    }

    /**
     * @return light source description written to every output, keyed by NXsource field
     */
    public Map<String, String> getSource() {
        Map<String, String> source = new LinkedHashMap<>();
        getSection("source").forEach((k, v) -> source.put(k, String.valueOf(v)));
        return source;
    }

    /**
     * @param facility the facility
     * @return its schema
     * @throws IllegalArgumentException if the table has no entry for it
     */
    public FacilitySchema getSchema(Facility facility) {
        FacilitySchema schema = schemas.get(facility);
        if (schema == null) {
            throw new IllegalArgumentException("No layout configured for facility " + facility + " in " + origin);
        }
        return schema;
    }

    public Map<Facility, FacilitySchema> getSchemas() {
        return Collections.unmodifiableMap(schemas);
    }

    private Map<Facility, FacilitySchema> buildSchemas() {
        Map<Facility, FacilitySchema> built = new EnumMap<>(Facility.class);
        for (String name : getSection("facilities").keySet()) {
            Facility facility = Facility.fromName(name).orElse(null);
            if (facility == null) {
                logger.warn("Ignoring unknown facility '{}' in {}", name, origin);
                continue;
            }
            built.put(facility, buildSchema(facility, name));
        }
        logger.debug("Loaded {} facility layouts from {}", built.size(), origin);
        return built;
    }

    private FacilitySchema buildSchema(Facility facility, String name) {
        String[] base = {"facilities", name};
        Map<ExperimentType, ModalitySchema> modalities = new EnumMap<>(ExperimentType.class);
        for (String modality : getSection(path(base, "modalities")).keySet()) {
            ExperimentType type = ExperimentType.fromName(modality);
            modalities.put(type, buildModality(path(base, "modalities", modality)));
        }
        String directoryPattern = getString(path(base, "directory_pattern"));
        return new FacilitySchema(
                facility,
                compile(directoryPattern == null ? Pattern.quote(facility.id()) : directoryPattern, name),
                intOr(path(base, "raw_dir_depth"), 6),
                intOr(path(base, "staging_raw_dir_depth"), 8),
                getDouble(path(base, "detector_distance")),
                getList(path(base, "raw_metadata_files")),
                attributeRefs(path(base, "raw_angle_attributes")),
                modalities);
    }

    private ModalitySchema buildModality(String[] base) {
        String where = String.join("/", base);
        List<Pattern> filenamePatterns = new ArrayList<>();
        for (String regex : getList(path(base, "filename_patterns"))) {
            filenamePatterns.add(compile(regex, where));
        }
        List<Pattern> scanPatterns = new ArrayList<>();
        for (String regex : getList(path(base, "scan_attribute_patterns"))) {
            scanPatterns.add(compile(regex, where));
        }
        return new ModalitySchema(
                getString(path(base, "software")),
                getList(path(base, "extensions")),
                filenamePatterns,
                AttributeRef.parse(getString(path(base, "scan_attribute"))),
                scanPatterns,
                AttributeRef.parse(getString(path(base, "proj_attribute"))),
                AttributeRef.parse(getString(path(base, "save_dir_attribute"))),
                getList(path(base, "essential_paths")),
                AttributeRef.parse(getString(path(base, "signature"))),
                getString(path(base, "signature_value")),
                getString(path(base, "complex_path")),
                getString(path(base, "modulus_path")),
                getString(path(base, "phase_path")),
                getString(path(base, "transition_path")),
                getString(path(base, "pixel_size_path")),
                attributeRefs(path(base, "angle_attributes")),
                intOr(path(base, "scan_padding"), 0),
                intOr(path(base, "proj_padding"), 0));
    }

    private List<AttributeRef> attributeRefs(String... keys) {
        List<AttributeRef> refs = new ArrayList<>();
        for (String text : getList(keys)) {
            refs.add(AttributeRef.parse(text));
        }
        return refs;
    }

    private int intOr(String[] keys, int fallback) {
        Integer v = getInteger(keys);
        return v == null ? fallback : v;
    }

    private static Pattern compile(String regex, String where) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern '" + regex + "' in " + where, e);
        }
    }

    private static String[] path(String[] base, String... more) {
        String[] out = new String[base.length + more.length];
        System.arraycopy(base, 0, out, 0, base.length);
        System.arraycopy(more, 0, out, base.length, more.length);
        return out;
    }
}
