package tomo.ext.nxstack.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Beamlines whose data layouts are known.
 *
 * <p>Each facility has a canonical identifier (as it appears in directory names) and
 * zero or more aliases accepted on the command line and in the {@code BEAMLINE}
 * environment variable.</p>
 */
public enum Facility {

    I08_1("i08-1", "j08"),
    I13_1("i13-1", "i13"),
    I14("i14");

    private final String id;
    private final List<String> aliases;

    Facility(String id, String... aliases) {
        this.id = id;
        this.aliases = List.of(aliases);
    }

    /**
     * @return the canonical identifier, e.g. {@code "i13-1"}
     */
    public String id() {
        return id;
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Resolves a facility from its identifier or one of its aliases, ignoring case and
     * surrounding whitespace.
     *
     * @param name identifier or alias, may be null
     * @return the facility, or empty if the name is unknown
     */
    public static Optional<Facility> fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.id.equals(normalized) || f.aliases.contains(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
