package tomo.ext.nxstack.utilities;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Small helpers shared across the pipeline.
 */
public final class MinorFunctions {

    static final Path DLS_ROOT = Paths.get("/dls");
    static final Path STAGING_ROOT = Paths.get("/dls/staging/dls");

    private MinorFunctions() {
        // Utility class - no instantiation
    }

    /**
     * Formats items for messages, e.g. {@code 'a', 'b'}.
     */
    public static String quoteIterable(Collection<?> items) {
        return items.stream().map(i -> "'" + i + "'").collect(Collectors.joining(", "));
    }

    /**
     * @return true if the path lies under the DLS staging area
     */
    public static boolean isStagingArea(Path path) {
        return path != null && path.toAbsolutePath().normalize().startsWith(STAGING_ROOT);
    }

    /**
     * Maps a path under {@code /dls} to its mirror in the staging area. Paths already in the
     * staging area, and paths outside {@code /dls}, are returned unchanged.
     */
    public static Path asStagingArea(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (isStagingArea(normalized) || !normalized.startsWith(DLS_ROOT)) {
            return path;
        }
        return STAGING_ROOT.resolve(DLS_ROOT.relativize(normalized));
    }

    /**
     * Truncates a path to its first components, counting the root as one.
     * {@code topLevelDir(/dls/i14/data/2024/cm1-1/processing/x, 6)} is {@code /dls/i14/data/2024/cm1-1}.
     *
     * @param path  the path
     * @param depth number of components to keep, root included
     * @return the truncated path, or the path itself when it is not deeper than {@code depth}
     */
    public static Path topLevelDir(Path path, int depth) {
        Path absolute = path.toAbsolutePath().normalize();
        int names = depth - 1;
        if (names < 1 || absolute.getNameCount() <= names) {
            return absolute;
        }
        return absolute.getRoot().resolve(absolute.subpath(0, names));
    }

    /**
     * Replaces {@code {key}} placeholders. Unknown placeholders are left as they are.
     */
    public static String fillTemplate(String template, Map<String, String> values) {
        String out = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (entry.getValue() != null) {
                out = out.replace("{" + entry.getKey() + "}", entry.getValue());
            }
        }
        return out;
    }
}
