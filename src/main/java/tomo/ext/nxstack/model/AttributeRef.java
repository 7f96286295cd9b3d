package tomo.ext.nxstack.model;

/**
 * Reference to an attribute stored on a group or dataset inside a container, written
 * in configuration files as {@code <path>@<key>}.
 *
 * @param path the group or dataset path
 * @param key  the attribute key
 */
public record AttributeRef(String path, String key) {

    public AttributeRef {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Attribute path must not be empty");
        }
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Attribute key must not be empty for path " + path);
        }
    }

    /**
     * Parses {@code "/entry_1/experiment_1/data@data_ID"}.
     *
     * @param text the reference text, may be null
     * @return the reference, or null when {@code text} is null or blank
     * @throws IllegalArgumentException if the separator is missing
     */
    public static AttributeRef parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        int at = text.lastIndexOf('@');
        if (at <= 0 || at == text.length() - 1) {
            throw new IllegalArgumentException("Attribute reference must be '<path>@<key>': " + text);
        }
        return new AttributeRef(text.substring(0, at).trim(), text.substring(at + 1).trim());
    }

    @Override
    public String toString() {
        return path + "@" + key;
    }
}
