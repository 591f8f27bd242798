package io.github.eutro.funcextract.core.ext;

/**
 * A typed key for a piece of metadata attached to an {@link ExtContainer}.
 * <p>
 * Exts compare by identity, so two exts with the same name are still different keys.
 *
 * @param <T> The type of the attached metadata.
 */
public final class Ext<T> {
    private final Class<T> type;
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     *
     * @param type The type of the metadata. Values are checked against it when attached.
     * @param name The name of the ext, for debugging.
     * @param <T>  The type of the metadata.
     * @return The new ext.
     */
    public static <T> Ext<T> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    public Class<T> getType() {
        return type;
    }

    T check(Object value) {
        return type.cast(value);
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
