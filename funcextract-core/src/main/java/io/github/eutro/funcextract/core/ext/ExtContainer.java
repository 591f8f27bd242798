package io.github.eutro.funcextract.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something {@link Ext}s can be attached to.
 */
public interface ExtContainer {
    /**
     * Attach a value for {@code ext}, replacing any previous one.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     * @throws ClassCastException If the value is not of the ext's type.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Get the value attached for {@code ext}.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null if there is none.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }
}
