package io.github.eutro.funcextract.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * An {@link ExtContainer} that stores its exts in a map, allocated on first attach.
 */
public class ExtHolder implements ExtContainer {
    private @Nullable Map<Ext<?>, Object> exts = null;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (exts == null) exts = new IdentityHashMap<>(2);
        exts.put(ext, ext.check(value));
    }

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return exts == null ? null : ext.check(exts.get(ext));
    }
}
