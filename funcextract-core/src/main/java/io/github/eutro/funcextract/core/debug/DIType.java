package io.github.eutro.funcextract.core.debug;

import org.jetbrains.annotations.Nullable;

/**
 * A type descriptor from the debug information.
 * <p>
 * Descriptors form chains through {@link DICompositeType#getElementType() element types}
 * and {@link DIDerivedType#getBaseType() base types}. Those links can be set after construction
 * so that self-referential types can be described.
 */
public abstract class DIType {
    private final DwarfTag tag;
    private final @Nullable String name;

    DIType(DwarfTag tag, @Nullable String name) {
        this.tag = tag;
        this.name = name;
    }

    public DwarfTag getTag() {
        return tag;
    }

    /**
     * Get the name of this type.
     *
     * @return The name, or null for anonymous types.
     */
    public @Nullable String getName() {
        return name;
    }

    @Override
    public String toString() {
        return tag + "(" + (name == null ? "" : name) + ")";
    }
}
