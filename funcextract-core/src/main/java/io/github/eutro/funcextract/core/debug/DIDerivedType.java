package io.github.eutro.funcextract.core.debug;

import org.jetbrains.annotations.Nullable;

/**
 * A type derived from another: pointers, typedefs, qualifiers and members.
 */
public final class DIDerivedType extends DIType {
    private @Nullable DIType baseType;

    public DIDerivedType(DwarfTag tag, @Nullable String name, @Nullable DIType baseType) {
        super(tag, name);
        this.baseType = baseType;
    }

    public static DIDerivedType pointerTo(@Nullable DIType baseType) {
        return new DIDerivedType(DwarfTag.POINTER_TYPE, null, baseType);
    }

    public static DIDerivedType typedef(String name, DIType baseType) {
        return new DIDerivedType(DwarfTag.TYPEDEF, name, baseType);
    }

    /**
     * Get the type this is derived from.
     *
     * @return The base type, or null (e.g. for {@code void *}).
     */
    public @Nullable DIType getBaseType() {
        return baseType;
    }

    public void setBaseType(@Nullable DIType baseType) {
        this.baseType = baseType;
    }
}
