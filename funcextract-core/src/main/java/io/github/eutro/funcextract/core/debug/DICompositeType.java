package io.github.eutro.funcextract.core.debug;

import org.jetbrains.annotations.Nullable;

/**
 * An aggregate type: a struct, union, enum, class or array.
 */
public final class DICompositeType extends DIType {
    private @Nullable DIType elementType;

    /**
     * Construct a composite type.
     *
     * @param tag         The tag.
     * @param name        The name, or null if anonymous.
     * @param elementType The element type for arrays, otherwise usually null.
     */
    public DICompositeType(DwarfTag tag, @Nullable String name, @Nullable DIType elementType) {
        super(tag, name);
        this.elementType = elementType;
    }

    public static DICompositeType struct(String name) {
        return new DICompositeType(DwarfTag.STRUCTURE_TYPE, name, null);
    }

    public static DICompositeType arrayOf(DIType elementType) {
        return new DICompositeType(DwarfTag.ARRAY_TYPE, null, elementType);
    }

    public @Nullable DIType getElementType() {
        return elementType;
    }

    public void setElementType(@Nullable DIType elementType) {
        this.elementType = elementType;
    }
}
