package io.github.eutro.funcextract.core.analysis;

import io.github.eutro.funcextract.core.debug.*;
import org.jetbrains.annotations.Nullable;

/**
 * Unwraps the pointer and array layers of a type descriptor.
 * <p>
 * Walking stops at:
 * <ul>
 *     <li>basic types;</li>
 *     <li>composite types, unless they are arrays, which are unwrapped to their element type;</li>
 *     <li>derived types, unless they are pointers, which are unwrapped to their base type.
 *     Typedefs in particular are not unwrapped, their name is what the user wrote.</li>
 * </ul>
 * Pointers and arrays with no element type are taken to point to {@link #VOID void}.
 */
public final class TypeResolver {
    /**
     * How many layers may be unwrapped before a chain is considered malformed.
     */
    public static final int MAX_DEPTH = 64;

    /**
     * What untyped pointers resolve to.
     */
    public static final DIBasicType VOID = new DIBasicType("void");

    private TypeResolver() {
    }

    /**
     * Resolve a type to its terminal type and its indirection count.
     *
     * @param type The type.
     * @return The resolved type.
     * @throws MalformedTypeMetadataException If the chain is deeper than {@link #MAX_DEPTH}.
     */
    public static ResolvedType resolveBaseType(DIType type) {
        DIType current = type;
        int indirection = 0;
        while (true) {
            if (!isIndirection(current)) {
                return new ResolvedType(current, indirection);
            }
            if (indirection == MAX_DEPTH) {
                throw new MalformedTypeMetadataException("Type chain starting at " + type
                        + " is deeper than " + MAX_DEPTH + " levels, is it cyclic?");
            }
            indirection++;
            DIType next = unwrap(current);
            current = next == null ? VOID : next;
        }
    }

    private static boolean isIndirection(DIType type) {
        switch (type.getTag()) {
            case ARRAY_TYPE:
                return type instanceof DICompositeType;
            case POINTER_TYPE:
                return type instanceof DIDerivedType;
            default:
                return false;
        }
    }

    private static @Nullable DIType unwrap(DIType type) {
        if (type instanceof DICompositeType) return ((DICompositeType) type).getElementType();
        return ((DIDerivedType) type).getBaseType();
    }

    /**
     * Render a terminal type as it would be written in source.
     * <p>
     * Structs, unions and enums get their keyword. Anything anonymous is {@code unknown}.
     *
     * @param type The type, or null.
     * @return The rendered name.
     */
    public static String render(@Nullable DIType type) {
        if (type == null || type.getName() == null) return "unknown";
        switch (type.getTag()) {
            case STRUCTURE_TYPE:
                return "struct " + type.getName();
            case UNION_TYPE:
                return "union " + type.getName();
            case ENUMERATION_TYPE:
                return "enum " + type.getName();
            default:
                return type.getName();
        }
    }
}
