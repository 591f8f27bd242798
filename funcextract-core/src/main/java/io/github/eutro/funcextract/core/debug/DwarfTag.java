package io.github.eutro.funcextract.core.debug;

/**
 * The DWARF tags a type descriptor may carry.
 */
public enum DwarfTag {
    BASE_TYPE,
    STRUCTURE_TYPE,
    UNION_TYPE,
    ENUMERATION_TYPE,
    CLASS_TYPE,
    ARRAY_TYPE,
    POINTER_TYPE,
    REFERENCE_TYPE,
    TYPEDEF,
    CONST_TYPE,
    VOLATILE_TYPE,
    MEMBER,
}
