package io.github.eutro.funcextract.core.debug;

/**
 * A primitive type, like {@code int} or {@code char}.
 */
public final class DIBasicType extends DIType {
    public DIBasicType(String name) {
        super(DwarfTag.BASE_TYPE, name);
    }
}
