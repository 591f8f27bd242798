package io.github.eutro.funcextract.core.debug;

import org.jetbrains.annotations.Nullable;

/**
 * A local variable or parameter of a function.
 */
public final class DILocalVariable extends DIVariable {
    private final int arg;

    /**
     * Construct a local variable.
     *
     * @param name The name.
     * @param line The line it was declared on.
     * @param type The type.
     * @param arg  The 1-based parameter number, or 0 if this isn't a parameter.
     */
    public DILocalVariable(String name, int line, @Nullable DIType type, int arg) {
        super(name, line, type);
        this.arg = arg;
    }

    public DILocalVariable(String name, int line, @Nullable DIType type) {
        this(name, line, type, 0);
    }

    public int getArg() {
        return arg;
    }

    public boolean isParameter() {
        return arg != 0;
    }
}
