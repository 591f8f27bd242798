package io.github.eutro.funcextract.core.analysis;

import io.github.eutro.funcextract.core.debug.DIType;

/**
 * A type with its pointers and arrays unwrapped: the type at the end of the chain,
 * and how many levels of indirection were unwrapped to reach it.
 */
public final class ResolvedType {
    private final DIType terminal;
    private final int indirection;

    public ResolvedType(DIType terminal, int indirection) {
        this.terminal = terminal;
        this.indirection = indirection;
    }

    public DIType getTerminal() {
        return terminal;
    }

    public int getIndirection() {
        return indirection;
    }

    /**
     * Get the terminal type as it would be written in source.
     *
     * @return The name.
     * @see TypeResolver#render(DIType)
     */
    public String getTypeName() {
        return TypeResolver.render(terminal);
    }

    @Override
    public String toString() {
        return getTypeName() + " (" + indirection + ")";
    }
}
