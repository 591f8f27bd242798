package io.github.eutro.funcextract.core.debug;

import org.jetbrains.annotations.Nullable;

/**
 * A source-level variable: its name, where it was declared, and its type.
 */
public abstract class DIVariable {
    private final String name;
    private final int line;
    private final @Nullable DIType type;

    DIVariable(String name, int line, @Nullable DIType type) {
        this.name = name;
        this.line = line;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    /**
     * Get the source line the variable was declared on.
     *
     * @return The line.
     */
    public int getLine() {
        return line;
    }

    public @Nullable DIType getType() {
        return type;
    }

    @Override
    public String toString() {
        return name + "@" + line;
    }
}
