package io.github.eutro.funcextract.core.debug;

import org.jetbrains.annotations.Nullable;

/**
 * The debug descriptor of a function.
 */
public final class DISubprogram {
    private final String name;
    private final int line;
    private final @Nullable DIType returnType;

    /**
     * Construct a subprogram descriptor.
     *
     * @param name       The source name of the function.
     * @param line       The line the function was declared on.
     * @param returnType The return type, or null for {@code void}.
     */
    public DISubprogram(String name, int line, @Nullable DIType returnType) {
        this.name = name;
        this.line = line;
        this.returnType = returnType;
    }

    public String getName() {
        return name;
    }

    public int getLine() {
        return line;
    }

    public @Nullable DIType getReturnType() {
        return returnType;
    }
}
