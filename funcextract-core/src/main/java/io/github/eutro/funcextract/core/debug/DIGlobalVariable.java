package io.github.eutro.funcextract.core.debug;

import org.jetbrains.annotations.Nullable;

/**
 * A global variable.
 */
public final class DIGlobalVariable extends DIVariable {
    public DIGlobalVariable(String name, int line, @Nullable DIType type) {
        super(name, line, type);
    }
}
