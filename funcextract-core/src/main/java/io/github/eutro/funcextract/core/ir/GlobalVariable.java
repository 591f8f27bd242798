package io.github.eutro.funcextract.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * A module-level variable.
 */
public final class GlobalVariable extends Value implements StorageLocation {
    GlobalVariable(Module module, String name) {
        super(module, name);
    }

    @Override
    public Value asValue() {
        return this;
    }

    @Override
    public @Nullable BasicBlock getDefiningBlock() {
        return null;
    }

    @Override
    public boolean isGlobal() {
        return true;
    }

    @Override
    public String toString() {
        return "@" + getName();
    }
}
