package io.github.eutro.funcextract.core.ir;

import io.github.eutro.funcextract.core.ops.Ops;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;

/**
 * An {@link Ops#ALLOCA alloca} instruction, which is the storage location it allocates.
 */
public final class StackSlot extends Insn implements StorageLocation {
    StackSlot(Module module, String name) {
        super(module, name, Ops.ALLOCA, Collections.emptyList(), Collections.emptyList());
    }

    @Override
    public Value asValue() {
        return this;
    }

    @Override
    public @Nullable BasicBlock getDefiningBlock() {
        return getBlock();
    }

    @Override
    public boolean isGlobal() {
        return false;
    }
}
