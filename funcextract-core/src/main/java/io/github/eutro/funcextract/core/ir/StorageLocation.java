package io.github.eutro.funcextract.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A stack slot or global: the unit that region inputs and outputs are made of.
 */
public interface StorageLocation {
    /**
     * Get this location as an operand value.
     *
     * @return The value.
     */
    Value asValue();

    /**
     * Get the block that defines this location.
     *
     * @return The block of the allocating instruction, or null for globals.
     */
    @Nullable BasicBlock getDefiningBlock();

    /**
     * Get whether this is a global rather than a stack slot.
     *
     * @return Whether this is a global.
     */
    boolean isGlobal();

    /**
     * Get the IR name of this location.
     *
     * @return The name.
     */
    default String getName() {
        return asValue().getName();
    }

    /**
     * Get the instructions that use this location.
     *
     * @return The users.
     * @see Value#getUsers()
     */
    default List<Insn> getUsers() {
        return asValue().getUsers();
    }
}
