package io.github.eutro.funcextract.core.ops;

/**
 * The broad class of an instruction, which is all the region analyses look at.
 */
public enum InsnKind {
    /**
     * Reads memory through its address operand.
     */
    READ,
    /**
     * Writes memory. Operands are {@code [value, address]}.
     */
    WRITE,
    /**
     * Copies a block of memory. Operands are {@code [dest, src, length]}.
     */
    BLOCK_COPY,
    /**
     * Allocates a stack slot. The instruction is itself a storage location.
     */
    ALLOCATE,
    /**
     * Declares a source variable for a stack slot. Operands are {@code [slot]}.
     * This is a metadata use; it does not count as a user of the slot.
     */
    DECLARE,
    /**
     * Ends a basic block, and may jump to other blocks.
     */
    TERMINATOR,
    /**
     * Anything else.
     */
    OTHER;

    /**
     * Get whether instructions of this kind touch memory, which are the roots
     * of the operand dependency walk.
     *
     * @return Whether this is a read, write or block copy.
     */
    public boolean touchesMemory() {
        return this == READ || this == WRITE || this == BLOCK_COPY;
    }

    /**
     * Get whether instructions of this kind modify memory through their destination operand.
     *
     * @return Whether this is a write or block copy.
     */
    public boolean writesMemory() {
        return this == WRITE || this == BLOCK_COPY;
    }
}
