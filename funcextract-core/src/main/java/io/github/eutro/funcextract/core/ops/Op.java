package io.github.eutro.funcextract.core.ops;

import org.jetbrains.annotations.Nullable;

/**
 * An operation, identified by its mnemonic.
 */
public final class Op {
    /**
     * The mnemonic, as it would be printed.
     */
    public final String mnemonic;
    /**
     * What kind of instruction this operation makes.
     */
    public final InsnKind kind;
    private final int destOperand;

    Op(String mnemonic, InsnKind kind, int destOperand) {
        this.mnemonic = mnemonic;
        this.kind = kind;
        this.destOperand = destOperand;
    }

    /**
     * Create an operation the analyses don't treat specially.
     *
     * @param mnemonic The mnemonic.
     * @return The operation.
     */
    public static Op other(String mnemonic) {
        return new Op(mnemonic, InsnKind.OTHER, -1);
    }

    /**
     * Get the index of the operand this operation writes through, if it writes memory.
     *
     * @return The index, or null if this doesn't write memory.
     */
    public @Nullable Integer getDestOperand() {
        return destOperand < 0 ? null : destOperand;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
