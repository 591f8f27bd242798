package io.github.eutro.funcextract.core.analysis;

import io.github.eutro.funcextract.core.ir.*;
import io.github.eutro.funcextract.core.passes.IRPass;
import io.github.eutro.funcextract.core.util.GraphWalker;

import java.util.*;

/**
 * Finds the storage locations an instruction ultimately depends on, by walking its operands depth-first.
 * <p>
 * The walk recurses through instruction operands, and stops at stack slots and globals, which
 * are collected. Arguments and constants end the walk and are discarded. Each value is visited once,
 * so shared subexpressions and phi cycles are walked only once.
 * <p>
 * Results are ordered by {@link Value#getId() value id}.
 */
public class OperandDependencyResolver implements IRPass<Insn, Set<StorageLocation>> {
    /**
     * A singleton instance of this resolver.
     */
    public static final OperandDependencyResolver INSTANCE = new OperandDependencyResolver();

    private static final Comparator<StorageLocation> BY_ID = Comparator.comparingInt(it -> it.asValue().getId());

    /**
     * Get every storage location the instruction depends on through any of its operands.
     *
     * @param insn The instruction.
     * @return The locations.
     */
    @Override
    public Set<StorageLocation> run(Insn insn) {
        return walk(insn);
    }

    /**
     * Get the storage locations that one operand of an instruction depends on.
     *
     * @param insn  The instruction.
     * @param index The operand index.
     * @return The locations.
     */
    public Set<StorageLocation> resolveOperand(Insn insn, int index) {
        return walk(insn.getOperand(index));
    }

    /**
     * Get the storage locations a write or block copy writes to: those its destination operand depends on.
     *
     * @param insn The instruction.
     * @return The locations, empty if the instruction doesn't write memory.
     */
    public Set<StorageLocation> resolveWritten(Insn insn) {
        Integer dest = insn.getOp().getDestOperand();
        if (dest == null || dest >= insn.getOperands().size()) return Collections.emptySet();
        return resolveOperand(insn, dest);
    }

    private static Set<StorageLocation> walk(Value root) {
        List<StorageLocation> found = new ArrayList<>();
        for (Value value : new GraphWalker<Value>(root, OperandDependencyResolver::dependencies).walk()) {
            if (value instanceof StorageLocation) {
                found.add((StorageLocation) value);
            }
        }
        found.sort(BY_ID);
        return Collections.unmodifiableSet(new LinkedHashSet<>(found));
    }

    private static List<Value> dependencies(Value value) {
        if (value instanceof Insn && !(value instanceof StorageLocation)) {
            return ((Insn) value).getOperands();
        }
        return Collections.emptyList();
    }
}
