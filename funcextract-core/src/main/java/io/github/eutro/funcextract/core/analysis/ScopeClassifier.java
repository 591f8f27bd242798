package io.github.eutro.funcextract.core.analysis;

import io.github.eutro.funcextract.core.debug.DIVariable;
import io.github.eutro.funcextract.core.debug.LineBounds;
import io.github.eutro.funcextract.core.debug.VariableDebugInfo;
import io.github.eutro.funcextract.core.ir.*;

import java.util.*;

/**
 * Labels the storage locations touched by a region as inputs, outputs, or neither.
 * <p>
 * For every read, write and block copy in the region, the locations it depends on are found with
 * the {@link OperandDependencyResolver}. Then:
 * <ul>
 *     <li>A location is an <b>input</b> if it is defined in a predecessor block, and was declared
 *     outside the region's lines.</li>
 *     <li>A location is an <b>output</b> if the region writes to it (through the destination of a
 *     write or block copy), it was declared inside the region's lines, and it has a user in a
 *     successor block.</li>
 * </ul>
 * Each rule is evaluated at most once per location, so the result doesn't depend on the order
 * the region's instructions are visited in. All memoisation is local to one {@link #classify} call.
 * <p>
 * Locations with no debug record can't be tested against the region's lines, so they are
 * reported as unknown, with a {@link Diagnostic.Kind#MISSING_DEBUG_INFO diagnostic}.
 */
public final class ScopeClassifier {
    private final VariableDebugInfo debugInfo;
    private final OperandDependencyResolver resolver;

    public ScopeClassifier(VariableDebugInfo debugInfo) {
        this(debugInfo, OperandDependencyResolver.INSTANCE);
    }

    public ScopeClassifier(VariableDebugInfo debugInfo, OperandDependencyResolver resolver) {
        this.debugInfo = debugInfo;
        this.resolver = resolver;
    }

    /**
     * Classify the locations touched by a region.
     *
     * @param region       The region.
     * @param predecessors The blocks before the region.
     * @param successors   The blocks after the region.
     * @param regionBounds The lines the region spans.
     * @return The classification.
     */
    public ClassificationResult classify(Region region,
                                         BlockSet predecessors,
                                         BlockSet successors,
                                         LineBounds regionBounds) {
        Set<StorageLocation> inputs = new LinkedHashSet<>();
        Set<StorageLocation> outputs = new LinkedHashSet<>();
        Set<StorageLocation> unknown = new LinkedHashSet<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        Set<StorageLocation> inputChecked = new HashSet<>();
        Set<StorageLocation> outputChecked = new HashSet<>();

        for (BasicBlock block : region.getBlocks()) {
            for (Insn insn : block.getInsns()) {
                if (!insn.getKind().touchesMemory()) continue;
                Set<StorageLocation> written = insn.getKind().writesMemory()
                        ? resolver.resolveWritten(insn)
                        : Collections.emptySet();
                for (StorageLocation origin : resolver.run(insn)) {
                    boolean checkInput = inputChecked.add(origin);
                    boolean checkOutput = written.contains(origin) && outputChecked.add(origin);
                    if (!checkInput && !checkOutput) continue;

                    Optional<DIVariable> var = debugInfo.lookup(origin);
                    if (!var.isPresent()) {
                        if (unknown.add(origin)) {
                            diagnostics.add(new Diagnostic(Diagnostic.Kind.MISSING_DEBUG_INFO,
                                    "No debug info for variable " + origin.asValue()
                                            + " in " + region.getFunction().getName()));
                        }
                        continue;
                    }

                    boolean declaredInRegion = regionBounds.contains(var.get().getLine());
                    if (checkInput
                            && predecessors.contains(origin.getDefiningBlock())
                            && !declaredInRegion) {
                        inputs.add(origin);
                    }
                    if (checkOutput
                            && declaredInRegion
                            && hasUserIn(origin, successors)) {
                        outputs.add(origin);
                    }
                }
            }
        }
        return new ClassificationResult(inputs, outputs, unknown, diagnostics);
    }

    private static boolean hasUserIn(StorageLocation origin, BlockSet blocks) {
        for (Insn user : origin.getUsers()) {
            if (blocks.contains(user.getBlock())) return true;
        }
        return false;
    }
}
