package io.github.eutro.funcextract.core.passes;

import io.github.eutro.funcextract.core.debug.DIGlobalVariable;
import io.github.eutro.funcextract.core.debug.DILocalVariable;
import io.github.eutro.funcextract.core.debug.DIVariable;
import io.github.eutro.funcextract.core.debug.DebugExts;
import io.github.eutro.funcextract.core.debug.VariableDebugInfo;
import io.github.eutro.funcextract.core.ir.*;
import io.github.eutro.funcextract.core.ops.InsnKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects the source variable of every storage location visible in a function:
 * its stack slots, from their declarations, and the module's globals.
 */
public class CollectVariableDebugInfo implements IRPass<Function, VariableDebugInfo> {
    /**
     * A singleton instance of this pass.
     */
    public static final CollectVariableDebugInfo INSTANCE = new CollectVariableDebugInfo();

    @Override
    public VariableDebugInfo run(Function func) {
        Map<StorageLocation, DIVariable> vars = new LinkedHashMap<>();
        for (GlobalVariable global : func.getModule().getGlobals()) {
            DIGlobalVariable var = global.getNullable(DebugExts.GLOBAL_VARIABLE);
            if (var != null) vars.put(global, var);
        }
        for (BasicBlock block : func.getBlocks()) {
            for (Insn insn : block.getInsns()) {
                if (insn.getKind() != InsnKind.DECLARE || insn.getOperands().isEmpty()) continue;
                Value declared = insn.getOperand(0);
                DILocalVariable var = insn.getNullable(DebugExts.DECLARED_VARIABLE);
                if (var != null && declared instanceof StackSlot) {
                    // the first declaration wins
                    vars.putIfAbsent((StackSlot) declared, var);
                }
            }
        }
        return new VariableDebugInfo(vars);
    }
}
