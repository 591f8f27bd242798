package io.github.eutro.funcextract.core.debug;

import io.github.eutro.funcextract.core.ext.Ext;
import io.github.eutro.funcextract.core.ir.*;
import io.github.eutro.funcextract.core.ops.Ops;

/**
 * {@link Ext}s carrying debug information.
 */
public class DebugExts {
    /**
     * Attached to an {@link Insn}. The source line of its debug location.
     */
    public static final Ext<Integer> LINE = Ext.create(Integer.class, "LINE");
    /**
     * Attached to a {@link Function}. Its subprogram descriptor.
     */
    public static final Ext<DISubprogram> SUBPROGRAM = Ext.create(DISubprogram.class, "SUBPROGRAM");
    /**
     * Attached to a {@link Ops#DBG_DECLARE declaration}. The variable the declared slot holds.
     */
    public static final Ext<DILocalVariable> DECLARED_VARIABLE = Ext.create(DILocalVariable.class, "DECLARED_VARIABLE");
    /**
     * Attached to a {@link GlobalVariable}. Its variable descriptor.
     */
    public static final Ext<DIGlobalVariable> GLOBAL_VARIABLE = Ext.create(DIGlobalVariable.class, "GLOBAL_VARIABLE");
}
