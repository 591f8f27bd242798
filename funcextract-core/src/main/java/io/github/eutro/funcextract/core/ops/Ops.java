package io.github.eutro.funcextract.core.ops;

/**
 * The operations the analyses recognise.
 */
public class Ops {
    public static final Op LOAD = new Op("load", InsnKind.READ, -1);
    public static final Op STORE = new Op("store", InsnKind.WRITE, 1);
    public static final Op MEMCPY = new Op("memcpy", InsnKind.BLOCK_COPY, 0);
    public static final Op ALLOCA = new Op("alloca", InsnKind.ALLOCATE, -1);
    public static final Op DBG_DECLARE = new Op("dbg.declare", InsnKind.DECLARE, -1);

    public static final Op BR = new Op("br", InsnKind.TERMINATOR, -1);
    public static final Op SWITCH = new Op("switch", InsnKind.TERMINATOR, -1);
    public static final Op RET = new Op("ret", InsnKind.TERMINATOR, -1);
    public static final Op UNREACHABLE = new Op("unreachable", InsnKind.TERMINATOR, -1);

    public static final Op GEP = Op.other("getelementptr");
    public static final Op BITCAST = Op.other("bitcast");
    public static final Op PHI = Op.other("phi");
    public static final Op CALL = Op.other("call");
    public static final Op ADD = Op.other("add");
    public static final Op MUL = Op.other("mul");
    public static final Op ICMP = Op.other("icmp");
}
