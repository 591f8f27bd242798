/**
 * Metadata attachment.
 * <p>
 * IR objects are {@link io.github.eutro.funcextract.core.ext.ExtHolder}s, and metadata is attached to them
 * under {@link io.github.eutro.funcextract.core.ext.Ext} keys:
 * <pre>{@code
 * insn.attachExt(DebugExts.LINE, 12);
 * Integer line = insn.getNullable(DebugExts.LINE); // null if the instruction has no location
 * }</pre>
 * Source lines, subprograms and declared variables are all attached this way
 * (see {@link io.github.eutro.funcextract.core.debug.DebugExts}),
 * so IR without debug information needs no placeholder fields.
 */
package io.github.eutro.funcextract.core.ext;
