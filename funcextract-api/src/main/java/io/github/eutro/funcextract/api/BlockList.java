package io.github.eutro.funcextract.api;

import io.github.eutro.funcextract.core.analysis.BlockSetMatcher;
import io.github.eutro.funcextract.core.analysis.Diagnostic;

import java.util.*;

/**
 * The regions a user asked for: for each function, the names of the blocks of its target region.
 *
 * @see BlockListReader
 */
public final class BlockList {
    private final Map<String, Set<String>> entries = new LinkedHashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Add a function entry, with no blocks. If the function already has an entry, nothing changes.
     *
     * @param function The function name.
     * @return This, for convenience.
     */
    public BlockList addFunction(String function) {
        entries.computeIfAbsent(function, $ -> new LinkedHashSet<>());
        return this;
    }

    /**
     * Add a block to a function's entry, adding the entry if it doesn't exist.
     *
     * @param function The function name.
     * @param block    The block name.
     * @return This, for convenience.
     */
    public BlockList addBlock(String function, String block) {
        entries.computeIfAbsent(function, $ -> new LinkedHashSet<>()).add(block);
        return this;
    }

    void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public Set<String> getFunctions() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public boolean hasFunction(String function) {
        return entries.containsKey(function);
    }

    /**
     * Get the blocks listed for a function.
     *
     * @param function The function name.
     * @return The block names, in the order they were listed, or an empty set if the function isn't listed.
     */
    public Set<String> getBlocks(String function) {
        Set<String> blocks = entries.get(function);
        return blocks == null ? Collections.emptySet() : Collections.unmodifiableSet(blocks);
    }

    /**
     * Get the problems found while reading this list.
     *
     * @return The diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Create a matcher accepting exactly the regions in this list.
     *
     * @return The matcher.
     */
    public BlockSetMatcher toMatcher() {
        return new BlockSetMatcher(entries);
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
