package io.github.eutro.funcextract.core.analysis;

import io.github.eutro.funcextract.core.ir.BasicBlock;
import io.github.eutro.funcextract.core.ir.Region;

import java.util.*;

/**
 * Decides whether a region is one of the regions the user asked for, given the expected
 * block names for each function.
 * <p>
 * A region matches only if its block set is exactly the expected set for its function:
 * neither a subset nor a superset.
 */
public final class BlockSetMatcher {
    private final Map<String, Set<String>> expected;

    /**
     * Construct a matcher.
     *
     * @param expected The expected block names, by function name.
     */
    public BlockSetMatcher(Map<String, ? extends Collection<String>> expected) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        expected.forEach((func, blocks) -> copy.put(func, Collections.unmodifiableSet(new HashSet<>(blocks))));
        this.expected = Collections.unmodifiableMap(copy);
    }

    public boolean matches(Region region) {
        Set<String> blocks = expected.get(region.getFunction().getName());
        if (blocks == null) return false;
        // block names are unique in a function, so equal sizes and containment means equal sets
        if (region.getBlocks().size() != blocks.size()) return false;
        for (BasicBlock block : region.getBlocks()) {
            if (!blocks.contains(block.getName())) return false;
        }
        return true;
    }
}
