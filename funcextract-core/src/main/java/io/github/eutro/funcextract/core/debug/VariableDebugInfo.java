package io.github.eutro.funcextract.core.debug;

import io.github.eutro.funcextract.core.ir.StorageLocation;
import io.github.eutro.funcextract.core.passes.CollectVariableDebugInfo;

import java.util.*;

/**
 * The variables that storage locations were declared as.
 * <p>
 * This is partial: locations the compiler emitted no declaration for are simply absent.
 *
 * @see CollectVariableDebugInfo
 */
public final class VariableDebugInfo {
    private final Map<StorageLocation, DIVariable> variables;

    public VariableDebugInfo(Map<? extends StorageLocation, ? extends DIVariable> variables) {
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /**
     * Look up the variable a location was declared as.
     *
     * @param location The location.
     * @return The variable, or empty if there is no record of it.
     */
    public Optional<DIVariable> lookup(StorageLocation location) {
        return Optional.ofNullable(variables.get(location));
    }

    public Set<StorageLocation> getLocations() {
        return variables.keySet();
    }

    public int size() {
        return variables.size();
    }
}
