package io.github.eutro.funcextract.core.analysis;

import io.github.eutro.funcextract.core.ir.StorageLocation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The storage locations that cross a region's boundary.
 * <p>
 * The input and output sets are derived independently, so a location may be in both.
 * Locations without debug information can't be classified and are listed as unknown instead.
 */
public final class ClassificationResult {
    private final Set<StorageLocation> inputs;
    private final Set<StorageLocation> outputs;
    private final Set<StorageLocation> unknown;
    private final List<Diagnostic> diagnostics;

    public ClassificationResult(Set<StorageLocation> inputs,
                                Set<StorageLocation> outputs,
                                Set<StorageLocation> unknown,
                                List<Diagnostic> diagnostics) {
        this.inputs = Collections.unmodifiableSet(new LinkedHashSet<>(inputs));
        this.outputs = Collections.unmodifiableSet(new LinkedHashSet<>(outputs));
        this.unknown = Collections.unmodifiableSet(new LinkedHashSet<>(unknown));
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    /**
     * Get the locations the region reads that were set up before it.
     *
     * @return The inputs.
     */
    public Set<StorageLocation> getInputs() {
        return inputs;
    }

    /**
     * Get the locations declared in the region that it writes, and that are used after it.
     *
     * @return The outputs.
     */
    public Set<StorageLocation> getOutputs() {
        return outputs;
    }

    public Set<StorageLocation> getUnknown() {
        return unknown;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return "inputs=" + inputs + ", outputs=" + outputs + ", unknown=" + unknown;
    }
}
