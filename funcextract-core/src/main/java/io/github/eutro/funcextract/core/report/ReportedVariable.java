package io.github.eutro.funcextract.core.report;

import io.github.eutro.funcextract.core.ir.StorageLocation;

/**
 * A classified variable, as it appears in a report.
 */
public final class ReportedVariable {
    private final StorageLocation location;
    private final String name;
    private final int declarationLine;
    private final boolean output;
    private final int indirection;
    private final String type;

    public ReportedVariable(StorageLocation location,
                            String name,
                            int declarationLine,
                            boolean output,
                            int indirection,
                            String type) {
        this.location = location;
        this.name = name;
        this.declarationLine = declarationLine;
        this.output = output;
        this.indirection = indirection;
        this.type = type;
    }

    public StorageLocation getLocation() {
        return location;
    }

    /**
     * Get the source name of the variable.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    public int getDeclarationLine() {
        return declarationLine;
    }

    /**
     * Get whether this is an output, rather than an input, of the region.
     *
     * @return Whether this is an output.
     */
    public boolean isOutput() {
        return output;
    }

    /**
     * Get the number of pointer or array levels of the variable's type.
     *
     * @return The indirection count.
     */
    public int getIndirection() {
        return indirection;
    }

    /**
     * Get the variable's type, with its pointers and arrays unwrapped.
     *
     * @return The rendered type.
     */
    public String getType() {
        return type;
    }

    @Override
    public String toString() {
        return (output ? "out " : "in ") + type + " " + "*".repeat(indirection) + name;
    }
}
