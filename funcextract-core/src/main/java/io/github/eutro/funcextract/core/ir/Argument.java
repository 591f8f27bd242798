package io.github.eutro.funcextract.core.ir;

/**
 * A formal argument of a {@link Function}.
 */
public final class Argument extends Value {
    private final Function function;
    private final int index;

    Argument(Function function, int index, String name) {
        super(function.getModule(), name);
        this.function = function;
        this.index = index;
    }

    public Function getFunction() {
        return function;
    }

    public int getIndex() {
        return index;
    }
}
