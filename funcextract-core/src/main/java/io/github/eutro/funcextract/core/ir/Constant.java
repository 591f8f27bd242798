package io.github.eutro.funcextract.core.ir;

/**
 * A constant operand. Its name is its literal text.
 */
public final class Constant extends Value {
    Constant(Module module, String text) {
        super(module, text);
    }

    @Override
    public String toString() {
        return getName();
    }
}
