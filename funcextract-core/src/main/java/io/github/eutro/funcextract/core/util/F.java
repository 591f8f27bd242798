package io.github.eutro.funcextract.core.util;

/**
 * A one-argument function. Used instead of {@link java.util.function.Function},
 * whose name clashes with {@link io.github.eutro.funcextract.core.ir.Function}.
 *
 * @param <A> The argument type.
 * @param <B> The result type.
 */
@FunctionalInterface
public interface F<A, B> {
    B apply(A a);
}
