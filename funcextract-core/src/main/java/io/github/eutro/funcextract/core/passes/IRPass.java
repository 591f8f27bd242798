package io.github.eutro.funcextract.core.passes;

import io.github.eutro.funcextract.core.ir.Function;
import io.github.eutro.funcextract.core.ir.Region;

/**
 * A pass to run on some part of the IR (e.g. a {@link Function} or {@link Region}),
 * computing something from it.
 * <p>
 * Passes in this code base never modify the IR they are run on.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
@FunctionalInterface
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @param <C>  The result type.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return a -> next.run(run(a));
    }
}
