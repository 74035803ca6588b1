package io.github.eutro.checkmerge.core.passes;

/**
 * A step of the pipeline, turning one form of the program into another:
 * class files into IR, or a function into something derived from it.
 * <p>
 * Passes are stateless and exposed as {@code INSTANCE} singletons, so they can be
 * stored and run on demand, as {@link io.github.eutro.checkmerge.core.ext.MetadataState} does.
 *
 * @param <A> What the pass reads.
 * @param <B> What it produces.
 */
@FunctionalInterface
public interface IRPass<A, B> {
    B run(A a);
}
