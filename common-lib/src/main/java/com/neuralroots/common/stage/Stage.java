package com.neuralroots.common.stage;

/**
 * Contract shared by every analysis stage: typed input in, typed result out.
 *
 * <p>Implementations must be stateless and safe to call concurrently. Any collaborator
 * they read from is injected at construction time.
 *
 * @param <I> stage input
 * @param <R> stage result
 */
public interface Stage<I, R> {

    R evaluate(I input);

    String stageName();
}
