package com.verlumen.evolution.optimizer;

/**
 * Observes an optimizer after every generation, including the initial one.
 *
 * <p>Implementations may adjust {@link Optimizer#tuning()} to steer the remaining run.
 */
@FunctionalInterface
public interface ProgressHook<P> {
  void onGeneration(Optimizer<P> optimizer);
}
