package com.verlumen.evolution.optimizer;

/** Creates optimizers with an evaluated initial population. */
public interface OptimizerFactory {
  /**
   * @throws ConfigurationException if {@code config} is inconsistent
   */
  <P> Optimizer<P> create(OptimizerConfig<P> config);
}
