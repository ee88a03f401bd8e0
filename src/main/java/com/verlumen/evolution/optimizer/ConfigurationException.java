package com.verlumen.evolution.optimizer;

/** Thrown when an {@link OptimizerConfig} describes an optimizer that cannot be built. */
public final class ConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  ConfigurationException(String message) {
    super(message);
  }
}
