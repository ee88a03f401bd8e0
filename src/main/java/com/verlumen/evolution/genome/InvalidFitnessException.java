package com.verlumen.evolution.genome;

/** Thrown when a fitness value is negative or not a finite number. */
public final class InvalidFitnessException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  InvalidFitnessException(String kind, double value) {
    super(
        String.format(
            "%s must be a finite value greater than or equal to 0, not %s", kind, value));
  }
}
