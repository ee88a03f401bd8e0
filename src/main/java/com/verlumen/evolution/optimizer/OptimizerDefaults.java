package com.verlumen.evolution.optimizer;

/** Default values of the optimizer's configuration. */
public final class OptimizerDefaults {
  public static final double CROSSOVER_PROBABILITY = 0.6;
  public static final double MUTATION_PROBABILITY = 0.0333;
  public static final double INVERSION_PROBABILITY = 0.0;

  public static final double CONTINUOUS_CROSSOVER_PROBABILITY = 0.0;
  public static final double CONTINUOUS_MUTATION_PROBABILITY = 0.3;

  public static final double PMX_CROSSOVER_PROBABILITY = 0.9;
  public static final double PMX_MUTATION_PROBABILITY = 0.4;

  public static final double FITNESS_SCALE = 1.6;
  public static final double POPULATION_GROWTH = 1.0;
  public static final double OVERPOPULATION = 1.3;
  public static final int CHROMOSOME_SETS = 1;
  public static final int CHILDREN_PER_MATING = 2;
  public static final double FLOAT_SIGMA = 1.2;
  public static final double FLOAT_SIGMA_ADAPT = 0.85;

  /** Generations between two adaptations of the continuous mutation step. */
  public static final int FLOAT_SIGMA_ADAPT_INTERVAL = 5;

  private OptimizerDefaults() {
    throw new UnsupportedOperationException("Utility class");
  }
}
