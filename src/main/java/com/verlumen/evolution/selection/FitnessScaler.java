package com.verlumen.evolution.selection;

import com.verlumen.evolution.genome.Genotype;
import java.util.List;

/** Remaps raw fitness into scaled fitness to steer selection pressure. */
public interface FitnessScaler {
  /**
   * Sets the scaled fitness of every individual.
   *
   * @param population evaluated individuals
   * @param min minimum raw fitness of {@code population}
   * @param mean mean raw fitness of {@code population}
   * @param max maximum raw fitness of {@code population}
   * @param scale target ratio between the scaled maximum and the scaled mean, greater than 1
   */
  void scale(List<Genotype> population, double min, double mean, double max, double scale);
}
