package com.verlumen.evolution.selection;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.evolution.genome.Genotype;
import java.util.List;

/**
 * Linear fitness scaling after Goldberg.
 *
 * <p>Fitness is mapped through {@code a * f + b} such that the mean stays put and the maximum
 * becomes {@code scale} times the mean. Where that would push the minimum below zero, the map is
 * flattened so that the minimum lands on zero instead.
 */
final class LinearFitnessScaler implements FitnessScaler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Inject
  LinearFitnessScaler() {}

  @Override
  public void scale(List<Genotype> population, double min, double mean, double max, double scale) {
    checkArgument(scale > 1, "Fitness scale must be greater than 1: %s", scale);
    if (max <= mean) {
      // Every individual has the same fitness; there is nothing to spread.
      logger.atFine().log("Uniform fitness %f, leaving scaled fitness unchanged", mean);
      population.forEach(individual -> individual.setScaledFitness(individual.fitness()));
      return;
    }

    double a;
    if (mean <= (max + min * (scale - 1)) / scale) {
      a = mean * (scale - 1) / (max - mean);
    } else {
      a = mean / (mean - min);
    }
    double b = mean * (1 - a);
    for (Genotype individual : population) {
      individual.setScaledFitness(Math.max(0, individual.fitness() * a + b));
    }
  }
}
