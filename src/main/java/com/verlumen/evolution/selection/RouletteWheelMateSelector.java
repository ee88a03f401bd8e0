package com.verlumen.evolution.selection;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.evolution.genome.Genotype;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Fitness-proportionate selection: the chance of an eligible individual being picked is its share
 * of the total scaled fitness of all eligible individuals.
 */
final class RouletteWheelMateSelector implements MateSelector {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Inject
  RouletteWheelMateSelector() {}

  @Override
  public int select(List<Genotype> population, Set<Integer> excluded, Random random) {
    double fitnessSum = 0.0;
    int lastEligible = -1;
    for (int i = 0; i < population.size(); i++) {
      if (!excluded.contains(i)) {
        fitnessSum += population.get(i).scaledFitness();
        lastEligible = i;
      }
    }
    checkState(lastEligible >= 0, "Every individual of the population is excluded from mating");
    if (fitnessSum == 0) {
      logger.atWarning().atMostEvery(10, TimeUnit.SECONDS).log(
          "Eligible individuals have zero total fitness, picking the first one");
    }

    double limit = random.nextDouble() * fitnessSum;
    double partialSum = 0.0;
    for (int i = 0; i < population.size(); i++) {
      if (excluded.contains(i)) {
        continue;
      }
      partialSum += population.get(i).scaledFitness();
      if (partialSum >= limit) {
        return i;
      }
    }
    // Rounding kept the running sum below the limit.
    return lastEligible;
  }
}
