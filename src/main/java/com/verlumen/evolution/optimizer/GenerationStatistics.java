package com.verlumen.evolution.optimizer;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.math.Stats;
import com.verlumen.evolution.genome.Genotype;
import com.verlumen.evolution.operators.OperatorCounts;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Fitness distribution of one generation, measured before survivor selection, and the number of
 * genetic operations that produced it.
 */
@AutoValue
public abstract class GenerationStatistics {
  static GenerationStatistics create(
      List<Genotype> pool, OperatorCounts counts, OptionalDouble divorceRate) {
    checkArgument(!pool.isEmpty(), "Cannot compute statistics of an empty population");
    Stats stats = Stats.of(pool.stream().mapToDouble(Genotype::fitness).toArray());
    // Keep rounding noise from pushing the mean outside [min, max].
    double mean = Math.min(stats.max(), Math.max(stats.min(), stats.mean()));
    return new AutoValue_GenerationStatistics(
        mean,
        stats.populationVariance(),
        stats.min(),
        stats.max(),
        counts.crossovers(),
        counts.mutations(),
        counts.inversions(),
        divorceRate);
  }

  public abstract double mean();

  public abstract double variance();

  public abstract double min();

  public abstract double max();

  public abstract int crossovers();

  public abstract int mutations();

  public abstract int inversions();

  /**
   * Share of the population left without a partner when the last round of monogamous mating
   * ended. Present only with monogamous mating.
   */
  public abstract OptionalDouble divorceRate();
}
