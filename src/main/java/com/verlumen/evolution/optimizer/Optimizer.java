package com.verlumen.evolution.optimizer;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.decoding.Decoder;
import com.verlumen.evolution.evaluation.ObjectiveFunction;
import com.verlumen.evolution.genome.Genotype;

/**
 * A genetic algorithm maximizing an objective function over a population of genotypes.
 *
 * <p>An optimizer starts out with an evaluated initial population, generation 0. Every call to
 * {@link #run} advances it by a number of generations; runs can be resumed.
 *
 * @param <P> the phenotype genotypes are decoded into
 */
public interface Optimizer<P> {
  /** Advances the population by {@code generations} generations. */
  void run(int generations);

  /**
   * Advances the population by at most {@code generations} generations, stopping after the first
   * generation whose best fitness reaches {@code maxFitness}.
   */
  void run(int generations, double maxFitness);

  ObjectiveFunction<P> objectiveFunction();

  Decoder<P> decoder();

  /** Statistics of every generation so far, indexed by generation number. */
  ImmutableList<GenerationStatistics> statistics();

  /** Number of the current generation; 0 for the initial population. */
  int generation();

  ImmutableList<Genotype> population();

  /** Size the population will have after the current generation's selection. */
  int populationSize();

  boolean isPmx();

  /** The fittest individual of the current population; the first one among equals. */
  BestFit<P> bestFit();

  /** Parameters that may be changed between generations. */
  TuningParameters tuning();
}
