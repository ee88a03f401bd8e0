package com.verlumen.evolution.evaluation;

import com.verlumen.evolution.decoding.Decoder;
import com.verlumen.evolution.genome.Genotype;
import java.util.List;

/** Assigns raw fitness to a batch of genotypes. */
public interface FitnessEvaluator {
  /**
   * Decodes every genotype of {@code pool}, evaluates the phenotype and stores the result as the
   * genotype's fitness. Returns only once every genotype has been evaluated.
   *
   * @throws com.verlumen.evolution.genome.InvalidFitnessException if the objective returns a
   *     negative or non-finite value
   */
  <P> void evaluate(List<Genotype> pool, Decoder<P> decoder, ObjectiveFunction<P> objective);
}
