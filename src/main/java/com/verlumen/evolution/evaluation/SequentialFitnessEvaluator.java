package com.verlumen.evolution.evaluation;

import com.google.inject.Inject;
import com.verlumen.evolution.decoding.Decoder;
import com.verlumen.evolution.genome.Genotype;
import java.util.List;

/** Evaluates genotypes one after the other on the calling thread. */
public final class SequentialFitnessEvaluator implements FitnessEvaluator {
  @Inject
  SequentialFitnessEvaluator() {}

  @Override
  public <P> void evaluate(
      List<Genotype> pool, Decoder<P> decoder, ObjectiveFunction<P> objective) {
    for (Genotype genotype : pool) {
      genotype.setFitness(objective.evaluate(decoder.decode(genotype)));
    }
  }
}
