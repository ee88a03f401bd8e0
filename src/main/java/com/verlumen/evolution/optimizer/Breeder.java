package com.verlumen.evolution.optimizer;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.evolution.genome.Chromosome;
import com.verlumen.evolution.genome.Encoding;
import com.verlumen.evolution.genome.GenomeLayout;
import com.verlumen.evolution.genome.Genotype;
import com.verlumen.evolution.operators.Inverter;
import com.verlumen.evolution.operators.Meiosis;
import com.verlumen.evolution.operators.OperatorCounts;
import com.verlumen.evolution.operators.PartiallyMatchedCrossover;
import com.verlumen.evolution.operators.PointMutator;
import com.verlumen.evolution.operators.SimpleCrossover;
import java.util.Random;

/** Produces the mutated offspring of one mating. */
final class Breeder {
  private final SimpleCrossover simpleCrossover;
  private final PartiallyMatchedCrossover partiallyMatchedCrossover;
  private final Meiosis meiosis;
  private final PointMutator mutator;
  private final Inverter inverter;

  @Inject
  Breeder(
      SimpleCrossover simpleCrossover,
      PartiallyMatchedCrossover partiallyMatchedCrossover,
      Meiosis meiosis,
      PointMutator mutator,
      Inverter inverter) {
    this.simpleCrossover = simpleCrossover;
    this.partiallyMatchedCrossover = partiallyMatchedCrossover;
    this.meiosis = meiosis;
    this.mutator = mutator;
    this.inverter = inverter;
  }

  /**
   * Recombines two parents with the operator matching their layout, then mutates and inverts every
   * child.
   */
  ImmutableList<Genotype> breed(
      Genotype mother,
      Genotype father,
      int childrenPerMating,
      TuningParameters tuning,
      Random random,
      OperatorCounts counts) {
    GenomeLayout layout = mother.layout();
    double crossoverProbability = tuning.crossoverProbability();
    ImmutableList<ImmutableList<Chromosome>> genomes;
    if (layout.encoding() == Encoding.PERMUTATION) {
      genomes =
          partiallyMatchedCrossover.cross(
              mother.genome(), father.genome(), crossoverProbability, random, counts);
    } else if (mother.isHaploid()) {
      genomes =
          simpleCrossover.cross(
              mother.genome(),
              father.genome(),
              childrenPerMating,
              crossoverProbability,
              random,
              counts);
    } else {
      genomes =
          meiosis.reproduce(
              mother.genome(),
              father.genome(),
              childrenPerMating,
              crossoverProbability,
              random,
              counts);
    }

    ImmutableList.Builder<Genotype> children = ImmutableList.builder();
    for (ImmutableList<Chromosome> genome : genomes) {
      mutator.mutate(
          genome, layout, tuning.mutationProbability(), tuning.floatSigma(), random, counts);
      inverter.invert(genome, tuning.inversionProbability(), random, counts);
      children.add(Genotype.of(layout, genome));
    }
    return children.build();
  }
}
