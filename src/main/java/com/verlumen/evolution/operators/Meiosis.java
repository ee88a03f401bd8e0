package com.verlumen.evolution.operators;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.evolution.genome.Chromosome;
import java.util.List;
import java.util.Random;

/**
 * Sexual reproduction of diploid parents: each parent's two chromosome sets are recombined into
 * haploid gametes, and maternal and paternal gametes fuse one-to-one into diploid children.
 */
public final class Meiosis {
  private final SimpleCrossover crossover;

  @Inject
  Meiosis(SimpleCrossover crossover) {
    this.crossover = crossover;
  }

  /** Produces {@code numberOfChildren} diploid genomes from two diploid parents. */
  public ImmutableList<ImmutableList<Chromosome>> reproduce(
      List<Chromosome> mother,
      List<Chromosome> father,
      int numberOfChildren,
      double pCrossover,
      Random random,
      OperatorCounts counts) {
    ImmutableList<ImmutableList<Chromosome>> maternalSets = split(mother);
    ImmutableList<ImmutableList<Chromosome>> paternalSets = split(father);
    ImmutableList<ImmutableList<Chromosome>> eggs =
        crossover.cross(
            maternalSets.get(0), maternalSets.get(1), numberOfChildren, pCrossover, random, counts);
    ImmutableList<ImmutableList<Chromosome>> sperms =
        crossover.cross(
            paternalSets.get(0), paternalSets.get(1), numberOfChildren, pCrossover, random, counts);
    return fertilize(eggs, sperms);
  }

  /** Splits a diploid genome into its two haploid chromosome sets. */
  static ImmutableList<ImmutableList<Chromosome>> split(List<Chromosome> diploid) {
    ImmutableList.Builder<Chromosome> first = ImmutableList.builder();
    ImmutableList.Builder<Chromosome> second = ImmutableList.builder();
    for (Chromosome chromosome : diploid) {
      checkArgument(chromosome.layers() == 2, "Meiosis needs diploid chromosomes");
      first.add(chromosome.layer(0));
      second.add(chromosome.layer(1));
    }
    return ImmutableList.of(first.build(), second.build());
  }

  /** Fuses the i-th maternal gamete with the i-th paternal gamete. */
  static ImmutableList<ImmutableList<Chromosome>> fertilize(
      List<? extends List<Chromosome>> maternal, List<? extends List<Chromosome>> paternal) {
    checkArgument(maternal.size() == paternal.size(), "Gamete counts differ");
    ImmutableList.Builder<ImmutableList<Chromosome>> children = ImmutableList.builder();
    for (int n = 0; n < maternal.size(); n++) {
      ImmutableList.Builder<Chromosome> child = ImmutableList.builder();
      for (int i = 0; i < maternal.get(n).size(); i++) {
        child.add(Chromosome.diploid(maternal.get(n).get(i), paternal.get(n).get(i)));
      }
      children.add(child.build());
    }
    return children.build();
  }
}
