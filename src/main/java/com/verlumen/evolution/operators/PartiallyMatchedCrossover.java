package com.verlumen.evolution.operators;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.evolution.genome.Chromosome;
import java.util.List;
import java.util.Random;

/**
 * Partially matched crossover (PMX) for genomes whose chromosomes are permutations.
 *
 * <p>A random section is exchanged between the two parents; every allele that the exchange would
 * duplicate is swapped into the position vacated by the incoming one, so each child stays a
 * permutation of the alphabet.
 */
public final class PartiallyMatchedCrossover {
  @Inject
  PartiallyMatchedCrossover() {}

  /** Produces exactly two children from two permutation genomes. */
  public ImmutableList<ImmutableList<Chromosome>> cross(
      List<Chromosome> first,
      List<Chromosome> second,
      double pCrossover,
      Random random,
      OperatorCounts counts) {
    checkArgument(first.size() == second.size(), "Parents must have the same chromosome count");
    ImmutableList.Builder<Chromosome> child = ImmutableList.builder();
    ImmutableList.Builder<Chromosome> sibling = ImmutableList.builder();
    for (int i = 0; i < first.size(); i++) {
      Chromosome a = first.get(i).copy();
      Chromosome b = second.get(i).copy();
      checkArgument(a.length() == b.length(), "Chromosome %s lengths differ", i);
      if (random.nextDouble() < pCrossover) {
        int low = random.nextInt(a.length());
        int high = random.nextInt(a.length());
        exchange(a, b, Math.min(low, high), Math.max(low, high));
        counts.recordCrossover();
      }
      child.add(a);
      sibling.add(b);
    }
    return ImmutableList.of(child.build(), sibling.build());
  }

  /** Exchanges the section {@code [low, high]} between {@code a} and {@code b} in place. */
  static void exchange(Chromosome a, Chromosome b, int low, int high) {
    for (int j = low; j <= high; j++) {
      double alleleA = a.get(0, j);
      double alleleB = b.get(0, j);
      int duplicateInA = a.find(0, alleleB);
      int duplicateInB = b.find(0, alleleA);
      a.set(0, j, alleleB);
      b.set(0, j, alleleA);
      a.set(0, duplicateInA, alleleA);
      b.set(0, duplicateInB, alleleB);
    }
  }
}
