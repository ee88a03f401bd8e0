package com.verlumen.evolution.operators;

import com.google.inject.Inject;
import com.verlumen.evolution.genome.Chromosome;
import com.verlumen.evolution.genome.Encoding;
import com.verlumen.evolution.genome.GenomeLayout;
import java.util.List;
import java.util.Random;

/**
 * Per-gene mutation.
 *
 * <p>Every allele mutates with probability {@code pMutation}. What a mutation does depends on the
 * encoding:
 *
 * <ul>
 *   <li>continuous: adds a normally distributed offset with standard deviation {@code floatSigma},
 *       clamped to [0, 1];
 *   <li>permutation: swaps the allele with one at a random position of the same chromosome. Each
 *       swap touches two genes, so the probability is halved and each swap counts twice;
 *   <li>two-symbol alphabet: flips to the other symbol;
 *   <li>larger alphabets: picks one of the other symbols uniformly.
 * </ul>
 */
public final class PointMutator {
  @Inject
  PointMutator() {}

  /** Mutates {@code genome} in place. */
  public void mutate(
      List<Chromosome> genome,
      GenomeLayout layout,
      double pMutation,
      double floatSigma,
      Random random,
      OperatorCounts counts) {
    if (pMutation == 0) {
      return;
    }
    double threshold = pMutation;
    int increment = 1;
    if (layout.encoding() == Encoding.PERMUTATION) {
      threshold /= 2;
      increment = 2;
    }

    for (Chromosome chromosome : genome) {
      for (int j = 0; j < chromosome.length(); j++) {
        for (int k = 0; k < chromosome.layers(); k++) {
          if (random.nextDouble() < threshold) {
            mutateAllele(chromosome, k, j, layout, floatSigma, random);
            counts.recordMutations(increment);
          }
        }
      }
    }
  }

  private static void mutateAllele(
      Chromosome chromosome,
      int layer,
      int locus,
      GenomeLayout layout,
      double floatSigma,
      Random random) {
    switch (layout.encoding()) {
      case PERMUTATION:
        chromosome.swap(layer, locus, random.nextInt(chromosome.length()));
        break;
      case CONTINUOUS:
        double value = chromosome.get(layer, locus) + random.nextGaussian() * floatSigma;
        chromosome.set(layer, locus, Math.min(1.0, Math.max(0.0, value)));
        break;
      case DISCRETE:
        int size = layout.alphabet().size();
        int current = chromosome.index(layer, locus);
        if (size == 2) {
          chromosome.set(layer, locus, 1 - current);
        } else {
          int replacement = random.nextInt(size - 1);
          if (replacement >= current) {
            replacement++;
          }
          chromosome.set(layer, locus, replacement);
        }
        break;
    }
  }
}
