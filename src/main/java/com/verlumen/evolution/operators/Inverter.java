package com.verlumen.evolution.operators;

import com.google.inject.Inject;
import com.verlumen.evolution.genome.Chromosome;
import java.util.List;
import java.util.Random;

/** Reverses random sections of chromosomes. */
public final class Inverter {
  @Inject
  Inverter() {}

  /**
   * With probability {@code pInversion} per chromosome and layer, reverses the genes between two
   * random positions (inclusive) of {@code genome}, in place.
   */
  public void invert(
      List<Chromosome> genome, double pInversion, Random random, OperatorCounts counts) {
    if (pInversion == 0) {
      return;
    }
    for (Chromosome chromosome : genome) {
      for (int k = 0; k < chromosome.layers(); k++) {
        if (random.nextDouble() < pInversion) {
          int first = random.nextInt(chromosome.length());
          int second = random.nextInt(chromosome.length());
          chromosome.reverse(k, Math.min(first, second), Math.max(first, second));
          counts.recordInversion();
        }
      }
    }
  }
}
