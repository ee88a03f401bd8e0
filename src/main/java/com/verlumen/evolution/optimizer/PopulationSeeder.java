package com.verlumen.evolution.optimizer;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.evolution.genome.Chromosome;
import com.verlumen.evolution.genome.Encoding;
import com.verlumen.evolution.genome.GenomeLayout;
import com.verlumen.evolution.genome.Genotype;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Creates the initial population. */
final class PopulationSeeder {
  @Inject
  PopulationSeeder() {}

  /**
   * Returns {@code size} random genotypes.
   *
   * <p>For discrete, non-character alphabets smaller than the population, the first individuals
   * are replaced by uniform genomes, one per symbol, so that every symbol occurs at every locus.
   */
  ImmutableList<Genotype> seed(GenomeLayout layout, int size, Random random) {
    List<Genotype> population = new ArrayList<>(size);
    for (int n = 0; n < size; n++) {
      population.add(Genotype.random(layout, random));
    }
    if (layout.encoding() == Encoding.DISCRETE
        && !layout.alphabet().isCharacterAlphabet()
        && size > layout.alphabet().size()) {
      for (int k = 0; k < layout.alphabet().size(); k++) {
        population.set(k, uniformGenotype(layout, k));
      }
    }
    return ImmutableList.copyOf(population);
  }

  private static Genotype uniformGenotype(GenomeLayout layout, int symbolIndex) {
    ImmutableList.Builder<Chromosome> genome = ImmutableList.builder();
    for (int length : layout.chromosomeLengths()) {
      Chromosome chromosome = Chromosome.create(length, layout.ploidy().layers());
      for (int k = 0; k < chromosome.layers(); k++) {
        for (int j = 0; j < length; j++) {
          chromosome.set(k, j, symbolIndex);
        }
      }
      genome.add(chromosome);
    }
    return Genotype.of(layout, genome.build());
  }
}
