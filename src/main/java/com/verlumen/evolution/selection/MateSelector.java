package com.verlumen.evolution.selection;

import com.verlumen.evolution.genome.Genotype;
import java.util.List;
import java.util.Random;
import java.util.Set;

/** Picks mating partners from a population. */
public interface MateSelector {
  /**
   * Selects one individual.
   *
   * @param population the current population; every member must have a scaled fitness
   * @param excluded indices that must not be selected
   * @param random the optimizer's source of randomness
   * @return the index of the selected individual
   * @throws IllegalStateException if every individual is excluded
   */
  int select(List<Genotype> population, Set<Integer> excluded, Random random);
}
