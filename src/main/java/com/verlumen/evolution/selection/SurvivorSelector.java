package com.verlumen.evolution.selection;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.genome.Genotype;
import java.util.List;
import java.util.Random;

/** Reduces an over-populated generation to its target size. */
public interface SurvivorSelector {
  /**
   * @param pool evaluated offspring
   * @param targetSize number of survivors
   * @param random the optimizer's source of randomness
   * @return the survivors
   */
  ImmutableList<Genotype> select(List<Genotype> pool, int targetSize, Random random);
}
