package com.verlumen.evolution.selection;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.evolution.genome.Genotype;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Truncation selection on raw fitness. The survivors are shuffled so that their order carries no
 * information into the next round of mate selection.
 */
final class FittestSurvivorSelector implements SurvivorSelector {
  @Inject
  FittestSurvivorSelector() {}

  @Override
  public ImmutableList<Genotype> select(List<Genotype> pool, int targetSize, Random random) {
    checkArgument(targetSize > 0, "Target population size must be positive: %s", targetSize);
    if (pool.size() == targetSize) {
      return ImmutableList.copyOf(pool);
    }
    List<Genotype> ranked = new ArrayList<>(pool);
    // Stable sort: among equally fit individuals the earlier one wins.
    ranked.sort(Comparator.comparingDouble(Genotype::fitness).reversed());
    List<Genotype> survivors =
        new ArrayList<>(ranked.subList(0, Math.min(targetSize, ranked.size())));
    Collections.shuffle(survivors, random);
    return ImmutableList.copyOf(survivors);
  }
}
