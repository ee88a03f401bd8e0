package com.verlumen.evolution.selection;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Collections;
import java.util.HashSet;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Tracks which individuals have already found a partner during one generation.
 *
 * <p>Without monogamy the exclusion only lasts for one pairing, so nobody mates with itself. With
 * monogamy both partners stay excluded until the whole population is paired up; then everybody
 * divorces and the divorce rate is recorded.
 */
public final class MatingPool {
  private final int populationSize;
  private final boolean monogamous;
  private final Set<Integer> consumed = new HashSet<>();
  private double divorceRate;

  public MatingPool(int populationSize, boolean monogamous) {
    checkArgument(populationSize > 0, "Population size must be positive: %s", populationSize);
    this.populationSize = populationSize;
    this.monogamous = monogamous;
  }

  /** Indices currently excluded from being selected. */
  public Set<Integer> excluded() {
    return Collections.unmodifiableSet(consumed);
  }

  /** Records the first partner of a new pair. */
  public void addFirstPartner(int index) {
    consumed.add(index);
    if (consumed.size() >= populationSize) {
      consumed.clear();
    }
  }

  /** Records the second partner of a pair, completing the pairing. */
  public void completePair(int index) {
    if (!monogamous) {
      consumed.clear();
      return;
    }
    consumed.add(index);
    if (consumed.size() >= populationSize) {
      divorceRate = (double) (populationSize - consumed.size()) / populationSize;
      consumed.clear();
    }
  }

  /** The divorce rate of the last complete divorce; empty unless mating is monogamous. */
  public OptionalDouble divorceRate() {
    return monogamous ? OptionalDouble.of(divorceRate) : OptionalDouble.empty();
  }
}
