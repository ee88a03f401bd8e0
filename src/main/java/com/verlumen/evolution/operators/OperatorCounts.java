package com.verlumen.evolution.operators;

/**
 * Tallies the genetic operations applied while producing one generation.
 *
 * <p>Not thread-safe; offspring are produced on a single thread.
 */
public final class OperatorCounts {
  private int crossovers;
  private int mutations;
  private int inversions;

  public int crossovers() {
    return crossovers;
  }

  public int mutations() {
    return mutations;
  }

  public int inversions() {
    return inversions;
  }

  void recordCrossover() {
    crossovers++;
  }

  void recordMutations(int count) {
    mutations += count;
  }

  void recordInversion() {
    inversions++;
  }

  public void reset() {
    crossovers = 0;
    mutations = 0;
    inversions = 0;
  }

  @Override
  public String toString() {
    return String.format(
        "crossovers=%d, mutations=%d, inversions=%d", crossovers, mutations, inversions);
  }
}
