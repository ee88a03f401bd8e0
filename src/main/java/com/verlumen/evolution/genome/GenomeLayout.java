package com.verlumen.evolution.genome;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** The shape shared by every genome of a population. */
@AutoValue
public abstract class GenomeLayout {
  public static GenomeLayout create(
      List<Integer> chromosomeLengths, Ploidy ploidy, AlleleAlphabet alphabet, Encoding encoding) {
    checkArgument(!chromosomeLengths.isEmpty(), "At least one chromosome is required");
    checkArgument(
        chromosomeLengths.stream().allMatch(length -> length > 0),
        "Chromosome lengths must be positive: %s",
        chromosomeLengths);
    return new AutoValue_GenomeLayout(
        ImmutableList.copyOf(chromosomeLengths), ploidy, alphabet, encoding);
  }

  public abstract ImmutableList<Integer> chromosomeLengths();

  public abstract Ploidy ploidy();

  public abstract AlleleAlphabet alphabet();

  public abstract Encoding encoding();

  public int numberOfChromosomes() {
    return chromosomeLengths().size();
  }

  public int chromosomeLength(int chromosome) {
    return chromosomeLengths().get(chromosome);
  }

  /** Returns this layout with a different ploidy, e.g. for the gametes of a diploid genome. */
  public GenomeLayout withPloidy(Ploidy newPloidy) {
    return new AutoValue_GenomeLayout(chromosomeLengths(), newPloidy, alphabet(), encoding());
  }
}
