package com.verlumen.evolution.genome;

/** Number of complete chromosome sets carried by an individual. */
public enum Ploidy {
  HAPLOID(1),
  DIPLOID(2);

  private final int layers;

  Ploidy(int layers) {
    this.layers = layers;
  }

  /** Number of allele values per gene. */
  public int layers() {
    return layers;
  }

  public static Ploidy fromChromosomeSets(int chromosomeSets) {
    for (Ploidy ploidy : values()) {
      if (ploidy.layers == chromosomeSets) {
        return ploidy;
      }
    }
    throw new IllegalArgumentException(
        "The number of chromosome sets can only be 1 or 2, not " + chromosomeSets);
  }
}
