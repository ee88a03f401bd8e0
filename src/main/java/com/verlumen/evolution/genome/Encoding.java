package com.verlumen.evolution.genome;

/** How the genes of a population are interpreted by the genetic operators. */
public enum Encoding {
  /** Genes hold indices into a finite alphabet and vary independently. */
  DISCRETE,
  /** Genes hold real values in [0, 1]. */
  CONTINUOUS,
  /** Every chromosome is a permutation of a finite alphabet. */
  PERMUTATION;

  public static Encoding of(AlleleAlphabet alphabet, boolean pmx) {
    if (alphabet.isContinuous()) {
      return CONTINUOUS;
    }
    return pmx ? PERMUTATION : DISCRETE;
  }
}
