package com.verlumen.evolution.genome;

/** Commonly used allele alphabets. */
public final class Alphabets {

  /** Biallelic alphabet, the default for haploid chromosomes. */
  public static final AlleleAlphabet BINARY = AlleleAlphabet.of(0, 1);

  /**
   * Triallelic alphabet, the default for diploid chromosomes: -1 is a recessive 1, 0 a 0 and 1 a
   * dominant 1.
   */
  public static final AlleleAlphabet TERNARY = AlleleAlphabet.of(-1, 0, 1);

  /** A blank and the ASCII letters. */
  public static final AlleleAlphabet LETTERS =
      AlleleAlphabet.ofCharacters(" ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz");

  /** {@link #LETTERS} plus the decimal digits. */
  public static final AlleleAlphabet ALPHANUMERIC =
      AlleleAlphabet.ofCharacters(
          " ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789");

  /** {@link #ALPHANUMERIC} plus the punctuation found on a US keyboard. */
  public static final AlleleAlphabet KEYBOARD =
      AlleleAlphabet.ofCharacters(
          " ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789"
              + "~`!@#$%^&*()-_=+[{]}\\|;:'\",<.>/?");

  private Alphabets() {
    throw new UnsupportedOperationException("Alphabets cannot be instantiated");
  }
}
