package com.verlumen.evolution.genome;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.Arrays;

/**
 * A fixed-length sequence of genes with one allele value per gene and layer.
 *
 * <p>Haploid chromosomes have one layer, diploid chromosomes two. For discrete alphabets each value
 * is the index of the allele's symbol in the alphabet.
 *
 * <p>Chromosomes are mutable. {@link Genotype} only ever hands out copies, so an operator may
 * freely modify every chromosome it obtained from a genotype.
 */
public final class Chromosome {
  // [layer][locus]
  private final double[][] genes;

  private Chromosome(double[][] genes) {
    this.genes = genes;
  }

  /** Creates a chromosome of the given shape with every gene set to 0. */
  public static Chromosome create(int length, int layers) {
    checkArgument(length > 0, "Chromosome length must be positive: %s", length);
    checkArgument(layers == 1 || layers == 2, "A chromosome has 1 or 2 layers, not %s", layers);
    return new Chromosome(new double[layers][length]);
  }

  /** Creates a chromosome holding copies of the given layers. */
  public static Chromosome of(double[]... layers) {
    checkArgument(layers.length == 1 || layers.length == 2, "A chromosome has 1 or 2 layers");
    double[][] genes = new double[layers.length][];
    for (int k = 0; k < layers.length; k++) {
      checkArgument(layers[k].length == layers[0].length, "All layers must have the same length");
      genes[k] = layers[k].clone();
    }
    checkArgument(genes[0].length > 0, "Chromosome length must be positive");
    return new Chromosome(genes);
  }

  /** Creates a chromosome from allele indices. */
  public static Chromosome ofIndices(int[]... layers) {
    double[][] values = new double[layers.length][];
    for (int k = 0; k < layers.length; k++) {
      values[k] = Arrays.stream(layers[k]).asDoubleStream().toArray();
    }
    return of(values);
  }

  /** Pairs two haploid chromosomes into a diploid one, maternal values in layer 0. */
  public static Chromosome diploid(Chromosome maternal, Chromosome paternal) {
    checkArgument(
        maternal.layers() == 1 && paternal.layers() == 1, "Gametes must be haploid");
    checkArgument(maternal.length() == paternal.length(), "Gametes must have the same length");
    return of(maternal.genes[0], paternal.genes[0]);
  }

  public int length() {
    return genes[0].length;
  }

  public int layers() {
    return genes.length;
  }

  public double get(int layer, int locus) {
    return genes[layer][locus];
  }

  /** Returns the allele index stored at the given position of a discrete chromosome. */
  public int index(int layer, int locus) {
    return (int) genes[layer][locus];
  }

  public void set(int layer, int locus, double value) {
    genes[layer][locus] = value;
  }

  public void swap(int layer, int first, int second) {
    double[] values = genes[layer];
    double value = values[first];
    values[first] = values[second];
    values[second] = value;
  }

  /** Reverses the genes of one layer between {@code from} and {@code to}, both inclusive. */
  public void reverse(int layer, int from, int to) {
    checkElementIndex(from, length());
    checkElementIndex(to, length());
    checkArgument(from <= to, "Range start %s is after its end %s", from, to);
    for (int i = from, j = to; i < j; i++, j--) {
      swap(layer, i, j);
    }
  }

  /** Returns the first locus of {@code layer} holding {@code value}, or -1. */
  public int find(int layer, double value) {
    double[] values = genes[layer];
    for (int locus = 0; locus < values.length; locus++) {
      if (values[locus] == value) {
        return locus;
      }
    }
    return -1;
  }

  /** True if the given layer holds every index {@code 0 .. length - 1} exactly once. */
  public boolean isPermutation(int layer) {
    boolean[] seen = new boolean[length()];
    for (double value : genes[layer]) {
      int index = (int) value;
      if (index != value || index < 0 || index >= seen.length || seen[index]) {
        return false;
      }
      seen[index] = true;
    }
    return true;
  }

  /** Returns a copy of one layer as a haploid chromosome. */
  public Chromosome layer(int layer) {
    checkElementIndex(layer, layers());
    return of(genes[layer]);
  }

  public double[] values(int layer) {
    return genes[layer].clone();
  }

  public Chromosome copy() {
    return of(genes);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Chromosome && Arrays.deepEquals(genes, ((Chromosome) other).genes);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(genes);
  }

  @Override
  public String toString() {
    return Arrays.deepToString(genes);
  }
}
