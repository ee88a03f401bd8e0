package com.verlumen.evolution.decoding;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.evolution.genome.Encoding;
import com.verlumen.evolution.genome.Genotype;
import java.util.function.IntToDoubleFunction;

/**
 * Decoder for the simple encodings, producing a {@link Phenotype} with exactly one argument.
 *
 * <ul>
 *   <li>Continuous genomes: one {@code double[]} per chromosome, a single {@code Double} if the
 *       genome is one gene long, an {@code ImmutableList<double[]>} for several chromosomes.
 *   <li>Permutation genomes: the symbols of each chromosome in order, as an {@code ImmutableList}.
 *   <li>Character alphabets: one {@code String} per chromosome.
 *   <li>Haploid {0, 1} and diploid {-1, 0, 1} genomes: each chromosome is read as the bits of an
 *       unsigned integer and mapped onto [0, 1]; a {@code Double} for one chromosome, a {@code
 *       double[]} for several.
 * </ul>
 *
 * <p>Several parameters packed into one chromosome, or any other alphabet, require a custom
 * decoder.
 */
public final class GenericDecoder implements Decoder<Phenotype> {
  @Inject
  public GenericDecoder() {}

  @Override
  public Phenotype decode(Genotype genotype) {
    if (genotype.encoding() != Encoding.DISCRETE) {
      if (genotype.isDiploid()) {
        throw new UnsupportedGenotypeException(
            "Can only handle haploid chromosomes for float chromosomes and pmx");
      }
      return genotype.encoding() == Encoding.CONTINUOUS
          ? decodeContinuous(genotype)
          : decodePermutation(genotype);
    }
    if (genotype.isCharacterAlphabet()) {
      if (genotype.isDiploid()) {
        throw new UnsupportedGenotypeException(
            "Can only handle haploid chromosomes for character chromosomes");
      }
      return decodeCharacters(genotype);
    }
    return decodeBinaryFractions(genotype);
  }

  private static Phenotype decodeContinuous(Genotype genotype) {
    if (genotype.numberOfChromosomes() > 1) {
      ImmutableList.Builder<double[]> chromosomes = ImmutableList.builder();
      for (int i = 0; i < genotype.numberOfChromosomes(); i++) {
        chromosomes.add(genotype.chromosome(i).values(0));
      }
      return Phenotype.of(chromosomes.build());
    }
    double[] values = genotype.chromosome(0).values(0);
    return values.length > 1 ? Phenotype.of(values) : Phenotype.of(values[0]);
  }

  private static Phenotype decodePermutation(Genotype genotype) {
    if (genotype.numberOfChromosomes() > 1) {
      ImmutableList.Builder<Object> chromosomes = ImmutableList.builder();
      for (int i = 0; i < genotype.numberOfChromosomes(); i++) {
        chromosomes.add(symbols(genotype, i));
      }
      return Phenotype.of(chromosomes.build());
    }
    ImmutableList<Object> symbols = symbols(genotype, 0);
    return symbols.size() > 1 ? Phenotype.of(symbols) : Phenotype.of(symbols.get(0));
  }

  private static ImmutableList<Object> symbols(Genotype genotype, int chromosome) {
    ImmutableList.Builder<Object> symbols = ImmutableList.builder();
    for (int j = 0; j < genotype.chromosomeLengths().get(chromosome); j++) {
      symbols.add(genotype.symbol(chromosome, 0, j));
    }
    return symbols.build();
  }

  private static Phenotype decodeCharacters(Genotype genotype) {
    ImmutableList.Builder<String> strings = ImmutableList.builder();
    for (int i = 0; i < genotype.numberOfChromosomes(); i++) {
      StringBuilder builder = new StringBuilder();
      for (int j = 0; j < genotype.chromosomeLengths().get(i); j++) {
        builder.append(genotype.symbol(i, 0, j));
      }
      strings.add(builder.toString());
    }
    ImmutableList<String> decoded = strings.build();
    return decoded.size() == 1 ? Phenotype.of(decoded.get(0)) : Phenotype.of(decoded);
  }

  private static Phenotype decodeBinaryFractions(Genotype genotype) {
    double[] fractions = new double[genotype.numberOfChromosomes()];
    for (int i = 0; i < fractions.length; i++) {
      int chromosome = i;
      IntToDoubleFunction bit;
      if (genotype.isHaploid()) {
        if (!genotype.alphabet().hasNumericValues(0, 1)) {
          throw new UnsupportedGenotypeException(
              "Can only handle biallelic haploid chromosomes when alphabet is [0, 1]");
        }
        bit = locus -> numericSymbol(genotype, chromosome, 0, locus);
      } else {
        if (!genotype.alphabet().hasNumericValues(-1, 0, 1)) {
          throw new UnsupportedGenotypeException(
              "Can only handle triallelic diploid chromosomes when alphabet is [-1, 0, 1]");
        }
        // -1 is a recessive 1: the larger allele wins, and its magnitude is the expressed bit.
        bit =
            locus ->
                Math.abs(
                    Math.max(
                        numericSymbol(genotype, chromosome, 0, locus),
                        numericSymbol(genotype, chromosome, 1, locus)));
      }
      fractions[i] = binaryFraction(genotype.chromosomeLengths().get(i), bit);
    }
    return fractions.length == 1 ? Phenotype.of(fractions[0]) : Phenotype.of(fractions);
  }

  private static double binaryFraction(int length, IntToDoubleFunction bit) {
    double accumulator = 0.0;
    double power = Math.pow(2, length - 1);
    for (int locus = 0; locus < length; locus++) {
      accumulator += bit.applyAsDouble(locus) * power;
      power /= 2;
    }
    return accumulator / (Math.pow(2, length) - 1);
  }

  private static double numericSymbol(Genotype genotype, int chromosome, int layer, int locus) {
    return ((Number) genotype.symbol(chromosome, layer, locus)).doubleValue();
  }
}
