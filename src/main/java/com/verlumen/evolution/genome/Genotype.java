package com.verlumen.evolution.genome;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * The genome of one individual together with the fitness of its phenotype.
 *
 * <p>A genotype owns its chromosomes: they are copied on the way in and on the way out, so
 * offspring never share storage with their parents or each other. Only the fitness fields change
 * after construction.
 */
public final class Genotype {
  private final GenomeLayout layout;
  private final ImmutableList<Chromosome> chromosomes;
  private double fitness = Double.NaN;
  private double scaledFitness = Double.NaN;

  private Genotype(GenomeLayout layout, ImmutableList<Chromosome> chromosomes) {
    this.layout = layout;
    this.chromosomes = chromosomes;
  }

  /**
   * Creates a genotype with random alleles: uniform draws from the alphabet, uniform reals for the
   * continuous alphabet, or one random permutation of the alphabet per chromosome.
   */
  public static Genotype random(GenomeLayout layout, Random random) {
    checkNotNull(random, "Random cannot be null");
    int layers = layout.ploidy().layers();
    ImmutableList.Builder<Chromosome> genome = ImmutableList.builder();
    for (int length : layout.chromosomeLengths()) {
      Chromosome chromosome = Chromosome.create(length, layers);
      for (int k = 0; k < layers; k++) {
        switch (layout.encoding()) {
          case CONTINUOUS:
            for (int j = 0; j < length; j++) {
              chromosome.set(k, j, random.nextDouble());
            }
            break;
          case PERMUTATION:
            int[] permutation = randomPermutation(layout.alphabet().size(), random);
            for (int j = 0; j < length; j++) {
              chromosome.set(k, j, permutation[j]);
            }
            break;
          case DISCRETE:
            int size = layout.alphabet().size();
            for (int j = 0; j < length; j++) {
              chromosome.set(k, j, random.nextInt(size));
            }
            break;
        }
      }
      genome.add(chromosome);
    }
    return new Genotype(layout, genome.build());
  }

  /** Creates a genotype holding deep copies of the given chromosomes. */
  public static Genotype of(GenomeLayout layout, List<Chromosome> genome) {
    checkNotNull(genome, "Genome cannot be null");
    checkArgument(
        genome.size() == layout.numberOfChromosomes(),
        "Expected %s chromosomes but got %s",
        layout.numberOfChromosomes(),
        genome.size());
    ImmutableList.Builder<Chromosome> copies = ImmutableList.builder();
    for (int i = 0; i < genome.size(); i++) {
      Chromosome chromosome = genome.get(i);
      checkArgument(
          chromosome.length() == layout.chromosomeLength(i),
          "Chromosome %s must have length %s, not %s",
          i,
          layout.chromosomeLength(i),
          chromosome.length());
      checkArgument(
          chromosome.layers() == layout.ploidy().layers(),
          "Chromosome %s must have %s layers, not %s",
          i,
          layout.ploidy().layers(),
          chromosome.layers());
      copies.add(chromosome.copy());
    }
    return new Genotype(layout, copies.build());
  }

  public GenomeLayout layout() {
    return layout;
  }

  /** Raw fitness as returned by the objective function. */
  public double fitness() {
    checkState(hasFitness(), "Genotype has not been evaluated yet");
    return fitness;
  }

  public boolean hasFitness() {
    return !Double.isNaN(fitness);
  }

  /**
   * Sets the raw fitness and resets the scaled fitness to the same value.
   *
   * @throws InvalidFitnessException if the value is negative, NaN or infinite
   */
  public void setFitness(double value) {
    if (!isValidFitness(value)) {
      throw new InvalidFitnessException("Fitness returned by the objective function", value);
    }
    fitness = value;
    scaledFitness = value;
  }

  public double scaledFitness() {
    checkState(!Double.isNaN(scaledFitness), "Genotype has not been evaluated yet");
    return scaledFitness;
  }

  /** @throws InvalidFitnessException if the value is negative, NaN or infinite */
  public void setScaledFitness(double value) {
    if (!isValidFitness(value)) {
      throw new InvalidFitnessException("Scaled fitness", value);
    }
    scaledFitness = value;
  }

  public ImmutableList<Integer> chromosomeLengths() {
    return layout.chromosomeLengths();
  }

  public Ploidy ploidy() {
    return layout.ploidy();
  }

  public boolean isHaploid() {
    return layout.ploidy() == Ploidy.HAPLOID;
  }

  public boolean isDiploid() {
    return layout.ploidy() == Ploidy.DIPLOID;
  }

  public int numberOfChromosomes() {
    return chromosomes.size();
  }

  /** Returns a deep copy of all chromosomes. */
  public ImmutableList<Chromosome> genome() {
    return chromosomes.stream().map(Chromosome::copy).collect(toImmutableList());
  }

  /** Returns a copy of one chromosome. */
  public Chromosome chromosome(int chromosome) {
    return chromosomes.get(chromosome).copy();
  }

  /** Raw allele value: a real for continuous alphabets, an index otherwise. */
  public double allele(int chromosome, int layer, int locus) {
    return chromosomes.get(chromosome).get(layer, locus);
  }

  /** The alphabet symbol at the given position of a discrete genome. */
  public Object symbol(int chromosome, int layer, int locus) {
    return layout.alphabet().symbol(chromosomes.get(chromosome).index(layer, locus));
  }

  public AlleleAlphabet alphabet() {
    return layout.alphabet();
  }

  /** Number of symbols in the alphabet; positive infinity for the continuous alphabet. */
  public double alphabetSize() {
    return alphabet().isContinuous() ? Double.POSITIVE_INFINITY : alphabet().size();
  }

  public boolean isCharacterAlphabet() {
    return alphabet().isCharacterAlphabet();
  }

  public boolean isPmx() {
    return layout.encoding() == Encoding.PERMUTATION;
  }

  public Encoding encoding() {
    return layout.encoding();
  }

  @Override
  public String toString() {
    boolean valuesOnly = layout.encoding() != Encoding.DISCRETE;
    return IntStream.range(0, chromosomes.size())
        .mapToObj(
            i -> {
              if (valuesOnly) {
                return render(i, 0, " ");
              } else if (isHaploid()) {
                return render(i, 0, "");
              }
              return "(" + render(i, 0, "") + "),(" + render(i, 1, "") + ")";
            })
        .collect(Collectors.joining(", "));
  }

  private String render(int chromosome, int layer, String separator) {
    return IntStream.range(0, layout.chromosomeLength(chromosome))
        .mapToObj(
            locus ->
                layout.encoding() == Encoding.CONTINUOUS
                    ? String.valueOf(allele(chromosome, layer, locus))
                    : String.valueOf(symbol(chromosome, layer, locus)))
        .collect(Collectors.joining(separator));
  }

  private static boolean isValidFitness(double value) {
    return Double.isFinite(value) && value >= 0;
  }

  private static int[] randomPermutation(int size, Random random) {
    int[] permutation = IntStream.range(0, size).toArray();
    for (int i = size - 1; i > 0; i--) {
      int j = random.nextInt(i + 1);
      int value = permutation[i];
      permutation[i] = permutation[j];
      permutation[j] = value;
    }
    return permutation;
  }
}
