package com.verlumen.evolution.optimizer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import com.verlumen.evolution.genome.AlleleAlphabet;
import com.verlumen.evolution.genome.Alphabets;
import com.verlumen.evolution.genome.Encoding;
import com.verlumen.evolution.genome.GenomeLayout;
import com.verlumen.evolution.genome.Ploidy;
import java.util.Collections;
import java.util.OptionalDouble;

/**
 * Validates an {@link OptimizerConfig} and fills in the defaults that depend on other options.
 */
final class ConfigResolver {
  @Inject
  ConfigResolver() {}

  ResolvedConfig resolve(OptimizerConfig<?> config) {
    ImmutableList<Integer> lengths = chromosomeLengths(config);
    check(
        config.populationSize() > 0,
        "Population size must be positive: %s",
        config.populationSize());
    check(
        config.chromosomeSets() == 1 || config.chromosomeSets() == 2,
        "The number of chromosome sets can only be 1 or 2, not %s",
        config.chromosomeSets());
    Ploidy ploidy = Ploidy.fromChromosomeSets(config.chromosomeSets());
    check(
        config.childrenPerMating() > 0 && config.childrenPerMating() % 2 == 0,
        "Number of children per mating must be a positive multiple of 2: %s",
        config.childrenPerMating());

    AlleleAlphabet alphabet =
        config.alleleAlphabet().orElseGet(() -> defaultAlphabet(config, lengths));
    checkAlphabet(alphabet);
    Encoding encoding = Encoding.of(alphabet, config.pmx());
    switch (encoding) {
      case CONTINUOUS:
        check(!config.pmx(), "Partially matched crossover needs a discrete alphabet");
        check(ploidy == Ploidy.HAPLOID, "Continuous chromosomes can only be haploid");
        break;
      case PERMUTATION:
        check(ploidy == Ploidy.HAPLOID, "Partially matched crossover needs haploid chromosomes");
        check(
            config.childrenPerMating() == 2,
            "Partially matched crossover produces exactly 2 children per mating, not %s",
            config.childrenPerMating());
        for (int length : lengths) {
          check(
              length == alphabet.size(),
              "Partially matched crossover needs chromosomes as long as the alphabet (%s), not %s",
              alphabet.size(),
              length);
        }
        break;
      case DISCRETE:
        break;
    }

    double crossoverProbability =
        config.crossoverProbability().orElse(defaultCrossoverProbability(encoding));
    double mutationProbability =
        config.mutationProbability().orElse(defaultMutationProbability(encoding));
    double inversionProbability =
        config.inversionProbability().orElse(OptimizerDefaults.INVERSION_PROBABILITY);
    checkProbability("Crossover", crossoverProbability);
    checkProbability("Mutation", mutationProbability);
    checkProbability("Inversion", inversionProbability);

    check(
        config.populationGrowth() > 0,
        "Population growth must be positive: %s",
        config.populationGrowth());
    check(
        config.overpopulation() > 0,
        "Overpopulation must be positive: %s",
        config.overpopulation());
    check(config.floatSigma() > 0, "Float sigma must be positive: %s", config.floatSigma());
    check(
        config.floatSigmaAdapt() > 0,
        "Float sigma adaptation must be positive: %s",
        config.floatSigmaAdapt());

    return ResolvedConfig.builder()
        .setLayout(GenomeLayout.create(lengths, ploidy, alphabet, encoding))
        .setPopulationSize(config.populationSize())
        .setCrossoverProbability(crossoverProbability)
        .setMutationProbability(mutationProbability)
        .setInversionProbability(inversionProbability)
        .setPopulationGrowth(config.populationGrowth())
        .setOverpopulation(config.overpopulation())
        .setFitnessScale(fitnessScale(config, alphabet, encoding))
        .setMonogamous(config.monogamous())
        .setChildrenPerMating(config.childrenPerMating())
        .setBestImmortal(config.bestImmortal())
        .setFloatSigma(config.floatSigma())
        .setFloatSigmaAdapt(config.floatSigmaAdapt())
        .setParallelEvaluation(config.parallelEvaluation())
        .setRandomSeed(config.randomSeed())
        .build();
  }

  private static ImmutableList<Integer> chromosomeLengths(OptimizerConfig<?> config) {
    int count = config.numberOfChromosomes();
    check(count > 0, "Number of chromosomes must be positive: %s", count);
    ImmutableList<Integer> lengths;
    if (config.chromosomeLength().isPresent()) {
      check(
          config.chromosomeLengths().isEmpty(),
          "Set either a common chromosome length or one length per chromosome, not both");
      lengths =
          ImmutableList.copyOf(Collections.nCopies(count, config.chromosomeLength().getAsInt()));
    } else {
      check(!config.chromosomeLengths().isEmpty(), "Chromosome lengths are required");
      lengths = config.chromosomeLengths();
      check(
          lengths.size() == count,
          "Expected %s chromosome lengths but got %s: %s",
          count,
          lengths.size(),
          lengths);
    }
    for (int length : lengths) {
      check(length > 0, "Chromosome lengths must be positive: %s", lengths);
    }
    return lengths;
  }

  private static AlleleAlphabet defaultAlphabet(
      OptimizerConfig<?> config, ImmutableList<Integer> lengths) {
    if (config.pmx()) {
      check(
          ImmutableSet.copyOf(lengths).size() == 1,
          "Partially matched crossover without an alphabet needs chromosomes of equal length: %s",
          lengths);
      return AlleleAlphabet.range(lengths.get(0));
    }
    return config.chromosomeSets() == 2 ? Alphabets.TERNARY : Alphabets.BINARY;
  }

  private static void checkAlphabet(AlleleAlphabet alphabet) {
    if (alphabet.isContinuous()) {
      return;
    }
    check(
        alphabet.size() >= 2,
        "An allele alphabet needs at least 2 symbols: %s",
        alphabet.symbols());
    boolean characters =
        alphabet.symbols().stream().allMatch(symbol -> symbol instanceof Character);
    check(
        alphabet.isNumeric() || characters,
        "Allele alphabets must consist of numbers only or characters only: %s",
        alphabet.symbols());
    check(
        alphabet.hasDistinctSymbols(),
        "Allele alphabet has duplicate symbols: %s",
        alphabet.symbols());
  }

  private static double defaultCrossoverProbability(Encoding encoding) {
    switch (encoding) {
      case CONTINUOUS:
        return OptimizerDefaults.CONTINUOUS_CROSSOVER_PROBABILITY;
      case PERMUTATION:
        return OptimizerDefaults.PMX_CROSSOVER_PROBABILITY;
      default:
        return OptimizerDefaults.CROSSOVER_PROBABILITY;
    }
  }

  private static double defaultMutationProbability(Encoding encoding) {
    switch (encoding) {
      case CONTINUOUS:
        return OptimizerDefaults.CONTINUOUS_MUTATION_PROBABILITY;
      case PERMUTATION:
        return OptimizerDefaults.PMX_MUTATION_PROBABILITY;
      default:
        return OptimizerDefaults.MUTATION_PROBABILITY;
    }
  }

  private static OptionalDouble fitnessScale(
      OptimizerConfig<?> config, AlleleAlphabet alphabet, Encoding encoding) {
    if (config.fitnessScalingDisabled()) {
      check(
          config.fitnessScale().isEmpty(),
          "Fitness scaling cannot be both disabled and set to %s",
          config.fitnessScale().orElse(Double.NaN));
      return OptionalDouble.empty();
    }
    if (config.fitnessScale().isPresent()) {
      double scale = config.fitnessScale().getAsDouble();
      check(scale > 1, "Fitness scale must be greater than 1: %s", scale);
      return config.fitnessScale();
    }
    if (encoding != Encoding.DISCRETE || alphabet.isCharacterAlphabet()) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(OptimizerDefaults.FITNESS_SCALE);
  }

  private static void checkProbability(String kind, double probability) {
    check(
        probability >= 0 && probability <= 1,
        "%s probability must be within [0, 1]: %s",
        kind,
        probability);
  }

  private static void check(boolean condition, String template, Object... arguments) {
    if (!condition) {
      throw new ConfigurationException(String.format(template, arguments));
    }
  }
}
