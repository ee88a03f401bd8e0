package com.verlumen.evolution.optimizer;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.OptionalDouble;

/**
 * The parameters of a running optimizer that may change between generations, typically from a
 * {@link ProgressHook}. Changes take effect with the next generation.
 */
public final class TuningParameters {
  private double crossoverProbability;
  private double mutationProbability;
  private double inversionProbability;
  private double populationGrowth;
  private double overpopulation;
  private OptionalDouble fitnessScale;
  private double floatSigma;
  private double floatSigmaAdapt;

  private TuningParameters(ResolvedConfig config) {
    this.crossoverProbability = config.crossoverProbability();
    this.mutationProbability = config.mutationProbability();
    this.inversionProbability = config.inversionProbability();
    this.populationGrowth = config.populationGrowth();
    this.overpopulation = config.overpopulation();
    this.fitnessScale = config.fitnessScale();
    this.floatSigma = config.floatSigma();
    this.floatSigmaAdapt = config.floatSigmaAdapt();
  }

  static TuningParameters from(ResolvedConfig config) {
    return new TuningParameters(config);
  }

  public double crossoverProbability() {
    return crossoverProbability;
  }

  public void setCrossoverProbability(double crossoverProbability) {
    checkProbability(crossoverProbability);
    this.crossoverProbability = crossoverProbability;
  }

  public double mutationProbability() {
    return mutationProbability;
  }

  public void setMutationProbability(double mutationProbability) {
    checkProbability(mutationProbability);
    this.mutationProbability = mutationProbability;
  }

  public double inversionProbability() {
    return inversionProbability;
  }

  public void setInversionProbability(double inversionProbability) {
    checkProbability(inversionProbability);
    this.inversionProbability = inversionProbability;
  }

  /** Factor by which the population size changes from one generation to the next. */
  public double populationGrowth() {
    return populationGrowth;
  }

  public void setPopulationGrowth(double populationGrowth) {
    checkArgument(populationGrowth > 0, "Population growth must be positive: %s", populationGrowth);
    this.populationGrowth = populationGrowth;
  }

  /** Factor by which the offspring outnumber the next generation before selection. */
  public double overpopulation() {
    return overpopulation;
  }

  public void setOverpopulation(double overpopulation) {
    checkArgument(overpopulation > 0, "Overpopulation must be positive: %s", overpopulation);
    this.overpopulation = overpopulation;
  }

  /** Target ratio of maximum to mean scaled fitness; absent when scaling is off. */
  public OptionalDouble fitnessScale() {
    return fitnessScale;
  }

  public void setFitnessScale(double fitnessScale) {
    checkArgument(fitnessScale > 1, "Fitness scale must be greater than 1: %s", fitnessScale);
    this.fitnessScale = OptionalDouble.of(fitnessScale);
  }

  public void disableFitnessScaling() {
    this.fitnessScale = OptionalDouble.empty();
  }

  /** Standard deviation of the mutation step of continuous genes. */
  public double floatSigma() {
    return floatSigma;
  }

  public void setFloatSigma(double floatSigma) {
    checkArgument(floatSigma > 0, "Float sigma must be positive: %s", floatSigma);
    this.floatSigma = floatSigma;
  }

  public double floatSigmaAdapt() {
    return floatSigmaAdapt;
  }

  public void setFloatSigmaAdapt(double floatSigmaAdapt) {
    checkArgument(
        floatSigmaAdapt > 0, "Float sigma adaptation must be positive: %s", floatSigmaAdapt);
    this.floatSigmaAdapt = floatSigmaAdapt;
  }

  @Override
  public String toString() {
    return String.format(
        "crossoverProbability: %s, mutationProbability: %s, inversionProbability: %s, "
            + "populationGrowth: %s, overpopulation: %s, fitnessScale: %s, "
            + "floatSigma: %s, floatSigmaAdapt: %s",
        crossoverProbability,
        mutationProbability,
        inversionProbability,
        populationGrowth,
        overpopulation,
        fitnessScale.isPresent() ? fitnessScale.getAsDouble() : "off",
        floatSigma,
        floatSigmaAdapt);
  }

  private static void checkProbability(double probability) {
    checkArgument(
        probability >= 0 && probability <= 1, "Probability must be within [0, 1]: %s", probability);
  }
}
