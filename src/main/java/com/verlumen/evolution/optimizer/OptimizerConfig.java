package com.verlumen.evolution.optimizer;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.decoding.Decoder;
import com.verlumen.evolution.decoding.GenericDecoder;
import com.verlumen.evolution.decoding.Phenotype;
import com.verlumen.evolution.evaluation.ObjectiveFunction;
import com.verlumen.evolution.genome.AlleleAlphabet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Everything needed to build an {@link Optimizer}.
 *
 * <p>Options left unset fall back to defaults that depend on the alphabet and the pmx flag; see
 * {@link OptimizerDefaults}. Consistency is checked when the optimizer is created, not here.
 *
 * @param <P> the phenotype the decoder produces and the objective function consumes
 */
@AutoValue
public abstract class OptimizerConfig<P> {
  /** Starts a configuration that decodes genotypes with the {@link GenericDecoder}. */
  public static Builder<Phenotype> builder(ObjectiveFunction<Phenotype> objectiveFunction) {
    return builder(objectiveFunction, new GenericDecoder());
  }

  public static <P> Builder<P> builder(ObjectiveFunction<P> objectiveFunction, Decoder<P> decoder) {
    return new AutoValue_OptimizerConfig.Builder<P>()
        .setObjectiveFunction(objectiveFunction)
        .setDecoder(decoder)
        .setNumberOfChromosomes(1)
        .setChromosomeLengths(ImmutableList.of())
        .setPmx(false)
        .setPopulationGrowth(OptimizerDefaults.POPULATION_GROWTH)
        .setOverpopulation(OptimizerDefaults.OVERPOPULATION)
        .setChromosomeSets(OptimizerDefaults.CHROMOSOME_SETS)
        .setFitnessScalingDisabled(false)
        .setMonogamous(false)
        .setChildrenPerMating(OptimizerDefaults.CHILDREN_PER_MATING)
        .setBestImmortal(true)
        .setFloatSigma(OptimizerDefaults.FLOAT_SIGMA)
        .setFloatSigmaAdapt(OptimizerDefaults.FLOAT_SIGMA_ADAPT)
        .setParallelEvaluation(false);
  }

  public abstract ObjectiveFunction<P> objectiveFunction();

  public abstract Decoder<P> decoder();

  public abstract int numberOfChromosomes();

  /** Length shared by all chromosomes; mutually exclusive with {@link #chromosomeLengths()}. */
  public abstract OptionalInt chromosomeLength();

  /** Length of every chromosome; mutually exclusive with {@link #chromosomeLength()}. */
  public abstract ImmutableList<Integer> chromosomeLengths();

  public abstract int populationSize();

  public abstract Optional<AlleleAlphabet> alleleAlphabet();

  /** Whether chromosomes are permutations, recombined by partially matched crossover. */
  public abstract boolean pmx();

  public abstract OptionalDouble crossoverProbability();

  public abstract OptionalDouble mutationProbability();

  public abstract OptionalDouble inversionProbability();

  public abstract double populationGrowth();

  public abstract double overpopulation();

  public abstract int chromosomeSets();

  public abstract OptionalDouble fitnessScale();

  public abstract boolean fitnessScalingDisabled();

  public abstract boolean monogamous();

  public abstract int childrenPerMating();

  public abstract boolean bestImmortal();

  public abstract double floatSigma();

  public abstract double floatSigmaAdapt();

  public abstract Optional<ProgressHook<P>> progressHook();

  public abstract boolean parallelEvaluation();

  /** Seed of the optimizer's random number generator; unseeded if absent. */
  public abstract OptionalLong randomSeed();

  @AutoValue.Builder
  public abstract static class Builder<P> {
    public abstract Builder<P> setObjectiveFunction(ObjectiveFunction<P> objectiveFunction);

    public abstract Builder<P> setDecoder(Decoder<P> decoder);

    public abstract Builder<P> setNumberOfChromosomes(int numberOfChromosomes);

    public abstract Builder<P> setChromosomeLength(int chromosomeLength);

    public abstract Builder<P> setChromosomeLengths(List<Integer> chromosomeLengths);

    public Builder<P> setChromosomeLengths(Integer... chromosomeLengths) {
      return setChromosomeLengths(ImmutableList.copyOf(chromosomeLengths));
    }

    public abstract Builder<P> setPopulationSize(int populationSize);

    public abstract Builder<P> setAlleleAlphabet(AlleleAlphabet alleleAlphabet);

    public abstract Builder<P> setPmx(boolean pmx);

    public abstract Builder<P> setCrossoverProbability(double crossoverProbability);

    public abstract Builder<P> setMutationProbability(double mutationProbability);

    public abstract Builder<P> setInversionProbability(double inversionProbability);

    public abstract Builder<P> setPopulationGrowth(double populationGrowth);

    public abstract Builder<P> setOverpopulation(double overpopulation);

    public abstract Builder<P> setChromosomeSets(int chromosomeSets);

    public abstract Builder<P> setFitnessScale(double fitnessScale);

    public abstract Builder<P> setFitnessScalingDisabled(boolean fitnessScalingDisabled);

    public Builder<P> disableFitnessScaling() {
      return setFitnessScalingDisabled(true);
    }

    public abstract Builder<P> setMonogamous(boolean monogamous);

    public abstract Builder<P> setChildrenPerMating(int childrenPerMating);

    public abstract Builder<P> setBestImmortal(boolean bestImmortal);

    public abstract Builder<P> setFloatSigma(double floatSigma);

    public abstract Builder<P> setFloatSigmaAdapt(double floatSigmaAdapt);

    public abstract Builder<P> setProgressHook(ProgressHook<P> progressHook);

    public abstract Builder<P> setParallelEvaluation(boolean parallelEvaluation);

    public abstract Builder<P> setRandomSeed(long randomSeed);

    public abstract OptimizerConfig<P> build();
  }
}
