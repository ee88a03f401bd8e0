package com.verlumen.evolution.optimizer;

import com.google.auto.value.AutoValue;
import com.verlumen.evolution.genome.GenomeLayout;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/** An {@link OptimizerConfig} after validation, with every default filled in. */
@AutoValue
abstract class ResolvedConfig {
  static Builder builder() {
    return new AutoValue_ResolvedConfig.Builder();
  }

  abstract GenomeLayout layout();

  abstract int populationSize();

  abstract double crossoverProbability();

  abstract double mutationProbability();

  abstract double inversionProbability();

  abstract double populationGrowth();

  abstract double overpopulation();

  /** Absent when fitness scaling is off. */
  abstract OptionalDouble fitnessScale();

  abstract boolean monogamous();

  abstract int childrenPerMating();

  abstract boolean bestImmortal();

  abstract double floatSigma();

  abstract double floatSigmaAdapt();

  abstract boolean parallelEvaluation();

  abstract OptionalLong randomSeed();

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setLayout(GenomeLayout layout);

    abstract Builder setPopulationSize(int populationSize);

    abstract Builder setCrossoverProbability(double crossoverProbability);

    abstract Builder setMutationProbability(double mutationProbability);

    abstract Builder setInversionProbability(double inversionProbability);

    abstract Builder setPopulationGrowth(double populationGrowth);

    abstract Builder setOverpopulation(double overpopulation);

    abstract Builder setFitnessScale(OptionalDouble fitnessScale);

    abstract Builder setMonogamous(boolean monogamous);

    abstract Builder setChildrenPerMating(int childrenPerMating);

    abstract Builder setBestImmortal(boolean bestImmortal);

    abstract Builder setFloatSigma(double floatSigma);

    abstract Builder setFloatSigmaAdapt(double floatSigmaAdapt);

    abstract Builder setParallelEvaluation(boolean parallelEvaluation);

    abstract Builder setRandomSeed(OptionalLong randomSeed);

    abstract ResolvedConfig build();
  }
}
