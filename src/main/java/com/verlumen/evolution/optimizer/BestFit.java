package com.verlumen.evolution.optimizer;

import com.google.auto.value.AutoValue;
import com.verlumen.evolution.genome.Genotype;

/** The fittest individual of a population, together with its phenotype. */
@AutoValue
public abstract class BestFit<P> {
  static <P> BestFit<P> create(Genotype genotype, P phenotype, double fitness) {
    return new AutoValue_BestFit<>(genotype, phenotype, fitness);
  }

  public abstract Genotype genotype();

  public abstract P phenotype();

  public abstract double fitness();
}
