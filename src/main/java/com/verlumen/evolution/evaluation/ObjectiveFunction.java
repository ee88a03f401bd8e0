package com.verlumen.evolution.evaluation;

/**
 * The quantity being maximized.
 *
 * @param <P> the phenotype a genotype decodes into
 */
@FunctionalInterface
public interface ObjectiveFunction<P> {
  /** Returns a finite, non-negative fitness; higher is better. */
  double evaluate(P phenotype);
}
