package com.verlumen.evolution.evaluation;

import com.google.inject.AbstractModule;
import com.google.inject.assistedinject.FactoryModuleBuilder;

public final class EvaluationModule extends AbstractModule {
  public static EvaluationModule create() {
    return new EvaluationModule();
  }

  private EvaluationModule() {}

  @Override
  protected void configure() {
    install(new FactoryModuleBuilder().build(ParallelFitnessEvaluator.Factory.class));
  }
}
