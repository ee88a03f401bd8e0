package com.verlumen.evolution.optimizer;

import com.google.inject.AbstractModule;
import com.verlumen.evolution.evaluation.EvaluationModule;
import com.verlumen.evolution.selection.SelectionModule;

public final class OptimizerModule extends AbstractModule {
  public static OptimizerModule create() {
    return new OptimizerModule();
  }

  private OptimizerModule() {}

  @Override
  protected void configure() {
    install(EvaluationModule.create());
    install(SelectionModule.create());
    bind(OptimizerFactory.class).to(OptimizerFactoryImpl.class);
  }
}
