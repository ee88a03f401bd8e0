package com.verlumen.evolution.selection;

import com.google.inject.AbstractModule;

public final class SelectionModule extends AbstractModule {
  public static SelectionModule create() {
    return new SelectionModule();
  }

  private SelectionModule() {}

  @Override
  protected void configure() {
    bind(FitnessScaler.class).to(LinearFitnessScaler.class);
    bind(MateSelector.class).to(RouletteWheelMateSelector.class);
    bind(SurvivorSelector.class).to(FittestSurvivorSelector.class);
  }
}
