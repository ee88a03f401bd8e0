package com.verlumen.evolution.optimizer;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Provider;
import com.verlumen.evolution.evaluation.FitnessEvaluator;
import com.verlumen.evolution.evaluation.ParallelFitnessEvaluator;
import com.verlumen.evolution.evaluation.SequentialFitnessEvaluator;
import com.verlumen.evolution.selection.FitnessScaler;
import com.verlumen.evolution.selection.MateSelector;
import com.verlumen.evolution.selection.SurvivorSelector;

final class OptimizerFactoryImpl implements OptimizerFactory {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ConfigResolver configResolver;
  private final Provider<SequentialFitnessEvaluator> sequentialEvaluator;
  private final ParallelFitnessEvaluator.Factory parallelEvaluatorFactory;
  private final FitnessScaler fitnessScaler;
  private final MateSelector mateSelector;
  private final SurvivorSelector survivorSelector;
  private final Breeder breeder;
  private final PopulationSeeder seeder;

  @Inject
  OptimizerFactoryImpl(
      ConfigResolver configResolver,
      Provider<SequentialFitnessEvaluator> sequentialEvaluator,
      ParallelFitnessEvaluator.Factory parallelEvaluatorFactory,
      FitnessScaler fitnessScaler,
      MateSelector mateSelector,
      SurvivorSelector survivorSelector,
      Breeder breeder,
      PopulationSeeder seeder) {
    this.configResolver = configResolver;
    this.sequentialEvaluator = sequentialEvaluator;
    this.parallelEvaluatorFactory = parallelEvaluatorFactory;
    this.fitnessScaler = fitnessScaler;
    this.mateSelector = mateSelector;
    this.survivorSelector = survivorSelector;
    this.breeder = breeder;
    this.seeder = seeder;
  }

  @Override
  public <P> Optimizer<P> create(OptimizerConfig<P> config) {
    ResolvedConfig resolved = configResolver.resolve(config);
    FitnessEvaluator evaluator =
        resolved.parallelEvaluation()
            ? parallelEvaluatorFactory.create(Runtime.getRuntime().availableProcessors())
            : sequentialEvaluator.get();
    OptimizerImpl<P> optimizer =
        new OptimizerImpl<>(
            config,
            resolved,
            evaluator,
            fitnessScaler,
            mateSelector,
            survivorSelector,
            breeder,
            seeder);
    logger.atInfo().log(
        "Creating optimizer for %s with population %d",
        resolved.layout(),
        resolved.populationSize());
    optimizer.initialize();
    return optimizer;
  }
}
