package com.verlumen.evolution.optimizer;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.evolution.decoding.Decoder;
import com.verlumen.evolution.evaluation.FitnessEvaluator;
import com.verlumen.evolution.evaluation.ObjectiveFunction;
import com.verlumen.evolution.genome.Encoding;
import com.verlumen.evolution.genome.GenomeLayout;
import com.verlumen.evolution.genome.Genotype;
import com.verlumen.evolution.operators.OperatorCounts;
import com.verlumen.evolution.selection.FitnessScaler;
import com.verlumen.evolution.selection.MateSelector;
import com.verlumen.evolution.selection.MatingPool;
import com.verlumen.evolution.selection.SurvivorSelector;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;

final class OptimizerImpl<P> implements Optimizer<P> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ObjectiveFunction<P> objectiveFunction;
  private final Decoder<P> decoder;
  private final Optional<ProgressHook<P>> progressHook;
  private final ResolvedConfig config;
  private final TuningParameters tuning;
  private final FitnessEvaluator evaluator;
  private final FitnessScaler scaler;
  private final MateSelector mateSelector;
  private final SurvivorSelector survivorSelector;
  private final Breeder breeder;
  private final PopulationSeeder seeder;
  private final Random random;
  private final OperatorCounts counts = new OperatorCounts();
  private final List<GenerationStatistics> statistics = new ArrayList<>();

  private ImmutableList<Genotype> population = ImmutableList.of();
  private int populationSize;

  OptimizerImpl(
      OptimizerConfig<P> userConfig,
      ResolvedConfig config,
      FitnessEvaluator evaluator,
      FitnessScaler scaler,
      MateSelector mateSelector,
      SurvivorSelector survivorSelector,
      Breeder breeder,
      PopulationSeeder seeder) {
    this.objectiveFunction = userConfig.objectiveFunction();
    this.decoder = userConfig.decoder();
    this.progressHook = userConfig.progressHook();
    this.config = config;
    this.tuning = TuningParameters.from(config);
    this.evaluator = evaluator;
    this.scaler = scaler;
    this.mateSelector = mateSelector;
    this.survivorSelector = survivorSelector;
    this.breeder = breeder;
    this.seeder = seeder;
    this.random =
        config.randomSeed().isPresent()
            ? new Random(config.randomSeed().getAsLong())
            : new Random();
    this.populationSize = config.populationSize();
  }

  /** Creates and evaluates generation 0. */
  void initialize() {
    checkState(statistics.isEmpty(), "Optimizer is already initialized");
    population = seeder.seed(config.layout(), populationSize, random);
    evaluator.evaluate(population, decoder, objectiveFunction);
    counts.reset();
    statistics.add(
        GenerationStatistics.create(
            population,
            counts,
            config.monogamous() ? OptionalDouble.of(0.0) : OptionalDouble.empty()));
    logger.atFine().log("Generation 0: %s", statistics.get(0));
    invokeHook();
  }

  @Override
  public void run(int generations) {
    run(generations, OptionalDouble.empty());
  }

  @Override
  public void run(int generations, double maxFitness) {
    run(generations, OptionalDouble.of(maxFitness));
  }

  private void run(int generations, OptionalDouble maxFitness) {
    checkArgument(generations >= 0, "Number of generations cannot be negative: %s", generations);
    checkState(!statistics.isEmpty(), "Optimizer is not initialized");
    logger.atInfo().log(
        "Running up to %d generations from generation %d", generations, generation());
    for (int n = 0; n < generations; n++) {
      nextGeneration();
      invokeHook();
      if (maxFitness.isPresent() && fittest().fitness() >= maxFitness.getAsDouble()) {
        logger.atInfo().log(
            "Fitness %s reached in generation %d", maxFitness.getAsDouble(), generation());
        break;
      }
    }
    logger.atInfo().log(
        "Stopped at generation %d with best fitness %s", generation(), fittest().fitness());
  }

  private void nextGeneration() {
    counts.reset();
    int targetSize =
        (int) (tuning.overpopulation() * populationSize * tuning.populationGrowth());
    if (config.bestImmortal()) {
      targetSize--;
    }

    MatingPool matingPool = new MatingPool(population.size(), config.monogamous());
    List<Genotype> offspring = new ArrayList<>();
    while (offspring.size() < targetSize) {
      int i = mateSelector.select(population, matingPool.excluded(), random);
      matingPool.addFirstPartner(i);
      int j = mateSelector.select(population, matingPool.excluded(), random);
      offspring.addAll(
          breeder.breed(
              population.get(i),
              population.get(j),
              config.childrenPerMating(),
              tuning,
              random,
              counts));
      matingPool.completePair(j);
    }
    if (config.bestImmortal()) {
      offspring.add(fittest());
    }

    evaluator.evaluate(offspring, decoder, objectiveFunction);
    GenerationStatistics current =
        GenerationStatistics.create(offspring, counts, matingPool.divorceRate());
    statistics.add(current);

    if (tuning.fitnessScale().isPresent()) {
      scaler.scale(
          offspring,
          current.min(),
          current.mean(),
          current.max(),
          tuning.fitnessScale().getAsDouble());
    }

    populationSize = (int) Math.rint(populationSize * tuning.populationGrowth());
    population = survivorSelector.select(offspring, populationSize, random);

    int generation = generation();
    int interval = OptimizerDefaults.FLOAT_SIGMA_ADAPT_INTERVAL;
    if (config.layout().encoding() == Encoding.CONTINUOUS
        && generation > 0
        && generation % interval == 0) {
      if (current.mean() > statistics.get(generation - interval).mean()) {
        tuning.setFloatSigma(tuning.floatSigma() * tuning.floatSigmaAdapt());
      } else {
        tuning.setFloatSigma(tuning.floatSigma() / tuning.floatSigmaAdapt());
      }
      logger.atFine().log("Float sigma adapted to %s", tuning.floatSigma());
    }
    logger.atFine().log("Generation %d: %s", generation, current);
  }

  private void invokeHook() {
    progressHook.ifPresent(hook -> hook.onGeneration(this));
  }

  @Override
  public ObjectiveFunction<P> objectiveFunction() {
    return objectiveFunction;
  }

  @Override
  public Decoder<P> decoder() {
    return decoder;
  }

  @Override
  public ImmutableList<GenerationStatistics> statistics() {
    return ImmutableList.copyOf(statistics);
  }

  @Override
  public int generation() {
    return statistics.size() - 1;
  }

  @Override
  public ImmutableList<Genotype> population() {
    return population;
  }

  @Override
  public int populationSize() {
    return populationSize;
  }

  @Override
  public boolean isPmx() {
    return config.layout().encoding() == Encoding.PERMUTATION;
  }

  @Override
  public BestFit<P> bestFit() {
    Genotype best = fittest();
    return BestFit.create(best, decoder.decode(best), best.fitness());
  }

  /** First individual of the current population with the highest raw fitness. */
  private Genotype fittest() {
    checkState(!population.isEmpty(), "Optimizer is not initialized");
    Genotype best = population.get(0);
    for (Genotype individual : population) {
      if (individual.fitness() > best.fitness()) {
        best = individual;
      }
    }
    return best;
  }

  @Override
  public TuningParameters tuning() {
    return tuning;
  }

  @Override
  public String toString() {
    GenomeLayout layout = config.layout();
    StringBuilder summary = new StringBuilder("\n");
    summary
        .append("Problem parameters:\n")
        .append(
            String.format(
                "numberOfChromosomes: %d, chromosomeLengths: %s%n",
                layout.numberOfChromosomes(), layout.chromosomeLengths()))
        .append("\nOptimizer parameters:\n")
        .append(
            String.format(
                "populationSize: %d, chromosomeSets: %d, monogamous: %s, childrenPerMating: %d, "
                    + "bestImmortal: %s, parallelEvaluation: %s%n",
                populationSize,
                layout.ploidy().layers(),
                config.monogamous(),
                config.childrenPerMating(),
                config.bestImmortal(),
                config.parallelEvaluation()))
        .append(tuning)
        .append('\n')
        .append(String.format("%nGenerations computed: %d%n", generation()))
        .append("\nCurrent population:\n")
        .append(Joiner.on("; ").join(population))
        .append('\n');
    if (layout.encoding() == Encoding.DISCRETE) {
      List<P> decoded = new ArrayList<>();
      population.forEach(individual -> decoded.add(decoder.decode(individual)));
      summary.append("Decoded:\n").append(Joiner.on("; ").join(decoded)).append('\n');
    }
    List<Double> fitness = new ArrayList<>();
    population.forEach(individual -> fitness.add(individual.fitness()));
    summary
        .append("\nFitness:\n")
        .append(Joiner.on("; ").join(fitness))
        .append('\n')
        .append("\nCurrent statistics:\n")
        .append(statistics.isEmpty() ? "none" : statistics.get(statistics.size() - 1))
        .append('\n');
    return summary.toString();
  }
}
