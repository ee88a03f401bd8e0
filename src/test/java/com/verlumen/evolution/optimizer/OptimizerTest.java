package com.verlumen.evolution.optimizer;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.evolution.decoding.Decoder;
import com.verlumen.evolution.decoding.GenericDecoder;
import com.verlumen.evolution.decoding.Phenotype;
import com.verlumen.evolution.evaluation.ObjectiveFunction;
import com.verlumen.evolution.genome.AlleleAlphabet;
import com.verlumen.evolution.genome.Alphabets;
import com.verlumen.evolution.genome.Genotype;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Runs seeded optimizations end to end. */
@RunWith(JUnit4.class)
public class OptimizerTest {
  private static final long SEED = 42;

  // Fifth-degree polynomial on [0, 1] peaking at 1 for x = 0.15.
  private static final double[] COEFFICIENTS = {
    0, 16.8808211213239, -95.9080356878612, 214.767969260518, -206.190728636476, 70.4499739424963
  };

  private static final ObjectiveFunction<Phenotype> POLYNOMIAL =
      phenotype -> polynomial(phenotype.getDouble(0));

  private static final double[][] CITIES = {
    {0.1, 0.2}, {0.8, 0.1}, {0.9, 0.7}, {0.4, 0.9}, {0.2, 0.6}
  };

  @Inject private OptimizerFactory factory;

  @Before
  public void setUp() {
    Guice.createInjector(OptimizerModule.create()).injectMembers(this);
  }

  @Test
  public void run_haploidBinary_findsMaximum() {
    // Arrange
    Optimizer<Phenotype> optimizer = factory.create(binary().build());

    // Act
    optimizer.run(20);

    // Assert
    assertThat(optimizer.bestFit().fitness()).isGreaterThan(0.99);
    assertThat(optimizer.generation()).isEqualTo(20);
    assertThat(optimizer.statistics()).hasSize(21);
    assertThat(optimizer.population()).hasSize(30);
    assertThat(optimizer.populationSize()).isEqualTo(30);
  }

  @Test
  public void run_maxFitnessReached_stopsEarly() {
    // Arrange
    Optimizer<Phenotype> optimizer = factory.create(binary().build());

    // Act
    optimizer.run(20, 0.5);

    // Assert
    assertThat(optimizer.generation()).isLessThan(20);
    assertThat(optimizer.bestFit().fitness()).isAtLeast(0.5);
    assertStoppedAtFirstGenerationReaching(optimizer, 0.5);
  }

  @Test
  public void run_highMaxFitness_stopsAtFirstGenerationReachingIt() {
    // Arrange
    Optimizer<Phenotype> optimizer = factory.create(binary().build());

    // Act
    optimizer.run(20, 0.99);

    // Assert
    assertThat(optimizer.bestFit().fitness()).isAtLeast(0.99);
    assertStoppedAtFirstGenerationReaching(optimizer, 0.99);
  }

  @Test
  public void run_diploid_findsMaximum() {
    // Arrange
    Optimizer<Phenotype> optimizer = factory.create(binary().setChromosomeSets(2).build());

    // Act
    optimizer.run(20);

    // Assert
    assertThat(optimizer.bestFit().fitness()).isGreaterThan(0.99);
    assertThat(optimizer.bestFit().genotype().isDiploid()).isTrue();
  }

  @Test
  public void run_continuous_findsMaximum() {
    // Arrange
    Optimizer<Phenotype> optimizer =
        factory.create(
            OptimizerConfig.builder(POLYNOMIAL)
                .setChromosomeLength(1)
                .setPopulationSize(30)
                .setAlleleAlphabet(AlleleAlphabet.continuous())
                .setRandomSeed(SEED)
                .build());

    // Act
    optimizer.run(40);

    // Assert
    assertThat(optimizer.bestFit().fitness()).isGreaterThan(0.99);
    assertThat(optimizer.bestFit().phenotype().getDouble(0)).isWithin(0.03).of(0.15);
  }

  @Test
  public void run_continuous_adaptsFloatSigmaEveryFiveGenerations() {
    // Arrange
    List<Double> sigmas = new ArrayList<>();
    Optimizer<Phenotype> optimizer =
        factory.create(
            OptimizerConfig.builder(POLYNOMIAL)
                .setChromosomeLength(1)
                .setPopulationSize(30)
                .setAlleleAlphabet(AlleleAlphabet.continuous())
                .setProgressHook(running -> sigmas.add(running.tuning().floatSigma()))
                .setRandomSeed(SEED)
                .build());

    // Act
    optimizer.run(20);

    // Assert
    assertThat(sigmas).hasSize(21);
    assertThat(sigmas.get(0)).isEqualTo(OptimizerDefaults.FLOAT_SIGMA);
    double adapt = optimizer.tuning().floatSigmaAdapt();
    ImmutableList<GenerationStatistics> statistics = optimizer.statistics();
    for (int generation = 1; generation <= 20; generation++) {
      double expected = sigmas.get(generation - 1);
      if (generation % 5 == 0) {
        boolean improved =
            statistics.get(generation).mean() > statistics.get(generation - 5).mean();
        expected = improved ? expected * adapt : expected / adapt;
      }
      assertThat(sigmas.get(generation)).isWithin(1e-12).of(expected);
    }
    assertThat(sigmas.get(5)).isNotEqualTo(OptimizerDefaults.FLOAT_SIGMA);
  }

  @Test
  public void run_characters_findsPassword() {
    // Arrange
    String password = "Hello";
    ObjectiveFunction<Phenotype> matches =
        phenotype -> {
          String guess = phenotype.getString(0);
          int hits = 0;
          for (int i = 0; i < password.length(); i++) {
            hits += guess.charAt(i) == password.charAt(i) ? 1 : 0;
          }
          return (double) hits / password.length();
        };
    Optimizer<Phenotype> optimizer =
        factory.create(
            OptimizerConfig.builder(matches)
                .setChromosomeLength(password.length())
                .setPopulationSize(10)
                .setAlleleAlphabet(Alphabets.ALPHANUMERIC)
                .setRandomSeed(SEED)
                .build());

    // Act
    optimizer.run(800, 1.0);

    // Assert
    assertThat(optimizer.bestFit().phenotype().getString(0)).isEqualTo(password);
    assertThat(optimizer.bestFit().fitness()).isEqualTo(1.0);
  }

  @Test
  public void run_withoutImmortalBest_stillConverges() {
    // Arrange
    Optimizer<Phenotype> optimizer =
        factory.create(binary().setPopulationSize(20).setBestImmortal(false).build());

    // Act
    optimizer.run(20);

    // Assert
    assertThat(optimizer.bestFit().fitness()).isGreaterThan(0.99);
    assertThat(optimizer.population()).hasSize(20);
  }

  @Test
  public void run_pmx_solvesSmallTravelingSalesman() {
    // Arrange
    double shortest = shortestTour();
    ObjectiveFunction<Phenotype> inverseLength =
        phenotype -> shortest / tourLength(phenotype.getList(0));
    Optimizer<Phenotype> optimizer =
        factory.create(
            OptimizerConfig.builder(inverseLength)
                .setChromosomeLength(CITIES.length)
                .setPopulationSize(30)
                .setPmx(true)
                .setRandomSeed(SEED)
                .build());

    // Act
    optimizer.run(80);

    // Assert
    assertThat(optimizer.isPmx()).isTrue();
    assertThat(optimizer.bestFit().fitness()).isWithin(1e-12).of(1.0);
    for (Genotype individual : optimizer.population()) {
      assertThat(individual.chromosome(0).isPermutation(0)).isTrue();
    }
  }

  @Test
  public void run_parallelEvaluation_matchesSequentialRun() {
    // Arrange
    Optimizer<Phenotype> sequential = factory.create(binary().build());
    Optimizer<Phenotype> parallel = factory.create(binary().setParallelEvaluation(true).build());

    // Act
    sequential.run(20);
    parallel.run(20);

    // Assert
    assertThat(parallel.bestFit().fitness()).isEqualTo(sequential.bestFit().fitness());
    assertThat(parallel.statistics().get(20).mean())
        .isEqualTo(sequential.statistics().get(20).mean());
  }

  @Test
  public void run_monogamous_recordsDivorceRate() {
    // Arrange
    Optimizer<Phenotype> optimizer = factory.create(binary().setMonogamous(true).build());

    // Act
    optimizer.run(20);

    // Assert
    assertThat(optimizer.bestFit().fitness()).isGreaterThan(0.99);
    for (GenerationStatistics statistics : optimizer.statistics()) {
      assertThat(statistics.divorceRate().isPresent()).isTrue();
    }
  }

  @Test
  public void run_notMonogamous_recordsNoDivorceRate() {
    // Arrange
    Optimizer<Phenotype> optimizer = factory.create(binary().build());

    // Act
    optimizer.run(3);

    // Assert
    for (GenerationStatistics statistics : optimizer.statistics()) {
      assertThat(statistics.divorceRate().isPresent()).isFalse();
    }
  }

  @Test
  public void run_fourChildrenPerMating_findsMaximum() {
    // Arrange
    Optimizer<Phenotype> optimizer = factory.create(binary().setChildrenPerMating(4).build());

    // Act
    optimizer.run(20);

    // Assert
    assertThat(optimizer.bestFit().fitness()).isGreaterThan(0.99);
    assertThat(optimizer.population()).hasSize(30);
  }

  @Test
  public void run_populationGrowth_growsPopulationEveryGeneration() {
    // Arrange
    Optimizer<Phenotype> optimizer =
        factory.create(binary().setPopulationSize(20).setPopulationGrowth(1.1).build());

    // Act
    optimizer.run(20);

    // Assert
    assertThat(optimizer.populationSize()).isEqualTo(132);
    assertThat(optimizer.population()).hasSize(132);
    assertThat(optimizer.bestFit().fitness()).isGreaterThan(0.99);
  }

  @Test
  public void run_hook_isCalledAfterEveryGeneration() {
    // Arrange
    AtomicInteger calls = new AtomicInteger();
    Optimizer<Phenotype> optimizer =
        factory.create(binary().setProgressHook(unused -> calls.incrementAndGet()).build());
    int afterCreation = calls.get();

    // Act
    optimizer.run(20);

    // Assert
    assertThat(afterCreation).isEqualTo(1);
    assertThat(calls.get()).isEqualTo(21);
  }

  @Test
  public void run_hookChangesTuning_takesEffectNextGeneration() {
    // Arrange
    ProgressHook<Phenotype> freeze =
        running -> {
          running.tuning().setCrossoverProbability(0);
          running.tuning().setMutationProbability(0);
        };
    Optimizer<Phenotype> optimizer = factory.create(binary().setProgressHook(freeze).build());

    // Act
    optimizer.run(5);

    // Assert
    for (GenerationStatistics statistics : optimizer.statistics()) {
      assertThat(statistics.crossovers()).isEqualTo(0);
      assertThat(statistics.mutations()).isEqualTo(0);
    }
  }

  @Test
  public void run_withInversion_countsInversions() {
    // Arrange
    Optimizer<Phenotype> optimizer = factory.create(binary().setInversionProbability(0.1).build());

    // Act
    optimizer.run(5);

    // Assert
    int inversions = 0;
    for (GenerationStatistics statistics : optimizer.statistics()) {
      inversions += statistics.inversions();
    }
    assertThat(inversions).isGreaterThan(0);
  }

  @Test
  public void run_decodesOnlyForEvaluationAndBestFit() {
    // Arrange
    AtomicInteger decodes = new AtomicInteger();
    AtomicInteger evaluations = new AtomicInteger();
    GenericDecoder generic = new GenericDecoder();
    Decoder<Phenotype> counting =
        genotype -> {
          decodes.incrementAndGet();
          return generic.decode(genotype);
        };
    ObjectiveFunction<Phenotype> objective =
        phenotype -> {
          evaluations.incrementAndGet();
          return POLYNOMIAL.evaluate(phenotype);
        };
    Optimizer<Phenotype> optimizer =
        factory.create(
            OptimizerConfig.builder(objective, counting)
                .setChromosomeLength(32)
                .setPopulationSize(30)
                .setRandomSeed(SEED)
                .build());

    // Act
    optimizer.run(5, 2.0);
    int decodesAfterRun = decodes.get();
    optimizer.bestFit();

    // Assert
    assertThat(decodesAfterRun).isEqualTo(evaluations.get());
    assertThat(decodes.get()).isEqualTo(decodesAfterRun + 1);
  }

  @Test
  public void run_resumed_continuesWhereItStopped() {
    // Arrange
    Optimizer<Phenotype> once = factory.create(binary().build());
    Optimizer<Phenotype> twice = factory.create(binary().build());

    // Act
    once.run(20);
    twice.run(10);
    twice.run(10);

    // Assert
    assertThat(twice.generation()).isEqualTo(20);
    assertThat(twice.bestFit().fitness()).isEqualTo(once.bestFit().fitness());
  }

  @Test
  public void statistics_meanLiesBetweenMinAndMax() {
    // Arrange
    Optimizer<Phenotype> optimizer = factory.create(binary().build());

    // Act
    optimizer.run(20);

    // Assert
    for (GenerationStatistics statistics : optimizer.statistics()) {
      assertThat(statistics.mean()).isAtLeast(statistics.min());
      assertThat(statistics.mean()).isAtMost(statistics.max());
      assertThat(statistics.variance()).isAtLeast(0.0);
    }
  }

  @Test
  public void create_evaluatesInitialGeneration() {
    // Act
    Optimizer<Phenotype> optimizer = factory.create(binary().build());

    // Assert
    assertThat(optimizer.generation()).isEqualTo(0);
    assertThat(optimizer.statistics()).hasSize(1);
    for (Genotype individual : optimizer.population()) {
      assertThat(individual.hasFitness()).isTrue();
    }
  }

  @Test
  public void toString_summarizesState() {
    // Arrange
    Optimizer<Phenotype> optimizer = factory.create(binary().build());

    // Act
    optimizer.run(2);

    // Assert
    assertThat(optimizer.toString()).contains("Generations computed: 2");
    assertThat(optimizer.toString()).contains("chromosomeLengths: [32]");
  }

  @Test
  public void run_negativeGenerations_throws() {
    Optimizer<Phenotype> optimizer = factory.create(binary().build());

    assertThrows(IllegalArgumentException.class, () -> optimizer.run(-1));
  }

  private static void assertStoppedAtFirstGenerationReaching(
      Optimizer<Phenotype> optimizer, double maxFitness) {
    int last = optimizer.generation();
    assertThat(optimizer.statistics().get(last).max()).isAtLeast(maxFitness);
    assertThat(optimizer.statistics().get(last).max()).isEqualTo(optimizer.bestFit().fitness());
    for (int generation = 1; generation < last; generation++) {
      assertThat(optimizer.statistics().get(generation).max()).isLessThan(maxFitness);
    }
  }

  private static OptimizerConfig.Builder<Phenotype> binary() {
    return OptimizerConfig.builder(POLYNOMIAL)
        .setChromosomeLength(32)
        .setPopulationSize(30)
        .setRandomSeed(SEED);
  }

  private static double polynomial(double x) {
    double sum = 0;
    for (int power = 0; power < COEFFICIENTS.length; power++) {
      sum += COEFFICIENTS[power] * Math.pow(x, power);
    }
    return Math.max(0, sum);
  }

  private static double tourLength(List<Integer> tour) {
    double length = 0;
    for (int i = 0; i < tour.size(); i++) {
      double[] from = CITIES[tour.get(i)];
      double[] to = CITIES[tour.get((i + 1) % tour.size())];
      double dx = from[0] - to[0];
      double dy = from[1] - to[1];
      length += Math.sqrt(dx * dx + dy * dy);
    }
    return length;
  }

  private static double shortestTour() {
    return shortestTour(new ArrayList<>(), new boolean[CITIES.length]);
  }

  private static double shortestTour(List<Integer> prefix, boolean[] used) {
    if (prefix.size() == CITIES.length) {
      return tourLength(prefix);
    }
    double shortest = Double.MAX_VALUE;
    for (int city = 0; city < CITIES.length; city++) {
      if (!used[city]) {
        used[city] = true;
        prefix.add(city);
        shortest = Math.min(shortest, shortestTour(prefix, used));
        prefix.remove(prefix.size() - 1);
        used[city] = false;
      }
    }
    return shortest;
  }
}
