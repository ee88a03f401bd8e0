package com.verlumen.evolution.evaluation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.assistedinject.Assisted;
import com.verlumen.evolution.decoding.Decoder;
import com.verlumen.evolution.genome.Genotype;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Evaluates the objective function of a batch on a pool of worker threads.
 *
 * <p>Decoding and storing the results happen on the calling thread; only the objective function
 * runs on the workers, so it must be thread-safe. Every batch runs on the same pool of at most
 * {@code parallelism} daemon threads; idle workers exit after {@link #IDLE_TIMEOUT_SECONDS}.
 */
public final class ParallelFitnessEvaluator implements FitnessEvaluator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final ThreadFactory THREAD_FACTORY =
      new ThreadFactoryBuilder().setNameFormat("fitness-evaluator-%d").setDaemon(true).build();

  static final long IDLE_TIMEOUT_SECONDS = 60;

  private final int parallelism;
  private final ListeningExecutorService executorService;

  @Inject
  ParallelFitnessEvaluator(@Assisted int parallelism) {
    checkArgument(parallelism > 0, "Parallelism must be positive: %s", parallelism);
    this.parallelism = parallelism;
    ThreadPoolExecutor workers =
        new ThreadPoolExecutor(
            parallelism,
            parallelism,
            IDLE_TIMEOUT_SECONDS,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            THREAD_FACTORY);
    workers.allowCoreThreadTimeOut(true);
    this.executorService = MoreExecutors.listeningDecorator(workers);
  }

  @Override
  public <P> void evaluate(
      List<Genotype> pool, Decoder<P> decoder, ObjectiveFunction<P> objective) {
    if (pool.isEmpty()) {
      return;
    }
    List<P> phenotypes = new ArrayList<>(pool.size());
    for (Genotype genotype : pool) {
      phenotypes.add(decoder.decode(genotype));
    }

    List<ListenableFuture<Double>> futures = new ArrayList<>(phenotypes.size());
    try {
      for (P phenotype : phenotypes) {
        futures.add(executorService.submit(() -> objective.evaluate(phenotype)));
      }
      List<Double> fitness = Futures.allAsList(futures).get();
      for (int i = 0; i < pool.size(); i++) {
        pool.get(i).setFitness(fitness.get(i));
      }
      logger.atFinest().log(
          "Evaluated %d genotypes on %d threads", pool.size(), Math.min(parallelism, pool.size()));
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Fitness evaluation failed", cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while evaluating fitness", e);
    } finally {
      // No-op for finished tasks; stops the rest of a failed batch.
      futures.forEach(future -> future.cancel(true));
    }
  }

  public interface Factory {
    ParallelFitnessEvaluator create(int parallelism);
  }
}
