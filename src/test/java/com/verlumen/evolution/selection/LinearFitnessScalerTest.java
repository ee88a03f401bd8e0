package com.verlumen.evolution.selection;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.genome.Genotype;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LinearFitnessScalerTest {
  private static final double TOLERANCE = 1e-9;

  private final LinearFitnessScaler scaler = new LinearFitnessScaler();

  @Test
  public void scale_keepsMeanAndStretchesMaximum() {
    // Arrange
    ImmutableList<Genotype> population = Individuals.withFitness(1, 2, 3, 6);

    // Act
    scaler.scale(population, 1, 3, 6, 1.6);

    // Assert
    assertThat(population.get(0).scaledFitness()).isWithin(TOLERANCE).of(1.8);
    assertThat(population.get(1).scaledFitness()).isWithin(TOLERANCE).of(2.4);
    assertThat(population.get(2).scaledFitness()).isWithin(TOLERANCE).of(3.0);
    assertThat(population.get(3).scaledFitness()).isWithin(TOLERANCE).of(4.8);
    assertThat(population.get(3).fitness()).isEqualTo(6.0);
  }

  @Test
  public void scale_minimumWouldTurnNegative_flattensToZero() {
    // Arrange
    ImmutableList<Genotype> population = Individuals.withFitness(2, 10, 10, 10);

    // Act
    scaler.scale(population, 2, 8, 10, 2.0);

    // Assert
    assertThat(population.get(0).scaledFitness()).isWithin(TOLERANCE).of(0.0);
    assertThat(population.get(1).scaledFitness()).isWithin(TOLERANCE).of(32.0 / 3);
    double scaledSum = 0;
    for (Genotype individual : population) {
      scaledSum += individual.scaledFitness();
    }
    assertThat(scaledSum / population.size()).isWithin(TOLERANCE).of(8.0);
  }

  @Test
  public void scale_uniformFitness_resetsScaledToRaw() {
    // Arrange
    ImmutableList<Genotype> population = Individuals.withFitness(2, 2);
    population.get(0).setScaledFitness(5);

    // Act
    scaler.scale(population, 2, 2, 2, 1.6);

    // Assert
    assertThat(population.get(0).scaledFitness()).isEqualTo(2.0);
    assertThat(population.get(1).scaledFitness()).isEqualTo(2.0);
  }

  @Test
  public void scale_neverProducesNegativeFitness() {
    // Arrange
    ImmutableList<Genotype> population = Individuals.withFitness(0, 0, 0, 0, 100);

    // Act
    scaler.scale(population, 0, 20, 100, 3.0);

    // Assert
    for (Genotype individual : population) {
      assertThat(individual.scaledFitness()).isAtLeast(0.0);
    }
  }

  @Test
  public void scale_scaleNotAboveOne_throws() {
    ImmutableList<Genotype> population = Individuals.withFitness(1, 2);

    assertThrows(IllegalArgumentException.class, () -> scaler.scale(population, 1, 1.5, 2, 1.0));
  }
}
