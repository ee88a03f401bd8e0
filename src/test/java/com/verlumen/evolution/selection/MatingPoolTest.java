package com.verlumen.evolution.selection;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MatingPoolTest {
  @Test
  public void completePair_notMonogamous_clearsExclusions() {
    // Arrange
    MatingPool pool = new MatingPool(10, false);
    pool.addFirstPartner(3);

    // Act
    pool.completePair(5);

    // Assert
    assertThat(pool.excluded()).isEmpty();
    assertThat(pool.divorceRate().isPresent()).isFalse();
  }

  @Test
  public void addFirstPartner_excludesPartnerFromSecondDraw() {
    // Arrange
    MatingPool pool = new MatingPool(10, false);

    // Act
    pool.addFirstPartner(3);

    // Assert
    assertThat(pool.excluded()).containsExactly(3);
  }

  @Test
  public void addFirstPartner_lastAvailableIndividual_clearsExclusions() {
    // Arrange
    MatingPool pool = new MatingPool(1, false);

    // Act
    pool.addFirstPartner(0);

    // Assert
    assertThat(pool.excluded()).isEmpty();
  }

  @Test
  public void completePair_monogamous_keepsCouplesExcluded() {
    // Arrange
    MatingPool pool = new MatingPool(4, true);

    // Act
    pool.addFirstPartner(0);
    pool.completePair(1);
    pool.addFirstPartner(2);

    // Assert
    assertThat(pool.excluded()).containsExactly(0, 1, 2);
  }

  @Test
  public void completePair_monogamousPopulationExhausted_divorcesEverybody() {
    // Arrange
    MatingPool pool = new MatingPool(4, true);
    pool.addFirstPartner(0);
    pool.completePair(1);
    pool.addFirstPartner(2);

    // Act
    pool.completePair(3);

    // Assert
    assertThat(pool.excluded()).isEmpty();
    assertThat(pool.divorceRate().getAsDouble()).isEqualTo(0.0);
  }

  @Test
  public void excluded_isReadOnly() {
    MatingPool pool = new MatingPool(4, true);

    assertThrows(UnsupportedOperationException.class, () -> pool.excluded().add(1));
  }

  @Test
  public void constructor_emptyPopulation_throws() {
    assertThrows(IllegalArgumentException.class, () -> new MatingPool(0, false));
  }
}
