package com.verlumen.evolution.genome;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class PloidyTest {
  @Test
  public void fromChromosomeSets_roundTripsLayers(@TestParameter Ploidy ploidy) {
    assertThat(Ploidy.fromChromosomeSets(ploidy.layers())).isEqualTo(ploidy);
  }

  @Test
  public void fromChromosomeSets_unsupportedCount_throws(
      @TestParameter({"0", "3", "-1"}) int chromosomeSets) {
    assertThrows(
        IllegalArgumentException.class, () -> Ploidy.fromChromosomeSets(chromosomeSets));
  }
}
