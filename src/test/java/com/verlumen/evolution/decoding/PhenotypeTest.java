package com.verlumen.evolution.decoding;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PhenotypeTest {
  @Test
  public void getDoubleArray_returnsCopy() {
    // Arrange
    Phenotype phenotype = Phenotype.of(new double[] {1.0, 2.0});

    // Act
    phenotype.getDoubleArray(0)[0] = 5.0;

    // Assert
    assertThat(phenotype.getDoubleArray(0)[0]).isEqualTo(1.0);
  }

  @Test
  public void toString_rendersArrayContents() {
    assertThat(Phenotype.of(new double[] {0.5, 0.25}, "abc").toString())
        .isEqualTo("([0.5, 0.25], abc)");
  }
}
