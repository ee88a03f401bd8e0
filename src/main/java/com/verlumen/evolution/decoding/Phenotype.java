package com.verlumen.evolution.decoding;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/** The ordered argument tuple a decoded genotype passes to the objective function. */
@AutoValue
public abstract class Phenotype {
  public static Phenotype of(Object... arguments) {
    return new AutoValue_Phenotype(ImmutableList.copyOf(arguments));
  }

  public abstract ImmutableList<Object> arguments();

  public Object argument(int index) {
    return arguments().get(index);
  }

  public double getDouble(int index) {
    return ((Number) argument(index)).doubleValue();
  }

  public double[] getDoubleArray(int index) {
    return ((double[]) argument(index)).clone();
  }

  public String getString(int index) {
    return (String) argument(index);
  }

  @SuppressWarnings("unchecked") // Callers know the element type the decoder produced.
  public <T> List<T> getList(int index) {
    return (List<T>) argument(index);
  }

  @Override
  public final String toString() {
    StringBuilder builder = new StringBuilder("(");
    for (int i = 0; i < arguments().size(); i++) {
      Object argument = arguments().get(i);
      builder.append(
          argument instanceof double[] ? Arrays.toString((double[]) argument) : argument);
      builder.append(i + 1 < arguments().size() ? ", " : "");
    }
    return builder.append(")").toString();
  }
}
