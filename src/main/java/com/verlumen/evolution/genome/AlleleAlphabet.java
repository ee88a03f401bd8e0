package com.verlumen.evolution.genome;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * The set of values a gene may take.
 *
 * <p>An alphabet is either an ordered, finite list of symbols (numbers or characters) or the
 * continuous unit interval. Genes of a discrete chromosome hold the index of their symbol in this
 * list; genes of a continuous chromosome hold the real value itself.
 */
@AutoValue
public abstract class AlleleAlphabet {
  private static final AlleleAlphabet CONTINUOUS =
      new AutoValue_AlleleAlphabet(true, ImmutableList.of());

  /** Returns the alphabet of all real numbers in [0, 1]. */
  public static AlleleAlphabet continuous() {
    return CONTINUOUS;
  }

  public static AlleleAlphabet of(Object... symbols) {
    return of(Arrays.asList(symbols));
  }

  /**
   * Creates a discrete alphabet from the given symbols, in order.
   *
   * <p>No validation beyond null checks happens here; the optimizer configuration decides whether
   * an alphabet is usable.
   */
  public static AlleleAlphabet of(List<?> symbols) {
    checkNotNull(symbols, "Symbols cannot be null");
    return new AutoValue_AlleleAlphabet(false, ImmutableList.copyOf(symbols));
  }

  /** Creates an alphabet with one symbol per character of {@code characters}. */
  public static AlleleAlphabet ofCharacters(String characters) {
    checkNotNull(characters, "Characters cannot be null");
    ImmutableList.Builder<Object> symbols = ImmutableList.builder();
    characters.chars().forEach(c -> symbols.add((char) c));
    return new AutoValue_AlleleAlphabet(false, symbols.build());
  }

  /** Creates the alphabet of the integers {@code 0 .. size - 1}. */
  public static AlleleAlphabet range(int size) {
    checkArgument(size > 0, "Alphabet size must be positive: %s", size);
    return of(IntStream.range(0, size).boxed().collect(ImmutableList.toImmutableList()));
  }

  public abstract boolean isContinuous();

  /** The symbols of a discrete alphabet; empty for the continuous alphabet. */
  public abstract ImmutableList<Object> symbols();

  public int size() {
    checkState(!isContinuous(), "The continuous alphabet has no finite size");
    return symbols().size();
  }

  public Object symbol(int index) {
    checkState(!isContinuous(), "The continuous alphabet has no symbols");
    checkElementIndex(index, symbols().size());
    return symbols().get(index);
  }

  /**
   * Returns the index of {@code symbol}, or -1 if it is not part of this alphabet. Numbers are
   * compared by value, so {@code 1}, {@code 1L} and {@code 1.0} all match the same symbol.
   */
  public int indexOf(Object symbol) {
    for (int i = 0; i < symbols().size(); i++) {
      if (sameSymbol(symbols().get(i), symbol)) {
        return i;
      }
    }
    return -1;
  }

  public boolean isNumeric() {
    return !isContinuous()
        && !symbols().isEmpty()
        && symbols().stream().allMatch(symbol -> symbol instanceof Number);
  }

  /** True if every symbol is a printable character. */
  public boolean isCharacterAlphabet() {
    return !isContinuous()
        && !symbols().isEmpty()
        && symbols().stream().allMatch(AlleleAlphabet::isPrintableCharacter);
  }

  /** True if this alphabet consists of exactly the given numbers, in the given order. */
  public boolean hasNumericValues(double... values) {
    if (!isNumeric() || symbols().size() != values.length) {
      return false;
    }
    for (int i = 0; i < values.length; i++) {
      if (((Number) symbols().get(i)).doubleValue() != values[i]) {
        return false;
      }
    }
    return true;
  }

  /** True if no two symbols are equal (numbers compared by value). */
  public boolean hasDistinctSymbols() {
    for (int i = 0; i < symbols().size(); i++) {
      if (indexOf(symbols().get(i)) != i) {
        return false;
      }
    }
    return true;
  }

  private static boolean sameSymbol(Object a, Object b) {
    if (a instanceof Number && b instanceof Number) {
      return ((Number) a).doubleValue() == ((Number) b).doubleValue();
    }
    return a.equals(b);
  }

  private static boolean isPrintableCharacter(Object symbol) {
    if (!(symbol instanceof Character)) {
      return false;
    }
    char c = (Character) symbol;
    return Character.isDefined(c) && !Character.isISOControl(c);
  }
}
