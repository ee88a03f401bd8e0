package com.verlumen.evolution.decoding;

/**
 * Thrown by {@link GenericDecoder} for a genotype it cannot interpret; such populations need a
 * custom {@link Decoder}.
 */
public final class UnsupportedGenotypeException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  UnsupportedGenotypeException(String message) {
    super(message);
  }
}
