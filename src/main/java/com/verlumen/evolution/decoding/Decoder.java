package com.verlumen.evolution.decoding;

import com.verlumen.evolution.genome.Genotype;

/**
 * Maps a genotype to the phenotype the objective function expects.
 *
 * <p>Decoders must be side-effect free: the optimizer decodes the same genotype more than once.
 *
 * @param <P> the phenotype type
 */
@FunctionalInterface
public interface Decoder<P> {
  P decode(Genotype genotype);
}
