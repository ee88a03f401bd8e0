package com.verlumen.evolution.operators;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.evolution.genome.Chromosome;
import java.util.List;
import java.util.Random;

/**
 * One-point crossover between two haploid genomes.
 *
 * <p>Used directly to produce haploid children and, during meiosis, to recombine the two chromosome
 * sets of a diploid parent into gametes.
 */
public final class SimpleCrossover {
  @Inject
  SimpleCrossover() {}

  /**
   * Produces {@code numberOfChildren} haploid genomes from two haploid parents.
   *
   * <p>Children come in pairs. For every pair and every chromosome, a crossover point in {@code [1,
   * length - 1]} is drawn with probability {@code pCrossover}; the first child of the pair takes
   * the genes of {@code first} before that point and those of {@code second} from it on, the
   * second child the other way round. Without a crossover the children are copies of the parents.
   */
  public ImmutableList<ImmutableList<Chromosome>> cross(
      List<Chromosome> first,
      List<Chromosome> second,
      int numberOfChildren,
      double pCrossover,
      Random random,
      OperatorCounts counts) {
    checkArgument(
        numberOfChildren > 0 && numberOfChildren % 2 == 0,
        "Number of children must be a positive multiple of 2: %s",
        numberOfChildren);
    checkArgument(first.size() == second.size(), "Parents must have the same chromosome count");

    ImmutableList.Builder<ImmutableList<Chromosome>> children = ImmutableList.builder();
    for (int n = 0; n < numberOfChildren; n += 2) {
      ImmutableList.Builder<Chromosome> child = ImmutableList.builder();
      ImmutableList.Builder<Chromosome> sibling = ImmutableList.builder();
      for (int i = 0; i < first.size(); i++) {
        Chromosome mother = first.get(i);
        Chromosome father = second.get(i);
        checkArgument(
            mother.layers() == 1 && father.layers() == 1, "Crossover needs haploid chromosomes");
        checkArgument(mother.length() == father.length(), "Chromosome %s lengths differ", i);
        int length = mother.length();
        int point = length;
        if (random.nextDouble() < pCrossover && length > 1) {
          point = 1 + random.nextInt(length - 1);
          counts.recordCrossover();
        }
        child.add(splice(mother, father, point));
        sibling.add(splice(father, mother, point));
      }
      children.add(child.build());
      children.add(sibling.build());
    }
    return children.build();
  }

  private static Chromosome splice(Chromosome head, Chromosome tail, int point) {
    Chromosome result = Chromosome.create(head.length(), 1);
    for (int j = 0; j < head.length(); j++) {
      result.set(0, j, j < point ? head.get(0, j) : tail.get(0, j));
    }
    return result;
  }
}
