package io.teleops.evaluation;

/**
 * Text similarity used to grade a hypothesis against ground truth.
 * <p>
 * Implementations return values in [0, 1]; 1 means equivalent.
 */
@FunctionalInterface
public interface SimilarityFunction {

    double similarity(String a, String b);
}
