package com.intentcluster.clustering.service.vector;

import java.util.List;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/**
 * Pairwise cosine similarity over unit-length feature vectors.
 *
 * <p>A zero vector has similarity 0 to every vector, itself included. Every other vector has
 * similarity exactly 1 to itself.
 */
@Slf4j
@Service
public class CosineSimilarityEngine {

  public SimilarityMatrix similarity(List<FeatureVector> vectors) {
    int n = vectors.size();
    double[][] values = new double[n][n];

    for (int i = 0; i < n; i++) {
      FeatureVector left = vectors.get(i);
      if (left.isZero()) {
        continue;
      }
      values[i][i] = 1.0;
      for (int j = i + 1; j < n; j++) {
        FeatureVector right = vectors.get(j);
        if (right.isZero()) {
          continue;
        }
        double similarity = cosine(left, right);
        values[i][j] = similarity;
        values[j][i] = similarity;
      }
    }

    log.debug("Computed {}x{} similarity matrix", n, n);
    return new SimilarityMatrix(values);
  }

  /**
   * Cosine of two sparse vectors. Vectors coming out of the vectorizer already have norm 1, but
   * the division keeps this correct for any non-zero input.
   */
  public double cosine(FeatureVector left, FeatureVector right) {
    if (left.isZero() || right.isZero()) {
      return 0.0;
    }
    double similarity = left.dot(right) / (left.norm() * right.norm());
    return Math.max(-1.0, Math.min(1.0, similarity));
  }
}
