package com.intentcluster.clustering.service.vector;

import java.util.Arrays;

/**
 * Sparse weighted term vector. Column indices are strictly ascending and every stored weight is
 * non-zero. A vector with no entries is the zero vector.
 */
public final class FeatureVector {

  private static final FeatureVector ZERO = new FeatureVector(new int[0], new double[0]);

  private final int[] indices;
  private final double[] weights;

  private FeatureVector(int[] indices, double[] weights) {
    this.indices = indices;
    this.weights = weights;
  }

  public static FeatureVector zero() {
    return ZERO;
  }

  /**
   * Creates a vector from parallel arrays. The arrays are copied.
   *
   * @throws IllegalArgumentException if lengths differ or indices are not strictly ascending
   */
  public static FeatureVector of(int[] indices, double[] weights) {
    if (indices.length != weights.length) {
      throw new IllegalArgumentException(
          "Index and weight arrays differ in length: " + indices.length + " vs " + weights.length);
    }
    for (int i = 1; i < indices.length; i++) {
      if (indices[i] <= indices[i - 1]) {
        throw new IllegalArgumentException("Indices must be strictly ascending");
      }
    }
    if (indices.length == 0) {
      return ZERO;
    }
    return new FeatureVector(indices.clone(), weights.clone());
  }

  public boolean isZero() {
    return indices.length == 0;
  }

  public int nonZeroCount() {
    return indices.length;
  }

  public int indexAt(int position) {
    return indices[position];
  }

  public double weightAt(int position) {
    return weights[position];
  }

  /** Weight stored for a column, or 0 when the column is absent. */
  public double get(int column) {
    int position = Arrays.binarySearch(indices, column);
    return position >= 0 ? weights[position] : 0.0;
  }

  public double norm() {
    double sum = 0.0;
    for (double w : weights) {
      sum += w * w;
    }
    return Math.sqrt(sum);
  }

  /** Sparse dot product, a merge over both ascending index arrays. */
  public double dot(FeatureVector other) {
    double sum = 0.0;
    int a = 0;
    int b = 0;
    while (a < indices.length && b < other.indices.length) {
      int left = indices[a];
      int right = other.indices[b];
      if (left == right) {
        sum += weights[a++] * other.weights[b++];
      } else if (left < right) {
        a++;
      } else {
        b++;
      }
    }
    return sum;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FeatureVector)) {
      return false;
    }
    FeatureVector that = (FeatureVector) o;
    return Arrays.equals(indices, that.indices) && Arrays.equals(weights, that.weights);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(indices) + Arrays.hashCode(weights);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("FeatureVector{");
    for (int i = 0; i < indices.length; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(indices[i]).append('=').append(weights[i]);
    }
    return sb.append('}').toString();
  }
}
