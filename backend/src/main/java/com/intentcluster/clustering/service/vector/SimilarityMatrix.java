package com.intentcluster.clustering.service.vector;

/**
 * Dense symmetric N x N cosine similarity matrix. Read-only once built; {@link #toArray()} and
 * {@link #row(int)} hand out copies.
 */
public final class SimilarityMatrix {

  private final double[][] values;

  SimilarityMatrix(double[][] values) {
    this.values = values;
  }

  public int size() {
    return values.length;
  }

  public double get(int row, int column) {
    return values[row][column];
  }

  public double[] row(int row) {
    return values[row].clone();
  }

  public double[][] toArray() {
    double[][] copy = new double[values.length][];
    for (int i = 0; i < values.length; i++) {
      copy[i] = values[i].clone();
    }
    return copy;
  }
}
