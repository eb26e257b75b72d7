package com.intentcluster.clustering.service.clustering;

import java.util.Arrays;

/** One cluster label per utterance, by position. {@link #NOISE} marks unclustered items. */
public final class ClusterAssignment {

  public static final int NOISE = -1;

  private final int[] labels;

  public ClusterAssignment(int[] labels) {
    this.labels = labels.clone();
  }

  public static ClusterAssignment empty() {
    return new ClusterAssignment(new int[0]);
  }

  public int size() {
    return labels.length;
  }

  public int labelOf(int index) {
    return labels[index];
  }

  public boolean isNoise(int index) {
    return labels[index] == NOISE;
  }

  public int[] toArray() {
    return labels.clone();
  }

  /** Number of distinct non-noise labels. */
  public int clusterCount() {
    return (int) Arrays.stream(labels).filter(label -> label != NOISE).distinct().count();
  }

  public int noiseCount() {
    return (int) Arrays.stream(labels).filter(label -> label == NOISE).count();
  }

  /** True when both items carry the same non-noise label. */
  public boolean sameCluster(int first, int second) {
    return labels[first] != NOISE && labels[first] == labels[second];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ClusterAssignment)) {
      return false;
    }
    return Arrays.equals(labels, ((ClusterAssignment) o).labels);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(labels);
  }

  @Override
  public String toString() {
    return "ClusterAssignment" + Arrays.toString(labels);
  }
}
