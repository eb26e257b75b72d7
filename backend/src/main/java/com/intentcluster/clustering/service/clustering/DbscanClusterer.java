package com.intentcluster.clustering.service.clustering;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

import org.springframework.stereotype.Service;

import com.intentcluster.clustering.exception.InvalidClusteringParameterException;

import lombok.extern.slf4j.Slf4j;

/**
 * DBSCAN over dense feature rows with cosine distance {@code 1 - cos(a, b)}.
 *
 * <p>Traversal is fixed: seeds are taken in ascending index order and each cluster is expanded
 * breadth-first, scanning neighbours in ascending index order. A border point reachable from
 * more than one cluster stays in the first cluster that reaches it. Labels are numbered from 0
 * in order of discovery.
 *
 * <p>A row of zeros has no direction. It is treated as having cosine 0 to every row, itself
 * included, so for any {@code eps < 1} it is outside its own neighbourhood and can never be a
 * core point.
 */
@Slf4j
@Service
public class DbscanClusterer {

  /**
   * Labels every row as a member of a cluster or as {@link ClusterAssignment#NOISE}.
   *
   * @param features one row per point, all rows of equal length
   * @param eps neighbourhood radius in cosine distance, must be positive
   * @param minPts minimum neighbourhood size (point itself included) of a core point, at least 1
   * @return the label of every row
   * @throws InvalidClusteringParameterException if {@code eps} or {@code minPts} is out of range
   */
  public ClusterAssignment cluster(double[][] features, double eps, int minPts) {
    checkParameters(eps, minPts);

    int n = features.length;
    if (n == 0) {
      return ClusterAssignment.empty();
    }

    double[][] distances = pairwiseDistances(features);
    int[][] neighbourhoods = new int[n][];
    boolean[] core = new boolean[n];
    for (int p = 0; p < n; p++) {
      neighbourhoods[p] = regionQuery(distances[p], eps);
      core[p] = neighbourhoods[p].length >= minPts;
    }

    int[] labels = new int[n];
    Arrays.fill(labels, ClusterAssignment.NOISE);
    int nextLabel = 0;

    for (int seed = 0; seed < n; seed++) {
      if (labels[seed] != ClusterAssignment.NOISE || !core[seed]) {
        continue;
      }
      expandCluster(seed, nextLabel, neighbourhoods, core, labels);
      nextLabel++;
    }

    ClusterAssignment assignment = new ClusterAssignment(labels);
    log.debug(
        "DBSCAN eps={} minPts={} over {} points: {} clusters, {} noise",
        eps,
        minPts,
        n,
        assignment.clusterCount(),
        assignment.noiseCount());
    return assignment;
  }

  /**
   * Cosine distance between two rows, clamped to [0, 2]. Zero rows are at distance 1 from
   * everything.
   */
  public double cosineDistance(double[] left, double[] right) {
    double leftNorm = norm(left);
    double rightNorm = norm(right);
    if (leftNorm == 0.0 || rightNorm == 0.0) {
      return 1.0;
    }
    return clamp(1.0 - dot(left, right) / (leftNorm * rightNorm));
  }

  public static void checkParameters(double eps, int minPts) {
    if (Double.isNaN(eps) || Double.isInfinite(eps) || eps <= 0.0) {
      throw new InvalidClusteringParameterException(
          "eps", "eps must be a positive finite number, got " + eps);
    }
    if (minPts < 1) {
      throw new InvalidClusteringParameterException(
          "minPts", "minPts must be at least 1, got " + minPts);
    }
  }

  private void expandCluster(
      int seed, int label, int[][] neighbourhoods, boolean[] core, int[] labels) {
    Deque<Integer> frontier = new ArrayDeque<>();
    labels[seed] = label;
    frontier.add(seed);

    while (!frontier.isEmpty()) {
      int point = frontier.poll();
      // only core points are queued, so every neighbour here is density-reachable
      for (int neighbour : neighbourhoods[point]) {
        if (labels[neighbour] != ClusterAssignment.NOISE) {
          continue;
        }
        labels[neighbour] = label;
        if (core[neighbour]) {
          frontier.add(neighbour);
        }
      }
    }
  }

  private double[][] pairwiseDistances(double[][] features) {
    int n = features.length;
    int dimension = features[0].length;
    double[] norms = new double[n];
    for (int i = 0; i < n; i++) {
      if (features[i].length != dimension) {
        throw new IllegalArgumentException(
            "Feature row " + i + " has length " + features[i].length + ", expected " + dimension);
      }
      norms[i] = norm(features[i]);
    }

    double[][] distances = new double[n][n];
    for (int i = 0; i < n; i++) {
      if (norms[i] == 0.0) {
        for (int j = 0; j < n; j++) {
          distances[i][j] = 1.0;
          distances[j][i] = 1.0;
        }
        continue;
      }
      distances[i][i] = 0.0;
      for (int j = i + 1; j < n; j++) {
        double distance =
            norms[j] == 0.0
                ? 1.0
                : clamp(1.0 - dot(features[i], features[j]) / (norms[i] * norms[j]));
        distances[i][j] = distance;
        distances[j][i] = distance;
      }
    }
    return distances;
  }

  private int[] regionQuery(double[] distanceRow, double eps) {
    int[] buffer = new int[distanceRow.length];
    int count = 0;
    for (int q = 0; q < distanceRow.length; q++) {
      if (distanceRow[q] <= eps) {
        buffer[count++] = q;
      }
    }
    return Arrays.copyOf(buffer, count);
  }

  private static double dot(double[] left, double[] right) {
    double sum = 0.0;
    for (int i = 0; i < left.length; i++) {
      sum += left[i] * right[i];
    }
    return sum;
  }

  private static double norm(double[] row) {
    return Math.sqrt(dot(row, row));
  }

  private static double clamp(double distance) {
    return Math.max(0.0, Math.min(2.0, distance));
  }
}
