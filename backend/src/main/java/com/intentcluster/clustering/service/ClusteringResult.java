package com.intentcluster.clustering.service;

import java.util.LinkedHashMap;
import java.util.List;

import com.intentcluster.clustering.service.clustering.ClusterAssignment;
import com.intentcluster.clustering.service.vector.FeatureVector;
import com.intentcluster.clustering.service.vector.SimilarityMatrix;
import com.intentcluster.clustering.service.vector.Vocabulary;

import lombok.Builder;
import lombok.Getter;

/** Everything one pipeline run produced, from the vocabulary down to the grouped utterances. */
@Getter
@Builder
public class ClusteringResult {

  private final List<String> utterances;

  private final Vocabulary vocabulary;

  private final List<FeatureVector> vectors;

  private final SimilarityMatrix similarityMatrix;

  private final ClusterAssignment assignment;

  /** Label to member utterances, ascending label order. */
  private final LinkedHashMap<Integer, List<String>> groups;

  /** Label to member positions, same order as {@link #groups}. */
  private final LinkedHashMap<Integer, List<Integer>> indexGroups;

  private final double eps;

  private final int minPts;

  private final long processingTimeMs;
}
