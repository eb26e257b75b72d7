package com.intentcluster.clustering.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.intentcluster.clustering.config.ApplicationProperties;
import com.intentcluster.clustering.dto.clustering.ClusteringRequest;
import com.intentcluster.clustering.dto.clustering.ClusteringResponse;
import com.intentcluster.clustering.dto.clustering.ClusteringResponse.ProcessingMetadata;
import com.intentcluster.clustering.dto.clustering.ClusteringResponse.UtteranceCluster;
import com.intentcluster.clustering.service.clustering.ClusterAssignment;
import com.intentcluster.clustering.service.clustering.ClusterResultAggregator;
import com.intentcluster.clustering.service.clustering.DbscanClusterer;
import com.intentcluster.clustering.service.text.TextNormalizer;
import com.intentcluster.clustering.service.vector.CosineSimilarityEngine;
import com.intentcluster.clustering.service.vector.FeatureVector;
import com.intentcluster.clustering.service.vector.SimilarityMatrix;
import com.intentcluster.clustering.service.vector.TfIdfVectorizer;
import com.intentcluster.clustering.service.vector.VectorizationResult;
import com.intentcluster.clustering.service.vector.Vocabulary;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the clustering pipeline: normalize, vectorize, compare, cluster, group.
 *
 * <p>The density step clusters the rows of the similarity matrix rather than the TF-IDF vectors
 * themselves, with cosine distance applied on top. Both steps are intentional and together
 * define cluster membership.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentClusteringService {

  private final TextNormalizer normalizer;
  private final TfIdfVectorizer vectorizer;
  private final CosineSimilarityEngine similarityEngine;
  private final DbscanClusterer clusterer;
  private final ClusterResultAggregator aggregator;
  private final ApplicationProperties properties;

  /**
   * Clusters one batch of utterances.
   *
   * @param utterances raw utterances in input order; {@code null} entries count as empty text
   * @param eps neighbourhood radius in cosine distance, positive
   * @param minPts minimum core neighbourhood size, at least 1
   * @return labels and groups for the batch
   * @throws com.intentcluster.clustering.exception.InvalidClusteringParameterException if a
   *     parameter is out of range; nothing is computed in that case
   */
  public ClusteringResult cluster(List<String> utterances, double eps, int minPts) {
    long startTime = System.currentTimeMillis();
    DbscanClusterer.checkParameters(eps, minPts);

    List<String> batch =
        utterances.stream().map(u -> u == null ? "" : u).collect(Collectors.toList());
    log.info("Clustering {} utterances with eps={} minPts={}", batch.size(), eps, minPts);

    List<List<String>> tokenSequences = new ArrayList<>(batch.size());
    for (String utterance : batch) {
      tokenSequences.add(normalizer.normalize(utterance));
    }

    VectorizationResult vectorization = vectorizer.fitTransform(tokenSequences);
    List<FeatureVector> vectors = vectorization.getVectors();
    long zeroVectors = vectors.stream().filter(FeatureVector::isZero).count();
    if (zeroVectors > 0) {
      log.debug("{} utterances have no content tokens", zeroVectors);
    }

    SimilarityMatrix similarity = similarityEngine.similarity(vectors);
    ClusterAssignment assignment = clusterer.cluster(similarity.toArray(), eps, minPts);

    ClusteringResult result =
        ClusteringResult.builder()
            .utterances(List.copyOf(batch))
            .vocabulary(vectorization.getVocabulary())
            .vectors(vectors)
            .similarityMatrix(similarity)
            .assignment(assignment)
            .groups(aggregator.aggregate(batch, assignment))
            .indexGroups(aggregator.groupIndices(assignment))
            .eps(eps)
            .minPts(minPts)
            .processingTimeMs(System.currentTimeMillis() - startTime)
            .build();

    log.info(
        "Clustered {} utterances into {} clusters ({} noise, vocabulary {}) in {} ms",
        batch.size(),
        assignment.clusterCount(),
        assignment.noiseCount(),
        vectorization.getVocabulary().size(),
        result.getProcessingTimeMs());
    return result;
  }

  /**
   * Resolves request defaults, enforces the batch limit and maps the result for the API.
   *
   * @throws IllegalArgumentException if the batch exceeds the configured maximum
   */
  public ClusteringResponse clusterUtterances(ClusteringRequest request) {
    List<String> utterances = request.getUtterances() == null ? List.of() : request.getUtterances();
    int maxUtterances = properties.getLimits().getMaxUtterances();
    if (utterances.size() > maxUtterances) {
      throw new IllegalArgumentException(
          "Batch of "
              + utterances.size()
              + " utterances exceeds the maximum of "
              + maxUtterances);
    }

    double eps = request.getEps() != null ? request.getEps() : properties.getDefaults().getEps();
    int minPts =
        request.getMinPts() != null ? request.getMinPts() : properties.getDefaults().getMinPts();

    ClusteringResult result = cluster(utterances, eps, minPts);
    boolean includeMatrix = Boolean.TRUE.equals(request.getIncludeSimilarityMatrix());
    return toResponse(result, includeMatrix);
  }

  ClusteringResponse toResponse(ClusteringResult result, boolean includeSimilarityMatrix) {
    List<UtteranceCluster> clusters = new ArrayList<>();
    for (Map.Entry<Integer, List<String>> group : result.getGroups().entrySet()) {
      int label = group.getKey();
      boolean noise = label == ClusterAssignment.NOISE;
      clusters.add(
          UtteranceCluster.builder()
              .label(label)
              .noise(noise)
              .size(group.getValue().size())
              .utterances(group.getValue())
              .topTerms(
                  noise
                      ? null
                      : topTerms(
                          result.getVocabulary(),
                          result.getVectors(),
                          result.getIndexGroups().get(label),
                          properties.getTopTerms()))
              .build());
    }

    ClusterAssignment assignment = result.getAssignment();
    ProcessingMetadata metadata =
        ProcessingMetadata.builder()
            .totalUtterances(assignment.size())
            .vocabularySize(result.getVocabulary().size())
            .clusterCount(assignment.clusterCount())
            .noiseCount(assignment.noiseCount())
            .eps(result.getEps())
            .minPts(result.getMinPts())
            .processingTimeMs(result.getProcessingTimeMs())
            .build();

    return ClusteringResponse.builder()
        .clusters(clusters)
        .labels(Arrays.stream(assignment.toArray()).boxed().collect(Collectors.toList()))
        .processingMetadata(metadata)
        .similarityMatrix(includeSimilarityMatrix ? result.getSimilarityMatrix().toArray() : null)
        .build();
  }

  /**
   * Terms with the largest summed TF-IDF weight over the given members. Ties go to the
   * lexicographically smaller term, which is also the smaller column.
   */
  public List<String> topTerms(
      Vocabulary vocabulary, List<FeatureVector> vectors, List<Integer> members, int limit) {
    if (limit <= 0 || members == null || members.isEmpty()) {
      return List.of();
    }

    Map<Integer, Double> weightByColumn = new HashMap<>();
    for (int member : members) {
      FeatureVector vector = vectors.get(member);
      for (int i = 0; i < vector.nonZeroCount(); i++) {
        weightByColumn.merge(vector.indexAt(i), vector.weightAt(i), Double::sum);
      }
    }

    return weightByColumn.entrySet().stream()
        .sorted(
            Comparator.<Map.Entry<Integer, Double>>comparingDouble(Map.Entry::getValue)
                .reversed()
                .thenComparing(Map.Entry::getKey))
        .limit(limit)
        .map(entry -> vocabulary.termAt(entry.getKey()))
        .collect(Collectors.toList());
  }

  /** Label to member utterances, exactly as the aggregator ordered them. */
  public LinkedHashMap<Integer, List<String>> groupUtterances(
      List<String> utterances, double eps, int minPts) {
    return cluster(utterances, eps, minPts).getGroups();
  }
}
