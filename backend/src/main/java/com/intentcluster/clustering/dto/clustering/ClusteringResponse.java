package com.intentcluster.clustering.dto.clustering;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClusteringResponse {

  /** Groups in ascending label order; the noise group, when present, is first. */
  @JsonProperty("clusters")
  private List<UtteranceCluster> clusters;

  /** Cluster label of every input utterance, by position. */
  @JsonProperty("labels")
  private List<Integer> labels;

  @JsonProperty("processing_metadata")
  private ProcessingMetadata processingMetadata;

  @JsonProperty("similarity_matrix")
  private double[][] similarityMatrix;

  @JsonProperty("source_name")
  private String sourceName;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class UtteranceCluster {

    @JsonProperty("label")
    private int label;

    @JsonProperty("noise")
    private boolean noise;

    @JsonProperty("size")
    private int size;

    @JsonProperty("utterances")
    private List<String> utterances;

    @JsonProperty("top_terms")
    private List<String> topTerms;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ProcessingMetadata {

    @JsonProperty("total_utterances")
    private int totalUtterances;

    @JsonProperty("vocabulary_size")
    private int vocabularySize;

    @JsonProperty("cluster_count")
    private int clusterCount;

    @JsonProperty("noise_count")
    private int noiseCount;

    @JsonProperty("eps")
    private double eps;

    @JsonProperty("min_pts")
    private int minPts;

    @JsonProperty("processing_time_ms")
    private long processingTimeMs;
  }
}
