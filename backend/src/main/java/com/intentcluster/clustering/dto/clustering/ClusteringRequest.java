package com.intentcluster.clustering.dto.clustering;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Batch of utterances to cluster")
public class ClusteringRequest {

  @NotNull
  @JsonProperty("utterances")
  @Schema(description = "Utterances in input order; empty strings are allowed")
  private List<String> utterances;

  @Positive
  @JsonProperty("eps")
  @Schema(description = "Neighbourhood radius in cosine distance; server default when absent")
  private Double eps;

  @Min(1)
  @JsonProperty("min_pts")
  @Schema(description = "Minimum neighbourhood size of a core point; server default when absent")
  private Integer minPts;

  @JsonProperty("include_similarity_matrix")
  private Boolean includeSimilarityMatrix;
}
