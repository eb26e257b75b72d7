package com.intentcluster.clustering.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.intentcluster.clustering.dto.clustering.ClusteringRequest;
import com.intentcluster.clustering.dto.clustering.ClusteringResponse;
import com.intentcluster.clustering.exception.ErrorResponse;
import com.intentcluster.clustering.service.IntentClusteringService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/intent-clustering")
@RequiredArgsConstructor
@Tag(name = "Intent Clustering", description = "Group utterances into clusters of similar phrasings")
public class ClusteringController {

  private final IntentClusteringService clusteringService;

  @PostMapping(
      value = "/cluster",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Cluster a batch of utterances",
      description =
          "Normalizes, vectorizes and density-clusters the given utterances. Unclustered"
              + " utterances are reported in the noise group (label -1).")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Batch clustered",
            content = @Content(schema = @Schema(implementation = ClusteringResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid eps, min_pts or batch size",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
      })
  public ResponseEntity<ClusteringResponse> cluster(@Valid @RequestBody ClusteringRequest request) {
    log.info(
        "Cluster request: {} utterances, eps={}, min_pts={}",
        request.getUtterances().size(),
        request.getEps(),
        request.getMinPts());
    return ResponseEntity.ok(clusteringService.clusterUtterances(request));
  }
}
