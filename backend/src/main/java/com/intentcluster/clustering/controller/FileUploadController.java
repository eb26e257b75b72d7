package com.intentcluster.clustering.controller;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.intentcluster.clustering.dto.clustering.ClusteringRequest;
import com.intentcluster.clustering.dto.clustering.ClusteringResponse;
import com.intentcluster.clustering.service.IntentClusteringService;
import com.intentcluster.clustering.service.data_processing.UtteranceFileParsingService;
import com.opencsv.exceptions.CsvValidationException;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/intent-clustering")
@RequiredArgsConstructor
@Tag(name = "File Upload", description = "Cluster utterances read from an uploaded file")
public class FileUploadController {

  @Value("${app.upload.max-file-size:1048576}")
  private long maxFileSize;

  @Value("${app.upload.allowed-extensions:txt,csv}")
  private Set<String> allowedExtensions;

  private final UtteranceFileParsingService fileParsingService;
  private final IntentClusteringService clusteringService;

  @PostMapping(
      value = "/analyze",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Cluster utterances from a file",
      description =
          "Reads utterances from a .txt file (one per line) or a .csv file (one column, header"
              + " row required) and clusters them")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "File clustered",
            content = @Content(schema = @Schema(implementation = ClusteringResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid file or parameters",
            content = @Content),
        @ApiResponse(responseCode = "413", description = "File too large", content = @Content)
      })
  public ResponseEntity<ClusteringResponse> analyzeFile(
      @Parameter(description = "Utterance file (.txt or .csv)", required = true)
          @RequestParam("file")
          MultipartFile file,
      @Parameter(description = "CSV column holding the utterances; first column by default")
          @RequestParam(value = "column", required = false)
          String column,
      @Parameter(description = "Neighbourhood radius in cosine distance")
          @RequestParam(value = "eps", required = false)
          Double eps,
      @Parameter(description = "Minimum neighbourhood size of a core point")
          @RequestParam(value = "minPts", required = false)
          Integer minPts,
      @Parameter(description = "Include the pairwise similarity matrix in the response")
          @RequestParam(value = "includeSimilarityMatrix", required = false)
          Boolean includeSimilarityMatrix)
      throws IOException, CsvValidationException {

    validateFile(file);

    String fileName = file.getOriginalFilename();
    String extension = extractFileExtension(fileName).toLowerCase();

    List<String> utterances =
        "csv".equals(extension)
            ? fileParsingService.parseCsvColumn(file.getInputStream(), column)
            : fileParsingService.parseTextLines(file.getInputStream());
    log.info("Read {} utterances from {}", utterances.size(), fileName);

    ClusteringRequest request =
        ClusteringRequest.builder()
            .utterances(utterances)
            .eps(eps)
            .minPts(minPts)
            .includeSimilarityMatrix(includeSimilarityMatrix)
            .build();

    ClusteringResponse response = clusteringService.clusterUtterances(request);
    response.setSourceName(fileName);
    return ResponseEntity.ok(response);
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }

    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          "File size exceeds maximum allowed size of " + maxFileSize + " bytes");
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isEmpty()) {
      throw new IllegalArgumentException("File name is empty");
    }

    String extension = extractFileExtension(fileName);
    if (!allowedExtensions.contains(extension.toLowerCase())) {
      throw new IllegalArgumentException(
          "File type not supported. Allowed types: " + allowedExtensions);
    }
  }

  private String extractFileExtension(String fileName) {
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1);
  }
}
