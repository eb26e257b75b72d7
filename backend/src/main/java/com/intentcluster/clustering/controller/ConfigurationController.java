package com.intentcluster.clustering.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.intentcluster.clustering.config.ApplicationProperties;
import com.intentcluster.clustering.service.clustering.ClusterAssignment;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/** Exposes the server-side clustering defaults and upload limits to clients. */
@RestController
@RequestMapping("/api/config")
@Tag(name = "Configuration", description = "Runtime defaults and limits")
@RequiredArgsConstructor
public class ConfigurationController {

  private final ApplicationProperties properties;

  @Value("${app.upload.max-file-size:1048576}")
  private long maxFileSize;

  @Value("${app.upload.allowed-extensions:txt,csv}")
  private String allowedExtensions;

  @Value("${api.version:v1}")
  private String apiVersion;

  @GetMapping
  @Operation(
      summary = "Get runtime configuration",
      description = "Returns default clustering parameters and request limits")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Configuration retrieved successfully")
      })
  public Map<String, Object> getConfiguration() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("apiVersion", apiVersion);
    config.put("defaultEps", properties.getDefaults().getEps());
    config.put("defaultMinPts", properties.getDefaults().getMinPts());
    config.put("maxUtterances", properties.getLimits().getMaxUtterances());
    config.put("maxFileSize", maxFileSize);
    config.put("allowedExtensions", allowedExtensions.split(","));
    config.put("noiseLabel", ClusterAssignment.NOISE);
    return config;
  }
}
