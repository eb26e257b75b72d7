package com.intentcluster.clustering.IntegrationTests;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import com.fasterxml.jackson.databind.ObjectMapper;

/** Runs the whole pipeline behind the REST endpoints with the real stop word list. */
@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(
    properties = {
      "spring.profiles.active=test",
      "clustering.limits.max-utterances=20",
      "logging.level.com.intentcluster=DEBUG"
    })
@DisplayName("Intent Clustering API Integration Tests")
class IntentClusteringApiIntegrationTest {

  private static final List<String> SUPPORT_BATCH =
      List.of(
          "How do I reset my password?",
          "What is the process to change my password?",
          "Can you help me with password recovery?",
          "What is the refund policy?",
          "How can I get a refund?",
          "Tell me about your return policy.");

  @Autowired private MockMvc mockMvc;

  @Autowired private ObjectMapper objectMapper;

  @Test
  @DisplayName("Should cluster support questions into password and refund intents")
  void shouldClusterSupportQuestions() throws Exception {
    mockMvc
        .perform(
            post("/api/intent-clustering/cluster")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    objectMapper.writeValueAsString(
                        Map.of(
                            "utterances",
                            SUPPORT_BATCH,
                            "eps",
                            0.5,
                            "min_pts",
                            2,
                            "include_similarity_matrix",
                            true))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.labels", contains(0, 0, 0, 1, 1, 1)))
        .andExpect(jsonPath("$.clusters", hasSize(2)))
        .andExpect(jsonPath("$.clusters[0].top_terms[0]").value("password"))
        .andExpect(jsonPath("$.clusters[1].top_terms[0]").value("refund"))
        .andExpect(jsonPath("$.processing_metadata.noise_count").value(0))
        .andExpect(jsonPath("$.similarity_matrix", hasSize(6)))
        .andExpect(jsonPath("$.similarity_matrix[0][0]").value(1.0));
  }

  @Test
  @DisplayName("Should apply configured defaults when parameters are omitted")
  void shouldApplyDefaults() throws Exception {
    mockMvc
        .perform(
            post("/api/intent-clustering/cluster")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("utterances", SUPPORT_BATCH))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.processing_metadata.eps").value(0.5))
        .andExpect(jsonPath("$.processing_metadata.min_pts").value(2))
        .andExpect(jsonPath("$.processing_metadata.cluster_count").value(2));
  }

  @Test
  @DisplayName("Should cluster utterances uploaded as a text file")
  void shouldClusterUploadedTextFile() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile(
            "file",
            "support.txt",
            "text/plain",
            String.join("\n", SUPPORT_BATCH).getBytes(StandardCharsets.UTF_8));

    mockMvc
        .perform(multipart("/api/intent-clustering/analyze").file(file))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.source_name").value("support.txt"))
        .andExpect(jsonPath("$.processing_metadata.total_utterances").value(6))
        .andExpect(jsonPath("$.processing_metadata.cluster_count").value(2));
  }

  @Test
  @DisplayName("Should cluster one column of an uploaded CSV file")
  void shouldClusterUploadedCsvFile() throws Exception {
    StringBuilder csv = new StringBuilder("id,utterance\n");
    for (int i = 0; i < SUPPORT_BATCH.size(); i++) {
      csv.append(i).append(",\"").append(SUPPORT_BATCH.get(i)).append("\"\n");
    }
    MockMultipartFile file =
        new MockMultipartFile(
            "file", "support.csv", "text/csv", csv.toString().getBytes(StandardCharsets.UTF_8));

    mockMvc
        .perform(
            multipart("/api/intent-clustering/analyze")
                .file(file)
                .param("column", "utterance")
                .param("eps", "0.5")
                .param("minPts", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.labels", contains(0, 0, 0, 1, 1, 1)));
  }

  @Test
  @DisplayName("Should reject an invalid eps before clustering")
  void shouldRejectInvalidEps() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile("file", "support.txt", "text/plain", "refund\n".getBytes());

    mockMvc
        .perform(multipart("/api/intent-clustering/analyze").file(file).param("eps", "-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.validationErrors.eps").exists());
  }

  @Test
  @DisplayName("Should reject a batch above the configured limit")
  void shouldRejectOversizedBatch() throws Exception {
    List<String> batch = new ArrayList<>();
    for (int i = 0; i < 21; i++) {
      batch.add("refund request " + i);
    }

    mockMvc
        .perform(
            post("/api/intent-clustering/cluster")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("utterances", batch))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Batch of 21 utterances exceeds the maximum of 20"));
  }

  @Test
  @DisplayName("Should expose runtime configuration")
  void shouldExposeConfiguration() throws Exception {
    mockMvc
        .perform(get("/api/config"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.maxUtterances").value(20))
        .andExpect(jsonPath("$.noiseLabel").value(-1));
  }
}
