package com.intentcluster.clustering.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.intentcluster.clustering.dto.clustering.ClusteringRequest;
import com.intentcluster.clustering.service.text.StopWordLexicon;

public class CoreConfigTest {

  private CoreConfig coreConfig;

  @BeforeEach
  public void setUp() {
    coreConfig = new CoreConfig();
  }

  @Test
  public void testObjectMapperConfiguration() {
    ObjectMapper mapper = coreConfig.objectMapper();

    assertNotNull(mapper);
    assertTrue(mapper.isEnabled(SerializationFeature.INDENT_OUTPUT));
    assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    assertFalse(mapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
  }

  @Test
  public void testObjectMapperSerialization() throws Exception {
    ObjectMapper mapper = coreConfig.objectMapper();

    String json = mapper.writeValueAsString(LocalDateTime.of(2024, 3, 1, 12, 30));
    assertEquals("\"2024-03-01T12:30:00\"", json);

    ClusteringRequest request =
        mapper.readValue(
            "{\"utterances\":[\"refund\"],\"min_pts\":3,\"unknown\":true}",
            ClusteringRequest.class);
    assertEquals(3, request.getMinPts());
    assertEquals(1, request.getUtterances().size());
  }

  @Test
  public void testStopWordLexiconUsesConfiguredResource() {
    ApplicationProperties properties = new ApplicationProperties();

    StopWordLexicon lexicon = coreConfig.stopWordLexicon(properties);

    assertTrue(lexicon.contains("the"));
    assertFalse(lexicon.contains("refund"));
  }

  @Test
  public void testStopWordLexiconFailsForMissingResource() {
    ApplicationProperties properties = new ApplicationProperties();
    properties.getNormalizer().setStopwordsResource("stopwords/missing.txt");

    assertThrows(IllegalStateException.class, () -> coreConfig.stopWordLexicon(properties));
  }
}
