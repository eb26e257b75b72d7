package com.intentcluster.clustering.service.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TfIdfVectorizerTest {

  private static final double TOLERANCE = 1e-9;

  private TfIdfVectorizer vectorizer;

  @BeforeEach
  void setUp() {
    vectorizer = new TfIdfVectorizer();
  }

  @Nested
  @DisplayName("Vocabulary fitting")
  class Fitting {

    @Test
    @DisplayName("Should order columns lexicographically")
    void shouldOrderColumnsLexicographically() {
      Vocabulary vocabulary =
          vectorizer.fit(List.of(List.of("reset", "password"), List.of("refund", "policy")));

      assertThat(vocabulary.getTerms()).containsExactly("password", "policy", "refund", "reset");
      assertThat(vocabulary.columnOf("refund")).hasValue(2);
      assertThat(vocabulary.columnOf("unknown")).isEmpty();
      assertThat(vocabulary.termAt(0)).isEqualTo("password");
    }

    @Test
    @DisplayName("Should count document frequency once per document")
    void shouldCountDocumentFrequencyOncePerDocument() {
      Vocabulary vocabulary =
          vectorizer.fit(
              List.of(List.of("password", "password"), List.of("password", "reset"), List.of()));

      assertThat(vocabulary.getDocumentCount()).isEqualTo(3);
      assertThat(vocabulary.documentFrequency(vocabulary.columnOf("password").getAsInt()))
          .isEqualTo(2);
      assertThat(vocabulary.documentFrequency(vocabulary.columnOf("reset").getAsInt()))
          .isEqualTo(1);
    }

    @Test
    @DisplayName("Should use smoothed idf")
    void shouldUseSmoothedIdf() {
      Vocabulary vocabulary =
          vectorizer.fit(List.of(List.of("password"), List.of("password", "reset")));

      assertThat(vocabulary.idf(vocabulary.columnOf("password").getAsInt()))
          .isCloseTo(1.0, within(TOLERANCE));
      assertThat(vocabulary.idf(vocabulary.columnOf("reset").getAsInt()))
          .isCloseTo(Math.log(3.0 / 2.0) + 1.0, within(TOLERANCE));
    }

    @Test
    @DisplayName("Should yield empty vocabulary when no document has tokens")
    void shouldYieldEmptyVocabulary() {
      Vocabulary vocabulary = vectorizer.fit(List.of(List.of(), List.of()));

      assertThat(vocabulary.isEmpty()).isTrue();
      assertThat(vocabulary.size()).isZero();
      assertThat(vocabulary.getDocumentCount()).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("Weighting")
  class Weighting {

    @Test
    @DisplayName("Should weight by term frequency times idf then normalize")
    void shouldWeightAndNormalize() {
      // Given
      List<List<String>> corpus = List.of(List.of("account", "account", "balance"), List.of("balance"));

      // When
      VectorizationResult result = vectorizer.fitTransform(corpus);

      // Then
      double accountWeight = 2.0 * (Math.log(3.0 / 2.0) + 1.0);
      double balanceWeight = 1.0;
      double norm = Math.sqrt(accountWeight * accountWeight + balanceWeight * balanceWeight);

      FeatureVector first = result.getVectors().get(0);
      assertThat(first.get(0)).isCloseTo(accountWeight / norm, within(TOLERANCE));
      assertThat(first.get(1)).isCloseTo(balanceWeight / norm, within(TOLERANCE));

      FeatureVector second = result.getVectors().get(1);
      assertThat(second.get(0)).isZero();
      assertThat(second.get(1)).isCloseTo(1.0, within(TOLERANCE));
    }

    @Test
    @DisplayName("Should produce unit vectors for documents with tokens")
    void shouldProduceUnitVectors() {
      VectorizationResult result =
          vectorizer.fitTransform(
              List.of(
                  List.of("reset", "password"),
                  List.of("change", "password", "process"),
                  List.of("password", "recovery"),
                  List.of("refund", "policy"),
                  List.of("refund"),
                  List.of("return", "policy")));

      assertThat(result.getVectors()).hasSize(6);
      for (FeatureVector vector : result.getVectors()) {
        assertThat(vector.norm()).isCloseTo(1.0, within(TOLERANCE));
      }
    }

    @Test
    @DisplayName("Should produce the zero vector for an empty document")
    void shouldProduceZeroVectorForEmptyDocument() {
      VectorizationResult result =
          vectorizer.fitTransform(List.of(List.of("refund"), List.of()));

      assertThat(result.getVectors().get(1).isZero()).isTrue();
      assertThat(result.getVectors().get(1).norm()).isZero();
    }

    @Test
    @DisplayName("Should ignore tokens missing from the vocabulary")
    void shouldIgnoreUnknownTokens() {
      Vocabulary vocabulary = vectorizer.fit(List.of(List.of("refund"), List.of("policy")));

      List<FeatureVector> vectors =
          vectorizer.transform(
              vocabulary, List.of(List.of("refund", "shipping"), List.of("shipping")));

      assertThat(vectors.get(0).nonZeroCount()).isEqualTo(1);
      assertThat(vectors.get(0).get(vocabulary.columnOf("refund").getAsInt()))
          .isCloseTo(1.0, within(TOLERANCE));
      assertThat(vectors.get(1).isZero()).isTrue();
    }

    @Test
    @DisplayName("Should return nothing for an empty corpus")
    void shouldHandleEmptyCorpus() {
      VectorizationResult result = vectorizer.fitTransform(List.of());

      assertThat(result.getVectors()).isEmpty();
      assertThat(result.getVocabulary().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should give identical vectors to identical documents")
    void shouldBeDeterministic() {
      VectorizationResult result =
          vectorizer.fitTransform(List.of(List.of("refund", "policy"), List.of("refund", "policy")));

      assertThat(result.getVectors().get(0)).isEqualTo(result.getVectors().get(1));
    }
  }
}
