package com.intentcluster.clustering.service.vector;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/**
 * Converts token sequences into L2-normalized TF-IDF vectors.
 *
 * <p>Stateless: the fitted {@link Vocabulary} is returned to the caller instead of being kept on
 * this instance, so one vectorizer can serve concurrent batches.
 */
@Slf4j
@Service
public class TfIdfVectorizer {

  /**
   * Learns the vocabulary and document frequencies of a corpus.
   *
   * @param tokenSequences one token list per document; lists may be empty
   * @return the fitted vocabulary
   */
  public Vocabulary fit(List<List<String>> tokenSequences) {
    TreeMap<String, Integer> documentFrequency = new TreeMap<>();
    for (List<String> tokens : tokenSequences) {
      Set<String> seen = new HashSet<>(tokens);
      for (String term : seen) {
        documentFrequency.merge(term, 1, Integer::sum);
      }
    }

    Vocabulary vocabulary = new Vocabulary(documentFrequency, tokenSequences.size());
    log.debug(
        "Fitted vocabulary of {} terms over {} documents",
        vocabulary.size(),
        tokenSequences.size());
    return vocabulary;
  }

  /**
   * Weights each sequence against an already fitted vocabulary. Terms the vocabulary does not
   * know contribute nothing.
   */
  public List<FeatureVector> transform(Vocabulary vocabulary, List<List<String>> tokenSequences) {
    List<FeatureVector> vectors = new ArrayList<>(tokenSequences.size());
    for (List<String> tokens : tokenSequences) {
      vectors.add(toVector(vocabulary, tokens));
    }
    return vectors;
  }

  public VectorizationResult fitTransform(List<List<String>> tokenSequences) {
    Vocabulary vocabulary = fit(tokenSequences);
    return new VectorizationResult(vocabulary, transform(vocabulary, tokenSequences));
  }

  private FeatureVector toVector(Vocabulary vocabulary, List<String> tokens) {
    // column -> raw count, ascending by column
    TreeMap<Integer, Integer> termFrequency = new TreeMap<>();
    for (String token : tokens) {
      OptionalInt column = vocabulary.columnOf(token);
      if (column.isPresent()) {
        termFrequency.merge(column.getAsInt(), 1, Integer::sum);
      }
    }

    if (termFrequency.isEmpty()) {
      return FeatureVector.zero();
    }

    int[] indices = new int[termFrequency.size()];
    double[] weights = new double[termFrequency.size()];
    double squaredNorm = 0.0;
    int position = 0;
    for (Map.Entry<Integer, Integer> entry : termFrequency.entrySet()) {
      int column = entry.getKey();
      double weight = entry.getValue() * vocabulary.idf(column);
      indices[position] = column;
      weights[position] = weight;
      squaredNorm += weight * weight;
      position++;
    }

    double norm = Math.sqrt(squaredNorm);
    for (int i = 0; i < weights.length; i++) {
      weights[i] /= norm;
    }
    return FeatureVector.of(indices, weights);
  }
}
