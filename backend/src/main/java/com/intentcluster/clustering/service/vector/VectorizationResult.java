package com.intentcluster.clustering.service.vector;

import java.util.List;

/** Output of {@link TfIdfVectorizer#fitTransform}: the fitted vocabulary and one vector per input. */
public final class VectorizationResult {

  private final Vocabulary vocabulary;
  private final List<FeatureVector> vectors;

  public VectorizationResult(Vocabulary vocabulary, List<FeatureVector> vectors) {
    this.vocabulary = vocabulary;
    this.vectors = List.copyOf(vectors);
  }

  public Vocabulary getVocabulary() {
    return vocabulary;
  }

  public List<FeatureVector> getVectors() {
    return vectors;
  }
}
