package com.intentcluster.clustering.service.text;

import java.util.List;

/** Reduces a raw utterance to its ordered content tokens. */
public interface TextNormalizer {

  /**
   * Normalizes one utterance. Never throws for empty or malformed text; such input simply yields
   * an empty list.
   *
   * @param text raw utterance, may be {@code null}
   * @return lemmas in their original relative order, stop words and punctuation removed
   */
  List<String> normalize(String text);
}
