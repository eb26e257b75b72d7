package com.intentcluster.clustering.service.vector;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Fitted term dictionary. Terms are numbered in lexicographic order, so the same batch always
 * yields the same columns. Carries document frequencies and the smoothed inverse document
 * frequency {@code ln((1 + n) / (1 + df)) + 1} of every term.
 *
 * <p>Instances are immutable and are passed explicitly to {@link TfIdfVectorizer#transform}.
 */
public final class Vocabulary {

  private final Map<String, Integer> columns;
  private final List<String> terms;
  private final int[] documentFrequencies;
  private final double[] idf;
  private final int documentCount;

  Vocabulary(TreeMap<String, Integer> documentFrequencyByTerm, int documentCount) {
    int size = documentFrequencyByTerm.size();
    Map<String, Integer> columnMap = new TreeMap<>();
    String[] termArray = new String[size];
    int[] df = new int[size];
    double[] idfValues = new double[size];

    int column = 0;
    for (Map.Entry<String, Integer> entry : documentFrequencyByTerm.entrySet()) {
      columnMap.put(entry.getKey(), column);
      termArray[column] = entry.getKey();
      df[column] = entry.getValue();
      idfValues[column] = smoothedIdf(documentCount, entry.getValue());
      column++;
    }

    this.columns = Collections.unmodifiableMap(columnMap);
    this.terms = List.of(termArray);
    this.documentFrequencies = df;
    this.idf = idfValues;
    this.documentCount = documentCount;
  }

  static double smoothedIdf(int documentCount, int documentFrequency) {
    return Math.log((1.0 + documentCount) / (1.0 + documentFrequency)) + 1.0;
  }

  public int size() {
    return terms.size();
  }

  public boolean isEmpty() {
    return terms.isEmpty();
  }

  public int getDocumentCount() {
    return documentCount;
  }

  public OptionalInt columnOf(String term) {
    Integer column = columns.get(term);
    return column == null ? OptionalInt.empty() : OptionalInt.of(column);
  }

  public String termAt(int column) {
    return terms.get(column);
  }

  /** Terms in column order. */
  public List<String> getTerms() {
    return terms;
  }

  public int documentFrequency(int column) {
    return documentFrequencies[column];
  }

  public double idf(int column) {
    return idf[column];
  }
}
