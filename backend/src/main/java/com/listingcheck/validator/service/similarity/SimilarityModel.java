package com.listingcheck.validator.service.similarity;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TF-IDF model over catalog product names. Term weights are raw counts scaled by a smoothed
 * inverse document frequency, {@code ln((1 + n) / (1 + df)) + 1}, and every vector is
 * L2-normalised so a dot product is the cosine similarity.
 *
 * <p>Read-only once built; safe to share between threads.
 */
public final class SimilarityModel {

  private final Map<String, Integer> vocabulary;
  private final double[] idf;
  private final List<SparseVector> rows;

  private SimilarityModel(Map<String, Integer> vocabulary, double[] idf, List<SparseVector> rows) {
    this.vocabulary = vocabulary;
    this.idf = idf;
    this.rows = rows;
  }

  public static SimilarityModel fit(List<String> documents) {
    Map<String, Integer> vocabulary = new LinkedHashMap<>();
    Map<String, Integer> documentFrequency = new HashMap<>();

    for (String document : documents) {
      Set<String> seen = new HashSet<>(NameTokenizer.terms(document));
      for (String term : seen) {
        vocabulary.putIfAbsent(term, vocabulary.size());
        documentFrequency.merge(term, 1, Integer::sum);
      }
    }

    int n = documents.size();
    double[] idf = new double[vocabulary.size()];
    for (Map.Entry<String, Integer> entry : vocabulary.entrySet()) {
      int df = documentFrequency.get(entry.getKey());
      idf[entry.getValue()] = Math.log((1.0 + n) / (1.0 + df)) + 1.0;
    }

    SimilarityModel model = new SimilarityModel(Collections.unmodifiableMap(vocabulary), idf, null);
    List<SparseVector> rows = documents.stream().map(model::vectorize).toList();
    return new SimilarityModel(model.vocabulary, idf, rows);
  }

  /** Vectorises free text with the fitted vocabulary. Terms the catalog never used are dropped. */
  public SparseVector vectorize(String text) {
    Map<Integer, Double> weights = new HashMap<>();
    for (String term : NameTokenizer.terms(text)) {
      Integer column = vocabulary.get(term);
      if (column != null) {
        weights.merge(column, idf[column], Double::sum);
      }
    }
    return SparseVector.normalised(weights);
  }

  public SparseVector row(int catalogIndex) {
    return rows.get(catalogIndex);
  }

  public int rowCount() {
    return rows.size();
  }

  public int vocabularySize() {
    return vocabulary.size();
  }

  boolean knowsTerm(String term) {
    return vocabulary.containsKey(term);
  }
}
