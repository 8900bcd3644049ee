package com.listingcheck.validator.service.similarity;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/** Immutable sparse vector over the model vocabulary, indices kept sorted. */
public final class SparseVector {

  static final SparseVector EMPTY = new SparseVector(new int[0], new double[0]);

  private final int[] indices;
  private final double[] values;

  private SparseVector(int[] indices, double[] values) {
    this.indices = indices;
    this.values = values;
  }

  /** Builds an L2-normalised vector; an all-zero input yields {@link #EMPTY}. */
  static SparseVector normalised(Map<Integer, Double> weights) {
    TreeMap<Integer, Double> sorted = new TreeMap<>(weights);
    double norm = 0.0;
    for (double w : sorted.values()) {
      norm += w * w;
    }
    if (norm == 0.0) {
      return EMPTY;
    }
    norm = Math.sqrt(norm);

    int[] idx = new int[sorted.size()];
    double[] vals = new double[sorted.size()];
    int i = 0;
    for (Map.Entry<Integer, Double> e : sorted.entrySet()) {
      idx[i] = e.getKey();
      vals[i] = e.getValue() / norm;
      i++;
    }
    return new SparseVector(idx, vals);
  }

  public double dot(SparseVector other) {
    double sum = 0.0;
    int i = 0;
    int j = 0;
    while (i < indices.length && j < other.indices.length) {
      if (indices[i] == other.indices[j]) {
        sum += values[i] * other.values[j];
        i++;
        j++;
      } else if (indices[i] < other.indices[j]) {
        i++;
      } else {
        j++;
      }
    }
    return sum;
  }

  public boolean isEmpty() {
    return indices.length == 0;
  }

  int nonZeroCount() {
    return indices.length;
  }

  @Override
  public String toString() {
    return "SparseVector" + Arrays.toString(indices);
  }
}
