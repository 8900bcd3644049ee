package com.listingcheck.validator.service.similarity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.springframework.stereotype.Service;

import com.listingcheck.validator.dto.validation.Neighbour;

import lombok.extern.slf4j.Slf4j;

/**
 * Nearest-neighbour search over catalog names. Scores every catalog row, so a call costs
 * O(catalog size); fine for catalogs of a few tens of thousands of products.
 */
@Slf4j
@Service
public class NeighbourRetrievalService {

  public static final int DEFAULT_TOP_K = 15;

  public List<Neighbour> retrieve(CatalogIndex index, String queryName) {
    return retrieve(index, queryName, DEFAULT_TOP_K);
  }

  /**
   * Returns the {@code k} catalog entries most similar to {@code queryName}, highest similarity
   * first. Equal scores keep catalog order, so a query sharing no terms with the catalog yields the
   * first {@code k} entries at similarity 0.
   */
  public List<Neighbour> retrieve(CatalogIndex index, String queryName, int k) {
    if (k <= 0) {
      return List.of();
    }

    SimilarityModel model = index.getModel();
    SparseVector query = model.vectorize(queryName);

    double[] similarities = new double[index.size()];
    if (!query.isEmpty()) {
      for (int i = 0; i < similarities.length; i++) {
        similarities[i] = clamp(query.dot(model.row(i)));
      }
    }

    List<Integer> order =
        IntStream.range(0, similarities.length).boxed().collect(Collectors.toList());
    order.sort(Comparator.comparingDouble((Integer i) -> similarities[i]).reversed());

    int limit = Math.min(k, order.size());
    List<Neighbour> neighbours = new ArrayList<>(limit);
    for (int rank = 0; rank < limit; rank++) {
      int catalogIndex = order.get(rank);
      neighbours.add(
          Neighbour.builder()
              .catalogIndex(catalogIndex)
              .product(index.get(catalogIndex))
              .similarity(similarities[catalogIndex])
              .build());
    }

    log.debug(
        "Retrieved {} neighbours for '{}' (top similarity {})",
        neighbours.size(),
        queryName,
        neighbours.isEmpty() ? 0.0 : neighbours.get(0).getSimilarity());
    return neighbours;
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
