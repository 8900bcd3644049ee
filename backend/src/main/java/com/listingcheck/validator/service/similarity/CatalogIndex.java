package com.listingcheck.validator.service.similarity;

import java.util.List;

import com.listingcheck.validator.dto.catalog.CatalogEntry;

import lombok.Getter;

/**
 * The reference catalog together with the similarity model fitted on its names. Row {@code i} of
 * the model belongs to {@code entries.get(i)}.
 */
@Getter
public final class CatalogIndex {

  private final List<CatalogEntry> entries;
  private final SimilarityModel model;

  CatalogIndex(List<CatalogEntry> entries, SimilarityModel model) {
    this.entries = List.copyOf(entries);
    this.model = model;
  }

  public int size() {
    return entries.size();
  }

  public CatalogEntry get(int catalogIndex) {
    return entries.get(catalogIndex);
  }
}
