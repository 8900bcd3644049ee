package com.listingcheck.validator.service.similarity;

import java.util.List;

import org.springframework.stereotype.Component;

import com.listingcheck.validator.dto.catalog.CatalogEntry;
import com.listingcheck.validator.exception.CatalogDataException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class CatalogIndexBuilder {

  public static final String UNKNOWN_CATEGORY = "Unknown";

  /**
   * Normalises the entries (blank names become empty strings, blank categories become {@value
   * #UNKNOWN_CATEGORY}) and fits the similarity model on their names.
   *
   * @throws CatalogDataException if the catalog is null or empty
   */
  public CatalogIndex build(List<CatalogEntry> catalog) {
    if (catalog == null || catalog.isEmpty()) {
      throw new CatalogDataException("Reference catalog is empty");
    }

    List<CatalogEntry> entries = catalog.stream().map(CatalogIndexBuilder::normalise).toList();
    SimilarityModel model =
        SimilarityModel.fit(entries.stream().map(CatalogEntry::getProductName).toList());

    log.info(
        "Built similarity model over {} catalog entries ({} terms)",
        entries.size(),
        model.vocabularySize());
    return new CatalogIndex(entries, model);
  }

  private static CatalogEntry normalise(CatalogEntry entry) {
    String name = entry.getProductName() == null ? "" : entry.getProductName();
    String category =
        entry.getCategory() == null || entry.getCategory().isBlank()
            ? UNKNOWN_CATEGORY
            : entry.getCategory();
    if (name.equals(entry.getProductName()) && category.equals(entry.getCategory())) {
      return entry;
    }
    return entry.toBuilder().productName(name).category(category).build();
  }
}
