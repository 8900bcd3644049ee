package com.listingcheck.validator.service.catalog;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Component;

import com.listingcheck.validator.config.ApplicationProperties;
import com.listingcheck.validator.dto.catalog.CatalogEntry;
import com.listingcheck.validator.exception.CatalogDataException;
import com.listingcheck.validator.service.similarity.CatalogIndex;
import com.listingcheck.validator.service.similarity.CatalogIndexBuilder;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the shared {@link CatalogIndex}. The index is built once at startup; a reload builds a
 * complete replacement before swapping the reference, so concurrent validations always see one
 * consistent snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogIndexProvider {

  private final CatalogLoaderService catalogLoaderService;
  private final CatalogIndexBuilder catalogIndexBuilder;
  private final ApplicationProperties applicationProperties;

  private final AtomicReference<CatalogIndex> current = new AtomicReference<>();
  private volatile CatalogDataException loadFailure;

  @PostConstruct
  public void init() {
    String location = applicationProperties.getCatalog().getLocation();
    try {
      current.set(buildFrom(location));
      loadFailure = null;
    } catch (CatalogDataException e) {
      loadFailure = e;
      if (applicationProperties.getCatalog().isFailFast()) {
        throw e;
      }
      log.error(
          "Reference catalog failed to load from {}; validation requests will be rejected",
          location,
          e);
    }
  }

  /**
   * @throws CatalogDataException if no catalog has been loaded successfully
   */
  public CatalogIndex getIndex() {
    CatalogIndex index = current.get();
    if (index == null) {
      throw loadFailure != null
          ? new CatalogDataException(
              "Reference catalog is unavailable: " + loadFailure.getMessage(), loadFailure)
          : new CatalogDataException("Reference catalog has not been loaded");
    }
    return index;
  }

  public boolean isAvailable() {
    return current.get() != null;
  }

  /** Rebuilds the index from the configured location and swaps it in. */
  public CatalogIndex reload() {
    String location = applicationProperties.getCatalog().getLocation();
    CatalogIndex rebuilt = buildFrom(location);
    current.set(rebuilt);
    loadFailure = null;
    log.info("Reference catalog reloaded from {} ({} entries)", location, rebuilt.size());
    return rebuilt;
  }

  /** Sorted distinct categories of the current catalog. */
  public List<String> categories() {
    TreeSet<String> categories = new TreeSet<>();
    for (CatalogEntry entry : getIndex().getEntries()) {
      categories.add(Objects.requireNonNullElse(entry.getCategory(), CatalogIndexBuilder.UNKNOWN_CATEGORY));
    }
    return List.copyOf(categories);
  }

  private CatalogIndex buildFrom(String location) {
    return catalogIndexBuilder.build(catalogLoaderService.load(location));
  }
}
