package com.listingcheck.validator.service.rules;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.listingcheck.validator.config.ApplicationProperties;

/**
 * Fixed head office policy: products in an alcohol category, or whose name contains an
 * alcohol-related word, must be sold with age verification. Independent of the catalog.
 */
@Component
public class AgeRestrictionPolicy {

  private final String categoryMarker;
  private final Set<String> keywords;

  @Autowired
  public AgeRestrictionPolicy(ApplicationProperties applicationProperties) {
    this(
        applicationProperties.getPolicy().getAgeRestrictedCategoryMarker(),
        applicationProperties.getPolicy().getAgeRestrictedKeywords());
  }

  public AgeRestrictionPolicy(String categoryMarker, List<String> keywords) {
    this.categoryMarker = categoryMarker == null ? "" : categoryMarker.toLowerCase(Locale.ROOT);
    this.keywords =
        keywords.stream()
            .map(k -> k.trim().toLowerCase(Locale.ROOT))
            .filter(k -> !k.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /**
   * Keywords match anywhere in the lower-cased name, so "Beerenauslese Riesling" and "Ginger
   * Biscuits" are both restricted.
   */
  public boolean requiresVerification(String productName, String category) {
    String lowerCategory = category == null ? "" : category.toLowerCase(Locale.ROOT);
    if (!categoryMarker.isEmpty() && lowerCategory.contains(categoryMarker)) {
      return true;
    }
    if (productName == null) {
      return false;
    }
    String lowerName = productName.toLowerCase(Locale.ROOT);
    return keywords.stream().anyMatch(lowerName::contains);
  }
}
