package com.listingcheck.validator.UnitTests.service.similarity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.listingcheck.validator.dto.catalog.CatalogEntry;
import com.listingcheck.validator.exception.CatalogDataException;
import com.listingcheck.validator.fixtures.TestFixtures;
import com.listingcheck.validator.service.similarity.CatalogIndex;
import com.listingcheck.validator.service.similarity.CatalogIndexBuilder;

@DisplayName("CatalogIndexBuilder Tests")
class CatalogIndexBuilderTest {

  private final CatalogIndexBuilder builder = new CatalogIndexBuilder();

  @Test
  void shouldRejectEmptyCatalog() {
    assertThatThrownBy(() -> builder.build(List.of()))
        .isInstanceOf(CatalogDataException.class)
        .hasMessageContaining("empty");
    assertThatThrownBy(() -> builder.build(null)).isInstanceOf(CatalogDataException.class);
  }

  @Test
  void shouldDefaultMissingNameAndCategory() {
    // Given
    List<CatalogEntry> catalog =
        List.of(
            TestFixtures.catalogEntry(null, "Snacks", "1.00", "No"),
            TestFixtures.catalogEntry("Mystery Item", " ", "2.00", null));

    // When
    CatalogIndex index = builder.build(catalog);

    // Then
    assertThat(index.size()).isEqualTo(2);
    assertThat(index.get(0).getProductName()).isEmpty();
    assertThat(index.get(1).getCategory()).isEqualTo(CatalogIndexBuilder.UNKNOWN_CATEGORY);
    assertThat(index.getModel().rowCount()).isEqualTo(2);
  }

  @Test
  void shouldKeepCatalogOrder() {
    CatalogIndex index = builder.build(TestFixtures.createSampleCatalog());

    assertThat(index.get(4).getProductName()).isEqualTo("Cola 2L");
    assertThat(index.getEntries()).hasSize(12);
  }
}
