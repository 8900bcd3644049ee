package com.listingcheck.validator.UnitTests.service.similarity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Comparator;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.listingcheck.validator.dto.validation.Neighbour;
import com.listingcheck.validator.fixtures.TestFixtures;
import com.listingcheck.validator.service.similarity.CatalogIndex;
import com.listingcheck.validator.service.similarity.NeighbourRetrievalService;

@DisplayName("NeighbourRetrievalService Tests")
class NeighbourRetrievalServiceTest {

  private CatalogIndex index;
  private NeighbourRetrievalService service;

  @BeforeEach
  void setUp() {
    index = TestFixtures.createSampleIndex();
    service = new NeighbourRetrievalService();
  }

  @Test
  void shouldRankExactNameFirst() {
    // When
    List<Neighbour> neighbours = service.retrieve(index, "Cola 2L", 3);

    // Then
    assertThat(neighbours).hasSize(3);
    assertThat(neighbours.get(0).getCatalogIndex()).isEqualTo(4);
    assertThat(neighbours.get(0).getSimilarity()).isCloseTo(1.0, within(1e-9));
    assertThat(neighbours.get(1).getProduct().getProductName()).isEqualTo("Diet Cola 2L");
  }

  @Test
  void shouldReturnNeighboursInDescendingSimilarity() {
    List<Neighbour> neighbours = service.retrieve(index, "Premium Lager 4x440ml", 15);

    assertThat(neighbours)
        .isSortedAccordingTo(Comparator.comparingDouble(Neighbour::getSimilarity).reversed());
    assertThat(neighbours)
        .allSatisfy(n -> assertThat(n.getSimilarity()).isBetween(0.0, 1.0));
    assertThat(neighbours.get(0).getCatalogIndex()).isZero();
    assertThat(neighbours.get(1).getCatalogIndex()).isEqualTo(1);
  }

  @Test
  void shouldCapResultsAtCatalogSize() {
    assertThat(service.retrieve(index, "Cola", 50)).hasSize(index.size());
  }

  @Test
  void shouldReturnNothingForNonPositiveK() {
    assertThat(service.retrieve(index, "Cola", 0)).isEmpty();
    assertThat(service.retrieve(index, "Cola", -3)).isEmpty();
  }

  @Test
  void shouldReturnFirstEntriesAtZeroSimilarityWhenNothingOverlaps() {
    // When
    List<Neighbour> neighbours = service.retrieve(index, "Xylophone Zebra", 5);

    // Then
    assertThat(neighbours).hasSize(5);
    assertThat(neighbours).extracting(Neighbour::getCatalogIndex).containsExactly(0, 1, 2, 3, 4);
    assertThat(neighbours).extracting(Neighbour::getSimilarity).containsOnly(0.0);
  }

  @Test
  void shouldTreatBlankQueryAsNoOverlap() {
    List<Neighbour> neighbours = service.retrieve(index, "", 3);

    assertThat(neighbours).extracting(Neighbour::getSimilarity).containsOnly(0.0);
  }

  @Test
  void shouldUseFifteenNeighboursByDefault() {
    assertThat(NeighbourRetrievalService.DEFAULT_TOP_K).isEqualTo(15);
    assertThat(service.retrieve(index, "Cola")).hasSize(index.size());
  }
}
