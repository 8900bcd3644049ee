package com.listingcheck.validator.UnitTests.service.inference;

import static com.listingcheck.validator.fixtures.TestFixtures.catalogEntry;
import static com.listingcheck.validator.fixtures.TestFixtures.neighbour;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.listingcheck.validator.dto.validation.Inference;
import com.listingcheck.validator.dto.validation.Neighbour;
import com.listingcheck.validator.dto.validation.PriceBand;
import com.listingcheck.validator.service.inference.FieldInferenceService;

@DisplayName("FieldInferenceService Tests")
class FieldInferenceServiceTest {

  private final FieldInferenceService service = new FieldInferenceService();

  @Nested
  @DisplayName("Category inference")
  class CategoryInference {

    @Test
    void shouldPickCategoryWithLargestSimilaritySum() {
      // Given
      List<Neighbour> neighbours =
          List.of(
              neighbour(catalogEntry("Lager A", "Alcohol - Beer", "5.00", "Yes"), 0.6),
              neighbour(catalogEntry("Cola", "Soft Drinks", "1.80", "No"), 0.5),
              neighbour(catalogEntry("Lager B", "Alcohol - Beer", "6.00", "Yes"), 0.2));

      // When
      Inference inference = service.inferCategory(neighbours);

      // Then
      assertThat(inference.getPredicted()).isEqualTo("Alcohol - Beer");
      assertThat(inference.getStrength()).isCloseTo(0.8 / 1.3, within(1e-12));
    }

    @Test
    void shouldBreakTiesByFirstCategorySeen() {
      List<Neighbour> neighbours =
          List.of(
              neighbour(catalogEntry("Cola", "Soft Drinks", "1.80", "No"), 0.5),
              neighbour(catalogEntry("Lager", "Alcohol - Beer", "5.00", "Yes"), 0.5));

      Inference inference = service.inferCategory(neighbours);

      assertThat(inference.getPredicted()).isEqualTo("Soft Drinks");
      assertThat(inference.getStrength()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void shouldPredictNothingWithoutSimilarity() {
      List<Neighbour> neighbours =
          List.of(neighbour(catalogEntry("Cola", "Soft Drinks", "1.80", "No"), 0.0));

      assertThat(service.inferCategory(neighbours).hasPrediction()).isFalse();
      assertThat(service.inferCategory(List.of()).getStrength()).isZero();
    }
  }

  @Nested
  @DisplayName("Price band inference")
  class PriceBandInference {

    @Test
    void shouldUseMiddlePriceForOddCount() {
      List<Neighbour> neighbours =
          List.of(
              neighbour(catalogEntry("A", "X", "3.00", "No"), 0.9),
              neighbour(catalogEntry("B", "X", "1.00", "No"), 0.5),
              neighbour(catalogEntry("C", "X", "2.00", "No"), 0.1));

      PriceBand band = service.inferPriceBand(neighbours);

      assertThat(band.getMedian()).isEqualByComparingTo("2.00");
      assertThat(band.getLower()).isEqualByComparingTo("1.50");
      assertThat(band.getUpper()).isEqualByComparingTo("2.50");
    }

    @Test
    void shouldAverageMiddlePricesForEvenCount() {
      List<Neighbour> neighbours =
          List.of(
              neighbour(catalogEntry("A", "X", "1.00", "No"), 0.0),
              neighbour(catalogEntry("B", "X", "2.00", "No"), 0.0),
              neighbour(catalogEntry("C", "X", "3.00", "No"), 0.0),
              neighbour(catalogEntry("D", "X", "4.00", "No"), 0.0));

      PriceBand band = service.inferPriceBand(neighbours);

      assertThat(band.getMedian()).isEqualByComparingTo("2.5");
      assertThat(band.getLower()).isEqualByComparingTo("1.875");
      assertThat(band.getUpper()).isEqualByComparingTo("3.125");
    }

    @Test
    void shouldSkipNeighboursWithoutPrice() {
      List<Neighbour> neighbours =
          List.of(
              neighbour(catalogEntry("A", "X", null, "No"), 0.7),
              neighbour(catalogEntry("B", "X", "4.00", "No"), 0.3));

      assertThat(service.inferPriceBand(neighbours).getMedian()).isEqualByComparingTo("4.00");
    }

    @Test
    void shouldBeUndefinedWhenNoPricesAreKnown() {
      List<Neighbour> neighbours = List.of(neighbour(catalogEntry("A", "X", null, "No"), 0.7));

      assertThat(service.inferPriceBand(neighbours).isDefined()).isFalse();
      assertThat(service.inferPriceBand(List.of()).isDefined()).isFalse();
    }
  }

  @Nested
  @DisplayName("Age flag inference")
  class AgeFlagInference {

    @Test
    void shouldPredictYesForMajorityWithConfidenceFromMargin() {
      List<Neighbour> neighbours =
          List.of(
              neighbour(catalogEntry("A", "X", "1.00", "Yes"), 0.4),
              neighbour(catalogEntry("B", "X", "1.00", "yes"), 0.3),
              neighbour(catalogEntry("C", "X", "1.00", "Yes"), 0.2),
              neighbour(catalogEntry("D", "X", "1.00", "No"), 0.1));

      Inference inference = service.inferAgeFlag(neighbours);

      assertThat(inference.getPredicted()).isEqualTo("Yes");
      assertThat(inference.getStrength()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void shouldPredictYesWithZeroConfidenceOnEvenSplit() {
      List<Neighbour> neighbours =
          List.of(
              neighbour(catalogEntry("A", "X", "1.00", "Yes"), 0.4),
              neighbour(catalogEntry("B", "X", "1.00", "No"), 0.3));

      Inference inference = service.inferAgeFlag(neighbours);

      assertThat(inference.getPredicted()).isEqualTo("Yes");
      assertThat(inference.getStrength()).isZero();
    }

    @Test
    void shouldPredictNoWhenUnanimous() {
      List<Neighbour> neighbours =
          List.of(
              neighbour(catalogEntry("A", "X", "1.00", "No"), 0.4),
              neighbour(catalogEntry("B", "X", "1.00", null), 0.3),
              neighbour(catalogEntry("C", "X", "1.00", "No"), 0.3));

      Inference inference = service.inferAgeFlag(neighbours);

      assertThat(inference.getPredicted()).isEqualTo("No");
      assertThat(inference.getStrength()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void shouldPredictNothingWithoutEvidence() {
      List<Neighbour> zeroSimilarity =
          List.of(neighbour(catalogEntry("A", "X", "1.00", "Yes"), 0.0));
      List<Neighbour> noFlags = List.of(neighbour(catalogEntry("A", "X", "1.00", " "), 0.6));

      assertThat(service.inferAgeFlag(zeroSimilarity).hasPrediction()).isFalse();
      assertThat(service.inferAgeFlag(noFlags).hasPrediction()).isFalse();
      assertThat(service.inferAgeFlag(List.of()).hasPrediction()).isFalse();
    }
  }
}
