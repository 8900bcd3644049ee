package com.listingcheck.validator.UnitTests.service.rules;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.listingcheck.validator.config.ApplicationProperties;
import com.listingcheck.validator.service.rules.AgeRestrictionPolicy;

@DisplayName("AgeRestrictionPolicy Tests")
class AgeRestrictionPolicyTest {

  private final AgeRestrictionPolicy policy = new AgeRestrictionPolicy(new ApplicationProperties());

  @ParameterizedTest
  @ValueSource(
      strings = {
        "Premium Lager 4x440ml",
        "London Dry GIN",
        "Scotch Whisky 70cl",
        "Mixed Ciders Pack",
        "Sparkling Wines Selection"
      })
  void shouldRestrictNamesContainingAlcoholWords(String name) {
    assertThat(policy.requiresVerification(name, "Grocery")).isTrue();
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "Beerenauslese Riesling",
        "Rumchata Cream Liqueur",
        "Ciderhouse Apple 500ml",
        "Winegum Sweets",
        "Rumbling Tums Snack Bar",
        "Ginger Biscuits"
      })
  void shouldMatchAlcoholWordsInsideLongerWords(String name) {
    assertThat(policy.requiresVerification(name, "Snacks")).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"Cola 2L", "Ready Salted Crisps", "Semi Skimmed Milk 2 Pint"})
  void shouldNotRestrictOrdinaryGroceries(String name) {
    assertThat(policy.requiresVerification(name, "Grocery")).isFalse();
  }

  @Test
  void shouldRestrictAlcoholCategoriesWhateverTheName() {
    assertThat(policy.requiresVerification("Mystery Bottle", "Alcohol - Spirits")).isTrue();
    assertThat(policy.requiresVerification("Mystery Bottle", "LOW ALCOHOL DRINKS")).isTrue();
  }

  @Test
  void shouldHandleMissingValues() {
    assertThat(policy.requiresVerification(null, null)).isFalse();
  }
}
