package com.listingcheck.validator.UnitTests.service.similarity;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.listingcheck.validator.service.similarity.NameTokenizer;

@DisplayName("NameTokenizer Tests")
class NameTokenizerTest {

  @Test
  void shouldLowercaseAndDropSingleCharacterTokens() {
    assertThat(NameTokenizer.tokens("Coca-Cola 2L x 6")).containsExactly("coca", "cola", "2l");
  }

  @Test
  void shouldAppendAdjacentPairsAfterUnigrams() {
    assertThat(NameTokenizer.terms("Premium Lager 4x440ml"))
        .containsExactly(
            "premium", "lager", "4x440ml", "premium lager", "lager 4x440ml");
  }

  @Test
  void shouldReturnNoTermsForNullOrBlankText() {
    assertThat(NameTokenizer.terms(null)).isEmpty();
    assertThat(NameTokenizer.terms("")).isEmpty();
    assertThat(NameTokenizer.terms("  - ")).isEmpty();
  }

  @Test
  void shouldKeepDuplicateTerms() {
    assertThat(NameTokenizer.terms("Cola Cola"))
        .containsExactly("cola", "cola", "cola cola");
  }
}
