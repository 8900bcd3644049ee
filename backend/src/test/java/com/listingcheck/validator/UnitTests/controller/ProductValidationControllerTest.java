package com.listingcheck.validator.UnitTests.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.listingcheck.validator.config.CoreConfig;
import com.listingcheck.validator.controller.ProductValidationController;
import com.listingcheck.validator.dto.submission.ExplanationResponse;
import com.listingcheck.validator.exception.CatalogDataException;
import com.listingcheck.validator.exception.GlobalExceptionHandler;
import com.listingcheck.validator.exception.ValidationInputException;
import com.listingcheck.validator.fixtures.TestFixtures;
import com.listingcheck.validator.service.SubmissionService;
import com.listingcheck.validator.service.catalog.CatalogIndexProvider;
import com.listingcheck.validator.service.llm.LLMServiceSelector;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ProductValidationController Tests")
class ProductValidationControllerTest {

  @Mock private SubmissionService submissionService;
  @Mock private CatalogIndexProvider catalogIndexProvider;
  @Mock private LLMServiceSelector llmServiceSelector;

  @InjectMocks private ProductValidationController controller;

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    objectMapper = new CoreConfig().objectMapper();
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
            .build();
  }

  @Nested
  @DisplayName("GET /api/health")
  class Health {

    @Test
    void shouldReportUpWithCatalogSize() throws Exception {
      when(catalogIndexProvider.isAvailable()).thenReturn(true);
      when(catalogIndexProvider.getIndex()).thenReturn(TestFixtures.createSampleIndex());
      when(llmServiceSelector.getActiveProvider()).thenReturn("openai");

      mockMvc
          .perform(get("/api/health"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("UP"))
          .andExpect(jsonPath("$.catalogSize").value(12))
          .andExpect(jsonPath("$.explanationProvider").value("openai"))
          .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void shouldReportDegradedWithoutCatalog() throws Exception {
      when(catalogIndexProvider.isAvailable()).thenReturn(false);
      when(llmServiceSelector.getActiveProvider()).thenReturn("none");

      mockMvc
          .perform(get("/api/health"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("DEGRADED"))
          .andExpect(jsonPath("$.catalogSize").value(0));
    }
  }

  @Nested
  @DisplayName("POST /api/validate")
  class Validate {

    @Test
    void shouldReturnDecisionsInWireFormat() throws Exception {
      // Given
      when(submissionService.validate(any())).thenReturn(TestFixtures.createWarningResult());

      // When & Then
      mockMvc
          .perform(
              post("/api/validate")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      "{\"product_name\":\"Cola 2L\",\"category\":\"Drinks\","
                          + "\"price\":1.8,\"age_flag\":\"No\"}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.category.decision").value("warning"))
          .andExpect(jsonPath("$.category.predicted").value("Soft Drinks"))
          .andExpect(jsonPath("$.price.decision").value("pass"))
          .andExpect(jsonPath("$.price.median").value(1.80))
          .andExpect(jsonPath("$.age_verification.decision").value("pass"))
          .andExpect(jsonPath("$.overall").value("warnings_pending_review"))
          .andExpect(
              jsonPath("$.overall_message").value("Submitted with warnings; HO will review."));
    }

    @Test
    void shouldRejectMalformedJson() throws Exception {
      mockMvc
          .perform(post("/api/validate").contentType(MediaType.APPLICATION_JSON).content("{oops"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("Malformed JSON request"));

      verifyNoInteractions(submissionService);
    }

    @Test
    void shouldRejectOverlongProductName() throws Exception {
      String name = "x".repeat(501);

      mockMvc
          .perform(
              post("/api/validate")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"product_name\":\"" + name + "\",\"price\":1.0}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.error").value("Validation Failed"))
          .andExpect(jsonPath("$.validationErrors.product_name").exists());
    }

    @Test
    void shouldMapInvalidPriceToBadRequest() throws Exception {
      when(submissionService.validate(any()))
          .thenThrow(new ValidationInputException("Price must be a finite number, got NaN"));

      mockMvc
          .perform(
              post("/api/validate")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"product_name\":\"Cola 2L\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.path").value("/api/validate"));
    }

    @Test
    void shouldMapMissingCatalogToServiceUnavailable() throws Exception {
      when(submissionService.validate(any()))
          .thenThrow(new CatalogDataException("Reference catalog has not been loaded"));

      mockMvc
          .perform(
              post("/api/validate")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"product_name\":\"Cola 2L\",\"price\":1.8}"))
          .andExpect(status().isServiceUnavailable())
          .andExpect(jsonPath("$.message").value("Reference catalog has not been loaded"));
    }
  }

  @Test
  void shouldReturnValidationWithExplanation() throws Exception {
    when(submissionService.validateAndExplain(any()))
        .thenReturn(
            ExplanationResponse.builder()
                .validation(TestFixtures.createReadyResult())
                .explanation("### For the store\n- Good to go")
                .build());

    mockMvc
        .perform(
            post("/api/explain")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(TestFixtures.createColaInput())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.validation.overall").value("ready"))
        .andExpect(jsonPath("$.explanation").value("### For the store\n- Good to go"));
  }

  @Test
  void shouldListCategories() throws Exception {
    when(catalogIndexProvider.categories()).thenReturn(List.of("Dairy", "Soft Drinks"));

    mockMvc
        .perform(get("/api/categories"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0]").value("Dairy"))
        .andExpect(jsonPath("$[1]").value("Soft Drinks"));
  }
}
