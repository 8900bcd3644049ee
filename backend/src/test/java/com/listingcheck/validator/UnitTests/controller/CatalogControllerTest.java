package com.listingcheck.validator.UnitTests.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.listingcheck.validator.controller.CatalogController;
import com.listingcheck.validator.exception.CatalogDataException;
import com.listingcheck.validator.exception.GlobalExceptionHandler;
import com.listingcheck.validator.fixtures.TestFixtures;
import com.listingcheck.validator.service.catalog.CatalogIndexProvider;
import com.listingcheck.validator.service.similarity.CatalogIndex;

@ExtendWith(MockitoExtension.class)
@DisplayName("CatalogController Tests")
class CatalogControllerTest {

  @Mock private CatalogIndexProvider catalogIndexProvider;

  @InjectMocks private CatalogController controller;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void shouldReportReloadedIndexSize() throws Exception {
    CatalogIndex index = TestFixtures.createSampleIndex();
    when(catalogIndexProvider.reload()).thenReturn(index);

    mockMvc
        .perform(post("/api/catalog/reload"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("reloaded"))
        .andExpect(jsonPath("$.catalogSize").value(12))
        .andExpect(jsonPath("$.vocabularySize").value(index.getModel().vocabularySize()));
  }

  @Test
  void shouldReturnServiceUnavailableWhenReloadFails() throws Exception {
    when(catalogIndexProvider.reload())
        .thenThrow(new CatalogDataException("Catalog file not found: missing.csv"));

    mockMvc
        .perform(post("/api/catalog/reload"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(header().exists("Retry-After"))
        .andExpect(jsonPath("$.code").value("CATALOG_UNAVAILABLE"))
        .andExpect(jsonPath("$.message").value("Catalog file not found: missing.csv"));
  }
}
