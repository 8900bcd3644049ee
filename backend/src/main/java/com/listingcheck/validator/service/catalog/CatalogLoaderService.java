package com.listingcheck.validator.service.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import com.listingcheck.validator.dto.catalog.CatalogEntry;
import com.listingcheck.validator.exception.CatalogDataException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the head office reference catalog from CSV. Expected columns are {@value #NAME_COLUMN},
 * {@value #CATEGORY_COLUMN}, {@value #PRICE_COLUMN} and {@value #AGE_FLAG_COLUMN}; any other column
 * is kept as a descriptive attribute.
 *
 * <p>Missing columns are reported and defaulted rather than rejected.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogLoaderService {

  public static final String NAME_COLUMN = "ProductName";
  public static final String CATEGORY_COLUMN = "Category";
  public static final String PRICE_COLUMN = "PriceGBP";
  public static final String AGE_FLAG_COLUMN = "AgeVerificationRequired";

  private static final List<String> REQUIRED_COLUMNS =
      List.of(NAME_COLUMN, CATEGORY_COLUMN, PRICE_COLUMN, AGE_FLAG_COLUMN);

  private final ResourceLoader resourceLoader;

  public List<CatalogEntry> load(String location) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new CatalogDataException("Reference catalog not found at " + location);
    }

    try (InputStream in = resource.getInputStream()) {
      List<CatalogEntry> entries = parse(in, location);
      log.info("Loaded {} catalog entries from {}", entries.size(), location);
      return entries;
    } catch (IOException e) {
      throw new CatalogDataException("Failed to read reference catalog at " + location, e);
    }
  }

  List<CatalogEntry> parse(InputStream csvStream, String source) throws IOException {
    List<CatalogEntry> entries = new ArrayList<>();

    try (CSVReader reader =
        new CSVReader(new InputStreamReader(csvStream, StandardCharsets.UTF_8))) {
      String[] headers = reader.readNext();
      if (headers == null || headers.length == 0) {
        throw new CatalogDataException("Reference catalog " + source + " has no header row");
      }

      Map<String, Integer> columnIndex = new HashMap<>();
      for (int i = 0; i < headers.length; i++) {
        columnIndex.put(stripBom(headers[i]).trim(), i);
      }

      List<String> missing =
          REQUIRED_COLUMNS.stream().filter(c -> !columnIndex.containsKey(c)).toList();
      if (!missing.isEmpty()) {
        log.warn(
            "Reference catalog {} is missing columns {}; defaults will be used for them",
            source,
            missing);
      }

      String[] row;
      int line = 1;
      while ((row = reader.readNext()) != null) {
        line++;
        if (row.length == 1 && row[0].isBlank()) {
          continue;
        }
        entries.add(toEntry(row, headers, columnIndex, source, line));
      }
    } catch (CsvValidationException e) {
      throw new CatalogDataException("Malformed reference catalog " + source, e);
    }

    if (entries.isEmpty()) {
      throw new CatalogDataException("Reference catalog " + source + " contains no products");
    }
    return entries;
  }

  private CatalogEntry toEntry(
      String[] row, String[] headers, Map<String, Integer> columnIndex, String source, int line) {
    Map<String, String> attributes = new LinkedHashMap<>();
    for (int i = 0; i < headers.length && i < row.length; i++) {
      String header = stripBom(headers[i]).trim();
      if (!REQUIRED_COLUMNS.contains(header) && !row[i].isBlank()) {
        attributes.put(header, row[i].trim());
      }
    }

    return CatalogEntry.builder()
        .productName(valueOf(row, columnIndex, NAME_COLUMN))
        .category(valueOf(row, columnIndex, CATEGORY_COLUMN))
        .price(parsePrice(valueOf(row, columnIndex, PRICE_COLUMN), source, line))
        .ageVerificationRequired(valueOf(row, columnIndex, AGE_FLAG_COLUMN))
        .attributes(Map.copyOf(attributes))
        .build();
  }

  private static String valueOf(String[] row, Map<String, Integer> columnIndex, String column) {
    Integer idx = columnIndex.get(column);
    if (idx == null || idx >= row.length) {
      return null;
    }
    String value = row[idx].trim();
    return value.isEmpty() ? null : value;
  }

  private static BigDecimal parsePrice(String raw, String source, int line) {
    if (raw == null) {
      return null;
    }
    try {
      return new BigDecimal(raw.replace("£", "").replace(",", "").trim());
    } catch (NumberFormatException e) {
      log.warn("Ignoring unparseable price '{}' in {} line {}", raw, source, line);
      return null;
    }
  }

  private static String stripBom(String header) {
    return header.startsWith("\uFEFF") ? header.substring(1) : header;
  }
}
