package com.listingcheck.validator.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "validator")
public class ApplicationProperties {

  private String version;

  private Catalog catalog = new Catalog();
  private Neighbours neighbours = new Neighbours();
  private Policy policy = new Policy();
  private Storage storage = new Storage();
  private Explanation explanation = new Explanation();

  @Data
  public static class Catalog {
    /** File path, or a {@code classpath:} resource holding the HO reference catalog CSV. */
    private String location = "classpath:catalog/ho_products.csv";

    /** Abort startup when the catalog cannot be loaded. */
    private boolean failFast = true;
  }

  @Data
  public static class Neighbours {
    private int topK = 15;
  }

  @Data
  public static class Policy {
    private String ageRestrictedCategoryMarker = "alcohol";
    private List<String> ageRestrictedKeywords =
        new ArrayList<>(
            List.of(
                "beer", "lager", "cider", "wine", "vodka", "rum", "gin", "whisky", "whiskey",
                "brandy", "alcopop"));
  }

  @Data
  public static class Storage {
    /** {@code file} or {@code s3}. */
    private String type = "file";

    private String submissionsFile = "./data/submissions.json";
    private String s3Bucket;
    private String s3Prefix = "submissions/";
    private String s3Region = "eu-west-2";
  }

  @Data
  public static class Explanation {
    private boolean enabled = true;
    private Cache cache = new Cache();
  }

  @Data
  public static class Cache {
    private boolean enabled = true;
    private long maxSize = 500;
    private long expireAfterWriteMinutes = 60;
  }
}
