package com.listingcheck.validator.service.storage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.listingcheck.validator.config.ApplicationProperties;
import com.listingcheck.validator.dto.submission.Submission;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * S3-backed submission store. Each submission is an individual JSON object under the configured
 * prefix; reads are served from a local cache filled at startup.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "validator.storage", name = "type", havingValue = "s3")
public class S3SubmissionRepository implements ISubmissionRepository {

  private final ObjectMapper objectMapper;
  private final String bucketName;
  private final String prefix;
  private final S3Client s3Client;
  private final boolean ownsClient;

  private final Map<String, Submission> cache = new ConcurrentHashMap<>();
  private final AtomicLong lastId = new AtomicLong();

  @Autowired
  public S3SubmissionRepository(
      ObjectMapper objectMapper, ApplicationProperties applicationProperties) {
    this(
        objectMapper,
        applicationProperties,
        S3Client.builder()
            .region(Region.of(applicationProperties.getStorage().getS3Region()))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .build(),
        true);
  }

  S3SubmissionRepository(
      ObjectMapper objectMapper,
      ApplicationProperties applicationProperties,
      S3Client s3Client,
      boolean ownsClient) {
    String bucket = applicationProperties.getStorage().getS3Bucket();
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalStateException(
          "validator.storage.s3-bucket must be set when validator.storage.type=s3");
    }
    this.objectMapper = objectMapper;
    this.bucketName = bucket;
    this.prefix = applicationProperties.getStorage().getS3Prefix();
    this.s3Client = s3Client;
    this.ownsClient = ownsClient;
  }

  @PostConstruct
  public void init() {
    log.info("Using S3 submission store s3://{}/{}", bucketName, prefix);
    reload();
  }

  @PreDestroy
  public void cleanup() {
    if (ownsClient) {
      s3Client.close();
    }
  }

  @Override
  public synchronized Submission append(Submission submission) {
    long next = lastId.get() + 1;
    Submission stored = submission.toBuilder().id(Long.toString(next)).build();
    putObject(stored);
    cache.put(stored.getId(), stored);
    lastId.set(next);
    return stored.toBuilder().build();
  }

  @Override
  public Optional<Submission> findById(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(cache.get(id)).map(s -> s.toBuilder().build());
  }

  @Override
  public List<Submission> findAll() {
    List<Submission> all = new ArrayList<>();
    for (Submission submission : cache.values()) {
      all.add(submission.toBuilder().build());
    }
    all.sort(NEWEST_FIRST);
    return all;
  }

  @Override
  public synchronized Submission update(Submission submission) {
    if (submission.getId() == null || !cache.containsKey(submission.getId())) {
      throw new IllegalArgumentException("Unknown submission id: " + submission.getId());
    }
    Submission stored = submission.toBuilder().build();
    putObject(stored);
    cache.put(stored.getId(), stored);
    return stored.toBuilder().build();
  }

  private synchronized void reload() {
    cache.clear();
    lastId.set(0);

    String continuationToken = null;
    do {
      ListObjectsV2Response listing =
          s3Client.listObjectsV2(
              ListObjectsV2Request.builder()
                  .bucket(bucketName)
                  .prefix(prefix)
                  .continuationToken(continuationToken)
                  .build());

      for (S3Object object : listing.contents()) {
        if (object.key().endsWith(".json")) {
          loadObject(object.key());
        }
      }
      continuationToken = listing.isTruncated() ? listing.nextContinuationToken() : null;
    } while (continuationToken != null);

    log.info("Loaded {} submissions from s3://{}/{}", cache.size(), bucketName, prefix);
  }

  private void loadObject(String key) {
    try {
      ResponseBytes<GetObjectResponse> bytes =
          s3Client.getObjectAsBytes(GetObjectRequest.builder().bucket(bucketName).key(key).build());
      Submission submission = objectMapper.readValue(bytes.asByteArray(), Submission.class);
      cache.put(submission.getId(), submission);
      lastId.accumulateAndGet(ISubmissionRepository.parseIdOrZero(submission.getId()), Math::max);
    } catch (IOException | S3Exception e) {
      log.error("Skipping unreadable submission object s3://{}/{}", bucketName, key, e);
    }
  }

  private void putObject(Submission submission) {
    try {
      byte[] json = objectMapper.writeValueAsBytes(submission);
      s3Client.putObject(
          PutObjectRequest.builder()
              .bucket(bucketName)
              .key(keyFor(submission.getId()))
              .contentType("application/json")
              .build(),
          RequestBody.fromBytes(json));
      log.debug("Stored submission {} in s3://{}/{}", submission.getId(), bucketName, prefix);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to serialise submission " + submission.getId(), e);
    }
  }

  private String keyFor(String id) {
    return prefix + id + ".json";
  }
}
