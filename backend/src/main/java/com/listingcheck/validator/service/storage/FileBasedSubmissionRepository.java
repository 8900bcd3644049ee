package com.listingcheck.validator.service.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.listingcheck.validator.config.ApplicationProperties;
import com.listingcheck.validator.dto.submission.Submission;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps submissions in memory and snapshots the full set to a JSON file on every change. Callers
 * always receive copies, so a change is only seen by others once {@link #update} has persisted it.
 * Default store when {@code validator.storage.type} is unset.
 */
@Slf4j
@Repository
@ConditionalOnProperty(
    prefix = "validator.storage",
    name = "type",
    havingValue = "file",
    matchIfMissing = true)
@RequiredArgsConstructor
public class FileBasedSubmissionRepository implements ISubmissionRepository {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;
  private final Map<String, Submission> submissions = new ConcurrentHashMap<>();
  private final AtomicLong lastId = new AtomicLong();
  private Path submissionsFile;

  @PostConstruct
  public void init() {
    submissionsFile = Paths.get(applicationProperties.getStorage().getSubmissionsFile());
    try {
      Path parent = submissionsFile.toAbsolutePath().getParent();
      if (parent != null && !Files.exists(parent)) {
        Files.createDirectories(parent);
      }
    } catch (IOException e) {
      log.warn(
          "Failed to ensure directory for submissions file '{}': {}",
          submissionsFile,
          e.getMessage());
    }
    loadSubmissions();
  }

  /** The id is only used up, and the submission only visible, once the file write succeeds. */
  @Override
  public synchronized Submission append(Submission submission) {
    long next = lastId.get() + 1;
    Submission stored = submission.toBuilder().id(Long.toString(next)).build();
    persistThenPublish(stored);
    lastId.set(next);
    return stored.toBuilder().build();
  }

  @Override
  public Optional<Submission> findById(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(submissions.get(id)).map(s -> s.toBuilder().build());
  }

  @Override
  public List<Submission> findAll() {
    List<Submission> all = new ArrayList<>();
    for (Submission submission : submissions.values()) {
      all.add(submission.toBuilder().build());
    }
    all.sort(NEWEST_FIRST);
    return all;
  }

  @Override
  public synchronized Submission update(Submission submission) {
    if (submission.getId() == null || !submissions.containsKey(submission.getId())) {
      throw new IllegalArgumentException("Unknown submission id: " + submission.getId());
    }
    Submission stored = submission.toBuilder().build();
    persistThenPublish(stored);
    return stored.toBuilder().build();
  }

  /** Writes the current set plus {@code submission}; the cache changes only once that succeeds. */
  private void persistThenPublish(Submission submission) {
    Map<String, Submission> next = new HashMap<>(submissions);
    next.put(submission.getId(), submission);
    List<Submission> snapshot = new ArrayList<>(next.values());
    snapshot.sort(NEWEST_FIRST);
    saveSubmissions(snapshot);
    submissions.put(submission.getId(), submission);
  }

  private void loadSubmissions() {
    if (!Files.exists(submissionsFile)) {
      log.debug("No submissions file found at {}, starting empty", submissionsFile);
      return;
    }

    try {
      List<Submission> stored =
          objectMapper.readValue(
              submissionsFile.toFile(),
              objectMapper.getTypeFactory().constructCollectionType(List.class, Submission.class));

      for (Submission submission : stored) {
        submissions.put(submission.getId(), submission);
        lastId.accumulateAndGet(ISubmissionRepository.parseIdOrZero(submission.getId()), Math::max);
      }
      log.info("Loaded {} submissions from {}", submissions.size(), submissionsFile);
    } catch (IOException e) {
      log.error("Failed to load submissions from file: {}", submissionsFile, e);
    }
  }

  private void saveSubmissions(List<Submission> snapshot) {
    try {
      Path tmp = submissionsFile.resolveSibling(submissionsFile.getFileName() + ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
      Files.move(tmp, submissionsFile, StandardCopyOption.REPLACE_EXISTING);
      log.debug("Saved {} submissions to {}", snapshot.size(), submissionsFile);
    } catch (IOException e) {
      log.error("Failed to save submissions to file: {}", submissionsFile, e);
      throw new UncheckedIOException("Failed to persist submissions", e);
    }
  }
}
