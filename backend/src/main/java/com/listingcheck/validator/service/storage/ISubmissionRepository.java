package com.listingcheck.validator.service.storage;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.listingcheck.validator.dto.submission.Submission;
import com.listingcheck.validator.dto.submission.SubmissionStatus;

/**
 * Append-mostly store of product submissions keyed by a monotonically increasing id. Reads return
 * copies; a change only takes effect through {@link #update}.
 */
public interface ISubmissionRepository {

  /** Newest first, ties broken by id descending. */
  Comparator<Submission> NEWEST_FIRST =
      Comparator.comparing(
              Submission::getTimestamp, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
          .thenComparingLong(s -> parseIdOrZero(s.getId()))
          .reversed();

  /**
   * Stores a copy of the submission under the next id. Nothing is stored, and no id used up, if
   * persisting fails.
   *
   * @param submission the submission to store; any id it carries is ignored
   * @return a copy of the stored submission with its id set
   */
  Submission append(Submission submission);

  /**
   * Finds a submission by id.
   *
   * @param id the submission id
   * @return the submission if found
   */
  Optional<Submission> findById(String id);

  /**
   * Lists all submissions, newest first.
   *
   * @return all stored submissions
   */
  List<Submission> findAll();

  /**
   * Replaces an existing submission. The previous version stays in place if persisting fails.
   *
   * @param submission the submission, identified by its id
   * @return the stored submission
   * @throws IllegalArgumentException if no submission has that id
   */
  Submission update(Submission submission);

  /**
   * Lists submissions with the given status, newest first.
   *
   * @param status the status to filter on
   * @return matching submissions
   */
  default List<Submission> findByStatus(SubmissionStatus status) {
    return findAll().stream().filter(s -> s.getStatus() == status).toList();
  }

  static long parseIdOrZero(String id) {
    try {
      return id == null ? 0L : Long.parseLong(id);
    } catch (NumberFormatException e) {
      return 0L;
    }
  }
}
