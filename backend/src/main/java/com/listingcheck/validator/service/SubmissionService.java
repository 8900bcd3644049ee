package com.listingcheck.validator.service;

import java.io.IOException;
import java.io.Writer;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.listingcheck.validator.dto.submission.ExplanationResponse;
import com.listingcheck.validator.dto.submission.ProductInput;
import com.listingcheck.validator.dto.submission.Submission;
import com.listingcheck.validator.dto.submission.SubmissionRequest;
import com.listingcheck.validator.dto.submission.SubmissionStatus;
import com.listingcheck.validator.dto.submission.SubmissionsResponse;
import com.listingcheck.validator.dto.validation.OverallVerdict;
import com.listingcheck.validator.dto.validation.ValidationResult;
import com.listingcheck.validator.exception.ExplanationException;
import com.listingcheck.validator.exception.ResourceNotFoundException;
import com.listingcheck.validator.service.explanation.ProductExplainer;
import com.listingcheck.validator.service.storage.ISubmissionRepository;
import com.opencsv.CSVWriter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Store submission and head office review workflow. Every submission is re-validated on receipt;
 * anything the store flags or the engine does not rate {@link OverallVerdict#READY} waits for
 * review, everything else is approved immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionService {

  static final String[] EXPORT_HEADER = {
    "id",
    "timestamp",
    "status",
    "flagged",
    "product_name",
    "category",
    "price",
    "age_flag",
    "overall",
    "category_decision",
    "price_decision",
    "age_verification_decision",
    "notes",
    "denial_reason",
    "reviewed_at"
  };

  static final Comparator<Submission> REVIEW_PRIORITY =
      Comparator.comparingInt(Submission::getRiskScore)
          .reversed()
          .thenComparing(ISubmissionRepository.NEWEST_FIRST);

  private final ProductValidationService productValidationService;
  private final ISubmissionRepository submissionRepository;
  private final ProductExplainer productExplainer;

  public ValidationResult validate(ProductInput product) {
    return productValidationService.validateProduct(
        product.getProductName(), product.getCategory(), product.getPrice(), product.getAgeFlag());
  }

  /** Validates and, where a provider is available, explains the result. */
  public ExplanationResponse validateAndExplain(ProductInput product) {
    ValidationResult result = validate(product);
    return ExplanationResponse.builder()
        .validation(result)
        .explanation(explainQuietly(product, result).orElse(null))
        .build();
  }

  public Submission submit(SubmissionRequest request) {
    ProductInput product = request.getProduct();
    ValidationResult result = validate(product);

    boolean flagged = request.isFlagged() || result.getOverall() != OverallVerdict.READY;
    SubmissionStatus status = flagged ? SubmissionStatus.PENDING : SubmissionStatus.APPROVED;

    Submission submission =
        Submission.builder()
            .timestamp(LocalDateTime.now())
            .product(product)
            .validation(result)
            .acceptedChanges(
                request.getAcceptedChanges() == null
                    ? new ArrayList<>()
                    : new ArrayList<>(request.getAcceptedChanges()))
            .notes(request.getNotes())
            .flagged(flagged)
            .status(status)
            .build();

    if (request.isExplain()) {
      explainQuietly(product, result).ifPresent(submission::setExplanation);
    }

    Submission stored = submissionRepository.append(submission);
    log.info(
        "Stored submission {} for '{}' as {} (overall={})",
        stored.getId(),
        product.getProductName(),
        status.getValue(),
        result.getOverall().getCode());
    return stored;
  }

  public Submission getSubmission(String id) {
    return submissionRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Submission", "id", id));
  }

  /**
   * Lists submissions for head office review. The pending queue is ordered by risk score, highest
   * first, then newest first; reviewed submissions are newest first. Counts always cover every
   * submission, whatever the filter.
   *
   * @param status only list submissions with this status, or {@code null} for all
   */
  public SubmissionsResponse listSubmissions(SubmissionStatus status) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (SubmissionStatus each : SubmissionStatus.values()) {
      counts.put(each.getValue(), 0);
    }

    List<Submission> pending = new ArrayList<>();
    List<Submission> reviewed = new ArrayList<>();
    for (Submission submission : submissionRepository.findAll()) {
      if (submission.getStatus() != null) {
        counts.merge(submission.getStatus().getValue(), 1, Integer::sum);
      }
      if (status != null && submission.getStatus() != status) {
        continue;
      }
      if (submission.getStatus() == SubmissionStatus.PENDING) {
        pending.add(submission);
      } else {
        reviewed.add(submission);
      }
    }
    pending.sort(REVIEW_PRIORITY);
    return SubmissionsResponse.builder()
        .pending(pending)
        .reviewed(reviewed)
        .counts(counts)
        .build();
  }

  /** The stored submission is replaced, never modified in place. */
  public Submission approve(String id) {
    Submission approved =
        getSubmission(id).toBuilder()
            .status(SubmissionStatus.APPROVED)
            .denialReason(null)
            .reviewedAt(LocalDateTime.now())
            .build();
    Submission stored = submissionRepository.update(approved);
    log.info("Submission {} approved", id);
    return stored;
  }

  public Submission deny(String id, String reason) {
    Submission denied =
        getSubmission(id).toBuilder()
            .status(SubmissionStatus.DENIED)
            .denialReason(reason == null || reason.isBlank() ? null : reason.trim())
            .reviewedAt(LocalDateTime.now())
            .build();
    Submission stored = submissionRepository.update(denied);
    log.info("Submission {} denied: {}", id, stored.getDenialReason());
    return stored;
  }

  /** Writes every submission, newest first, as CSV. */
  public int exportCsv(Writer writer) throws IOException {
    List<Submission> all = submissionRepository.findAll();
    CSVWriter csvWriter = new CSVWriter(writer);
    csvWriter.writeNext(EXPORT_HEADER);
    for (Submission submission : all) {
      csvWriter.writeNext(toRow(submission));
    }
    csvWriter.flush();
    return all.size();
  }

  private String[] toRow(Submission submission) {
    ProductInput product = submission.getProduct();
    ValidationResult result = submission.getValidation();
    return new String[] {
      submission.getId(),
      valueOf(submission.getTimestamp()),
      submission.getStatus() == null ? "" : submission.getStatus().getValue(),
      Boolean.toString(submission.isFlagged()),
      product == null ? "" : valueOf(product.getProductName()),
      product == null ? "" : valueOf(product.getCategory()),
      product == null || product.getPrice() == null ? "" : product.getPrice().toPlainString(),
      product == null ? "" : valueOf(product.getAgeFlag()),
      result == null ? "" : result.getOverall().getCode(),
      result == null ? "" : result.getCategory().getDecision().getValue(),
      result == null ? "" : result.getPrice().getDecision().getValue(),
      result == null ? "" : result.getAgeVerification().getDecision().getValue(),
      valueOf(submission.getNotes()),
      valueOf(submission.getDenialReason()),
      valueOf(submission.getReviewedAt())
    };
  }

  private Optional<String> explainQuietly(ProductInput product, ValidationResult result) {
    try {
      return productExplainer.explain(product, result);
    } catch (ExplanationException e) {
      log.warn("Explanation unavailable: {}", e.getMessage(), e);
      return Optional.empty();
    }
  }

  private static String valueOf(Object value) {
    return value == null ? "" : value.toString();
  }
}
