package io.b2mash.b2b.bidsubmission.submission;

import io.b2mash.b2b.bidsubmission.audit.AuditLogEntry;
import io.b2mash.b2b.bidsubmission.audit.AuditLogEntryBuilder;
import io.b2mash.b2b.bidsubmission.audit.AuditLogWriteException;
import io.b2mash.b2b.bidsubmission.audit.SubmissionAuditEvents;
import io.b2mash.b2b.bidsubmission.audit.SubmissionAuditLog;
import io.b2mash.b2b.bidsubmission.document.BidDocument;
import io.b2mash.b2b.bidsubmission.document.DocumentRenderingException;
import io.b2mash.b2b.bidsubmission.document.UnsupportedFormatException;
import io.b2mash.b2b.bidsubmission.exception.InvalidReferenceException;
import io.b2mash.b2b.bidsubmission.exception.InvalidStateException;
import io.b2mash.b2b.bidsubmission.exception.PastDeadlineException;
import io.b2mash.b2b.bidsubmission.exception.ResourceNotFoundException;
import io.b2mash.b2b.bidsubmission.exception.RetryExhaustedException;
import io.b2mash.b2b.bidsubmission.notification.NotificationSink;
import io.b2mash.b2b.bidsubmission.notification.SubmissionEventType;
import io.b2mash.b2b.bidsubmission.packaging.BidDocumentPackage;
import io.b2mash.b2b.bidsubmission.packaging.PackageAssembler;
import io.b2mash.b2b.bidsubmission.packaging.PackageAssemblyException;
import io.b2mash.b2b.bidsubmission.portal.DeliveryOutcome;
import io.b2mash.b2b.bidsubmission.portal.PortalAdapter;
import io.b2mash.b2b.bidsubmission.portal.PortalAdapterRegistry;
import io.b2mash.b2b.bidsubmission.portal.PortalRequirements;
import io.b2mash.b2b.bidsubmission.rfp.RfpLookup;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.ErrorResponseException;

/**
 * Owns the submission job table and drives every job through its lifecycle: admission by priority
 * and deadline under a concurrency cap, package assembly and validation, portal delivery under a
 * timeout, outcome classification, and requeueing within the retry budget.
 *
 * <p>Concurrency model:
 *
 * <ul>
 *   <li>Admission happens under {@code admissionLock}; a job leaves QUEUED inside that lock, so two
 *       concurrent {@link #processQueue()} calls never admit the same job.
 *   <li>Each job's transitions happen under the job's monitor. The audit entry for a transition is
 *       appended before the transition is applied, inside the same monitor, so the audit order is
 *       the transition order and a failed append leaves the job unchanged.
 *   <li>Attempts run on the worker pool; portal calls run on the transport pool so a worker can
 *       give up at the portal timeout. A timed-out call is tracked until it returns and its job is
 *       not readmitted before then.
 *   <li>After each transition the job is written through to the {@link SubmissionJobStore}.
 *       Queries read the job's published snapshot and never take its monitor.
 * </ul>
 *
 * <p>A failed audit or store write in a worker returns the job to QUEUED and halts admission until
 * {@link #resumeAdmission()}.
 *
 * <p>Retry budget: a job may make up to {@code maxRetries + 1} portal calls. It is requeued after a
 * retryable failure while {@code attempts <= maxRetries}. The same bound applies to assembly
 * failures, which are counted separately. An operator retry requires {@code attempts <
 * maxRetries}.
 */
@Service
public class SubmissionOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(SubmissionOrchestrator.class);

  private static final int MAX_BACKOFF_EXPONENT = 20;

  static final Comparator<SubmissionJob> QUEUE_ORDER =
      Comparator.comparing(SubmissionJob::getPriority, Comparator.reverseOrder())
          .thenComparing(SubmissionJob::getDeadline)
          .thenComparing(SubmissionJob::getCreatedAt)
          .thenComparing(SubmissionJob::getId);

  private final RfpLookup rfpLookup;
  private final PackageAssembler packageAssembler;
  private final PortalAdapterRegistry portalAdapterRegistry;
  private final SubmissionAuditLog auditLog;
  private final SubmissionJobStore jobStore;
  private final NotificationSink notificationSink;
  private final SubmissionProperties properties;
  private final ExecutorService workerExecutor;
  private final ExecutorService transportExecutor;
  private final Clock clock;

  private final Map<String, SubmissionJob> jobs = new ConcurrentHashMap<>();
  private final Set<String> lingeringDeliveries = ConcurrentHashMap.newKeySet();
  private final Object admissionLock = new Object();
  private int inFlight; // guarded by admissionLock
  private volatile RuntimeException admissionHaltCause;

  public SubmissionOrchestrator(
      RfpLookup rfpLookup,
      PackageAssembler packageAssembler,
      PortalAdapterRegistry portalAdapterRegistry,
      SubmissionAuditLog auditLog,
      SubmissionJobStore jobStore,
      NotificationSink notificationSink,
      SubmissionProperties properties,
      @Qualifier("submissionWorkerExecutor") ExecutorService workerExecutor,
      @Qualifier("portalTransportExecutor") ExecutorService transportExecutor,
      Clock clock) {
    this.rfpLookup = rfpLookup;
    this.packageAssembler = packageAssembler;
    this.portalAdapterRegistry = portalAdapterRegistry;
    this.auditLog = auditLog;
    this.jobStore = jobStore;
    this.notificationSink = notificationSink;
    this.properties = properties;
    this.workerExecutor = workerExecutor;
    this.transportExecutor = transportExecutor;
    this.clock = clock;
  }

  /** Queues a bid for delivery with the portal's default retry budget and no scheduled time. */
  public SubmissionJobSnapshot submit(
      String rfpId, BidDocument bidDocument, String portal, int priority) {
    return submit(SubmissionRequest.of(rfpId, bidDocument, portal, priority));
  }

  /**
   * Creates a QUEUED job for the request.
   *
   * @throws InvalidReferenceException if the RFP or the portal is unknown
   * @throws PastDeadlineException if the RFP's response deadline is not in the future
   * @throws AuditLogWriteException if the creation could not be recorded; no job is created
   * @throws SubmissionStoreException if the job could not be persisted; no job is created
   */
  public SubmissionJobSnapshot submit(SubmissionRequest request) {
    var rfp =
        rfpLookup
            .findByRfpId(request.rfpId())
            .orElseThrow(() -> new InvalidReferenceException("RFP", request.rfpId()));
    Instant now = clock.instant();
    if (rfp.responseDeadline() == null) {
      throw InvalidReferenceException.withDetail(
          "RFP has no response deadline", "RFP " + rfp.rfpId() + " has no response deadline");
    }
    if (!rfp.responseDeadline().isAfter(now)) {
      throw new PastDeadlineException(rfp.rfpId(), rfp.responseDeadline());
    }
    var requirements =
        properties
            .requirementsFor(request.portal())
            .orElseThrow(() -> new InvalidReferenceException("Portal", request.portal()));
    if (portalAdapterRegistry.find(request.portal()).isEmpty()) {
      throw new InvalidReferenceException("Portal", request.portal());
    }

    var job =
        new SubmissionJob(
            UUID.randomUUID().toString(),
            rfp.rfpId(),
            request.portal(),
            request.bidDocument(),
            rfp.responseDeadline(),
            request.priority(),
            request.scheduledTime(),
            resolveMaxRetries(request, requirements),
            now);

    synchronized (job) {
      auditLog.append(
          entry(job, SubmissionAuditEvents.CREATED)
              .detail("rfpId", job.getRfpId())
              .detail("portal", job.getPortal())
              .detail("priority", job.getPriority())
              .detail("maxRetries", job.getMaxRetries())
              .detail("deadline", job.getDeadline().toString())
              .detail(
                  "scheduledTime",
                  request.scheduledTime() != null ? request.scheduledTime().toString() : null)
              .build());
      jobStore.save(job);
      jobs.put(job.getId(), job);
    }
    log.info(
        "Queued submission {} for RFP {} to {} (priority={}, maxRetries={})",
        job.getId(),
        job.getRfpId(),
        job.getPortal(),
        job.getPriority(),
        job.getMaxRetries());
    notifySafely(SubmissionEventType.QUEUED, basePayload(job));
    return job.snapshot();
  }

  /**
   * Admits eligible jobs, highest priority first and earliest deadline among equals, up to the
   * free concurrency capacity, and starts an attempt for each on the worker pool.
   *
   * @throws AuditLogWriteException if a worker failed to write the audit log since admission was
   *     last resumed
   * @throws SubmissionStoreException if a worker failed to persist a job since admission was last
   *     resumed
   */
  public QueueTick processQueue() {
    var haltCause = admissionHaltCause;
    if (haltCause instanceof SubmissionStoreException storeFailure) {
      throw new SubmissionStoreException(
          "Submission admission halted after a job store failure: "
              + storeFailure.getBody().getDetail(),
          storeFailure);
    }
    if (haltCause != null) {
      throw new AuditLogWriteException(
          "Submission admission halted after an audit log failure: " + describe(haltCause),
          haltCause);
    }

    Instant now = clock.instant();
    var admitted = new ArrayList<SubmissionJob>();
    synchronized (admissionLock) {
      int capacity = properties.maxConcurrentSubmissions() - inFlight;
      if (capacity <= 0) {
        return QueueTick.empty();
      }
      var candidates =
          jobs.values().stream()
              .filter(job -> !lingeringDeliveries.contains(job.getId()))
              .filter(job -> job.isEligible(now))
              .sorted(QUEUE_ORDER)
              .toList();
      for (var job : candidates) {
        if (admitted.size() == capacity) {
          break;
        }
        if (job.admit()) {
          admitted.add(job);
        }
      }
      inFlight += admitted.size();
    }
    if (admitted.isEmpty()) {
      return QueueTick.empty();
    }

    var startedIds = new ArrayList<String>();
    var attempts = new ArrayList<CompletableFuture<Void>>();
    for (var job : admitted) {
      try {
        attempts.add(CompletableFuture.runAsync(() -> runAttempt(job), workerExecutor));
        startedIds.add(job.getId());
      } catch (RejectedExecutionException e) {
        log.warn("Worker pool rejected submission {}; returning it to the queue", job.getId());
        job.revertAdmission();
        releaseSlot();
      }
    }
    log.debug("Admitted {} submission(s): {}", startedIds.size(), startedIds);
    return new QueueTick(
        startedIds, CompletableFuture.allOf(attempts.toArray(new CompletableFuture<?>[0])));
  }

  /**
   * Returns a FAILED job to the queue. Does not count as an attempt.
   *
   * @throws ResourceNotFoundException if the job is unknown
   * @throws InvalidStateException if the job is not FAILED
   * @throws RetryExhaustedException if the job has used its retry budget
   */
  public SubmissionJobSnapshot retrySubmission(String jobId) {
    var job = requireJob(jobId);
    synchronized (job) {
      if (job.getStatus() != SubmissionStatus.FAILED) {
        throw new InvalidStateException(
            "Submission not retryable",
            "Submission "
                + jobId
                + " is "
                + job.getStatus()
                + "; only FAILED submissions can be retried");
      }
      if (job.getAttempts() >= job.getMaxRetries()) {
        throw new RetryExhaustedException(jobId, job.getAttempts(), job.getMaxRetries());
      }
      auditLog.append(
          entry(job, SubmissionAuditEvents.SUBMISSION_RETRY)
              .detail("attempts", job.getAttempts())
              .detail("previousError", job.getLastError())
              .build());
      job.requeueByOperator();
      jobStore.save(job);
    }
    log.info("Submission {} requeued by operator after {} attempt(s)", jobId, job.getAttempts());
    return job.snapshot();
  }

  public SubmissionJobSnapshot getJobStatus(String jobId) {
    return requireJob(jobId).snapshot();
  }

  public SubmissionStatistics getStatistics() {
    var counts = new EnumMap<SubmissionStatus, Long>(SubmissionStatus.class);
    for (var status : SubmissionStatus.values()) {
      counts.put(status, 0L);
    }
    long total = 0;
    for (var job : jobs.values()) {
      counts.merge(job.snapshot().status(), 1L, Long::sum);
      total++;
    }
    double successRate =
        total == 0 ? 0.0 : (double) counts.get(SubmissionStatus.CONFIRMED) / total;
    return new SubmissionStatistics(total, counts, successRate);
  }

  /** Jobs in queue order, optionally restricted to one status. */
  public List<SubmissionJobSnapshot> getQueue(Optional<SubmissionStatus> status) {
    return jobs.values().stream()
        .sorted(QUEUE_ORDER)
        .map(SubmissionJob::snapshot)
        .filter(snapshot -> status.map(s -> s == snapshot.status()).orElse(true))
        .toList();
  }

  public List<AuditLogEntry> getAuditTrail(String jobId) {
    requireJob(jobId);
    return auditLog.findByJobId(jobId);
  }

  /** Queued jobs whose deadline falls within {@code window} from now, earliest deadline first. */
  public List<SubmissionJobSnapshot> findDeadlineWarnings(Duration window) {
    Instant now = clock.instant();
    Instant horizon = now.plus(window);
    return jobs.values().stream()
        .map(SubmissionJob::snapshot)
        .filter(snapshot -> snapshot.status() == SubmissionStatus.QUEUED)
        .filter(snapshot -> snapshot.deadline().isAfter(now))
        .filter(snapshot -> !snapshot.deadline().isAfter(horizon))
        .sorted(Comparator.comparing(SubmissionJobSnapshot::deadline))
        .toList();
  }

  /**
   * Loads every persisted job into the job table. Jobs that were VALIDATING or SUBMITTED when the
   * process stopped go back to QUEUED, or to FAILED if their retry budget is already spent.
   *
   * @return the number of jobs loaded
   */
  public int restoreJobs() {
    var stored = jobStore.loadAll();
    int recovered = 0;
    for (var job : stored) {
      synchronized (job) {
        if (job.getStatus() != SubmissionStatus.CONFIRMED) {
          var trail = auditLog.findByJobId(job.getId());
          if (!trail.isEmpty()) {
            job.advanceAuditSequence(trail.get(trail.size() - 1).sequence());
          }
        }
        if (job.getStatus().isInFlight()) {
          recoverInterruptedJob(job);
          recovered++;
        }
      }
      jobs.putIfAbsent(job.getId(), job);
    }
    log.info(
        "Restored {} submission(s) from the job store; {} interrupted in flight",
        stored.size(),
        recovered);
    return stored.size();
  }

  /** Clears an admission halt once the audit log and job store are writable again. */
  public void resumeAdmission() {
    if (admissionHaltCause != null) {
      admissionHaltCause = null;
      log.info("Submission admission resumed");
    }
  }

  private void runAttempt(SubmissionJob job) {
    try {
      attemptDelivery(job);
    } catch (AuditLogWriteException | SubmissionStoreException e) {
      haltAdmission(job, e);
    } catch (RuntimeException e) {
      log.error("Unexpected failure processing submission {}", job.getId(), e);
      recoverFromUnexpectedFailure(job, e);
    } finally {
      releaseSlot();
    }
  }

  private void attemptDelivery(SubmissionJob job) {
    var requirements = properties.requirementsFor(job.getPortal()).orElse(null);
    synchronized (job) {
      Instant now = clock.instant();
      if (now.isAfter(job.getDeadline()) && job.markDeadlinePassedRecorded()) {
        auditLog.append(
            entry(job, SubmissionAuditEvents.DEADLINE_PASSED)
                .detail("deadline", job.getDeadline().toString())
                .failure("Response deadline passed before delivery")
                .build());
        log.warn(
            "Submission {} for RFP {} is past its deadline {}; attempting anyway",
            job.getId(),
            job.getRfpId(),
            job.getDeadline());
      }
      auditLog.append(
          entry(job, SubmissionAuditEvents.ATTEMPT_STARTED)
              .detail("attempt", job.getAttempts() + 1)
              .detail("portal", job.getPortal())
              .build());
    }

    if (requirements == null) {
      synchronized (job) {
        handleAssemblyFailure(
            job, List.of("No requirements configured for portal " + job.getPortal()));
      }
      return;
    }

    BidDocumentPackage bidPackage = null;
    List<String> violations;
    try {
      bidPackage =
          packageAssembler
              .assemble(job.getBidDocument(), requirements)
              .withIdempotencyKey(job.getId());
      violations = packageAssembler.validate(bidPackage, requirements);
    } catch (PackageAssemblyException
        | UnsupportedFormatException
        | DocumentRenderingException e) {
      violations = List.of(e.getBody().getDetail());
    }
    if (!violations.isEmpty()) {
      synchronized (job) {
        handleAssemblyFailure(job, violations);
      }
      return;
    }

    var adapter = portalAdapterRegistry.resolve(job.getPortal());
    synchronized (job) {
      job.markSubmitted(clock.instant());
      jobStore.save(job);
    }
    var outcome = deliver(job, adapter, bidPackage, requirements.submitTimeout());

    synchronized (job) {
      if (outcome.success()) {
        handleConfirmation(job, outcome);
      } else {
        handleDeliveryFailure(job, outcome);
      }
    }
  }

  private DeliveryOutcome deliver(
      SubmissionJob job, PortalAdapter adapter, BidDocumentPackage bidPackage, Duration timeout) {
    CompletableFuture<DeliveryOutcome> call;
    try {
      call = CompletableFuture.supplyAsync(() -> adapter.submit(bidPackage), transportExecutor);
    } catch (RejectedExecutionException e) {
      return DeliveryOutcome.retryable("Portal transport unavailable");
    }
    try {
      var outcome = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return outcome != null
          ? outcome
          : DeliveryOutcome.retryable("Portal " + adapter.portalId() + " returned no outcome");
    } catch (TimeoutException e) {
      trackLingeringDelivery(job, call);
      log.warn(
          "Portal {} did not respond within {} for submission {}",
          adapter.portalId(),
          timeout,
          job.getId());
      return DeliveryOutcome.retryable(
          "Portal " + adapter.portalId() + " did not respond within " + timeout);
    } catch (ExecutionException e) {
      var cause = e.getCause() != null ? e.getCause() : e;
      log.warn(
          "Portal adapter {} failed for submission {}", adapter.portalId(), job.getId(), cause);
      return DeliveryOutcome.retryable("Portal adapter error: " + cause.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      trackLingeringDelivery(job, call);
      return DeliveryOutcome.retryable("Delivery interrupted");
    }
  }

  private void trackLingeringDelivery(SubmissionJob job, CompletableFuture<DeliveryOutcome> call) {
    lingeringDeliveries.add(job.getId());
    call.whenComplete(
        (outcome, error) -> {
          lingeringDeliveries.remove(job.getId());
          log.info(
              "Timed-out delivery for submission {} returned late: {}",
              job.getId(),
              error != null ? error.toString() : outcome);
        });
  }

  // The handlers below run while holding the job's monitor.

  private void handleConfirmation(SubmissionJob job, DeliveryOutcome outcome) {
    auditLog.append(
        entry(job, SubmissionAuditEvents.ATTEMPT_SUCCEEDED)
            .detail("attempt", job.getAttempts())
            .detail("confirmationNumber", outcome.confirmationNumber())
            .build());
    job.markConfirmed(outcome.confirmationNumber(), clock.instant());
    jobStore.save(job);
    log.info(
        "Submission {} confirmed by {} after {} attempt(s): {}",
        job.getId(),
        job.getPortal(),
        job.getAttempts(),
        job.getConfirmationNumber());
    var payload = basePayload(job);
    payload.put("confirmationNumber", job.getConfirmationNumber());
    notifySafely(SubmissionEventType.SUBMISSION_SUCCESSFUL, payload);
  }

  private void handleDeliveryFailure(SubmissionJob job, DeliveryOutcome outcome) {
    var error =
        outcome.errorMessage() != null ? outcome.errorMessage() : outcome.errorClass().name();
    auditLog.append(
        entry(job, SubmissionAuditEvents.ATTEMPT_FAILED)
            .detail("attempt", job.getAttempts())
            .detail("errorClass", outcome.errorClass().name())
            .failure(error)
            .build());

    if (outcome.isRetryable() && job.getAttempts() <= job.getMaxRetries()) {
      scheduleRetry(job, job.getAttempts() + job.getAssemblyFailures(), "delivery");
      job.recordDeliveryFailure(error);
      jobStore.save(job);
      log.warn(
          "Submission {} attempt {} failed, will retry: {}", job.getId(), job.getAttempts(), error);
      return;
    }

    if (outcome.isRetryable()) {
      auditLog.append(
          entry(job, SubmissionAuditEvents.ABANDONED)
              .detail("attempts", job.getAttempts())
              .failure("Retry budget exhausted: " + error)
              .build());
    }
    job.recordDeliveryFailure(error);
    job.markFailed();
    jobStore.save(job);
    log.error(
        "Submission {} failed after {} attempt(s) ({}): {}",
        job.getId(),
        job.getAttempts(),
        outcome.errorClass(),
        error);
    notifyFailure(job, error);
  }

  private void handleAssemblyFailure(SubmissionJob job, List<String> violations) {
    var error = String.join("; ", violations);
    int failures = job.getAssemblyFailures() + 1;
    auditLog.append(
        entry(job, SubmissionAuditEvents.ASSEMBLY_FAILED)
            .detail("violations", violations)
            .detail("assemblyFailures", failures)
            .failure(error)
            .build());

    if (failures <= job.getMaxRetries()) {
      scheduleRetry(job, job.getAttempts() + failures, "assembly");
      job.recordAssemblyFailure(error);
      jobStore.save(job);
      log.warn("Submission {} package assembly failed, will retry: {}", job.getId(), error);
      return;
    }

    auditLog.append(
        entry(job, SubmissionAuditEvents.ABANDONED)
            .detail("assemblyFailures", failures)
            .failure("Package assembly failed " + failures + " time(s): " + error)
            .build());
    job.recordAssemblyFailure(error);
    job.markFailed();
    jobStore.save(job);
    log.error("Submission {} abandoned after {} assembly failure(s)", job.getId(), failures);
    notifyFailure(job, error);
  }

  private void scheduleRetry(SubmissionJob job, int failuresSoFar, String reason) {
    var notBefore = clock.instant().plus(backoff(failuresSoFar));
    auditLog.append(
        entry(job, SubmissionAuditEvents.RETRY_SCHEDULED)
            .detail("reason", reason)
            .detail("notBefore", notBefore.toString())
            .build());
    job.requeue(notBefore);
  }

  Duration backoff(int failuresSoFar) {
    var base = properties.retryBackoff();
    if (failuresSoFar <= 0 || base.isZero() || base.isNegative()) {
      return Duration.ZERO;
    }
    int exponent = Math.min(failuresSoFar - 1, MAX_BACKOFF_EXPONENT);
    var delay = base.multipliedBy(1L << exponent);
    var cap = properties.maxRetryBackoff();
    return delay.compareTo(cap) > 0 ? cap : delay;
  }

  private void recoverFromUnexpectedFailure(SubmissionJob job, RuntimeException cause) {
    var error = "Unexpected error: " + cause.getMessage();
    try {
      synchronized (job) {
        switch (job.getStatus()) {
          case VALIDATING -> handleAssemblyFailure(job, List.of(error));
          case SUBMITTED -> handleDeliveryFailure(job, DeliveryOutcome.retryable(error));
          default -> {
            // already settled
          }
        }
      }
    } catch (RuntimeException e) {
      // the recovery transition could not be recorded either
      haltAdmission(job, e);
    }
  }

  private void recoverInterruptedJob(SubmissionJob job) {
    var previous = job.getStatus();
    var error = "Interrupted by restart while " + previous;
    boolean exhausted =
        job.getAttempts() > job.getMaxRetries() || job.getAssemblyFailures() > job.getMaxRetries();
    auditLog.append(
        entry(job, SubmissionAuditEvents.RECOVERED)
            .detail("previousStatus", previous.name())
            .detail("attempts", job.getAttempts())
            .failure(error)
            .build());
    job.recordDeliveryFailure(error);
    if (exhausted) {
      job.markFailed();
    } else {
      job.requeue(null);
    }
    jobStore.save(job);
    log.warn("Submission {} was {} at shutdown; now {}", job.getId(), previous, job.getStatus());
    if (exhausted) {
      notifyFailure(job, error);
    }
  }

  private void haltAdmission(SubmissionJob job, RuntimeException cause) {
    admissionHaltCause = cause;
    log.error(
        "Persisting state failed while processing submission {}; admission halted",
        job.getId(),
        cause);
    synchronized (job) {
      if (job.getStatus().isInFlight()) {
        job.recordDeliveryFailure("Submission state not recorded: " + describe(cause));
        job.requeue(null);
      }
    }
  }

  private static String describe(RuntimeException cause) {
    if (cause instanceof ErrorResponseException errorResponse
        && errorResponse.getBody().getDetail() != null) {
      return errorResponse.getBody().getDetail();
    }
    return cause.toString();
  }

  private void releaseSlot() {
    synchronized (admissionLock) {
      inFlight--;
    }
  }

  private void notifyFailure(SubmissionJob job, String error) {
    var payload = basePayload(job);
    payload.put("error", error);
    notifySafely(SubmissionEventType.SUBMISSION_FAILED, payload);
  }

  private void notifySafely(SubmissionEventType type, Map<String, Object> payload) {
    try {
      notificationSink.notify(type.getEventType(), payload);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to publish {} notification for submission {}",
          type.getEventType(),
          payload.get("jobId"),
          e);
    }
  }

  private static Map<String, Object> basePayload(SubmissionJob job) {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("jobId", job.getId());
    payload.put("rfpId", job.getRfpId());
    payload.put("portal", job.getPortal());
    payload.put("attempts", job.getAttempts());
    payload.put("deadline", job.getDeadline().toString());
    return payload;
  }

  private AuditLogEntryBuilder entry(SubmissionJob job, String eventType) {
    return AuditLogEntryBuilder.builder()
        .jobId(job.getId())
        .sequence(job.nextAuditSequence())
        .eventType(eventType)
        .timestamp(clock.instant());
  }

  private SubmissionJob requireJob(String jobId) {
    var job = jobId != null ? jobs.get(jobId) : null;
    if (job == null) {
      throw new ResourceNotFoundException("Submission", jobId);
    }
    return job;
  }

  private int resolveMaxRetries(SubmissionRequest request, PortalRequirements requirements) {
    if (request.maxRetries() != null) {
      return request.maxRetries();
    }
    return requirements.maxRetries() != null
        ? requirements.maxRetries()
        : properties.defaultMaxRetries();
  }
}
