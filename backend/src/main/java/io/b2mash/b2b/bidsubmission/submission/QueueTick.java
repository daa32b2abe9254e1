package io.b2mash.b2b.bidsubmission.submission;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Result of one {@link SubmissionOrchestrator#processQueue()} call.
 *
 * @param admittedJobIds jobs admitted by this call, in admission order
 * @param completion completes once every admitted attempt has finished
 */
public record QueueTick(List<String> admittedJobIds, CompletableFuture<Void> completion) {

  public QueueTick {
    admittedJobIds = List.copyOf(admittedJobIds);
  }

  static QueueTick empty() {
    return new QueueTick(List.of(), CompletableFuture.completedFuture(null));
  }
}
