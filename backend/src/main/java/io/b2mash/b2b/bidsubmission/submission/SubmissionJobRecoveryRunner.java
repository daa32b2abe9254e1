package io.b2mash.b2b.bidsubmission.submission;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Reloads persisted submission jobs into the orchestrator on startup. */
@Component
public class SubmissionJobRecoveryRunner implements ApplicationRunner {

  private final SubmissionOrchestrator orchestrator;

  public SubmissionJobRecoveryRunner(SubmissionOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Override
  public void run(ApplicationArguments args) {
    orchestrator.restoreJobs();
  }
}
