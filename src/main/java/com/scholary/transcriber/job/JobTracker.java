package com.scholary.transcriber.job;

import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

/** Counts jobs currently inside the pipeline, for the readiness endpoint. */
@Component
public class JobTracker {

  private final AtomicInteger activeJobs = new AtomicInteger();

  public int jobStarted() {
    return activeJobs.incrementAndGet();
  }

  public int jobFinished() {
    return activeJobs.decrementAndGet();
  }

  public int activeJobs() {
    return activeJobs.get();
  }
}
