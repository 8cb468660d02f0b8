package dev.visibility;

import dev.visibility.cfp.CfpOrchestrator;
import dev.visibility.cfp.CfpRequest;
import dev.visibility.cfp.CfpResult;
import dev.visibility.retry.ErrorSanitizer;
import dev.visibility.scheduler.AutomationScheduler;
import dev.visibility.scheduler.SchedulerRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Runs the process in the configured mode: one scheduler pass, one CFP run for a URL,
 * or daemon mode where cron-driven passes do the work.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutomationRunner {

  public static final String MODE_SCHEDULED = "scheduled";
  public static final String MODE_CFP = "cfp";
  public static final String MODE_DAEMON = "daemon";

  private static final String SEPARATOR = "========================================";

  private final AutomationScheduler scheduler;
  private final CfpOrchestrator orchestrator;

  @Value("${runner.mode:scheduled}")
  private String mode;

  @Value("${runner.url:}")
  private String url;

  @Value("${runner.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  public boolean isDaemon() {
    return MODE_DAEMON.equals(normalizedMode());
  }

  /**
   * Executes the configured one-shot run and handles the post-execution wait.
   *
   * @return number of businesses processed successfully
   */
  public int execute() {
    String runMode = normalizedMode();
    log.info(SEPARATOR);
    log.info("AI Visibility Engine Starting (mode: {})", runMode);
    log.info(SEPARATOR);

    try {
      int count;
      if (MODE_CFP.equals(runMode)) {
        count = runCfp();
      } else if (MODE_SCHEDULED.equals(runMode)) {
        count = runScheduledPass();
      } else if (MODE_DAEMON.equals(runMode)) {
        log.info("Daemon mode - waiting for scheduled automation passes");
        return 0;
      } else {
        throw new IllegalArgumentException("Unknown runner mode: " + mode);
      }

      log.info(SEPARATOR);
      log.info("AI Visibility Engine Completed Successfully");
      log.info("Businesses processed successfully: {}", count);
      log.info(SEPARATOR);

      handleMetricsWait();

      return count;
    } catch (Exception e) {
      log.error("AI Visibility Engine failed: {}", ErrorSanitizer.sanitize(e));
      throw new IllegalStateException("Automation run failed", e);
    }
  }

  private int runScheduledPass() {
    SchedulerRunSummary summary = scheduler.processScheduledAutomation().block();
    if (summary == null) {
      return 0;
    }
    if (summary.failed() > 0) {
      log.warn("{} of {} businesses failed in this pass", summary.failed(), summary.processed());
    }
    return summary.succeeded();
  }

  private int runCfp() {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("runner.url is required in cfp mode");
    }
    CfpResult result = orchestrator.execute(CfpRequest.forUrl(url)).block();
    if (result == null || !result.success()) {
      String error = result != null ? result.error() : "no result";
      throw new IllegalStateException("CFP run failed for " + url + ": " + error);
    }
    if (result.fingerprint() != null) {
      log.info("Visibility score for '{}': {}", result.business().name(), result.fingerprint().visibilityScore());
    }
    return 1;
  }

  private String normalizedMode() {
    return mode == null ? MODE_SCHEDULED : mode.trim().toLowerCase(Locale.ROOT);
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
