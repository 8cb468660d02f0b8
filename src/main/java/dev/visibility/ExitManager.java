package dev.visibility;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Ends the process after a one-shot run. The context is closed first so pending
 * metrics and database connections are released before the JVM stops.
 */
@Slf4j
@Component
public class ExitManager {

  private final ConfigurableApplicationContext context;
  private final boolean exitOnCompletion;

  public ExitManager(ConfigurableApplicationContext context,
      @Value("${runner.exit-on-completion:true}") boolean exitOnCompletion) {
    this.context = context;
    this.exitOnCompletion = exitOnCompletion;
  }

  public void exit(int status) {
    if (!exitOnCompletion) {
      log.debug("Exit with status {} suppressed (runner.exit-on-completion=false)", status);
      return;
    }
    int code = SpringApplication.exit(context, () -> status);
    System.exit(code);
  }

  boolean isExitOnCompletion() {
    return exitOnCompletion;
  }
}
