package dev.visibility;

import dev.visibility.retry.ErrorSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class VisibilityEngineApplication implements CommandLineRunner {

  private final AutomationRunner automationRunner;
  private final ExitManager exitManager;

  public static void main(String[] args) {
    SpringApplication.run(VisibilityEngineApplication.class, args);
  }

  @Override
  public void run(String... args) {
    if (automationRunner.isDaemon()) {
      automationRunner.execute();
      return;
    }

    try {
      automationRunner.execute();
      log.info("AI Visibility Engine exiting...");
      exitManager.exit(0);
    } catch (Exception e) {
      log.error("AI Visibility Engine failed: {}", ErrorSanitizer.sanitize(e));
      exitManager.exit(1);
    }
  }
}
