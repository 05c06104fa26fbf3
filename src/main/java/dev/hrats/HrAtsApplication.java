package dev.hrats;

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
public class HrAtsApplication implements CommandLineRunner {

  private final CommandRunner commandRunner;
  private final ExitManager exitManager;

  public static void main(String[] args) {
    SpringApplication.run(HrAtsApplication.class, args);
  }

  @Override
  public void run(String... args) {
    try {
      int status = commandRunner.execute(args);
      exitManager.exit(status);
    } catch (Exception e) {
      log.error("HR ATS failed: {}", e.getMessage(), e);
      exitManager.exit(CommandRunner.EXIT_ERROR);
    }
  }
}
