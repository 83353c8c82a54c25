package org.kartograph.mutations;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Kartograph graph mutation server.
 */
@SpringBootApplication
@EnableScheduling
@SuppressWarnings("PMD.UseUtilityClass") // Spring Boot requires instantiable main class
public class MutationServerApplication {

  /**
   * Main entry point.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(MutationServerApplication.class, args);
  }
}
