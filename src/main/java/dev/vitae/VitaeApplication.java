package dev.vitae;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the vitae resume pipeline.
 *
 * <p>Runs without a web server: PDFs named on the command line are profiled, rated and printed as
 * JSON, then the application exits.
 */
@SpringBootApplication
public class VitaeApplication {
  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(VitaeApplication.class, args)));
  }
}
