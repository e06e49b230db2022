package com.flamingo.ai.regulation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the regulation structuring service. */
@SpringBootApplication
public class RegulationStructurerApplication {

  public static void main(String[] args) {
    SpringApplication.run(RegulationStructurerApplication.class, args);
  }
}
