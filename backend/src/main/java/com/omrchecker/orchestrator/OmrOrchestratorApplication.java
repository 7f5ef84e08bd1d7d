package com.omrchecker.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OmrOrchestratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(OmrOrchestratorApplication.class, args);
  }
}
