package com.harbour.jobfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HarbourJobFeedApplication {

  public static void main(String[] args) {
    SpringApplication.run(HarbourJobFeedApplication.class, args);
  }
}
