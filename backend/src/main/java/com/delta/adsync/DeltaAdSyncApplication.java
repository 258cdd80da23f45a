package com.delta.adsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaAdSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeltaAdSyncApplication.class, args);
  }
}
