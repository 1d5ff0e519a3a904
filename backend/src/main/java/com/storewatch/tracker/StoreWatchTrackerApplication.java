package com.storewatch.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StoreWatchTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(StoreWatchTrackerApplication.class, args);
  }
}
