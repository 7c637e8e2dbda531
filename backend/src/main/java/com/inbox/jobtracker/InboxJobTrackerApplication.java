package com.inbox.jobtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InboxJobTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(InboxJobTrackerApplication.class, args);
  }
}
