package com.jobly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JoblyApplication {

  public static void main(String[] args) {
    SpringApplication.run(JoblyApplication.class, args);
  }
}
