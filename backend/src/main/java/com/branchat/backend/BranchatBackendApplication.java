package com.branchat.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BranchatBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(BranchatBackendApplication.class, args);
  }
}
