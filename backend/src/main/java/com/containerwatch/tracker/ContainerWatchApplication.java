package com.containerwatch.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ContainerWatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContainerWatchApplication.class, args);
  }
}
