package com.flamingo.ai.entities;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EntityExtractorApplication {

  public static void main(String[] args) {
    SpringApplication.run(EntityExtractorApplication.class, args);
  }
}
