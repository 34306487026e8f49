package com.flamingo.ai.frontdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the front desk knowledge engine. */
@SpringBootApplication
public class FrontdeskKnowledgeApplication {

  public static void main(String[] args) {
    SpringApplication.run(FrontdeskKnowledgeApplication.class, args);
  }
}
