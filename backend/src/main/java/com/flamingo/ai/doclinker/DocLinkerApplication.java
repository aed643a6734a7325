package com.flamingo.ai.doclinker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocLinkerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocLinkerApplication.class, args);
  }
}
