package com.flamingo.ai.searchablepdf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SearchablePdfApplication {

  public static void main(String[] args) {
    SpringApplication.run(SearchablePdfApplication.class, args);
  }
}
