package com.gu.contentapi.tagsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TagSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(TagSearchApplication.class, args);
  }
}
