package com.linelist.cleaner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LinelistCleanerApplication {

  public static void main(String[] args) {
    SpringApplication.run(LinelistCleanerApplication.class, args);
  }
}
