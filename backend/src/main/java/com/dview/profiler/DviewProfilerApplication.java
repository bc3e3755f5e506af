package com.dview.profiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DviewProfilerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DviewProfilerApplication.class, args);
  }
}
