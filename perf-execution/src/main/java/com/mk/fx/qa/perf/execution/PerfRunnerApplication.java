package com.mk.fx.qa.perf.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PerfRunnerApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(PerfRunnerApplication.class, args)));
  }
}
