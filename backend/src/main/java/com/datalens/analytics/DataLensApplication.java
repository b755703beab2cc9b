package com.datalens.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DataLensApplication {

  public static void main(String[] args) {
    SpringApplication.run(DataLensApplication.class, args);
  }
}
