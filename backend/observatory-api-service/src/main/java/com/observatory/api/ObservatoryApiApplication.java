package com.observatory.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.observatory")
public class ObservatoryApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(ObservatoryApiApplication.class, args);
  }
}
