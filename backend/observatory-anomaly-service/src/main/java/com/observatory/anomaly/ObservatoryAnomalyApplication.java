package com.observatory.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ObservatoryAnomalyApplication {
  public static void main(String[] args) {
    SpringApplication.run(ObservatoryAnomalyApplication.class, args);
  }
}
