package com.example.faceclusters;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FaceClustersApplication {

  public static void main(String[] args) {
    SpringApplication.run(FaceClustersApplication.class, args);
  }
}
