package com.intentcluster.clustering;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IntentClusteringApplication {

  public static void main(String[] args) {
    SpringApplication.run(IntentClusteringApplication.class, args);
  }
}
