package com.intentcluster.clustering.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "clustering")
public class ApplicationProperties {

  private int topTerms = 5;

  private Defaults defaults = new Defaults();
  private Limits limits = new Limits();
  private Normalizer normalizer = new Normalizer();

  @Data
  public static class Defaults {
    private double eps = 0.5;
    private int minPts = 2;
  }

  @Data
  public static class Limits {
    private int maxUtterances = 2000;
  }

  @Data
  public static class Normalizer {
    private String stopwordsResource = "stopwords/english.txt";
  }
}
