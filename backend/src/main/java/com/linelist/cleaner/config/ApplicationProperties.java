package com.linelist.cleaner.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "cleaner")
public class ApplicationProperties {

  private String version;

  private Classification classification = new Classification();
  private Csv csv = new Csv();
  private Defaults defaults = new Defaults();

  @Data
  public static class Classification {
    private int detectWindow = 20;
  }

  @Data
  public static class Csv {
    /** Cell contents, besides the empty string, read as missing values. */
    private List<String> missingTokens = new ArrayList<>(List.of("NA"));
  }

  @Data
  public static class Defaults {
    private String spellingVars = "3";
    private boolean warn;
  }
}
