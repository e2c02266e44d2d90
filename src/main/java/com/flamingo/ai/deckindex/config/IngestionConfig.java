package com.flamingo.ai.deckindex.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Getter
@Setter
public class IngestionConfig {

  /** Root directory for staging, rendered assets and logs. */
  private String dataDir = "./data";

  /** Run triggered once the application is ready: none, incremental or full. */
  private String runOnStartup = "none";

  private Source source = new Source();
  private Staging staging = new Staging();
  private Download download = new Download();
  private Extraction extraction = new Extraction();
  private Rendering rendering = new Rendering();
  private Embedding embedding = new Embedding();
  private Indexing indexing = new Indexing();
  private Alerting alerting = new Alerting();

  @Getter
  @Setter
  public static class Source {
    /** Source implementation: local or graph. */
    private String type = "local";

    private List<String> extensions = new ArrayList<>(List.of(".pptx", ".pdf"));
    private Local local = new Local();
    private Graph graph = new Graph();

    @Getter
    @Setter
    public static class Local {
      private String directory = "./documents";
    }

    @Getter
    @Setter
    public static class Graph {
      private String tenantId;
      private String clientId;
      private String clientSecret;
      private String siteHostname;
      private String sitePath;
      private String libraryName = "Documents";
      private String folderPath = "";
      private String baseUrl = "https://graph.microsoft.com/v1.0";
      private String authorityUrl = "https://login.microsoftonline.com";
      private int timeoutSeconds = 60;
    }
  }

  @Getter
  @Setter
  public static class Staging {
    /** Defaults to {@code <dataDir>/staging} when empty. */
    private String directory = "";

    /** Defaults to {@code <dataDir>/rendered} when empty. */
    private String renderedDirectory = "";
  }

  /** Retry settings shared by all stages. */
  @Getter
  @Setter
  public static class Retry {
    private int maxAttempts = 3;
    private long initialBackoffMs = 4000;
    private double multiplier = 2.0;
    private long maxBackoffMs = 60000;
  }

  @Getter
  @Setter
  public static class Download {
    private int concurrency = 10;
    private Retry retry = new Retry();
  }

  @Getter
  @Setter
  public static class Extraction {
    private int concurrency = 5;
    private boolean stripRepeatedLines = true;
    private int minUnitsForRepeatedLineStrip = 3;
  }

  @Getter
  @Setter
  public static class Rendering {
    /** Render engine: java2d or office. */
    private String engine = "java2d";

    private float dpi = 150f;
    private Retry retry = new Retry();
    private Office office = new Office();

    @Getter
    @Setter
    public static class Office {
      private String command = "soffice";
      private int timeoutSeconds = 180;
    }
  }

  @Getter
  @Setter
  public static class Embedding {
    private int concurrency = 4;
    private int batchSize = 16;
    private int maxChars = 5000;
    private String passagePrefix = "";
    private String queryPrefix = "";

    /** Document fails when the share of units without embeddings exceeds this ratio. */
    private double maxFailedUnitRatio = 0.1;

    private Retry retry = new Retry();
    private Visual visual = new Visual();

    @Getter
    @Setter
    public static class Visual {
      private boolean enabled = false;
      private String baseUrl = "http://localhost:8081";
      private int readTimeoutMs = 30000;
    }
  }

  @Getter
  @Setter
  public static class Indexing {
    private int concurrency = 2;
    private String indexName = "deck-index-units";
    private int textVectorDimensions = 1536;
    private int visualVectorDimensions = 512;
  }

  @Getter
  @Setter
  public static class Alerting {
    private double failureRateThreshold = 0.10;
  }
}
