package com.flamingo.ai.deckindex;

import com.flamingo.ai.deckindex.config.DataDirectoryPreparer;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the presentation ingestion and indexing service. */
@SpringBootApplication
public class DeckIndexApplication {

  public static void main(String[] args) {
    SpringApplication application = new SpringApplication(DeckIndexApplication.class);
    application.addListeners(new DataDirectoryPreparer());
    application.run(args);
  }
}
