package com.flamingo.ai.deckindex.domain.model;

import java.nio.file.Path;

/** Source bytes fetched into local staging, identified by their content hash. */
public record StagedDocument(
    String remoteId, String displayName, Path file, String contentHash, String stagingKey) {}
