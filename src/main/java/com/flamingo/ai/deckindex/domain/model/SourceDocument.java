package com.flamingo.ai.deckindex.domain.model;

import java.time.Instant;

/**
 * A document as listed by the remote source, before any bytes are fetched.
 *
 * @param remoteId stable identifier assigned by the source
 * @param displayName human-readable name, usually the file name
 * @param modifiedTime last modification time reported by the source, may be null
 * @param size size in bytes as reported by the source
 */
public record SourceDocument(
    String remoteId, String displayName, Instant modifiedTime, long size) {}
