package com.flamingo.ai.deckindex.domain.enums;

/** Kind of embedding stored for a content unit. Each kind maps to its own index field. */
public enum VectorKind {
  TEXT("text_vector"),
  VISUAL("visual_vector");

  private final String fieldName;

  VectorKind(String fieldName) {
    this.fieldName = fieldName;
  }

  public String getFieldName() {
    return fieldName;
  }
}
