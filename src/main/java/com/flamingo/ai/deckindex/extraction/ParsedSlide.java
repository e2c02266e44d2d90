package com.flamingo.ai.deckindex.extraction;

/** Raw content of one slide or page as read by a parser, before cleaning. */
public record ParsedSlide(String title, String text, String notes) {}
