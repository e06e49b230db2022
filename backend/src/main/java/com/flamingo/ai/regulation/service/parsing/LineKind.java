package com.flamingo.ai.regulation.service.parsing;

/** Outcome of classifying one line segment, ordered from the top of the hierarchy down. */
public enum LineKind {
  PARAGRAPH,
  ITEM,
  SUBITEM,
  SUB_SUBITEM,
  FREE_TEXT
}
