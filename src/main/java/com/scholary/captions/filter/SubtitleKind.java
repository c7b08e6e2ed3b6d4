package com.scholary.captions.filter;

/** Formats the exclusion filter can rewrite. */
public enum SubtitleKind {
  ASS,
  SRT
}
