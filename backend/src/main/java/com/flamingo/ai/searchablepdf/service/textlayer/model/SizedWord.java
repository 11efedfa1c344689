package com.flamingo.ai.searchablepdf.service.textlayer.model;

/** A mapped word together with the sizing derived for it. */
public record SizedWord(MappedWord word, GlyphSizing sizing) {}
