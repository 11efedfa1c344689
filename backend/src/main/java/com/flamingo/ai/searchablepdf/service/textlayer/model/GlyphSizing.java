package com.flamingo.ai.searchablepdf.service.textlayer.model;

/**
 * Font size and horizontal scale that make a word's invisible glyphs fill its box.
 *
 * @param fontSize font size in points
 * @param horizontalScale ratio of box width to the font's natural width (1.0 = unscaled)
 */
public record GlyphSizing(float fontSize, float horizontalScale) {}
