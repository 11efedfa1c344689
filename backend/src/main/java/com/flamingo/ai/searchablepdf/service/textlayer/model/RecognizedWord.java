package com.flamingo.ai.searchablepdf.service.textlayer.model;

/**
 * A word recognized by the OCR provider.
 *
 * @param text recognized text
 * @param box bounding box in the page's pixel space
 * @param pageIndex 0-based index of the page the word belongs to
 */
public record RecognizedWord(String text, PixelBox box, int pageIndex) {}
