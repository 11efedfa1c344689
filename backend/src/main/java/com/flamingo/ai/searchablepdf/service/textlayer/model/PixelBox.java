package com.flamingo.ai.searchablepdf.service.textlayer.model;

/**
 * Rectangle in the OCR provider's pixel space (origin top-left, y grows downward).
 *
 * @param x left edge
 * @param y top edge
 * @param width horizontal extent; may be negative or zero when the provider reports a corrupt box
 * @param height vertical extent
 */
public record PixelBox(double x, double y, double width, double height) {}
