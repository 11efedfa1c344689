package com.flamingo.ai.searchablepdf.service.textlayer.model;

import org.apache.pdfbox.pdmodel.graphics.state.RenderingMode;

/**
 * One positioned text-showing instruction of an invisible layer.
 *
 * @param text literal text to show
 * @param x text origin x in user space
 * @param y text origin y in user space
 * @param fontSize font size in points
 * @param horizontalScale horizontal scale as a ratio
 * @param rotation baseline direction in degrees counter-clockwise
 * @param renderingMode text rendering mode; always {@link RenderingMode#NEITHER} for OCR layers
 */
public record TextPlacement(
    String text,
    float x,
    float y,
    float fontSize,
    float horizontalScale,
    int rotation,
    RenderingMode renderingMode) {}
