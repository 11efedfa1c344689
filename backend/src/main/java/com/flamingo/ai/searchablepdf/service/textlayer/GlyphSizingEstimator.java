package com.flamingo.ai.searchablepdf.service.textlayer;

import com.flamingo.ai.searchablepdf.exception.LayerConstructionFailedException;
import com.flamingo.ai.searchablepdf.service.textlayer.model.EmbeddingOptions;
import com.flamingo.ai.searchablepdf.service.textlayer.model.GlyphSizing;
import com.flamingo.ai.searchablepdf.service.textlayer.model.MappedWord;
import java.io.IOException;
import java.util.Optional;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.springframework.stereotype.Component;

/**
 * Derives the font size and horizontal scale that make a word's invisible glyphs cover its box.
 *
 * <p>Font size follows the box height ({@code height * calibration}, clamped). The horizontal
 * scale then stretches the font's natural advance width to exactly the box width, so selection
 * highlights line up with the scanned word even though the layer font's metrics differ from
 * the scanned typeface.
 *
 * <p>Stateless; the {@link PDFont} passed in must not be shared between threads because PDFBox
 * caches glyph widths per font instance.
 */
@Component
public class GlyphSizingEstimator {

  private static final float GLYPH_SPACE_UNITS = 1000f;

  /**
   * Estimates glyph sizing for a mapped word.
   *
   * @param word the word in user space
   * @param text the text to be shown
   * @param font font the text will be shown with
   * @param options calibration and bounds
   * @return the sizing, or empty if the text is blank or the box has no area
   * @throws LayerConstructionFailedException if the font cannot measure the text
   */
  public Optional<GlyphSizing> estimate(
      MappedWord word, String text, PDFont font, EmbeddingOptions options) {
    if (text == null || text.isBlank() || !word.hasArea()) {
      return Optional.empty();
    }

    float fontSize =
        Math.max(
            options.minFontSize(),
            Math.min(word.height() * options.calibration(), options.maxFontSize()));

    float naturalWidth = naturalWidth(word.pageIndex(), text, font, fontSize);
    float scale = naturalWidth > 0 ? word.width() / naturalWidth : 1.0f;
    scale = Math.max(options.minHorizontalScale(), scale);

    return Optional.of(new GlyphSizing(fontSize, scale));
  }

  /** Advance width of {@code text} at {@code fontSize}, in points. */
  float naturalWidth(int pageIndex, String text, PDFont font, float fontSize) {
    try {
      return font.getStringWidth(text) / GLYPH_SPACE_UNITS * fontSize;
    } catch (IOException | IllegalArgumentException e) {
      // IllegalArgumentException: a character outside the font's encoding
      throw new LayerConstructionFailedException(
          pageIndex,
          String.format(
              "Font %s cannot measure '%s': %s", font.getName(), text, e.getMessage()),
          e);
    }
  }
}
