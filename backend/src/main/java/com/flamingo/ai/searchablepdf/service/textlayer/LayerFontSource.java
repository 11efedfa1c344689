package com.flamingo.ai.searchablepdf.service.textlayer;

import com.flamingo.ai.searchablepdf.config.TextLayerConfig;
import com.flamingo.ai.searchablepdf.exception.LayerConstructionFailedException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Supplies the font the invisible layer is measured and shown with.
 *
 * <p>Without {@code text-layer.font.file} this is built-in Helvetica, which needs no embedding but
 * only encodes WinAnsi characters. With a TrueType file configured, every call loads a fresh
 * {@link PDType0Font} from the cached bytes; PDFBox subsets it into the document on save, so
 * Greek, Cyrillic and any other script the file covers become searchable.
 *
 * <p>Loading registers the font with the document and is not thread-safe. Call it from the
 * thread that owns the document.
 */
@Component
@Slf4j
public class LayerFontSource {

  /** Font used when no TrueType file is configured. */
  public static final Standard14Fonts.FontName BUILT_IN = Standard14Fonts.FontName.HELVETICA;

  private final byte[] trueTypeFont;

  public LayerFontSource(TextLayerConfig textLayerConfig) {
    Resource file = textLayerConfig.getFont().getFile();
    if (file == null) {
      trueTypeFont = null;
      log.info("Invisible text layer uses built-in {}", BUILT_IN.getName());
      return;
    }
    trueTypeFont = readAndCheck(file);
    log.info(
        "Invisible text layer embeds {} ({} bytes)", file.getDescription(), trueTypeFont.length);
  }

  /** Whether the layer embeds a configured TrueType font instead of the built-in one. */
  public boolean embedsTrueType() {
    return trueTypeFont != null;
  }

  /**
   * Creates a new font instance for the document.
   *
   * <p>Instances cache glyph widths, so each worker measuring text needs its own.
   *
   * @param document document the font will be written into
   * @param pageIndex page the font is requested for, reported on failure
   * @return a fresh font instance
   * @throws LayerConstructionFailedException if the TrueType data cannot be loaded
   */
  public PDFont load(PDDocument document, int pageIndex) {
    if (trueTypeFont == null) {
      return new PDType1Font(BUILT_IN);
    }
    try {
      return PDType0Font.load(document, new ByteArrayInputStream(trueTypeFont), true);
    } catch (IOException e) {
      throw new LayerConstructionFailedException(
          pageIndex, "Failed to load text layer font: " + e.getMessage(), e);
    }
  }

  // ---- private helpers ----

  private static byte[] readAndCheck(Resource file) {
    byte[] bytes;
    try (InputStream in = file.getInputStream()) {
      bytes = in.readAllBytes();
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read text layer font " + file.getDescription(), e);
    }
    // fail at startup rather than on every page
    try (PDDocument scratch = new PDDocument()) {
      PDType0Font.load(scratch, new ByteArrayInputStream(bytes), true);
    } catch (IOException | RuntimeException e) {
      throw new IllegalStateException(
          "Text layer font " + file.getDescription() + " is not a usable TrueType font", e);
    }
    return bytes;
  }
}
