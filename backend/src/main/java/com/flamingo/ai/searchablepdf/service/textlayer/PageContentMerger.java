package com.flamingo.ai.searchablepdf.service.textlayer;

import com.flamingo.ai.searchablepdf.exception.LayerConstructionFailedException;
import com.flamingo.ai.searchablepdf.exception.UnsupportedPageStructureException;
import com.flamingo.ai.searchablepdf.service.textlayer.model.EmbeddingOptions;
import com.flamingo.ai.searchablepdf.service.textlayer.model.InvisibleLayer;
import com.flamingo.ai.searchablepdf.service.textlayer.model.TextPlacement;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSStream;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.graphics.state.RenderingMode;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Component;

/**
 * Appends an invisible layer to a page without touching its existing drawing.
 *
 * <p>The existing content streams are never parsed or rewritten. PDFBox's reset-context append
 * brackets them with {@code q ... Q}, and the layer itself sits inside its own {@code q ... Q}
 * block in a separate stream, so neither side can leak graphics state into the other.
 *
 * <p>The layer font is registered under {@code fontResourcePrefix}, or the first free
 * {@code prefixN} name when the page already uses that name.
 *
 * <p>On any failure while writing, the page's {@code /Contents} and the added font entry are rolled
 * back so the original page survives intact.
 */
@Component
@Slf4j
public class PageContentMerger {

  /**
   * Finds content arrays referenced by more than one page.
   *
   * <p>Appending to such an array would put the layer on every page sharing it.
   *
   * @param document the document
   * @return identity set of shared {@code /Contents} arrays
   */
  public Set<COSBase> findSharedContents(PDDocument document) {
    Map<COSBase, Integer> references = new IdentityHashMap<>();
    for (PDPage page : document.getPages()) {
      COSBase contents = page.getCOSObject().getDictionaryObject(COSName.CONTENTS);
      if (contents instanceof COSArray) {
        references.merge(contents, 1, Integer::sum);
      }
    }
    Set<COSBase> shared = Collections.newSetFromMap(new IdentityHashMap<>());
    references.forEach(
        (contents, count) -> {
          if (count > 1) {
            shared.add(contents);
          }
        });
    return shared;
  }

  /**
   * Appends the layer to the page.
   *
   * @param document document owning the page
   * @param page page to append to
   * @param layer layer to append; an empty layer leaves the page untouched
   * @param font font instance to show the text with
   * @param options resource naming and compression settings
   * @param sharedContents result of {@link #findSharedContents(PDDocument)}
   * @return resource name the font was registered under, or empty if nothing was appended
   * @throws UnsupportedPageStructureException if the page's content cannot be safely appended to
   * @throws LayerConstructionFailedException if writing the layer failed; the page is restored
   */
  public Optional<COSName> merge(
      PDDocument document,
      PDPage page,
      InvisibleLayer layer,
      PDFont font,
      EmbeddingOptions options,
      Set<COSBase> sharedContents) {
    if (layer.isEmpty()) {
      return Optional.empty();
    }
    int pageIndex = layer.pageIndex();
    checkAppendable(page, pageIndex, sharedContents);

    PDResources resources = page.getResources();
    if (resources == null) {
      resources = new PDResources();
      page.setResources(resources);
    }

    ContentsSnapshot snapshot = ContentsSnapshot.of(page);
    COSName fontName = uniqueFontName(resources, font, options.fontResourcePrefix());
    boolean fontAdded = !fontName.equals(findFontKey(resources, font));
    resources.put(fontName, font);

    try (PDPageContentStream stream =
        new PDPageContentStream(
            document, page, PDPageContentStream.AppendMode.APPEND, options.compress(), true)) {
      writeLayer(stream, layer, font);
    } catch (IOException | RuntimeException e) {
      snapshot.restore(page);
      if (fontAdded) {
        removeFont(resources, fontName);
      }
      throw new LayerConstructionFailedException(
          pageIndex, "Failed to append text layer to page " + pageIndex, e);
    }

    log.debug(
        "Appended {} invisible placements to page {} with font /{}",
        layer.placements().size(),
        pageIndex,
        fontName.getName());
    return Optional.of(fontName);
  }

  /** Writes the layer's placements as one {@code q BT ... ET Q} block. */
  void writeLayer(PDPageContentStream stream, InvisibleLayer layer, PDFont font)
      throws IOException {
    stream.saveGraphicsState();
    stream.beginText();
    RenderingMode currentMode = null;
    for (TextPlacement placement : layer.placements()) {
      if (placement.renderingMode() != currentMode) {
        stream.setRenderingMode(placement.renderingMode());
        currentMode = placement.renderingMode();
      }
      stream.setFont(font, placement.fontSize());
      stream.setHorizontalScaling(placement.horizontalScale() * 100f);
      stream.setTextMatrix(
          Matrix.getRotateInstance(
              Math.toRadians(placement.rotation()), placement.x(), placement.y()));
      stream.showText(placement.text());
    }
    stream.endText();
    stream.restoreGraphicsState();
  }

  private void checkAppendable(PDPage page, int pageIndex, Set<COSBase> sharedContents) {
    COSBase contents = page.getCOSObject().getDictionaryObject(COSName.CONTENTS);
    if (contents == null || contents instanceof COSStream) {
      return;
    }
    if (!(contents instanceof COSArray array)) {
      throw new UnsupportedPageStructureException(
          pageIndex, "/Contents is a " + contents.getClass().getSimpleName());
    }
    if (sharedContents.contains(array)) {
      throw new UnsupportedPageStructureException(
          pageIndex, "/Contents array is shared with another page");
    }
    for (int i = 0; i < array.size(); i++) {
      if (!(array.getObject(i) instanceof COSStream)) {
        throw new UnsupportedPageStructureException(
            pageIndex, "/Contents element " + i + " is not a stream");
      }
    }
  }

  private COSName uniqueFontName(PDResources resources, PDFont font, String prefix) {
    COSName existing = findFontKey(resources, font);
    if (existing != null) {
      return existing;
    }
    COSDictionary fonts = resources.getCOSObject().getCOSDictionary(COSName.FONT);
    COSName candidate = COSName.getPDFName(prefix);
    int suffix = 1;
    while (fonts != null && fonts.containsKey(candidate)) {
      candidate = COSName.getPDFName(prefix + suffix++);
    }
    return candidate;
  }

  private COSName findFontKey(PDResources resources, PDFont font) {
    COSDictionary fonts = resources.getCOSObject().getCOSDictionary(COSName.FONT);
    if (fonts == null) {
      return null;
    }
    for (COSName key : fonts.keySet()) {
      if (fonts.getDictionaryObject(key) == font.getCOSObject()) {
        return key;
      }
    }
    return null;
  }

  private void removeFont(PDResources resources, COSName fontName) {
    COSDictionary fonts = resources.getCOSObject().getCOSDictionary(COSName.FONT);
    if (fonts != null) {
      fonts.removeItem(fontName);
    }
  }

  /** Raw {@code /Contents} entry of a page, including the elements of an array in place. */
  private record ContentsSnapshot(COSBase item, List<COSBase> arrayElements) {

    static ContentsSnapshot of(PDPage page) {
      COSBase item = page.getCOSObject().getItem(COSName.CONTENTS);
      COSBase resolved = page.getCOSObject().getDictionaryObject(COSName.CONTENTS);
      List<COSBase> elements = null;
      if (resolved instanceof COSArray array) {
        elements = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
          elements.add(array.get(i));
        }
      }
      return new ContentsSnapshot(item, elements);
    }

    void restore(PDPage page) {
      if (item == null) {
        page.getCOSObject().removeItem(COSName.CONTENTS);
        return;
      }
      page.getCOSObject().setItem(COSName.CONTENTS, item);
      if (arrayElements != null
          && page.getCOSObject().getDictionaryObject(COSName.CONTENTS) instanceof COSArray array) {
        array.clear();
        arrayElements.forEach(array::add);
      }
    }
  }
}
