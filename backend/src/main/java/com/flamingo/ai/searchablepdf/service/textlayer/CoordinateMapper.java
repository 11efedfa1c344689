package com.flamingo.ai.searchablepdf.service.textlayer;

import com.flamingo.ai.searchablepdf.exception.InvalidPageMetadataException;
import com.flamingo.ai.searchablepdf.service.textlayer.model.MappedWord;
import com.flamingo.ai.searchablepdf.service.textlayer.model.PageGeometry;
import com.flamingo.ai.searchablepdf.service.textlayer.model.PageImageMeta;
import com.flamingo.ai.searchablepdf.service.textlayer.model.PixelBox;
import com.flamingo.ai.searchablepdf.service.textlayer.model.RecognizedWord;
import org.springframework.stereotype.Component;

/**
 * Converts OCR pixel-space word boxes into PDF user-space coordinates.
 *
 * <p>The OCR raster shows the page as a viewer displays it, so boxes are first scaled into the
 * displayed page (origin bottom-left, y up) and clamped to it. The lower-left corner is then
 * carried back through the page's {@code /Rotate} into unrotated user space, where content stream
 * coordinates live:
 *
 * <ul>
 *   <li><strong>0</strong>: {@code (X, Y)}
 *   <li><strong>90</strong>: {@code (W - Y, X)}
 *   <li><strong>180</strong>: {@code (W - X, H - Y)}
 *   <li><strong>270</strong>: {@code (Y, H - X)}
 * </ul>
 *
 * <p>where {@code W x H} is the unrotated reference rectangle. The resulting baseline points
 * {@code rotation} degrees counter-clockwise in user space, which reads left-to-right on screen.
 */
@Component
public class CoordinateMapper {

  /**
   * Maps a recognized word onto its page.
   *
   * @param word the word with its pixel-space box
   * @param pageMeta pixel dimensions of the OCR raster for the page
   * @param page reference rectangle and rotation of the page
   * @return the word in user space, clamped to the page; zero-sized if the box lies outside it
   * @throws InvalidPageMetadataException if the pixel dimensions are not positive
   */
  public MappedWord map(RecognizedWord word, PageImageMeta pageMeta, PageGeometry page) {
    validate(pageMeta, page.pageIndex());

    double displayedWidth = page.displayedWidth();
    double displayedHeight = page.displayedHeight();
    double sx = displayedWidth / pageMeta.pixelWidth();
    double sy = displayedHeight / pageMeta.pixelHeight();

    PixelBox box = word.box();
    double left = clamp(box.x() * sx, displayedWidth);
    double right = clamp((box.x() + box.width()) * sx, displayedWidth);
    double bottom = clamp(displayedHeight - (box.y() + box.height()) * sy, displayedHeight);
    double top = clamp(displayedHeight - box.y() * sy, displayedHeight);

    double width = Math.max(0.0, right - left);
    double height = Math.max(0.0, top - bottom);

    double[] origin = toUserSpace(left, bottom, page);
    return new MappedWord(
        word.text(),
        page.pageIndex(),
        (float) origin[0],
        (float) origin[1],
        (float) width,
        (float) height,
        page.rotation());
  }

  /**
   * Checks that the OCR raster dimensions can be used to derive a scale factor.
   *
   * @throws InvalidPageMetadataException if either dimension is zero, negative or not finite
   */
  public void validate(PageImageMeta pageMeta, int pageIndex) {
    if (pageMeta == null) {
      throw new InvalidPageMetadataException(pageIndex, 0, 0);
    }
    if (!pageMeta.isValid()) {
      throw new InvalidPageMetadataException(
          pageIndex, pageMeta.pixelWidth(), pageMeta.pixelHeight());
    }
  }

  private double[] toUserSpace(double displayedX, double displayedY, PageGeometry page) {
    double width = page.width();
    double height = page.height();
    double ux;
    double uy;
    switch (page.rotation()) {
      case 90 -> {
        ux = width - displayedY;
        uy = displayedX;
      }
      case 180 -> {
        ux = width - displayedX;
        uy = height - displayedY;
      }
      case 270 -> {
        ux = displayedY;
        uy = height - displayedX;
      }
      default -> {
        ux = displayedX;
        uy = displayedY;
      }
    }
    return new double[] {page.x() + ux, page.y() + uy};
  }

  private static double clamp(double value, double max) {
    return Math.max(0.0, Math.min(value, max));
  }
}
