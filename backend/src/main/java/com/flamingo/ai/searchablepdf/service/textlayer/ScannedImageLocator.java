package com.flamingo.ai.searchablepdf.service.textlayer;

import java.awt.geom.Point2D;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.OperatorProcessor;
import org.apache.pdfbox.contentstream.operator.state.Concatenate;
import org.apache.pdfbox.contentstream.operator.state.Restore;
import org.apache.pdfbox.contentstream.operator.state.Save;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Component;

/**
 * Finds where a scanned page places its raster image.
 *
 * <p>Walks the page's content stream and intercepts "Do" operations, reading the current
 * transformation matrix at the first image draw. The image's unit square mapped through the CTM
 * gives its placement in user space.
 */
@Component
@Slf4j
public class ScannedImageLocator {

  /**
   * Locates the first image drawn on the page.
   *
   * @param page the page to inspect
   * @return bounding rectangle of the image in user space, or empty if the page draws no image or
   *     its content cannot be read
   */
  public Optional<PDRectangle> locate(PDPage page) {
    FirstImageFinder finder = new FirstImageFinder();
    try {
      finder.processPage(page);
    } catch (IOException e) {
      log.warn("Could not scan page content for images: {}", e.getMessage());
      return Optional.empty();
    }
    return Optional.ofNullable(finder.bounds);
  }

  private static final class FirstImageFinder extends PDFStreamEngine {

    private PDRectangle bounds;

    FirstImageFinder() {
      addOperator(new Save(this));
      addOperator(new Restore(this));
      addOperator(new Concatenate(this));
      addOperator(new DrawObject(this));
    }

    void recordImage(Matrix ctm) {
      Point2D.Float[] corners = {
        ctm.transformPoint(0, 0),
        ctm.transformPoint(1, 0),
        ctm.transformPoint(0, 1),
        ctm.transformPoint(1, 1)
      };
      float minX = Float.MAX_VALUE;
      float minY = Float.MAX_VALUE;
      float maxX = -Float.MAX_VALUE;
      float maxY = -Float.MAX_VALUE;
      for (Point2D.Float corner : corners) {
        minX = Math.min(minX, corner.x);
        minY = Math.min(minY, corner.y);
        maxX = Math.max(maxX, corner.x);
        maxY = Math.max(maxY, corner.y);
      }
      if (maxX - minX > 0 && maxY - minY > 0) {
        bounds = new PDRectangle(minX, minY, maxX - minX, maxY - minY);
      }
    }

    /** Handles "Do": records the first image, descends into forms until one is found. */
    private static class DrawObject extends OperatorProcessor {
      private final FirstImageFinder finder;

      DrawObject(FirstImageFinder finder) {
        super(finder);
        this.finder = finder;
      }

      @Override
      public void process(Operator operator, List<COSBase> operands) throws IOException {
        if (finder.bounds != null || operands.isEmpty()
            || !(operands.get(0) instanceof COSName objectName)) {
          return;
        }
        PDXObject xObject = finder.getResources().getXObject(objectName);
        if (xObject instanceof PDImageXObject) {
          finder.recordImage(finder.getGraphicsState().getCurrentTransformationMatrix());
        } else if (xObject instanceof PDFormXObject form) {
          finder.showForm(form);
        }
      }

      @Override
      public String getName() {
        return OperatorName.DRAW_OBJECT;
      }
    }
  }
}
