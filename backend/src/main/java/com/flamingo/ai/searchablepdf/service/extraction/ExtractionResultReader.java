package com.flamingo.ai.searchablepdf.service.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.searchablepdf.exception.ExtractionResultException;
import com.flamingo.ai.searchablepdf.service.textlayer.model.PageImageMeta;
import com.flamingo.ai.searchablepdf.service.textlayer.model.PageWords;
import com.flamingo.ai.searchablepdf.service.textlayer.model.PixelBox;
import com.flamingo.ai.searchablepdf.service.textlayer.model.RecognizedWord;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the OCR provider's word-level bounding-box response into per-page word lists.
 *
 * <p>Expected shape (only the fields used here):
 *
 * <pre>
 * { "success": true,
 *   "result": { "markdown": { "metadata": { "bounding_boxes": {
 *       "success": true,
 *       "elements": [ { "content": "Invoice", "page": 1, "markdown_line": 0, "word_offset": 0,
 *                       "bounding_box": { "x": 0.1, "y": 0.05, "width": 0.2, "height": 0.02,
 *                                         "normalized": true } } ],
 *       "page_dimensions": { "pages": [ { "page": 1, "width": 1700, "height": 2200 } ] } } } } } }
 * </pre>
 *
 * <p>Pages are 1-based in the response and 0-based in the result. Boxes are converted to
 * normalized form so every page uses {@link PageImageMeta#normalized()}. Words are ordered by
 * {@code (markdown_line, word_offset)}, the provider's reading order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExtractionResultReader {

  private final ObjectMapper objectMapper;

  /**
   * Parses a provider response.
   *
   * @param json response body
   * @return words and raster metadata keyed by 0-based page index
   * @throws ExtractionResultException if the body is not JSON, reports failure, or has no boxes
   */
  public Map<Integer, PageWords> read(InputStream json) {
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (IOException e) {
      throw new ExtractionResultException("Extraction response is not valid JSON", e);
    }
    if (root == null || root.isMissingNode() || root.isNull()) {
      throw new ExtractionResultException("Extraction response is empty");
    }
    return read(root);
  }

  public Map<Integer, PageWords> read(byte[] json) {
    try {
      return read(objectMapper.readTree(json));
    } catch (IOException e) {
      throw new ExtractionResultException("Extraction response is not valid JSON", e);
    }
  }

  private Map<Integer, PageWords> read(JsonNode root) {
    if (!root.path("success").asBoolean(false) || "failed".equals(root.path("status").asText())) {
      throw new ExtractionResultException(
          root.path("message").asText("Extraction failed"));
    }

    JsonNode boxes = root.path("result").path("markdown").path("metadata").path("bounding_boxes");
    if (boxes.isMissingNode() || boxes.isNull()) {
      throw new ExtractionResultException("No bounding boxes in extraction response");
    }
    if (!boxes.path("success").asBoolean(false)) {
      throw new ExtractionResultException("Bounding box extraction was not successful");
    }

    Map<Integer, double[]> dimensions = readPageDimensions(boxes.path("page_dimensions"));
    Map<Integer, List<OrderedWord>> byPage = new TreeMap<>();
    int skipped = 0;

    for (JsonNode element : boxes.path("elements")) {
      JsonNode bbox = element.path("bounding_box");
      if (!bbox.isObject() || bbox.isEmpty()) {
        // images and other non-text elements carry no coordinates
        continue;
      }
      int pageIndex = element.path("page").asInt(1) - 1;
      PixelBox box = toNormalizedBox(bbox, dimensions.get(pageIndex));
      if (box == null) {
        skipped++;
        continue;
      }
      RecognizedWord word = new RecognizedWord(element.path("content").asText(""), box, pageIndex);
      byPage
          .computeIfAbsent(pageIndex, k -> new ArrayList<>())
          .add(
              new OrderedWord(
                  element.path("markdown_line").asInt(0),
                  element.path("word_offset").asInt(0),
                  word));
    }

    if (skipped > 0) {
      log.warn("Dropped {} pixel-space elements on pages without reported dimensions", skipped);
    }

    Map<Integer, PageWords> result = new TreeMap<>();
    byPage.forEach(
        (pageIndex, words) ->
            result.put(
                pageIndex,
                new PageWords(
                    words.stream()
                        .sorted(
                            Comparator.comparingInt(OrderedWord::line)
                                .thenComparingInt(OrderedWord::offset))
                        .map(OrderedWord::word)
                        .toList(),
                    PageImageMeta.normalized())));
    log.debug("Read {} pages of recognized words", result.size());
    return result;
  }

  private Map<Integer, double[]> readPageDimensions(JsonNode pageDimensions) {
    Map<Integer, double[]> dimensions = new HashMap<>();
    int position = 0;
    for (JsonNode page : pageDimensions.path("pages")) {
      position++;
      int pageIndex = page.path("page").asInt(position) - 1;
      dimensions.put(
          pageIndex,
          new double[] {page.path("width").asDouble(0), page.path("height").asDouble(0)});
    }
    return dimensions;
  }

  private PixelBox toNormalizedBox(JsonNode bbox, double[] pageDimensions) {
    double x = bbox.path("x").asDouble(0);
    double y = bbox.path("y").asDouble(0);
    double width = bbox.path("width").asDouble(0);
    double height = bbox.path("height").asDouble(0);
    if (bbox.path("normalized").asBoolean(true)) {
      return new PixelBox(x, y, width, height);
    }
    if (pageDimensions == null || pageDimensions[0] <= 0 || pageDimensions[1] <= 0) {
      return null;
    }
    double pw = pageDimensions[0];
    double ph = pageDimensions[1];
    return new PixelBox(x / pw, y / ph, width / pw, height / ph);
  }

  private record OrderedWord(int line, int offset, RecognizedWord word) {}
}
