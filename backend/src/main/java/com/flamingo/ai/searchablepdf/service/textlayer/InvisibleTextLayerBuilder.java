package com.flamingo.ai.searchablepdf.service.textlayer;

import com.flamingo.ai.searchablepdf.service.textlayer.model.GlyphSizing;
import com.flamingo.ai.searchablepdf.service.textlayer.model.InvisibleLayer;
import com.flamingo.ai.searchablepdf.service.textlayer.model.MappedWord;
import com.flamingo.ai.searchablepdf.service.textlayer.model.SizedWord;
import com.flamingo.ai.searchablepdf.service.textlayer.model.TextPlacement;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.graphics.state.RenderingMode;
import org.springframework.stereotype.Component;

/**
 * Assembles the ordered, invisible text placements for one page.
 *
 * <p>Words keep the OCR provider's order. No line or paragraph reconstruction is attempted: the
 * layer only has to make search hit the right spot and copy yield the words in sequence.
 */
@Component
public class InvisibleTextLayerBuilder {

  /**
   * Builds the layer for a page.
   *
   * @param pageIndex 0-based page index
   * @param sizedWords mapped and sized words in OCR reading order
   * @return the layer; empty if no word qualified
   */
  public InvisibleLayer build(int pageIndex, List<SizedWord> sizedWords) {
    List<TextPlacement> placements = new ArrayList<>(sizedWords.size());
    for (SizedWord sized : sizedWords) {
      MappedWord word = sized.word();
      GlyphSizing sizing = sized.sizing();
      if (word.text() == null || word.text().isBlank() || !word.hasArea()) {
        continue;
      }
      placements.add(
          new TextPlacement(
              word.text(),
              word.x(),
              word.y(),
              sizing.fontSize(),
              sizing.horizontalScale(),
              word.rotation(),
              RenderingMode.NEITHER));
    }
    return new InvisibleLayer(pageIndex, placements);
  }
}
