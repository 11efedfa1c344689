package com.flamingo.ai.searchablepdf.config;

import com.flamingo.ai.searchablepdf.service.textlayer.model.AnchorMode;
import com.flamingo.ai.searchablepdf.service.textlayer.model.EmbeddingOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

/** Configuration properties for invisible text layer embedding. */
@Configuration
@ConfigurationProperties(prefix = "text-layer")
@Getter
@Setter
public class TextLayerConfig {

  private Sizing sizing = new Sizing();
  private Mapping mapping = new Mapping();
  private Merge merge = new Merge();
  private Concurrency concurrency = new Concurrency();
  private Font font = new Font();

  /** Snapshot of the current settings, handed to a single embedding run. */
  public EmbeddingOptions toOptions() {
    return new EmbeddingOptions(
        sizing.getCalibration(),
        sizing.getMinFontSize(),
        sizing.getMaxFontSize(),
        sizing.getMinHorizontalScale(),
        mapping.getAnchor(),
        merge.isStrict(),
        merge.getFontResourcePrefix(),
        merge.isCompress(),
        concurrency.isParallel());
  }

  @Getter
  @Setter
  public static class Sizing {
    /**
     * Font size per point of box height. Tuned so Helvetica's ascender-to-descender extent
     * roughly covers the scanned glyphs; validate against real scans before changing it.
     */
    private float calibration = 0.85f;

    private float minFontSize = 4.0f;
    private float maxFontSize = 72.0f;

    /** Lower bound of the horizontal scale ratio; guards against corrupt, near-zero boxes. */
    private float minHorizontalScale = 0.01f;
  }

  @Getter
  @Setter
  public static class Mapping {
    /** Rectangle the OCR pixel space is mapped onto: CROP_BOX (default) or SCANNED_IMAGE. */
    private AnchorMode anchor = AnchorMode.CROP_BOX;
  }

  @Getter
  @Setter
  public static class Merge {
    /** When true, one page that cannot take a layer fails the whole document. */
    private boolean strict = false;

    /** Preferred font resource name; a numeric suffix is added if the page already uses it. */
    private String fontResourcePrefix = "OcrF";

    private boolean compress = true;
  }

  @Getter
  @Setter
  public static class Font {
    /**
     * TrueType font embedded as a subset for the layer, e.g. {@code file:/fonts/NotoSans.ttf}.
     * Unset means built-in Helvetica, which only encodes WinAnsi characters.
     */
    private Resource file;
  }

  @Getter
  @Setter
  public static class Concurrency {
    private boolean parallel = true;
    private int poolSize = 4;
    private int queueCapacity = 100;
  }
}
