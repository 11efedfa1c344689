package com.flamingo.ai.searchablepdf.service.textlayer;

import com.flamingo.ai.searchablepdf.config.TextLayerConfig;
import com.flamingo.ai.searchablepdf.exception.EmptyDocumentException;
import com.flamingo.ai.searchablepdf.exception.InvalidPageMetadataException;
import com.flamingo.ai.searchablepdf.exception.LayerConstructionFailedException;
import com.flamingo.ai.searchablepdf.exception.MalformedInputException;
import com.flamingo.ai.searchablepdf.exception.TextLayerErrorCode;
import com.flamingo.ai.searchablepdf.exception.TextLayerException;
import com.flamingo.ai.searchablepdf.exception.UnsupportedPageStructureException;
import com.flamingo.ai.searchablepdf.service.textlayer.model.AnchorMode;
import com.flamingo.ai.searchablepdf.service.textlayer.model.EmbeddingOptions;
import com.flamingo.ai.searchablepdf.service.textlayer.model.EmbeddingWarning;
import com.flamingo.ai.searchablepdf.service.textlayer.model.GlyphSizing;
import com.flamingo.ai.searchablepdf.service.textlayer.model.MappedWord;
import com.flamingo.ai.searchablepdf.service.textlayer.model.PageGeometry;
import com.flamingo.ai.searchablepdf.service.textlayer.model.PageLayerResult;
import com.flamingo.ai.searchablepdf.service.textlayer.model.PageWords;
import com.flamingo.ai.searchablepdf.service.textlayer.model.RecognizedWord;
import com.flamingo.ai.searchablepdf.service.textlayer.model.SizedWord;
import com.flamingo.ai.searchablepdf.service.textlayer.model.TextLayerResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns a scanned PDF plus OCR word boxes into a searchable PDF.
 *
 * <p>Per page: {@link CoordinateMapper} → {@link GlyphSizingEstimator} → {@link
 * InvisibleTextLayerBuilder} → {@link PageContentMerger}. Layers are built concurrently on the
 * {@code pageLayerExecutor}; merging happens afterwards on the calling thread in page order,
 * because a {@link PDDocument} must not be mutated from several threads.
 *
 * <p>Failure containment:
 *
 * <ul>
 *   <li>a bad word is skipped, the rest of its page is embedded;
 *   <li>a page whose metadata or structure is unusable keeps its original content and gets no
 *       layer, unless {@link EmbeddingOptions#strict()} is set for structure problems;
 *   <li>unreadable or empty input fails the whole call.
 * </ul>
 *
 * <p>Every recovered failure is reported as an {@link EmbeddingWarning} in the result.
 */
@Service
@Slf4j
public class TextLayerEmbeddingService {

  private final CoordinateMapper coordinateMapper;
  private final GlyphSizingEstimator sizingEstimator;
  private final InvisibleTextLayerBuilder layerBuilder;
  private final PageContentMerger contentMerger;
  private final ScannedImageLocator imageLocator;
  private final LayerFontSource fontSource;
  private final TextLayerConfig textLayerConfig;
  private final Executor pageLayerExecutor;
  private final MeterRegistry meterRegistry;

  public TextLayerEmbeddingService(
      CoordinateMapper coordinateMapper,
      GlyphSizingEstimator sizingEstimator,
      InvisibleTextLayerBuilder layerBuilder,
      PageContentMerger contentMerger,
      ScannedImageLocator imageLocator,
      LayerFontSource fontSource,
      TextLayerConfig textLayerConfig,
      @Qualifier("pageLayerExecutor") Executor pageLayerExecutor,
      MeterRegistry meterRegistry) {
    this.coordinateMapper = coordinateMapper;
    this.sizingEstimator = sizingEstimator;
    this.layerBuilder = layerBuilder;
    this.contentMerger = contentMerger;
    this.imageLocator = imageLocator;
    this.fontSource = fontSource;
    this.textLayerConfig = textLayerConfig;
    this.pageLayerExecutor = pageLayerExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Embeds the text layer using the configured {@code text-layer.*} settings.
   *
   * @see #process(byte[], Map, EmbeddingOptions)
   */
  @Timed(value = "textlayer.process", description = "Time to embed an invisible text layer")
  public TextLayerResult process(byte[] documentBytes, Map<Integer, PageWords> perPageWords) {
    return process(documentBytes, perPageWords, textLayerConfig.toOptions());
  }

  /**
   * Embeds an invisible, searchable text layer into every page that has recognized words.
   *
   * @param documentBytes the input PDF
   * @param perPageWords OCR words and raster size keyed by 0-based page index; pages without an
   *     entry pass through unchanged
   * @param options settings for this run
   * @return the output PDF with per-page warnings
   * @throws MalformedInputException if the bytes are not a readable PDF
   * @throws EmptyDocumentException if the PDF has no pages
   * @throws UnsupportedPageStructureException in strict mode, for the first page that cannot be
   *     appended to
   */
  @Timed(value = "textlayer.process", description = "Time to embed an invisible text layer")
  public TextLayerResult process(
      byte[] documentBytes, Map<Integer, PageWords> perPageWords, EmbeddingOptions options) {
    long start = System.nanoTime();
    try (PDDocument document = load(documentBytes)) {
      int pageCount = document.getNumberOfPages();
      if (pageCount == 0) {
        throw new EmptyDocumentException();
      }
      log.info(
          "Embedding text layer: {} pages, {} pages with recognized words",
          pageCount,
          perPageWords.size());

      List<PageJob> jobs = preparePageJobs(document, perPageWords, options);
      SortedMap<Integer, PageLayerResult> layers = buildLayers(jobs, options);

      List<EmbeddingWarning> warnings = new ArrayList<>();
      int embeddedPages = mergeLayers(document, layers, options, warnings);

      byte[] output = save(document);
      log.info(
          "Text layer embedded into {}/{} pages with {} warnings in {} ms",
          embeddedPages,
          pageCount,
          warnings.size(),
          (System.nanoTime() - start) / 1_000_000);
      return new TextLayerResult(output, pageCount, embeddedPages, warnings);
    } catch (TextLayerException e) {
      meterRegistry
          .counter("textlayer.documents.failed", "code", e.getCode().name())
          .increment();
      throw e;
    } catch (IOException e) {
      meterRegistry
          .counter("textlayer.documents.failed", "code", TextLayerErrorCode.MALFORMED_INPUT.name())
          .increment();
      throw new MalformedInputException("Failed to write PDF: " + e.getMessage(), e);
    }
  }

  // ---- private helpers ----

  private PDDocument load(byte[] documentBytes) {
    if (documentBytes == null || documentBytes.length == 0) {
      throw new MalformedInputException("Input document is empty");
    }
    try {
      return Loader.loadPDF(documentBytes);
    } catch (IOException e) {
      log.warn("PDFBox could not parse input: {}", e.getMessage());
      throw new MalformedInputException("Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  private byte[] save(PDDocument document) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    document.save(out);
    return out.toByteArray();
  }

  /** Reads page geometry sequentially; the document is not touched again until merging. */
  private List<PageJob> preparePageJobs(
      PDDocument document, Map<Integer, PageWords> perPageWords, EmbeddingOptions options) {
    int pageCount = document.getNumberOfPages();
    List<PageJob> jobs = new ArrayList<>();
    for (Map.Entry<Integer, PageWords> entry : new TreeMap<>(perPageWords).entrySet()) {
      int pageIndex = entry.getKey();
      if (pageIndex < 0 || pageIndex >= pageCount) {
        log.warn(
            "Ignoring recognized words for page {}: document has {} pages", pageIndex, pageCount);
        continue;
      }
      PageWords pageWords = entry.getValue();
      if (pageWords == null || pageWords.words().isEmpty()) {
        continue;
      }
      PDPage page = document.getPage(pageIndex);
      PageGeometry geometry = geometryOf(page, pageIndex, options.anchor());
      log.debug("Page {} geometry: {}", pageIndex, geometry);
      jobs.add(new PageJob(geometry, pageWords, fontSource.load(document, pageIndex)));
    }
    return jobs;
  }

  private PageGeometry geometryOf(PDPage page, int pageIndex, AnchorMode anchor) {
    PDRectangle reference = page.getCropBox();
    if (anchor == AnchorMode.SCANNED_IMAGE) {
      Optional<PDRectangle> image = imageLocator.locate(page);
      if (image.isPresent()) {
        reference = image.get();
      } else {
        log.debug("Page {} draws no image, anchoring on crop box", pageIndex);
      }
    }
    return new PageGeometry(
        pageIndex,
        reference.getLowerLeftX(),
        reference.getLowerLeftY(),
        reference.getWidth(),
        reference.getHeight(),
        page.getRotation());
  }

  private SortedMap<Integer, PageLayerResult> buildLayers(
      List<PageJob> jobs, EmbeddingOptions options) {
    Map<Integer, PageLayerResult> results = new ConcurrentHashMap<>();
    if (!options.parallel() || jobs.size() < 2) {
      jobs.forEach(job -> results.put(job.geometry().pageIndex(), buildPageLayer(job, options)));
    } else {
      CompletableFuture<?>[] futures =
          jobs.stream()
              .map(
                  job ->
                      CompletableFuture.supplyAsync(
                              () -> buildPageLayer(job, options), pageLayerExecutor)
                          .thenAccept(result -> results.put(result.pageIndex(), result)))
              .toArray(CompletableFuture[]::new);
      try {
        CompletableFuture.allOf(futures).join();
      } catch (CompletionException e) {
        if (e.getCause() instanceof RuntimeException cause) {
          throw cause;
        }
        throw e;
      }
    }
    return new TreeMap<>(results);
  }

  /** Maps, sizes and assembles one page's layer. Runs on a worker thread. */
  PageLayerResult buildPageLayer(PageJob job, EmbeddingOptions options) {
    PageGeometry geometry = job.geometry();
    int pageIndex = geometry.pageIndex();
    PageWords pageWords = job.words();

    try {
      coordinateMapper.validate(pageWords.meta(), pageIndex);
    } catch (InvalidPageMetadataException e) {
      log.warn("Skipping text layer for page {}: {}", pageIndex, e.getMessage());
      return PageLayerResult.skipped(
          pageIndex, EmbeddingWarning.forPage(pageIndex, e.getCode(), e.getMessage()));
    }

    List<SizedWord> sizedWords = new ArrayList<>(pageWords.words().size());
    List<EmbeddingWarning> warnings = new ArrayList<>();
    List<RecognizedWord> words = pageWords.words();
    for (int i = 0; i < words.size(); i++) {
      RecognizedWord word = words.get(i);
      try {
        MappedWord mapped = coordinateMapper.map(word, pageWords.meta(), geometry);
        Optional<GlyphSizing> sizing =
            sizingEstimator.estimate(mapped, word.text(), job.font(), options);
        if (sizing.isPresent()) {
          sizedWords.add(new SizedWord(mapped, sizing.get()));
        } else {
          warnings.add(
              EmbeddingWarning.forWord(
                  pageIndex,
                  i,
                  TextLayerErrorCode.DEGENERATE_WORD,
                  "Blank text or zero-area box: " + word.box()));
        }
      } catch (LayerConstructionFailedException e) {
        log.warn("Skipping word {} on page {}: {}", i, pageIndex, e.getMessage());
        warnings.add(EmbeddingWarning.forWord(pageIndex, i, e.getCode(), e.getMessage()));
      } catch (RuntimeException e) {
        log.warn("Unexpected failure on word {} of page {}", i, pageIndex, e);
        warnings.add(
            EmbeddingWarning.forWord(
                pageIndex, i, TextLayerErrorCode.LAYER_CONSTRUCTION_FAILED, e.toString()));
      }
    }

    meterRegistry.counter("textlayer.words.skipped").increment(warnings.size());
    log.debug(
        "Page {}: {} of {} words sized for embedding", pageIndex, sizedWords.size(), words.size());
    return new PageLayerResult(pageIndex, layerBuilder.build(pageIndex, sizedWords), warnings);
  }

  private int mergeLayers(
      PDDocument document,
      SortedMap<Integer, PageLayerResult> layers,
      EmbeddingOptions options,
      List<EmbeddingWarning> warnings) {
    Set<COSBase> sharedContents = contentMerger.findSharedContents(document);
    PDFont layerFont = null;
    int embeddedPages = 0;

    for (PageLayerResult result : layers.values()) {
      int pageIndex = result.pageIndex();
      warnings.addAll(result.warnings());
      if (!result.hasPlacements()) {
        if (result.layer() == null) {
          meterRegistry.counter("textlayer.pages.skipped").increment();
        }
        continue;
      }

      try {
        if (layerFont == null) {
          layerFont = fontSource.load(document, pageIndex);
        }
        contentMerger.merge(
            document,
            document.getPage(pageIndex),
            result.layer(),
            layerFont,
            options,
            sharedContents);
        embeddedPages++;
        meterRegistry.counter("textlayer.pages.embedded").increment();
        meterRegistry
            .counter("textlayer.words.embedded")
            .increment(result.layer().placements().size());
      } catch (UnsupportedPageStructureException e) {
        if (options.strict()) {
          throw e;
        }
        log.warn("Skipping text layer for page {}: {}", pageIndex, e.getMessage());
        warnings.add(EmbeddingWarning.forPage(pageIndex, e.getCode(), e.getMessage()));
        meterRegistry.counter("textlayer.pages.skipped").increment();
      } catch (LayerConstructionFailedException e) {
        log.warn("Skipping text layer for page {}: {}", pageIndex, e.getMessage(), e);
        warnings.add(EmbeddingWarning.forPage(pageIndex, e.getCode(), e.getMessage()));
        meterRegistry.counter("textlayer.pages.skipped").increment();
      }
    }
    return embeddedPages;
  }

  /**
   * Work item for one page.
   *
   * @param geometry reference rectangle and rotation of the page
   * @param words OCR output for the page
   * @param font measuring font owned by this job alone
   */
  record PageJob(PageGeometry geometry, PageWords words, PDFont font) {}
}
