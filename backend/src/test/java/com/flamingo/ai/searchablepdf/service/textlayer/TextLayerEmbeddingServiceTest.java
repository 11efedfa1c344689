package com.flamingo.ai.searchablepdf.service.textlayer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.searchablepdf.TestPdfs;
import com.flamingo.ai.searchablepdf.config.ExecutorConfig;
import com.flamingo.ai.searchablepdf.config.TextLayerConfig;
import com.flamingo.ai.searchablepdf.exception.EmptyDocumentException;
import com.flamingo.ai.searchablepdf.exception.MalformedInputException;
import com.flamingo.ai.searchablepdf.exception.TextLayerErrorCode;
import com.flamingo.ai.searchablepdf.exception.UnsupportedPageStructureException;
import com.flamingo.ai.searchablepdf.service.textlayer.model.AnchorMode;
import com.flamingo.ai.searchablepdf.service.textlayer.model.EmbeddingOptions;
import com.flamingo.ai.searchablepdf.service.textlayer.model.EmbeddingWarning;
import com.flamingo.ai.searchablepdf.service.textlayer.model.PageImageMeta;
import com.flamingo.ai.searchablepdf.service.textlayer.model.PageWords;
import com.flamingo.ai.searchablepdf.service.textlayer.model.PixelBox;
import com.flamingo.ai.searchablepdf.service.textlayer.model.RecognizedWord;
import com.flamingo.ai.searchablepdf.service.textlayer.model.TextLayerResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Unit tests for {@link TextLayerEmbeddingService}. */
class TextLayerEmbeddingServiceTest {

  private static final PageImageMeta LETTER_SCAN = new PageImageMeta(1700, 2200);

  private MeterRegistry meterRegistry;
  private ExecutorService executor;
  private TextLayerEmbeddingService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    executor = Executors.newFixedThreadPool(4);
    service = newService(new PageContentMerger());
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void shouldEmbedSearchableWord_atMappedPosition() throws IOException {
    byte[] input = TestPdfs.blankPages(1, TestPdfs.LETTER);

    TextLayerResult result =
        service.process(input, Map.of(0, page(word("Invoice", 100, 50, 200, 40))));

    assertThat(result.pageCount()).isEqualTo(1);
    assertThat(result.embeddedPages()).isEqualTo(1);
    assertThat(result.hasWarnings()).isFalse();
    assertThat(TestPdfs.extractText(result.document())).contains("Invoice");

    TextPosition first = textPositions(result.document(), 0).get(0);
    assertThat(first.getUnicode()).isEqualTo("I");
    assertThat(first.getTextMatrix().getTranslateX()).isCloseTo(36f, within(1f));
    assertThat(first.getTextMatrix().getTranslateY()).isCloseTo(759.6f, within(1f));
  }

  @Test
  void shouldNotChangeRenderedAppearance() throws IOException {
    byte[] input =
        TestPdfs.scannedPages(1, TestPdfs.LETTER, new PDRectangle(50, 100, 400, 500));

    TextLayerResult result =
        service.process(
            input,
            Map.of(
                0,
                page(
                    word("Invoice", 100, 50, 200, 40),
                    word("Total", 300, 900, 150, 40),
                    word("4711", 900, 1500, 120, 40))));

    assertThat(result.embeddedPages()).isEqualTo(1);
    assertSameRaster(TestPdfs.render(input, 0), TestPdfs.render(result.document(), 0));
  }

  @Test
  void shouldSkipDegenerateWord_andKeepRestOfDocument() throws IOException {
    byte[] input = TestPdfs.blankPages(3, TestPdfs.LETTER);
    Map<Integer, PageWords> words =
        Map.of(
            0,
            page(word("alpha", 100, 100, 200, 40)),
            1,
            page(
                word("beta", 100, 100, 200, 40),
                word("bad", 400, 100, -50, 40),
                word("gamma", 100, 300, 200, 40)),
            2,
            page(word("delta", 100, 100, 200, 40)));

    TextLayerResult result = service.process(input, words);

    assertThat(result.pageCount()).isEqualTo(3);
    assertThat(result.embeddedPages()).isEqualTo(3);
    assertThat(result.warnings()).hasSize(1);
    EmbeddingWarning warning = result.warnings().get(0);
    assertThat(warning.pageIndex()).isEqualTo(1);
    assertThat(warning.wordIndex()).isEqualTo(1);
    assertThat(warning.code()).isEqualTo(TextLayerErrorCode.DEGENERATE_WORD);
    assertThat(TestPdfs.extractText(result.document(), 1))
        .contains("beta")
        .contains("gamma")
        .doesNotContain("bad");
    assertThat(TestPdfs.extractText(result.document(), 0)).contains("alpha");
    assertThat(TestPdfs.extractText(result.document(), 2)).contains("delta");
  }

  @Test
  void shouldPassThroughPagesWithoutWords() throws IOException {
    byte[] input = TestPdfs.blankPages(3, TestPdfs.LETTER);

    TextLayerResult result =
        service.process(input, Map.of(2, page(word("last", 100, 100, 200, 40))));

    assertThat(result.pageCount()).isEqualTo(3);
    assertThat(result.embeddedPages()).isEqualTo(1);
    assertThat(TestPdfs.extractText(result.document(), 0)).isBlank();
    assertThat(TestPdfs.extractText(result.document(), 1)).isBlank();
    assertThat(TestPdfs.extractText(result.document(), 2)).contains("last");
  }

  @Test
  void shouldReturnEquivalentDocument_whenNoWordsGiven() throws IOException {
    byte[] input = TestPdfs.blankPages(2, TestPdfs.LETTER);

    TextLayerResult result = service.process(input, Map.of());

    assertThat(result.pageCount()).isEqualTo(2);
    assertThat(result.embeddedPages()).isZero();
    assertThat(TestPdfs.pageCount(result.document())).isEqualTo(2);
  }

  @Test
  void shouldIgnoreWordsForPagesOutsideDocument() throws IOException {
    byte[] input = TestPdfs.blankPages(1, TestPdfs.LETTER);

    TextLayerResult result =
        service.process(
            input,
            Map.of(
                0, page(word("kept", 100, 100, 200, 40)),
                5, page(word("ghost", 100, 100, 200, 40))));

    assertThat(result.embeddedPages()).isEqualTo(1);
    assertThat(TestPdfs.extractText(result.document())).contains("kept").doesNotContain("ghost");
  }

  @Test
  void shouldReportInvalidPageMetadata_andLeavePageUnchanged() throws IOException {
    byte[] input = TestPdfs.blankPages(2, TestPdfs.LETTER);
    Map<Integer, PageWords> words =
        Map.of(
            0, new PageWords(List.of(word("lost", 100, 100, 200, 40)), new PageImageMeta(0, 2200)),
            1, page(word("found", 100, 100, 200, 40)));

    TextLayerResult result = service.process(input, words);

    assertThat(result.embeddedPages()).isEqualTo(1);
    assertThat(result.warningsForPage(0))
        .singleElement()
        .satisfies(
            w -> {
              assertThat(w.code()).isEqualTo(TextLayerErrorCode.INVALID_PAGE_METADATA);
              assertThat(w.isPageLevel()).isTrue();
            });
    assertThat(TestPdfs.extractText(result.document(), 0)).isBlank();
    assertThat(TestPdfs.extractText(result.document(), 1)).contains("found");
    assertThat(meterRegistry.counter("textlayer.pages.skipped").count()).isEqualTo(1.0);
  }

  @Test
  void shouldReportUnencodableWord_andEmbedTheRest() throws IOException {
    byte[] input = TestPdfs.blankPages(1, TestPdfs.LETTER);

    TextLayerResult result =
        service.process(
            input,
            Map.of(0, page(word("請求書", 100, 100, 200, 40), word("Invoice", 100, 300, 200, 40))));

    assertThat(result.embeddedPages()).isEqualTo(1);
    assertThat(result.warnings())
        .singleElement()
        .satisfies(
            w -> {
              assertThat(w.code()).isEqualTo(TextLayerErrorCode.LAYER_CONSTRUCTION_FAILED);
              assertThat(w.wordIndex()).isZero();
            });
    assertThat(TestPdfs.extractText(result.document())).contains("Invoice");
  }

  @Test
  void shouldFailOnDocumentWithoutPages() throws IOException {
    byte[] input = TestPdfs.emptyDocument();

    assertThatThrownBy(() -> service.process(input, Map.of()))
        .isInstanceOf(EmptyDocumentException.class);
    assertThat(
            meterRegistry
                .counter("textlayer.documents.failed", "code", "EMPTY_DOCUMENT")
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldFailOnUnreadableInput() {
    byte[] garbage = "definitely not a pdf".getBytes(StandardCharsets.US_ASCII);

    assertThatThrownBy(() -> service.process(garbage, Map.of()))
        .isInstanceOfSatisfying(
            MalformedInputException.class,
            ex -> assertThat(ex.getCode()).isEqualTo(TextLayerErrorCode.MALFORMED_INPUT));
  }

  @Test
  void shouldFailOnMissingInput() {
    assertThatThrownBy(() -> service.process(null, Map.of()))
        .isInstanceOf(MalformedInputException.class);
    assertThatThrownBy(() -> service.process(new byte[0], Map.of()))
        .isInstanceOf(MalformedInputException.class);
  }

  @Test
  void shouldSkipPageWithUnsupportedStructure_whenNotStrict() throws IOException {
    PageContentMerger merger = mock(PageContentMerger.class);
    when(merger.merge(any(), any(), any(), any(), any(), any()))
        .thenThrow(new UnsupportedPageStructureException(0, "shared contents"));
    TextLayerEmbeddingService lenient = newService(merger);
    byte[] input = TestPdfs.blankPages(1, TestPdfs.LETTER);

    TextLayerResult result =
        lenient.process(input, Map.of(0, page(word("Invoice", 100, 50, 200, 40))));

    assertThat(result.pageCount()).isEqualTo(1);
    assertThat(result.embeddedPages()).isZero();
    assertThat(result.warnings())
        .singleElement()
        .satisfies(
            w -> assertThat(w.code()).isEqualTo(TextLayerErrorCode.UNSUPPORTED_PAGE_STRUCTURE));
  }

  @Test
  void shouldFailWholeDocument_whenStrictAndStructureUnsupported() throws IOException {
    PageContentMerger merger = mock(PageContentMerger.class);
    when(merger.merge(any(), any(), any(), any(), any(), any()))
        .thenThrow(new UnsupportedPageStructureException(0, "shared contents"));
    TextLayerEmbeddingService strict = newService(merger);
    byte[] input = TestPdfs.blankPages(1, TestPdfs.LETTER);
    EmbeddingOptions options = EmbeddingOptions.defaults().withStrict(true);

    assertThatThrownBy(
            () ->
                strict.process(
                    input, Map.of(0, page(word("Invoice", 100, 50, 200, 40))), options))
        .isInstanceOf(UnsupportedPageStructureException.class);
    assertThat(
            meterRegistry
                .counter("textlayer.documents.failed", "code", "UNSUPPORTED_PAGE_STRUCTURE")
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldNotCallMerger_forPagesWithoutPlacements() throws IOException {
    PageContentMerger merger = mock(PageContentMerger.class);
    TextLayerEmbeddingService mocked = newService(merger);
    byte[] input = TestPdfs.blankPages(1, TestPdfs.LETTER);

    TextLayerResult result = mocked.process(input, Map.of(0, page(word(" ", 100, 50, 200, 40))));

    verify(merger, never()).merge(any(), any(), any(), any(), any(), any());
    assertThat(result.warnings())
        .extracting(EmbeddingWarning::code)
        .containsExactly(TextLayerErrorCode.DEGENERATE_WORD);
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 90, 180, 270})
  void shouldAlignTextWithDisplayedPage_onRotatedPage(int rotation) throws IOException {
    // media box chosen so every rotation displays as portrait letter
    PDRectangle mediaBox =
        rotation % 180 == 0 ? new PDRectangle(612, 792) : new PDRectangle(792, 612);
    byte[] input = TestPdfs.rotatedPage(mediaBox, rotation);

    TextLayerResult result =
        service.process(input, Map.of(0, page(word("Invoice", 100, 50, 200, 40))));

    List<TextPosition> glyphs = textPositions(result.document(), 0);
    TextPosition first = glyphs.get(0);
    TextPosition last = glyphs.get(glyphs.size() - 1);
    assertThat(first.getUnicode()).isEqualTo("I");
    assertThat(last.getUnicode()).isEqualTo("e");
    assertThat(first.getDir()).isEqualTo((float) rotation);
    assertThat(first.getXDirAdj()).isCloseTo(36f, within(1f));
    assertThat(first.getYDirAdj()).isCloseTo(32.4f, within(1f));
    assertThat(last.getXDirAdj() + last.getWidthDirAdj()).isCloseTo(108f, within(1f));
    try (PDDocument document = Loader.loadPDF(result.document())) {
      assertThat(document.getPage(0).getRotation()).isEqualTo(rotation);
    }
  }

  @Test
  void shouldEmbedEveryPage_whenPagesOutnumberWorkerQueue() throws IOException {
    TextLayerConfig config = new TextLayerConfig();
    config.getConcurrency().setPoolSize(1);
    config.getConcurrency().setQueueCapacity(1);
    ThreadPoolTaskExecutor pool =
        (ThreadPoolTaskExecutor) new ExecutorConfig().pageLayerExecutor(config);
    try {
      TextLayerEmbeddingService pooled = newService(new PageContentMerger(), pool, config);
      int pageCount = 160;
      Map<Integer, PageWords> words = new HashMap<>();
      for (int i = 0; i < pageCount; i++) {
        words.put(i, page(word("page" + i, 100, 100, 200, 40), word("total", 100, 300, 200, 40)));
      }

      TextLayerResult result =
          pooled.process(TestPdfs.blankPages(pageCount, TestPdfs.LETTER), words);

      assertThat(result.pageCount()).isEqualTo(pageCount);
      assertThat(result.embeddedPages()).isEqualTo(pageCount);
      assertThat(result.hasWarnings()).isFalse();
      assertThat(TestPdfs.extractText(result.document(), 0)).contains("page0");
      assertThat(TestPdfs.extractText(result.document(), pageCount - 1)).contains("page159");
    } finally {
      pool.shutdown();
    }
  }

  @Test
  void shouldEmbedNonLatinWords_whenTrueTypeFontConfigured() throws IOException {
    TextLayerConfig config = new TextLayerConfig();
    config.getFont().setFile(new ClassPathResource(TestPdfs.UNICODE_FONT));
    TextLayerEmbeddingService unicode = newService(new PageContentMerger(), executor, config);
    byte[] input = TestPdfs.blankPages(1, TestPdfs.LETTER);

    TextLayerResult result =
        unicode.process(
            input,
            Map.of(
                0,
                page(
                    word("Привет", 100, 100, 200, 40),
                    word("Ελλάδα", 100, 300, 200, 40),
                    word("Invoice", 100, 500, 200, 40))));

    assertThat(result.embeddedPages()).isEqualTo(1);
    assertThat(result.hasWarnings()).isFalse();
    assertThat(TestPdfs.extractText(result.document()))
        .contains("Привет")
        .contains("Ελλάδα")
        .contains("Invoice");
  }

  @Test
  void shouldAnchorOnScannedImage_whenRequested() throws IOException {
    byte[] input =
        TestPdfs.scannedPages(1, TestPdfs.LETTER, new PDRectangle(50, 100, 400, 500));
    PageWords normalized =
        new PageWords(
            List.of(new RecognizedWord("Header", new PixelBox(0, 0, 0.5, 0.1), 0)),
            PageImageMeta.normalized());

    TextLayerResult result =
        service.process(
            input,
            Map.of(0, normalized),
            EmbeddingOptions.defaults().withAnchor(AnchorMode.SCANNED_IMAGE));

    TextPosition first = textPositions(result.document(), 0).get(0);
    assertThat(first.getTextMatrix().getTranslateX()).isCloseTo(50f, within(1f));
    assertThat(first.getTextMatrix().getTranslateY()).isCloseTo(550f, within(1f));
  }

  @Test
  void shouldProduceSameText_parallelAndSequential() throws IOException {
    byte[] input = TestPdfs.blankPages(4, TestPdfs.LETTER);
    Map<Integer, PageWords> words =
        Map.of(
            0, page(word("zero", 100, 100, 200, 40), word("one", 400, 100, 150, 40)),
            1, page(word("two", 100, 100, 200, 40)),
            2, page(word("three", 100, 100, 200, 40), word("four", 100, 300, 200, 40)),
            3, page(word("five", 100, 100, 200, 40)));

    TextLayerResult parallel =
        service.process(input, words, EmbeddingOptions.defaults().withParallel(true));
    TextLayerResult sequential =
        service.process(input, words, EmbeddingOptions.defaults().withParallel(false));

    assertThat(parallel.embeddedPages()).isEqualTo(4);
    assertThat(TestPdfs.extractText(parallel.document()))
        .isEqualTo(TestPdfs.extractText(sequential.document()));
  }

  @Test
  void shouldRecordEmbeddingCounters() throws IOException {
    byte[] input = TestPdfs.blankPages(2, TestPdfs.LETTER);

    service.process(
        input,
        Map.of(
            0, page(word("one", 100, 100, 200, 40), word("two", 400, 100, 200, 40)),
            1, page(word("three", 100, 100, 200, 40), word("", 100, 300, 200, 40))));

    assertThat(meterRegistry.counter("textlayer.pages.embedded").count()).isEqualTo(2.0);
    assertThat(meterRegistry.counter("textlayer.words.embedded").count()).isEqualTo(3.0);
    assertThat(meterRegistry.counter("textlayer.words.skipped").count()).isEqualTo(1.0);
  }

  // ---- helpers ----

  private TextLayerEmbeddingService newService(PageContentMerger merger) {
    return newService(merger, executor, new TextLayerConfig());
  }

  private TextLayerEmbeddingService newService(
      PageContentMerger merger, Executor pool, TextLayerConfig config) {
    return new TextLayerEmbeddingService(
        new CoordinateMapper(),
        new GlyphSizingEstimator(),
        new InvisibleTextLayerBuilder(),
        merger,
        new ScannedImageLocator(),
        new LayerFontSource(config),
        config,
        pool,
        meterRegistry);
  }

  private static RecognizedWord word(String text, double x, double y, double w, double h) {
    return new RecognizedWord(text, new PixelBox(x, y, w, h), 0);
  }

  private static PageWords page(RecognizedWord... words) {
    return new PageWords(List.of(words), LETTER_SCAN);
  }

  private static List<TextPosition> textPositions(byte[] pdf, int pageIndex) throws IOException {
    List<TextPosition> positions = new ArrayList<>();
    PDFTextStripper stripper =
        new PDFTextStripper() {
          @Override
          protected void writeString(String text, List<TextPosition> textPositions) {
            positions.addAll(textPositions);
          }
        };
    stripper.setStartPage(pageIndex + 1);
    stripper.setEndPage(pageIndex + 1);
    try (PDDocument document = Loader.loadPDF(pdf)) {
      stripper.getText(document);
    }
    return positions;
  }

  private static void assertSameRaster(BufferedImage expected, BufferedImage actual) {
    assertThat(actual.getWidth()).isEqualTo(expected.getWidth());
    assertThat(actual.getHeight()).isEqualTo(expected.getHeight());
    for (int y = 0; y < expected.getHeight(); y++) {
      for (int x = 0; x < expected.getWidth(); x++) {
        if (expected.getRGB(x, y) != actual.getRGB(x, y)) {
          throw new AssertionError("Pixel differs at (" + x + ", " + y + ")");
        }
      }
    }
  }
}
