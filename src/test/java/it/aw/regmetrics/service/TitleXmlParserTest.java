package it.aw.regmetrics.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import it.aw.regmetrics.model.DocumentNode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TitleXmlParserTest {

  private static final String CHAPTER_I =
      "CHAPTER I-OFFICE OF MANAGEMENT AND BUDGET PART 1-ABOUT TITLE 2 "
          + "This part describes the purpose of the title.";
  private static final String CHAPTER_II =
      "Uniform administrative requirements apply. Cost principles are";

  private DocumentNode root;

  @BeforeEach
  void setUp() throws Exception {
    try (InputStream in = getClass().getResourceAsStream("/title-sample.xml")) {
      root = TitleXmlParser.parse(in.readAllBytes());
    }
  }

  @Test
  void wholeDocumentJoinsStrippedTextInDocumentOrder() {
    String text = TitleXmlParser.extractText(root, null);

    assertThat(text)
        .isEqualTo(
            "Title 2-Grants and Agreements "
                + CHAPTER_I
                + " "
                + CHAPTER_II
                + " Not a chapter node.");
    assertThat(text).doesNotContain("  ").doesNotStartWith(" ").doesNotEndWith(" ");
  }

  @Test
  void emptyFilterMeansWholeDocument() {
    assertThat(TitleXmlParser.extractText(root, Set.of()))
        .isEqualTo(TitleXmlParser.extractText(root, null));
  }

  @Test
  void chapterFilterKeepsOnlyMatchingChapter() {
    assertThat(TitleXmlParser.extractText(root, Set.of("I"))).isEqualTo(CHAPTER_I);
  }

  @Test
  void chapterCodesMatchCaseInsensitively() {
    assertThat(TitleXmlParser.extractText(root, Set.of("II"))).isEqualTo(CHAPTER_II);
    assertThat(TitleXmlParser.extractText(root, Set.of("i"))).isEqualTo(CHAPTER_I);
  }

  @Test
  void chapterCodesAreNotPrefixMatched() {
    assertThat(TitleXmlParser.extractText(root, Set.of("I", "X"))).isEqualTo(CHAPTER_I);
    assertThat(TitleXmlParser.extractText(root, Set.of("IV"))).isEmpty();
  }

  @Test
  void missingChapterYieldsNoText() {
    // DIV3 with TYPE other than CHAPTER is not a chapter node
    assertThat(TitleXmlParser.extractText(root, Set.of("III"))).isEmpty();
  }

  @Test
  void onlyLeadingTextOfEachNodeIsCollected() {
    assertThat(TitleXmlParser.extractText(root, Set.of("II"))).doesNotContain("binding");
  }

  @Test
  void sectionsUseHeadingOrSynthesizedLabel() {
    Map<String, String> sections = TitleXmlParser.extractSections(root, null);

    assertThat(sections)
        .containsExactly(
            Map.entry("CHAPTER I-OFFICE OF MANAGEMENT AND BUDGET", CHAPTER_I),
            Map.entry("Chapter II", CHAPTER_II));
  }

  @Test
  void sectionsHonourFilter() {
    Map<String, String> sections = TitleXmlParser.extractSections(root, List.of("i"));

    assertThat(sections).hasSize(1).containsKey("CHAPTER I-OFFICE OF MANAGEMENT AND BUDGET");
    assertThat(TitleXmlParser.extractText(root, List.of("i"))).isEqualTo(sections.values().iterator().next());
  }

  @Test
  void findChaptersReturnsOnlyChapterDivisions() {
    assertThat(TitleXmlParser.findChapters(root))
        .extracting(node -> node.attribute("N"))
        .containsExactly("I", "ii");
  }

  @Test
  void extractionIsDeterministicAcrossParses() throws Exception {
    byte[] xml;
    try (InputStream in = getClass().getResourceAsStream("/title-sample.xml")) {
      xml = in.readAllBytes();
    }
    String first = TitleXmlParser.extractText(TitleXmlParser.parse(xml), Set.of("I", "II"));
    String second = TitleXmlParser.extractText(TitleXmlParser.parse(xml), Set.of("II", "I"));

    assertThat(first).isEqualTo(second).isEqualTo(CHAPTER_I + " " + CHAPTER_II);
    assertThat(MetricsCalculator.checksum(first)).isEqualTo(MetricsCalculator.checksum(second));
  }

  @Test
  void malformedXmlRaisesParseException() {
    byte[] broken = "<ECFR><DIV3 N=\"I\" TYPE=\"CHAPTER\">text</ECFR>".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> TitleXmlParser.parse(broken))
        .isInstanceOf(TitleParseException.class)
        .hasMessageContaining("XML non valido");
  }

  @Test
  void emptyContentRaisesParseException() {
    assertThatThrownBy(() -> TitleXmlParser.parse(new byte[0]))
        .isInstanceOf(TitleParseException.class);
  }

  @Test
  void cdataIsTreatedAsText() throws IOException, TitleParseException {
    byte[] xml =
        "<ECFR><P><![CDATA[  a < b  ]]></P></ECFR>".getBytes(StandardCharsets.UTF_8);

    assertThat(TitleXmlParser.extractText(TitleXmlParser.parse(xml), null)).isEqualTo("a < b");
  }

  @Test
  void unicodeWhitespaceOnlyNodesAreSkipped() throws Exception {
    byte[] xml = "<ECFR><P>a</P><P>\u00A0</P><P>\u2009b\u2009</P></ECFR>".getBytes(StandardCharsets.UTF_8);

    String text = TitleXmlParser.extractText(TitleXmlParser.parse(xml), null);

    assertThat(text).isEqualTo("a b");
    assertThat(MetricsCalculator.wordCount(text)).isEqualTo(2);
  }

  @Test
  void blankUnicodeHeadingFallsBackToChapterLabel() throws Exception {
    byte[] xml =
        "<ECFR><DIV3 N=\"v\" TYPE=\"CHAPTER\"><HEAD>\u00A0</HEAD><P>text</P></DIV3></ECFR>"
            .getBytes(StandardCharsets.UTF_8);

    assertThat(TitleXmlParser.extractSections(TitleXmlParser.parse(xml), null))
        .containsExactly(Map.entry("Chapter V", "text"));
  }
}
