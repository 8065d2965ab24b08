package it.aw.regmetrics.service;

import static org.assertj.core.api.Assertions.assertThat;

import it.aw.regmetrics.model.MetricsRecord;
import org.junit.jupiter.api.Test;

class MetricsCalculatorTest {

  @Test
  void wordCountSplitsOnAnyWhitespace() {
    assertThat(MetricsCalculator.wordCount("a b c")).isEqualTo(3);
    assertThat(MetricsCalculator.wordCount("  a\tb\n\nc  ")).isEqualTo(3);
    assertThat(MetricsCalculator.wordCount("")).isZero();
    assertThat(MetricsCalculator.wordCount("   ")).isZero();
  }

  @Test
  void unicodeSpacesSeparateWords() {
    assertThat(MetricsCalculator.wordCount("a\u2009b")).isEqualTo(2);
    assertThat(MetricsCalculator.wordCount("\u00A0a\u00A0b\u3000c\u00A0")).isEqualTo(3);
    assertThat(MetricsCalculator.wordCount("\u00A0\u2009")).isZero();
    assertThat(MetricsCalculator.complexity("\u00A0\u2009")).isNull();
    assertThat(MetricsCalculator.complexity("The\u00A0cat sat.")).isEqualTo(-2.6);
  }

  @Test
  void checksumIsSha256HexOfUtf8Bytes() {
    assertThat(MetricsCalculator.checksum("abc"))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    assertThat(MetricsCalculator.checksum("")).hasSize(64);
  }

  @Test
  void checksumChangesWithSingleCharacter() {
    assertThat(MetricsCalculator.checksum("Cost principles apply."))
        .isNotEqualTo(MetricsCalculator.checksum("Cost principles apply!"))
        .isNotEqualTo(MetricsCalculator.checksum("Cost principles apply. "));
  }

  @Test
  void complexityFollowsFleschKincaidGrade() {
    // 3 words, 1 sentence, 3 syllables: 0.39*3 + 11.8*1 - 15.59
    assertThat(MetricsCalculator.complexity("The cat sat.")).isEqualTo(-2.6);
  }

  @Test
  void longerSentencesRaiseComplexity() {
    Double split = MetricsCalculator.complexity("The cat sat. The dog ran. The cow ate.");
    Double joined = MetricsCalculator.complexity("The cat sat and the dog ran and the cow ate.");

    assertThat(joined).isGreaterThan(split);
  }

  @Test
  void complexityIsAbsentWithoutWords() {
    assertThat(MetricsCalculator.complexity("")).isNull();
    assertThat(MetricsCalculator.complexity("   ")).isNull();
    assertThat(MetricsCalculator.complexity("... -- !!")).isNull();
    assertThat(MetricsCalculator.complexity(null)).isNull();
  }

  @Test
  void textWithoutTerminalPunctuationCountsAsOneSentence() {
    assertThat(MetricsCalculator.sentenceCount("no punctuation here")).isEqualTo(1);
    assertThat(MetricsCalculator.sentenceCount("One. Two! Three?")).isEqualTo(3);
    assertThat(MetricsCalculator.sentenceCount("Section 200.1 applies.")).isEqualTo(1);
  }

  @Test
  void syllableEstimate() {
    assertThat(MetricsCalculator.syllables("make")).isEqualTo(1);
    assertThat(MetricsCalculator.syllables("table")).isEqualTo(2);
    assertThat(MetricsCalculator.syllables("regulation")).isEqualTo(4);
    assertThat(MetricsCalculator.syllables("CFR")).isEqualTo(1);
  }

  @Test
  void computeUsesSameTextForCountAndChecksum() {
    MetricsRecord record = MetricsCalculator.compute("a b c");

    assertThat(record.wordCount()).isEqualTo(3);
    assertThat(record.checksum()).isEqualTo(MetricsCalculator.checksum("a b c"));
    assertThat(record.complexity()).isNotNull();
  }
}
