package it.aw.regmetrics.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AgencyReferenceIndexTest {

  private static final String FEED =
      """
      {
        "agencies": [
          {
            "name": "Department of Agriculture",
            "display_name": "Agriculture Department",
            "cfr_references": [
              {"title": 7, "chapter": "II"},
              {"title": 2, "chapter": "IV"},
              {"title": 7, "chapter": "III"}
            ]
          },
          {
            "name": "Administrative Conference of the United States",
            "cfr_references": [ {"title": 1, "chapter": "III"} ]
          },
          {
            "name": "Office Without Titles",
            "cfr_references": []
          },
          {
            "name": "Department of Energy",
            "cfr_references": [
              {"title": 10, "chapter": "II"},
              {"title": 10},
              {"title": 48, "chapter": "9"},
              {"chapter": "X"}
            ]
          },
          {
            "name": "Agriculture Department",
            "cfr_references": [ {"title": 36, "chapter": "II"} ]
          }
        ]
      }
      """;

  private AgencyReferenceIndex index;

  @BeforeEach
  void setUp() throws Exception {
    JsonNode feed = new ObjectMapper().readTree(FEED);
    index = AgencyReferenceIndex.build(feed);
  }

  @Test
  void agenciesWithoutTitlesAreOmitted() {
    assertThat(index.agencyNames())
        .containsExactly(
            "Agriculture Department",
            "Administrative Conference of the United States",
            "Department of Energy");
    assertThat(index.listedNames()).contains("Office Without Titles");
  }

  @Test
  void listedNamesIncludeEveryAgencySorted() {
    assertThat(index.listedNames())
        .containsExactly(
            "Administrative Conference of the United States",
            "Agriculture Department",
            "Department of Energy",
            "Office Without Titles");
  }

  @Test
  void displayNamePreferredAndDuplicatesMerged() {
    assertThat(index.titlesFor("Agriculture Department")).containsExactly(2, 7, 36);
    assertThat(index.chaptersFor("Agriculture Department", 36)).contains(Set.of("II"));
  }

  @Test
  void chaptersForCollectsExplicitChapters() {
    assertThat(index.chaptersFor("Agriculture Department", 7)).contains(Set.of("II", "III"));
    assertThat(index.chaptersFor("Department of Energy", 48)).contains(Set.of("9"));
  }

  @Test
  void missingChapterDegradesToWholeTitle() {
    assertThat(index.chaptersFor("Department of Energy", 10)).isEqualTo(Optional.empty());
  }

  @Test
  void referencesWithoutTitleAreIgnored() {
    assertThat(index.titlesFor("Department of Energy")).containsExactly(10, 48);
  }

  @Test
  void unknownAgencyIsResolutionError() {
    assertThatThrownBy(() -> index.require("Nope"))
        .isInstanceOf(AgencyNotFoundException.class)
        .hasMessageContaining("Nope");
    assertThatThrownBy(() -> index.chaptersFor("Office Without Titles", 1))
        .isInstanceOf(AgencyNotFoundException.class);
  }

  @Test
  void feedWithoutAgenciesArrayIsRejected() throws Exception {
    JsonNode broken = new ObjectMapper().readTree("{\"items\": []}");

    assertThatThrownBy(() -> AgencyReferenceIndex.build(broken))
        .isInstanceOf(ReferenceFeedException.class);
    assertThatThrownBy(() -> AgencyReferenceIndex.build(null))
        .isInstanceOf(ReferenceFeedException.class);
  }
}
