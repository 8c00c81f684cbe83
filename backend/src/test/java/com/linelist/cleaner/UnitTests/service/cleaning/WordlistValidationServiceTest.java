package com.linelist.cleaner.service.cleaning;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.linelist.cleaner.exception.WordlistConfigurationException;
import com.linelist.cleaner.model.ColumnKind;
import com.linelist.cleaner.model.DataColumn;
import com.linelist.cleaner.model.DataTable;
import com.linelist.cleaner.model.GroupReference;
import com.linelist.cleaner.model.NamedWordlist;
import com.linelist.cleaner.model.SingleTableBundle;
import com.linelist.cleaner.model.TableCollectionBundle;
import com.linelist.cleaner.model.Wordlist;

@DisplayName("WordlistValidationService Tests")
class WordlistValidationServiceTest {

  private static final List<String> ELIGIBLE = List.of("grp", "sym");

  private WordlistValidationService service;

  @BeforeEach
  void setUp() {
    service = new WordlistValidationService();
  }

  private static Wordlist grouped(String[]... rows) {
    List<List<String>> cells = new ArrayList<>();
    for (String[] row : rows) {
      cells.add(Arrays.asList(row));
    }
    return Wordlist.of(List.of("options", "values", "grp"), cells);
  }

  @Nested
  @DisplayName("Dataset checks")
  class DatasetChecks {

    @Test
    @DisplayName("Should reject a null or empty dataset")
    void shouldRejectEmptyDataset() {
      assertThatThrownBy(() -> service.validateDataset(null))
          .isInstanceOf(WordlistConfigurationException.class)
          .hasMessage(WordlistValidationService.BAD_DATASET);
      assertThatThrownBy(() -> service.validateDataset(DataTable.of(List.of())))
          .hasMessage(WordlistValidationService.BAD_DATASET);
    }

    @Test
    @DisplayName("Should reject kinds for columns that do not exist")
    void shouldRejectUnknownKindColumns() {
      DataTable table = DataTable.of(List.of(DataColumn.undeclared("grp", List.of("y"))));

      assertThatThrownBy(() -> service.validateKinds(table, Map.of("other", ColumnKind.TEXT)))
          .isInstanceOf(WordlistConfigurationException.class)
          .hasMessageContaining("other");
      assertThatCode(() -> service.validateKinds(table, Map.of("grp", ColumnKind.TEXT)))
          .doesNotThrowAnyException();
      assertThatCode(() -> service.validateKinds(table, null)).doesNotThrowAnyException();
    }
  }

  @Nested
  @DisplayName("Single wordlist checks")
  class SingleWordlistChecks {

    @Test
    @DisplayName("Should reject a null bundle")
    void shouldRejectNullBundle() {
      assertThatThrownBy(
              () -> service.validateBundle(null, GroupReference.defaultReference(), ELIGIBLE))
          .hasMessage(WordlistValidationService.BAD_WORDLISTS);
    }

    @Test
    @DisplayName("Should reject a wordlist with a single column")
    void shouldRejectNarrowWordlist() {
      Wordlist narrow = Wordlist.of(List.of("options"), List.of(List.of("y")));

      assertThatThrownBy(
              () ->
                  service.validateBundle(
                      SingleTableBundle.of(narrow), GroupReference.none(), ELIGIBLE))
          .hasMessage(WordlistValidationService.BAD_ENTRY);
    }

    @Test
    @DisplayName("Should reject a group reference that does not resolve")
    void shouldRejectUnresolvedGroup() {
      Wordlist wordlist = grouped(new String[] {"y", "yes", "grp"});

      assertThatThrownBy(
              () ->
                  service.validateBundle(
                      SingleTableBundle.of(wordlist), GroupReference.byPosition(5), ELIGIBLE))
          .isInstanceOf(WordlistConfigurationException.class)
          .hasMessageStartingWith(WordlistValidationService.BAD_GROUP)
          .hasMessageContaining("got 5");
      assertThatThrownBy(
              () ->
                  service.validateBundle(
                      SingleTableBundle.of(wordlist), GroupReference.byName("var"), ELIGIBLE))
          .hasMessageContaining("'var'");
    }

    @Test
    @DisplayName("Should reject .default in rows grouped as .global")
    void shouldRejectDefaultInGlobalGroup() {
      Wordlist wordlist =
          grouped(
              new String[] {"y", "yes", ".global"},
              new String[] {".default", "other", ".global"});

      assertThatThrownBy(
              () ->
                  service.validateBundle(
                      SingleTableBundle.of(wordlist), GroupReference.defaultReference(), ELIGIBLE))
          .hasMessage(WordlistValidationService.DEFAULT_WITH_GLOBAL);
    }

    @Test
    @DisplayName("Should accept .default in a column-specific group")
    void shouldAcceptDefaultInSpecificGroup() {
      Wordlist wordlist =
          grouped(new String[] {"y", "yes", ".global"}, new String[] {".default", "other", "grp"});

      assertThatCode(
              () ->
                  service.validateBundle(
                      SingleTableBundle.of(wordlist), GroupReference.defaultReference(), ELIGIBLE))
          .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject .default anywhere when the wordlist is used globally")
    void shouldRejectDefaultWhenUsedGlobally() {
      Wordlist wordlist = grouped(new String[] {".default", "other", "grp"});

      assertThatThrownBy(
              () ->
                  service.validateBundle(
                      SingleTableBundle.of(wordlist), GroupReference.none(), ELIGIBLE))
          .hasMessage(WordlistValidationService.DEFAULT_WITH_GLOBAL);
    }
  }

  @Nested
  @DisplayName("Wordlist collection checks")
  class CollectionChecks {

    private final Wordlist pairs = Wordlist.ofPairs(Map.of("y", "yes"));

    @Test
    @DisplayName("Should reject an empty collection")
    void shouldRejectEmptyCollection() {
      assertThatThrownBy(
              () ->
                  service.validateBundle(
                      TableCollectionBundle.of(List.of()), GroupReference.none(), ELIGIBLE))
          .hasMessage(WordlistValidationService.BAD_WORDLISTS);
    }

    @Test
    @DisplayName("Should reject unnamed entries")
    void shouldRejectUnnamedEntries() {
      TableCollectionBundle bundle =
          TableCollectionBundle.of(List.of(NamedWordlist.of(" ", pairs)));

      assertThatThrownBy(() -> service.validateBundle(bundle, GroupReference.none(), ELIGIBLE))
          .hasMessage(WordlistValidationService.UNNAMED);
    }

    @Test
    @DisplayName("Should reject duplicate entry names")
    void shouldRejectDuplicateNames() {
      TableCollectionBundle bundle =
          TableCollectionBundle.builder().add("grp", pairs).add("grp", pairs).build();

      assertThatThrownBy(() -> service.validateBundle(bundle, GroupReference.none(), ELIGIBLE))
          .hasMessage("dictionary names must be unique: grp");
    }

    @Test
    @DisplayName("Should reject entries that name no eligible column")
    void shouldRejectUnmatchedNames() {
      TableCollectionBundle bundle = TableCollectionBundle.builder().add("age", pairs).build();

      assertThatThrownBy(() -> service.validateBundle(bundle, GroupReference.none(), ELIGIBLE))
          .hasMessage(WordlistValidationService.UNMATCHED + " (age)");
    }

    @Test
    @DisplayName("Should reject .default inside the .global entry")
    void shouldRejectDefaultInGlobalEntry() {
      TableCollectionBundle bundle =
          TableCollectionBundle.builder()
              .global(Wordlist.ofPairs(Map.of(".default", "other")))
              .build();

      assertThatThrownBy(() -> service.validateBundle(bundle, GroupReference.none(), ELIGIBLE))
          .hasMessage(WordlistValidationService.DEFAULT_WITH_GLOBAL);
    }

    @Test
    @DisplayName("Should accept named entries plus .global")
    void shouldAcceptValidCollection() {
      TableCollectionBundle bundle =
          TableCollectionBundle.builder()
              .add("grp", Wordlist.ofPairs(Map.of(".default", "other")))
              .global(pairs)
              .build();

      assertThatCode(() -> service.validateBundle(bundle, GroupReference.none(), ELIGIBLE))
          .doesNotThrowAnyException();
    }
  }
}
