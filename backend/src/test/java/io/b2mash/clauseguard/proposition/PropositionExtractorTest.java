package io.b2mash.clauseguard.proposition;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PropositionExtractorTest {

  private final PropositionExtractor extractor = new PropositionExtractor();

  @Test
  void extract_terminationWithNotice_readsNoticeDays() {
    var proposition = extractor.extract("Seller may terminate with 30 days notice");

    assertThat(proposition.canTerminate()).isTrue();
    assertThat(proposition.noticeDays()).hasValue(30);
    assertThat(proposition.minTermDays()).isEmpty();
    assertThat(proposition.permission()).isTrue();
    assertThat(proposition.prohibition()).isFalse();
    assertThat(proposition.parties()).containsExactly(PartyRole.SELLER);
  }

  @Test
  void extract_minimumTerm_readsNumberAfterAnchor() {
    var proposition = extractor.extract("Neither party may terminate before 90 days");

    assertThat(proposition.minTermDays()).hasValue(90);
    assertThat(proposition.noticeDays()).isEmpty();
    assertThat(proposition.canTerminate()).isTrue();
  }

  @Test
  void extract_ambiguousMarkers_setsBothPermissionAndProhibition() {
    var proposition = extractor.extract("Neither party may terminate before 90 days");

    assertThat(proposition.prohibition()).isTrue();
    assertThat(proposition.permission()).isTrue();
  }

  @Test
  void extract_businessDays_areCounted() {
    var proposition = extractor.extract("Either Party may cancel on 45 business days notice");

    assertThat(proposition.noticeDays()).hasValue(45);
    assertThat(proposition.canTerminate()).isTrue();
  }

  @Test
  void extract_anchorBeforeNumber_readsNoticeDays() {
    var proposition = extractor.extract("Termination requires notice 60 calendar days in advance");

    assertThat(proposition.noticeDays()).hasValue(60);
  }

  @Test
  void extract_noAnchorWord_leavesDayCountsEmpty() {
    var proposition = extractor.extract("Seller shall deliver goods within 30 days");

    assertThat(proposition.noticeDays()).isEmpty();
    assertThat(proposition.minTermDays()).isEmpty();
    assertThat(proposition.canTerminate()).isFalse();
  }

  @Test
  void extract_dayCountTooLarge_isTreatedAsAbsent() {
    var proposition = extractor.extract("Seller may terminate with 99999999999 days notice");

    assertThat(proposition.noticeDays()).isEmpty();
    assertThat(proposition.canTerminate()).isTrue();
  }

  @Test
  void extract_exclusivityMarkers_areDetected() {
    assertThat(extractor.extract("Vendor is the exclusive supplier").exclusive()).isTrue();
    assertThat(extractor.extract("Buyer purchases only from Vendor").exclusive()).isTrue();
    assertThat(extractor.extract("Buyer purchases from Vendor").exclusive()).isFalse();
  }

  @Test
  void extract_partyVocabulary_includesPlural() {
    var proposition =
        extractor.extract("The Parties agree that the Licensee pays the Licensor monthly");

    assertThat(proposition.parties())
        .containsExactlyInAnyOrder(PartyRole.PARTY, PartyRole.LICENSEE, PartyRole.LICENSOR);
  }

  @Test
  void extract_cannot_isProhibitionNotPermission() {
    var proposition = extractor.extract("Buyer cannot terminate this agreement");

    assertThat(proposition.prohibition()).isTrue();
    assertThat(proposition.permission()).isFalse();
  }

  @Test
  void extract_nullOrBlankText_yieldsEmptyProposition() {
    for (String text : new String[] {null, "", "   "}) {
      var proposition = extractor.extract(text);

      assertThat(proposition.canTerminate()).isFalse();
      assertThat(proposition.noticeDays()).isEmpty();
      assertThat(proposition.minTermDays()).isEmpty();
      assertThat(proposition.exclusive()).isFalse();
      assertThat(proposition.prohibition()).isFalse();
      assertThat(proposition.permission()).isFalse();
      assertThat(proposition.parties()).isEmpty();
    }
  }

  @Test
  void extract_isCaseInsensitive() {
    var upper = extractor.extract("SELLER MAY TERMINATE WITH 30 DAYS NOTICE");
    var lower = extractor.extract("seller may terminate with 30 days notice");

    assertThat(upper).isEqualTo(lower);
  }
}
