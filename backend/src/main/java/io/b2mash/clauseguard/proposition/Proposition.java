package io.b2mash.clauseguard.proposition;

import java.util.Collections;
import java.util.EnumSet;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Salient logical attributes extracted from one clause. Attributes that no pattern matched are
 * empty or false; absence is never an error.
 *
 * @param normalizedText the lower-cased clause text the attributes were extracted from
 * @param canTerminate whether the clause talks about terminating the agreement
 * @param noticeDays the notice period in days, if one was found next to "notice"
 * @param minTermDays the minimum term in days, if one was found next to "before"
 * @param exclusive whether the clause grants or mentions exclusivity
 * @param prohibition whether the clause contains a prohibition marker
 * @param permission whether the clause contains a permission marker
 * @param parties party roles mentioned in the clause
 */
public record Proposition(
    String normalizedText,
    boolean canTerminate,
    OptionalInt noticeDays,
    OptionalInt minTermDays,
    boolean exclusive,
    boolean prohibition,
    boolean permission,
    Set<PartyRole> parties) {

  public Proposition {
    parties =
        parties.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(parties));
  }

  /** Whether the word "terminate" literally occurs in the clause. */
  public boolean mentionsTerminate() {
    return normalizedText.contains("terminate");
  }

  /** Whether this clause and {@code other} mention at least one common party role. */
  public boolean sharesPartyWith(Proposition other) {
    return parties.stream().anyMatch(other.parties()::contains);
  }
}
