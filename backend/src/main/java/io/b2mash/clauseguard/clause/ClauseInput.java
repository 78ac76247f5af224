package io.b2mash.clauseguard.clause;

/**
 * A single contract clause as submitted for verification. The position of a clause within the
 * submitted list is significant: conflicts are reported by index.
 *
 * @param id caller-assigned identifier, unique within one verification call
 * @param text raw clause text
 * @param category clause category, or null for free-text (heuristic-only) use
 * @param value caller-normalized magnitude (months or dollars), required only for DURATION and
 *     LIABILITY clauses on the formal path
 */
public record ClauseInput(String id, String text, ClauseCategory category, Long value) {

  /** Creates an uncategorized clause for free-text verification. */
  public static ClauseInput freeText(String id, String text) {
    return new ClauseInput(id, text, null, null);
  }

  /** Whether the formal path turns this clause into a constraint. */
  public boolean isConstrainable() {
    return category == ClauseCategory.DURATION || category == ClauseCategory.LIABILITY;
  }
}
