package io.b2mash.clauseguard.constraint;

import io.b2mash.clauseguard.clause.ClauseCategory;
import java.util.List;
import java.util.Optional;

/**
 * Qualifiers recognized in categorized clause text. Declaration order is matching precedence
 * within a category: the first qualifier whose keyword occurs in the text is chosen.
 */
public enum Qualifier {
  EXACT(ClauseCategory.DURATION, Relation.EQ, "exactly"),
  MINIMUM(ClauseCategory.DURATION, Relation.GTE, "minimum", "at least"),
  MAXIMUM(ClauseCategory.DURATION, Relation.LTE, "maximum", "up to"),
  /** An upper bound on allowed liability. */
  CAP(ClauseCategory.LIABILITY, Relation.LTE, "capped", "max"),
  /** A penalty obligation forces liability to be at least the penalty amount. */
  PENALTY(ClauseCategory.LIABILITY, Relation.GTE, "penalty", "fixed");

  private final ClauseCategory category;
  private final Relation relation;
  private final List<String> keywords;

  Qualifier(ClauseCategory category, Relation relation, String... keywords) {
    this.category = category;
    this.relation = relation;
    this.keywords = List.of(keywords);
  }

  public ClauseCategory category() {
    return category;
  }

  public Relation relation() {
    return relation;
  }

  public List<String> keywords() {
    return keywords;
  }

  /**
   * Classifies lower-cased clause text of the given category.
   *
   * @return the qualifier, or empty if no keyword of that category occurs in the text
   */
  public static Optional<Qualifier> classify(ClauseCategory category, String normalizedText) {
    for (Qualifier qualifier : values()) {
      if (qualifier.category == category
          && qualifier.keywords.stream().anyMatch(normalizedText::contains)) {
        return Optional.of(qualifier);
      }
    }
    return Optional.empty();
  }
}
