package io.b2mash.clauseguard.verification;

import io.b2mash.clauseguard.clause.ClauseInput;
import java.util.List;
import java.util.Objects;

/** Which contradiction-checking paths a verification call runs. */
public enum VerificationMode {
  /** Keyword heuristics over free clause text. */
  HEURISTIC,

  /** Constraint compilation over categorized clauses, checked by the solver. */
  FORMAL,

  /** Both paths; the report reflects their union. */
  BOTH;

  /** Whether running in this mode includes the given single-path strategy. */
  public boolean includes(VerificationMode strategy) {
    return this == BOTH || this == strategy;
  }

  /**
   * Infers the mode from the input shape: any categorized clause selects the formal path,
   * otherwise the clauses are treated as free text.
   */
  public static VerificationMode infer(List<ClauseInput> clauses) {
    boolean categorized =
        clauses != null
            && clauses.stream().filter(Objects::nonNull).anyMatch(c -> c.category() != null);
    return categorized ? FORMAL : HEURISTIC;
  }
}
