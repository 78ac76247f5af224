package io.b2mash.clauseguard.conflict;

import io.b2mash.clauseguard.proposition.Proposition;
import java.util.Optional;

/**
 * A pairwise check between two clause propositions. Rules are symmetric: swapping the arguments
 * must not change whether the rule fires or the reason it gives.
 */
public interface ConflictRule {

  /** Short machine-readable rule name (e.g., "notice-vs-minimum-term"). */
  String name();

  /** Returns the conflict reason if the two propositions conflict under this rule. */
  Optional<String> evaluate(Proposition first, Proposition second);
}
