package io.b2mash.clauseguard.conflict;

import io.b2mash.clauseguard.proposition.Proposition;
import java.util.Optional;

/** Fires when both clauses grant exclusivity to an overlapping set of party roles. */
public class ExclusivityCollisionRule implements ConflictRule {

  static final String REASON = "Multiple exclusive rights granted to same party";

  @Override
  public String name() {
    return "exclusivity-collision";
  }

  @Override
  public Optional<String> evaluate(Proposition first, Proposition second) {
    if (first.exclusive() && second.exclusive() && first.sharesPartyWith(second)) {
      return Optional.of(REASON);
    }
    return Optional.empty();
  }
}
