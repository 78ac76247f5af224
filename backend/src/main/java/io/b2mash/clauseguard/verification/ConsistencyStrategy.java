package io.b2mash.clauseguard.verification;

import io.b2mash.clauseguard.clause.ClauseInput;
import java.util.List;

/** One way of looking for contradictions among a call's clauses. */
public interface ConsistencyStrategy {

  /** HEURISTIC or FORMAL. */
  VerificationMode mode();

  /** Evaluates clauses that already passed common validation. */
  StrategyOutcome evaluate(List<ClauseInput> clauses);
}
