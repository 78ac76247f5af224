package io.b2mash.clauseguard.solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verdict of the satisfiability engine for one verification call.
 *
 * @param verdict the three-valued outcome
 * @param unsatCoreClauseIds ids of a minimal set of clauses that cannot hold together; empty unless
 *     the verdict is UNSATISFIABLE and the core could be computed
 * @param assignment witness value per variable name when satisfiable
 */
public record SolverOutcome(
    SatVerdict verdict, List<String> unsatCoreClauseIds, Map<String, Long> assignment) {

  public SolverOutcome {
    unsatCoreClauseIds = List.copyOf(unsatCoreClauseIds);
    assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
  }
}
