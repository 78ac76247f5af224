package io.b2mash.clauseguard.verification;

import io.b2mash.clauseguard.conflict.ConflictRecord;
import io.b2mash.clauseguard.solver.SolverOutcome;
import java.util.List;

/**
 * What one strategy found.
 *
 * @param strategy HEURISTIC or FORMAL
 * @param conflicts pairwise conflicts (heuristic path only)
 * @param solverOutcome solver verdict, or null if the strategy does not use the solver
 * @param warnings caller-visible notes that do not affect consistency
 */
public record StrategyOutcome(
    VerificationMode strategy,
    List<ConflictRecord> conflicts,
    SolverOutcome solverOutcome,
    List<String> warnings) {

  public StrategyOutcome {
    conflicts = List.copyOf(conflicts);
    warnings = List.copyOf(warnings);
  }

  public static StrategyOutcome heuristic(List<ConflictRecord> conflicts) {
    return new StrategyOutcome(VerificationMode.HEURISTIC, conflicts, null, List.of());
  }

  public static StrategyOutcome formal(SolverOutcome solverOutcome, List<String> warnings) {
    return new StrategyOutcome(VerificationMode.FORMAL, List.of(), solverOutcome, warnings);
  }
}
