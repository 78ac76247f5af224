package io.b2mash.clauseguard.verification;

import io.b2mash.clauseguard.clause.ClauseInput;
import io.b2mash.clauseguard.solver.SatVerdict;
import io.b2mash.clauseguard.solver.SolverOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Merges strategy outcomes into one {@link ConsistencyReport}. A call is consistent when no
 * heuristic conflict was found and the solver did not prove unsatisfiability; an UNKNOWN verdict
 * counts as consistent.
 */
@Component
public class ResultAggregator {

  static final String SINGLE_CLAUSE = "VERIFIED: Fewer than two clauses; no conflicts possible.";
  static final String HEURISTIC_VERIFIED = "VERIFIED: All clauses are logically consistent.";
  static final String FORMAL_VERIFIED = "VERIFIED: Contract logic is consistent.";
  static final String FORMAL_CONTRADICTION =
      "LOGIC CONTRADICTION: Clauses are mutually exclusive.";
  static final String FORMAL_UNKNOWN =
      "WARNING: Solver could not determine satisfiability; treated as consistent.";

  public ConsistencyReport aggregate(List<ClauseInput> clauses, List<StrategyOutcome> outcomes) {
    List<ReportedConflict> conflicts = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    List<String> lines = new ArrayList<>();
    List<VerificationMode> strategies = new ArrayList<>();
    SolverOutcome solverOutcome = null;

    for (StrategyOutcome outcome : outcomes) {
      strategies.add(outcome.strategy());
      warnings.addAll(outcome.warnings());
      if (outcome.strategy() == VerificationMode.HEURISTIC) {
        var reported =
            outcome.conflicts().stream()
                .map(
                    c ->
                        new ReportedConflict(
                            c.clauseIndexA(),
                            c.clauseIndexB(),
                            clauses.get(c.clauseIndexA()).id(),
                            clauses.get(c.clauseIndexB()).id(),
                            c.rule(),
                            c.reason()))
                .toList();
        conflicts.addAll(reported);
        lines.add(heuristicSummary(clauses.size(), reported));
      }
      if (outcome.solverOutcome() != null) {
        solverOutcome = outcome.solverOutcome();
        lines.add(formalSummary(solverOutcome));
      }
    }

    SatVerdict verdict = solverOutcome == null ? null : solverOutcome.verdict();
    boolean consistent = conflicts.isEmpty() && verdict != SatVerdict.UNSATISFIABLE;

    return new ConsistencyReport(
        consistent,
        List.copyOf(conflicts),
        String.join("\n", lines),
        verdict,
        solverOutcome == null ? List.of() : solverOutcome.unsatCoreClauseIds(),
        List.copyOf(warnings),
        solverOutcome == null ? Map.of() : solverOutcome.assignment(),
        List.copyOf(strategies));
  }

  private static String heuristicSummary(int clauseCount, List<ReportedConflict> conflicts) {
    if (clauseCount < 2) {
      return SINGLE_CLAUSE;
    }
    if (conflicts.isEmpty()) {
      return HEURISTIC_VERIFIED;
    }
    var summary = new StringBuilder();
    summary
        .append("WARNING: ")
        .append(conflicts.size())
        .append(" potential conflict(s) detected:");
    for (ReportedConflict conflict : conflicts) {
      summary
          .append("\n  - Clause ")
          .append(conflict.clauseIndexA() + 1)
          .append(" vs Clause ")
          .append(conflict.clauseIndexB() + 1)
          .append(": ")
          .append(conflict.reason());
    }
    return summary.toString();
  }

  private static String formalSummary(SolverOutcome outcome) {
    return switch (outcome.verdict()) {
      case SATISFIABLE -> FORMAL_VERIFIED;
      case UNKNOWN -> FORMAL_UNKNOWN;
      case UNSATISFIABLE ->
          outcome.unsatCoreClauseIds().isEmpty()
              ? FORMAL_CONTRADICTION
              : FORMAL_CONTRADICTION
                  + " Conflicting clauses: "
                  + String.join(", ", outcome.unsatCoreClauseIds());
    };
  }
}
