package io.b2mash.clauseguard.solver;

import io.b2mash.clauseguard.constraint.ClauseConstraint;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs compiled constraints through a {@link ConstraintSolver} and, when they are unsatisfiable,
 * narrows the contradiction down to a minimal set of clauses.
 */
@Component
public class SatisfiabilityEngine {

  private static final Logger log = LoggerFactory.getLogger(SatisfiabilityEngine.class);

  private final ConstraintSolver solver;
  private final SolverProperties properties;

  public SatisfiabilityEngine(ConstraintSolver solver, SolverProperties properties) {
    this.solver = solver;
    this.properties = properties;
  }

  public SolverOutcome solve(List<ClauseConstraint> constraints) {
    var check = solver.check(constraints);
    log.debug("Solver verdict {} for {} constraint(s)", check.verdict(), constraints.size());

    return switch (check.verdict()) {
      case SATISFIABLE -> new SolverOutcome(check.verdict(), List.of(), namedAssignment(check));
      case UNKNOWN -> new SolverOutcome(check.verdict(), List.of(), Map.of());
      case UNSATISFIABLE ->
          new SolverOutcome(
              check.verdict(),
              properties.explainConflicts() ? minimalConflict(constraints) : List.of(),
              Map.of());
    };
  }

  /**
   * Deletion-based minimal unsatisfiable subset: drops each constraint in turn and keeps it out if
   * the rest stays unsatisfiable. Returns the source clause ids of the survivors, or an empty list
   * if any re-check is inconclusive.
   */
  List<String> minimalConflict(List<ClauseConstraint> constraints) {
    List<ClauseConstraint> core = new ArrayList<>(constraints);
    int index = 0;
    while (index < core.size()) {
      List<ClauseConstraint> candidate = new ArrayList<>(core);
      candidate.remove(index);
      var verdict = solver.check(candidate).verdict();
      if (verdict == SatVerdict.UNSATISFIABLE) {
        core = candidate;
      } else if (verdict == SatVerdict.SATISFIABLE) {
        index++;
      } else {
        log.warn("Conflict explanation abandoned: solver could not decide a subset");
        return List.of();
      }
    }
    return core.stream().map(ClauseConstraint::sourceClauseId).distinct().toList();
  }

  private static Map<String, Long> namedAssignment(SolverCheck check) {
    Map<String, Long> named = new LinkedHashMap<>();
    check.assignment().entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(e -> named.put(e.getKey().variableName(), e.getValue()));
    return named;
  }
}
