package io.b2mash.clauseguard.solver;

import io.b2mash.clauseguard.constraint.ConstraintVariable;
import java.util.Map;

/**
 * Result of one solver invocation.
 *
 * @param verdict the three-valued outcome
 * @param assignment one witness value per variable when satisfiable, otherwise empty
 */
public record SolverCheck(SatVerdict verdict, Map<ConstraintVariable, Long> assignment) {

  public SolverCheck {
    assignment = Map.copyOf(assignment);
  }

  public static SolverCheck unsatisfiable() {
    return new SolverCheck(SatVerdict.UNSATISFIABLE, Map.of());
  }

  public static SolverCheck unknown() {
    return new SolverCheck(SatVerdict.UNKNOWN, Map.of());
  }
}
