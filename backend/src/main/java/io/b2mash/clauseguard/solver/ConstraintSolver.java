package io.b2mash.clauseguard.solver;

import io.b2mash.clauseguard.constraint.ClauseConstraint;
import java.util.List;

/**
 * Port for a bounded-integer constraint solver. Implementations must build a fresh solving
 * context on every call and must not throw: timeouts and internal failures are reported as {@link
 * SatVerdict#UNKNOWN}.
 */
public interface ConstraintSolver {

  /**
   * Checks the constraints together with the non-negativity bounds of every {@link
   * io.b2mash.clauseguard.constraint.ConstraintVariable}.
   */
  SolverCheck check(List<ClauseConstraint> constraints);
}
