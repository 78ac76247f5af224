package io.b2mash.clauseguard.solver;

/** Outcome of checking whether a constraint set admits any assignment. */
public enum SatVerdict {
  SATISFIABLE,
  UNSATISFIABLE,
  /** The solver timed out or could not decide. Treated as consistent. */
  UNKNOWN
}
