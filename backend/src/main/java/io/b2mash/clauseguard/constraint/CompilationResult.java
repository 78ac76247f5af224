package io.b2mash.clauseguard.constraint;

import java.util.List;

/**
 * Output of constraint compilation.
 *
 * @param constraints compiled constraints in clause order
 * @param skipped clauses that were soft-skipped for lack of a recognized qualifier
 */
public record CompilationResult(List<ClauseConstraint> constraints, List<SkippedClause> skipped) {

  public CompilationResult {
    constraints = List.copyOf(constraints);
    skipped = List.copyOf(skipped);
  }
}
