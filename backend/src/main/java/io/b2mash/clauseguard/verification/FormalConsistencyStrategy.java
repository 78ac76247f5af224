package io.b2mash.clauseguard.verification;

import io.b2mash.clauseguard.clause.ClauseInput;
import io.b2mash.clauseguard.constraint.ConstraintCompiler;
import io.b2mash.clauseguard.constraint.SkippedClause;
import io.b2mash.clauseguard.solver.SatVerdict;
import io.b2mash.clauseguard.solver.SatisfiabilityEngine;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Compiles categorized clauses into constraints and asks the solver whether they can all hold. */
@Component
public class FormalConsistencyStrategy implements ConsistencyStrategy {

  static final String UNKNOWN_WARNING =
      "Solver could not determine satisfiability within its limits; treated as consistent";

  private final ConstraintCompiler compiler;
  private final SatisfiabilityEngine engine;

  public FormalConsistencyStrategy(ConstraintCompiler compiler, SatisfiabilityEngine engine) {
    this.compiler = compiler;
    this.engine = engine;
  }

  @Override
  public VerificationMode mode() {
    return VerificationMode.FORMAL;
  }

  @Override
  public StrategyOutcome evaluate(List<ClauseInput> clauses) {
    var compilation = compiler.compile(clauses);
    var outcome = engine.solve(compilation.constraints());

    List<String> warnings = new ArrayList<>();
    compilation.skipped().stream().map(SkippedClause::reason).forEach(warnings::add);
    if (outcome.verdict() == SatVerdict.UNKNOWN) {
      warnings.add(UNKNOWN_WARNING);
    }
    return StrategyOutcome.formal(outcome, warnings);
  }
}
