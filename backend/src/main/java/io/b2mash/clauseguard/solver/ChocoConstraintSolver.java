package io.b2mash.clauseguard.solver;

import io.b2mash.clauseguard.constraint.ClauseConstraint;
import io.b2mash.clauseguard.constraint.ConstraintVariable;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.LongStream;
import org.chocosolver.solver.Model;
import org.chocosolver.solver.Solver;
import org.chocosolver.solver.constraints.Constraint;
import org.chocosolver.solver.variables.IntVar;
import org.chocosolver.util.ESat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** {@link ConstraintSolver} backed by Choco. Each check builds and discards its own model. */
@Component
public class ChocoConstraintSolver implements ConstraintSolver {

  private static final Logger log = LoggerFactory.getLogger(ChocoConstraintSolver.class);

  private final SolverProperties properties;

  public ChocoConstraintSolver(SolverProperties properties) {
    this.properties = properties;
  }

  @Override
  public SolverCheck check(List<ClauseConstraint> constraints) {
    try {
      return solve(constraints);
    } catch (RuntimeException e) {
      log.warn(
          "Solver failed, reporting UNKNOWN: constraints={}, error={}",
          constraints.size(),
          e.toString());
      return SolverCheck.unknown();
    }
  }

  private SolverCheck solve(List<ClauseConstraint> constraints) {
    Model model = new Model("clause-consistency");
    Map<ConstraintVariable, LiteralScale> scales = new EnumMap<>(ConstraintVariable.class);
    Map<ConstraintVariable, IntVar> variables = new EnumMap<>(ConstraintVariable.class);
    for (ConstraintVariable variable : ConstraintVariable.values()) {
      var scale = LiteralScale.of(variable, constraints);
      scales.put(variable, scale);
      variables.put(variable, model.intVar(variable.variableName(), 0, scale.maxRank(), true));
    }

    for (ClauseConstraint clauseConstraint : constraints) {
      var variable = clauseConstraint.variable();
      Constraint posted =
          model.arithm(
              variables.get(variable),
              clauseConstraint.relation().operator(),
              scales.get(variable).rank(clauseConstraint.literal()));
      posted.setName(clauseConstraint.sourceClauseId() + ": " + clauseConstraint.describe());
      posted.post();
    }

    Solver solver = model.getSolver();
    solver.limitTime(properties.timeout().toMillis());

    if (solver.solve()) {
      Map<ConstraintVariable, Long> assignment = new EnumMap<>(ConstraintVariable.class);
      variables.forEach(
          (variable, intVar) ->
              assignment.put(variable, scales.get(variable).valueAt(intVar.getValue())));
      return new SolverCheck(SatVerdict.SATISFIABLE, assignment);
    }
    if (solver.isStopCriterionMet() || solver.isFeasible() != ESat.FALSE) {
      log.warn(
          "Solver stopped without a verdict: constraints={}, timeout={}",
          constraints.size(),
          properties.timeout());
      return SolverCheck.unknown();
    }
    return SolverCheck.unsatisfiable();
  }

  /**
   * Sorted distinct literals one variable is compared against, plus its lower bound 0. The solver
   * works on positions in this table instead of raw amounts: EQ, GTE and LTE constraints over the
   * literals hold together exactly when they hold over their positions, so literals of any size fit
   * a small integer domain.
   */
  static final class LiteralScale {

    private final long[] values;

    private LiteralScale(long[] values) {
      this.values = values;
    }

    static LiteralScale of(ConstraintVariable variable, List<ClauseConstraint> constraints) {
      LongStream literals =
          constraints.stream()
              .filter(constraint -> constraint.variable() == variable)
              .mapToLong(ClauseConstraint::literal);
      return new LiteralScale(
          LongStream.concat(LongStream.of(0L), literals).sorted().distinct().toArray());
    }

    int maxRank() {
      return values.length - 1;
    }

    int rank(long literal) {
      int rank = Arrays.binarySearch(values, literal);
      if (rank < 0) {
        throw new IllegalArgumentException("Literal " + literal + " is not on this scale");
      }
      return rank;
    }

    long valueAt(int rank) {
      return values[rank];
    }
  }
}
