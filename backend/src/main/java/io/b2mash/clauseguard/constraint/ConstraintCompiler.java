package io.b2mash.clauseguard.constraint;

import io.b2mash.clauseguard.clause.ClauseInput;
import io.b2mash.clauseguard.clause.ClauseInputValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps categorized, pre-normalized clauses onto the shared constraint variables. Input is
 * validated first; a clause with a known category but no recognized qualifier is skipped and
 * reported, never rejected.
 */
@Component
public class ConstraintCompiler {

  private static final Logger log = LoggerFactory.getLogger(ConstraintCompiler.class);

  private final ClauseInputValidator validator;

  public ConstraintCompiler(ClauseInputValidator validator) {
    this.validator = validator;
  }

  /**
   * Compiles clauses into constraints. Each DURATION or LIABILITY clause contributes at most one
   * constraint; OTHER clauses contribute nothing.
   *
   * @param clauses clauses in submitted order
   * @return compiled constraints and soft-skipped clauses
   * @throws io.b2mash.clauseguard.exception.InvalidClauseInputException on hard validation failure
   */
  public CompilationResult compile(List<ClauseInput> clauses) {
    validator.validateForCompilation(clauses);

    List<ClauseConstraint> constraints = new ArrayList<>();
    List<SkippedClause> skipped = new ArrayList<>();

    for (int i = 0; i < clauses.size(); i++) {
      var clause = clauses.get(i);
      var variable = ConstraintVariable.forCategory(clause.category());
      if (variable.isEmpty()) {
        continue;
      }
      var qualifier =
          Qualifier.classify(clause.category(), clause.text().toLowerCase(Locale.ROOT));
      if (qualifier.isEmpty()) {
        log.warn(
            "Skipping clause without recognized qualifier: id={}, category={}",
            clause.id(),
            clause.category());
        skipped.add(
            new SkippedClause(
                i,
                clause.id(),
                "No "
                    + clause.category()
                    + " qualifier recognized in clause '"
                    + clause.id()
                    + "'; it was not checked"));
        continue;
      }
      var constraint =
          new ClauseConstraint(
              variable.get(),
              qualifier.get().relation(),
              clause.value(),
              qualifier.get(),
              clause.id());
      log.debug("Compiled clause {} to {}", clause.id(), constraint.describe());
      constraints.add(constraint);
    }
    return new CompilationResult(constraints, skipped);
  }
}
