package io.b2mash.clauseguard.clause;

import io.b2mash.clauseguard.exception.InvalidClauseInputException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Hard validation of submitted clauses. Every violation found in a call is collected and reported
 * together, so a caller can fix a payload in one round trip.
 */
@Component
public class ClauseInputValidator {

  /**
   * Checks the shape every verification path relies on: a non-null list, non-blank unique ids and
   * non-null text.
   *
   * @throws InvalidClauseInputException if any clause is malformed
   */
  public void validateCommon(List<ClauseInput> clauses) {
    var violations = commonViolations(clauses);
    if (!violations.isEmpty()) {
      throw new InvalidClauseInputException(violations);
    }
  }

  /**
   * Checks the stricter shape required before constraint compilation: on top of the common checks,
   * every clause declares a category and every DURATION / LIABILITY clause carries a non-negative
   * value.
   *
   * @throws InvalidClauseInputException if any clause is malformed
   */
  public void validateForCompilation(List<ClauseInput> clauses) {
    var violations = commonViolations(clauses);
    if (clauses != null) {
      for (int i = 0; i < clauses.size(); i++) {
        var clause = clauses.get(i);
        if (clause == null) {
          continue;
        }
        String label = label(clause, i);
        if (clause.category() == null) {
          violations.add(label + ": category is required for constraint verification");
          continue;
        }
        if (!clause.isConstrainable()) {
          continue;
        }
        if (clause.value() == null) {
          violations.add(label + ": value is required for " + clause.category() + " clauses");
        } else if (clause.value() < 0) {
          violations.add(label + ": value must not be negative (was " + clause.value() + ")");
        }
      }
    }
    if (!violations.isEmpty()) {
      throw new InvalidClauseInputException(violations);
    }
  }

  private List<String> commonViolations(List<ClauseInput> clauses) {
    List<String> violations = new ArrayList<>();
    if (clauses == null) {
      violations.add("clauses are required");
      return violations;
    }
    Set<String> seenIds = new HashSet<>();
    for (int i = 0; i < clauses.size(); i++) {
      var clause = clauses.get(i);
      if (clause == null) {
        violations.add("Clause " + (i + 1) + ": must not be null");
        continue;
      }
      String label = label(clause, i);
      if (clause.id() == null || clause.id().isBlank()) {
        violations.add(label + ": id is required");
      } else if (!seenIds.add(clause.id())) {
        violations.add(label + ": duplicate id '" + clause.id() + "'");
      }
      if (clause.text() == null) {
        violations.add(label + ": text is required");
      }
    }
    return violations;
  }

  private static String label(ClauseInput clause, int index) {
    if (clause.id() == null || clause.id().isBlank()) {
      return "Clause " + (index + 1);
    }
    return "Clause " + (index + 1) + " (" + clause.id() + ")";
  }
}
