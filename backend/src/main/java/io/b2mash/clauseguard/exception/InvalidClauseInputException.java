package io.b2mash.clauseguard.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when submitted clauses fail hard validation (missing ids, missing category or value on
 * the formal path, negative values). Results in HTTP 400 Bad Request. Clauses
 * whose qualifier is merely unrecognized are not rejected; they are skipped with a warning.
 */
public class InvalidClauseInputException extends ErrorResponseException {

  private final List<String> violations;

  public InvalidClauseInputException(List<String> violations) {
    super(HttpStatus.BAD_REQUEST, createProblem(violations), null);
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }

  private static ProblemDetail createProblem(List<String> violations) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid clause input");
    problem.setDetail(violations.size() + " clause validation error(s)");
    problem.setProperty("violations", List.copyOf(violations));
    return problem;
  }
}
