package io.b2mash.clauseguard.verification.dto;

import io.b2mash.clauseguard.clause.ClauseInput;
import io.b2mash.clauseguard.verification.VerificationMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Request body for a verification call.
 *
 * @param mode paths to run; inferred from the clauses when omitted
 * @param clauses clauses in contract order
 */
public record VerifyClausesRequest(
    VerificationMode mode,
    @NotNull(message = "clauses is required")
        @Size(max = 200, message = "at most 200 clauses can be verified at once")
        List<@Valid @NotNull ClauseRequest> clauses) {

  public List<ClauseInput> toClauseInputs() {
    return clauses.stream().map(ClauseRequest::toClauseInput).toList();
  }
}
