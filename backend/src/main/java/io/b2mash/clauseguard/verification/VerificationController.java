package io.b2mash.clauseguard.verification;

import io.b2mash.clauseguard.clause.ClauseInput;
import io.b2mash.clauseguard.verification.dto.ConsistencyReportResponse;
import io.b2mash.clauseguard.verification.dto.VerifyClausesRequest;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for clause-consistency verification. */
@RestController
@RequestMapping("/api/verifications")
public class VerificationController {

  private final ClauseConsistencyService consistencyService;
  private final VerificationCache verificationCache;

  public VerificationController(
      ClauseConsistencyService consistencyService, VerificationCache verificationCache) {
    this.consistencyService = consistencyService;
    this.verificationCache = verificationCache;
  }

  @PostMapping
  public ResponseEntity<ConsistencyReportResponse> verify(
      @Valid @RequestBody VerifyClausesRequest request) {
    var clauses = request.toClauseInputs();
    var report =
        verificationCache.get(
            request.mode(), clauses, () -> consistencyService.verify(request.mode(), clauses));
    return ResponseEntity.ok(ConsistencyReportResponse.from(report));
  }

  /** Free-text shortcut: a bare array of clause texts, checked heuristically. */
  @PostMapping("/heuristic")
  public ResponseEntity<ConsistencyReportResponse> verifyTexts(@RequestBody List<String> texts) {
    List<ClauseInput> clauses = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      clauses.add(ClauseInput.freeText("clause-" + (i + 1), texts.get(i)));
    }
    var report =
        verificationCache.get(
            VerificationMode.HEURISTIC,
            clauses,
            () -> consistencyService.verify(VerificationMode.HEURISTIC, clauses));
    return ResponseEntity.ok(ConsistencyReportResponse.from(report));
  }
}
