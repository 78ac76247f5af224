package io.b2mash.clauseguard.verification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import io.b2mash.clauseguard.clause.ClauseCategory;
import io.b2mash.clauseguard.clause.ClauseInput;
import io.b2mash.clauseguard.clause.ClauseInputValidator;
import io.b2mash.clauseguard.conflict.HeuristicConflictDetector;
import io.b2mash.clauseguard.constraint.ConstraintCompiler;
import io.b2mash.clauseguard.exception.InvalidClauseInputException;
import io.b2mash.clauseguard.proposition.PropositionExtractor;
import io.b2mash.clauseguard.solver.ChocoConstraintSolver;
import io.b2mash.clauseguard.solver.ConstraintSolver;
import io.b2mash.clauseguard.solver.SatVerdict;
import io.b2mash.clauseguard.solver.SatisfiabilityEngine;
import io.b2mash.clauseguard.solver.SolverCheck;
import io.b2mash.clauseguard.solver.SolverProperties;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ClauseConsistencyServiceTest {

  @Mock private ConstraintSolver undecidedSolver;

  private final ClauseConsistencyService service =
      serviceWith(new ChocoConstraintSolver(SolverProperties.defaults()));

  private static ClauseConsistencyService serviceWith(ConstraintSolver solver) {
    var validator = new ClauseInputValidator();
    var properties = SolverProperties.defaults();
    var heuristic =
        new HeuristicConsistencyStrategy(
            new PropositionExtractor(), new HeuristicConflictDetector());
    var formal =
        new FormalConsistencyStrategy(
            new ConstraintCompiler(validator),
            new SatisfiabilityEngine(solver, properties));
    // registration order must not matter
    return new ClauseConsistencyService(
        validator, List.of(formal, heuristic), new ResultAggregator());
  }

  private static ClauseInput duration(String id, String text, long months) {
    return new ClauseInput(id, text, ClauseCategory.DURATION, months);
  }

  private static ClauseInput liability(String id, String text, long usd) {
    return new ClauseInput(id, text, ClauseCategory.LIABILITY, usd);
  }

  @Test
  void verify_noClauses_isVacuouslyConsistent() {
    var report = service.verify(List.of());

    assertThat(report.consistent()).isTrue();
    assertThat(report.conflicts()).isEmpty();
    assertThat(report.message()).isEqualTo(ResultAggregator.SINGLE_CLAUSE);
    assertThat(report.strategies()).containsExactly(VerificationMode.HEURISTIC);
  }

  @Test
  void verify_singleClause_isConsistent() {
    var report =
        service.verify(
            List.of(ClauseInput.freeText("c1", "Seller may terminate with 5 days notice")));

    assertThat(report.consistent()).isTrue();
    assertThat(report.message()).isEqualTo(ResultAggregator.SINGLE_CLAUSE);
  }

  @Test
  void verify_noticeShorterThanMinimumTerm_reportsConflictWithIds() {
    var report =
        service.verify(
            List.of(
                ClauseInput.freeText("termination", "Seller may terminate with 10 days notice"),
                ClauseInput.freeText("payment", "Payment is due monthly"),
                ClauseInput.freeText("lock-in", "Neither party may terminate before 90 days")));

    assertThat(report.consistent()).isFalse();
    assertThat(report.verdict()).isNull();
    assertThat(report.conflicts())
        .singleElement()
        .satisfies(
            conflict -> {
              assertThat(conflict.clauseIndexA()).isZero();
              assertThat(conflict.clauseIndexB()).isEqualTo(2);
              assertThat(conflict.clauseIdA()).isEqualTo("termination");
              assertThat(conflict.clauseIdB()).isEqualTo("lock-in");
              assertThat(conflict.rule()).isEqualTo("notice-vs-minimum-term");
            });
    assertThat(report.message())
        .isEqualTo(
            "WARNING: 1 potential conflict(s) detected:\n"
                + "  - Clause 1 vs Clause 3: Termination notice (10 days) conflicts with minimum"
                + " term (90 days)");
  }

  @Test
  void verify_sameInputTwice_producesEqualReports() {
    var clauses =
        List.of(
            ClauseInput.freeText("a", "Buyer may terminate at any time"),
            ClauseInput.freeText("b", "Buyer may not terminate this agreement"));

    assertThat(service.verify(clauses)).isEqualTo(service.verify(clauses));
  }

  @Test
  void verify_exactTermBelowMinimum_isUnsatisfiableWithCore() {
    var report =
        service.verify(
            List.of(
                duration("d1", "The term is exactly 12 months", 12),
                duration("d2", "The term shall be at least 24 months", 24)));

    assertThat(report.consistent()).isFalse();
    assertThat(report.verdict()).isEqualTo(SatVerdict.UNSATISFIABLE);
    assertThat(report.unsatCoreClauseIds()).containsExactly("d1", "d2");
    assertThat(report.message())
        .isEqualTo(
            "LOGIC CONTRADICTION: Clauses are mutually exclusive. Conflicting clauses: d1, d2");
    assertThat(report.strategies()).containsExactly(VerificationMode.FORMAL);
  }

  @Test
  void verify_penaltyAboveLiabilityCap_isUnsatisfiable() {
    var report =
        service.verify(
            List.of(
                liability("cap", "Liability is capped at $10,000", 10_000),
                liability("penalty", "A penalty of $50,000 applies", 50_000)));

    assertThat(report.consistent()).isFalse();
    assertThat(report.verdict()).isEqualTo(SatVerdict.UNSATISFIABLE);
    assertThat(report.unsatCoreClauseIds()).containsExactly("cap", "penalty");
  }

  @Test
  void verify_penaltyWithinLiabilityCap_isSatisfiableWithWitness() {
    var report =
        service.verify(
            List.of(
                liability("cap", "Liability is capped at $20,000", 20_000),
                liability("penalty", "A penalty of $5,000 applies", 5_000)));

    assertThat(report.consistent()).isTrue();
    assertThat(report.verdict()).isEqualTo(SatVerdict.SATISFIABLE);
    assertThat(report.message()).isEqualTo(ResultAggregator.FORMAL_VERIFIED);
    assertThat(report.assignment().get("max_liability_usd")).isBetween(5_000L, 20_000L);
  }

  @Test
  void verify_otherClausesOnly_isSatisfiable() {
    var report =
        service.verify(
            List.of(
                new ClauseInput("o1", "Governing law is New York", ClauseCategory.OTHER, null),
                new ClauseInput(
                    "o2", "Notices go to the registered address", ClauseCategory.OTHER, null)));

    assertThat(report.consistent()).isTrue();
    assertThat(report.verdict()).isEqualTo(SatVerdict.SATISFIABLE);
  }

  @Test
  void verify_unrecognizedQualifier_isSkippedWithWarning() {
    var report =
        service.verify(
            List.of(
                duration("d1", "The term is exactly 12 months", 12),
                duration("d2", "The term is roughly two years", 24)));

    assertThat(report.consistent()).isTrue();
    assertThat(report.verdict()).isEqualTo(SatVerdict.SATISFIABLE);
    assertThat(report.warnings()).singleElement().asString().contains("d2");
  }

  @Test
  void verify_solverUndecided_isConsistentWithWarning() {
    when(undecidedSolver.check(anyList())).thenReturn(SolverCheck.unknown());
    var undecided = serviceWith(undecidedSolver);

    var report =
        undecided.verify(
            List.of(
                duration("d1", "The term is exactly 12 months", 12),
                duration("d2", "The term shall be at least 24 months", 24)));

    assertThat(report.consistent()).isTrue();
    assertThat(report.verdict()).isEqualTo(SatVerdict.UNKNOWN);
    assertThat(report.message()).isEqualTo(ResultAggregator.FORMAL_UNKNOWN);
    assertThat(report.warnings()).containsExactly(FormalConsistencyStrategy.UNKNOWN_WARNING);
  }

  @Test
  void verify_bothMode_unionsHeuristicAndFormalFindings() {
    var report =
        service.verify(
            VerificationMode.BOTH,
            List.of(
                duration("d1", "Seller may terminate with 10 days notice; exactly 12 months", 12),
                duration("d2", "Neither party may terminate before 90 days; at least 24", 24)));

    assertThat(report.consistent()).isFalse();
    assertThat(report.strategies())
        .containsExactly(VerificationMode.HEURISTIC, VerificationMode.FORMAL);
    assertThat(report.conflicts()).hasSize(1);
    assertThat(report.verdict()).isEqualTo(SatVerdict.UNSATISFIABLE);
    assertThat(report.message().lines())
        .hasSize(3)
        .last()
        .asString()
        .startsWith("LOGIC CONTRADICTION");
  }

  @Test
  void verify_heuristicModeOnCategorizedClauses_ignoresValues() {
    var report =
        service.verify(
            VerificationMode.HEURISTIC,
            List.of(
                duration("d1", "The term is exactly 12 months", 12),
                duration("d2", "The term shall be at least 24 months", 24)));

    assertThat(report.consistent()).isTrue();
    assertThat(report.verdict()).isNull();
    assertThat(report.message()).isEqualTo(ResultAggregator.HEURISTIC_VERIFIED);
  }

  @Test
  void verify_formalModeWithoutCategory_isRejected() {
    var clauses =
        List.of(
            ClauseInput.freeText("a", "The term is exactly 12 months"),
            ClauseInput.freeText("b", "The term shall be at least 24 months"));

    assertThatThrownBy(() -> service.verify(VerificationMode.FORMAL, clauses))
        .isInstanceOf(InvalidClauseInputException.class);
  }

  @Test
  void verify_duplicateIds_isRejectedBeforeAnyStrategyRuns() {
    var clauses =
        List.of(ClauseInput.freeText("a", "first"), ClauseInput.freeText("a", "second"));

    assertThatThrownBy(() -> service.verify(clauses))
        .isInstanceOf(InvalidClauseInputException.class)
        .hasFieldOrPropertyWithValue("violations", List.of("Clause 2 (a): duplicate id 'a'"));
  }

  @Test
  void verify_multiMillionPenaltyAboveCap_isUnsatisfiable() {
    var report =
        service.verify(
            List.of(
                liability("cap", "Liability is capped at $25,000,000", 25_000_000),
                liability("penalty", "A penalty of $30,000,000 applies", 30_000_000)));

    assertThat(report.consistent()).isFalse();
    assertThat(report.verdict()).isEqualTo(SatVerdict.UNSATISFIABLE);
    assertThat(report.unsatCoreClauseIds()).containsExactly("cap", "penalty");
  }

  @Test
  void verify_multiMillionPenaltyWithinCap_isSatisfiable() {
    var report =
        service.verify(
            List.of(
                liability("cap", "Liability is capped at $30,000,000", 30_000_000),
                liability("penalty", "A penalty of $25,000,000 applies", 25_000_000)));

    assertThat(report.consistent()).isTrue();
    assertThat(report.verdict()).isEqualTo(SatVerdict.SATISFIABLE);
    assertThat(report.assignment().get("max_liability_usd"))
        .isBetween(25_000_000L, 30_000_000L);
  }
}
