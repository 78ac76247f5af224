package io.b2mash.clauseguard.verification;

import io.b2mash.clauseguard.clause.ClauseInput;
import io.b2mash.clauseguard.clause.ClauseInputValidator;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single entry point for clause-consistency verification. Selects the heuristic and/or formal
 * strategy, runs them and merges their outcomes. Holds no per-call state, so one instance serves
 * any number of calls.
 */
@Service
public class ClauseConsistencyService {

  private static final Logger log = LoggerFactory.getLogger(ClauseConsistencyService.class);

  private final ClauseInputValidator validator;
  private final List<ConsistencyStrategy> strategies;
  private final ResultAggregator aggregator;

  public ClauseConsistencyService(
      ClauseInputValidator validator,
      List<ConsistencyStrategy> strategies,
      ResultAggregator aggregator) {
    this.validator = validator;
    this.strategies =
        strategies.stream().sorted(Comparator.comparing(ConsistencyStrategy::mode)).toList();
    this.aggregator = aggregator;
  }

  /** Verifies clauses with the mode inferred from their shape. */
  public ConsistencyReport verify(List<ClauseInput> clauses) {
    return verify(null, clauses);
  }

  /**
   * Verifies clauses.
   *
   * @param mode the paths to run, or null to infer them from the input shape
   * @param clauses clauses in submitted order
   * @return the combined report
   * @throws io.b2mash.clauseguard.exception.InvalidClauseInputException on hard validation failure
   */
  public ConsistencyReport verify(VerificationMode mode, List<ClauseInput> clauses) {
    validator.validateCommon(clauses);
    var effectiveMode = mode != null ? mode : VerificationMode.infer(clauses);

    var outcomes =
        strategies.stream()
            .filter(strategy -> effectiveMode.includes(strategy.mode()))
            .map(strategy -> strategy.evaluate(clauses))
            .toList();
    var report = aggregator.aggregate(clauses, outcomes);

    log.info(
        "Verified clauses: count={}, mode={}, consistent={}, conflicts={}, verdict={}",
        clauses.size(),
        effectiveMode,
        report.consistent(),
        report.conflicts().size(),
        report.verdict());
    return report;
  }
}
