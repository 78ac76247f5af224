package io.b2mash.clauseguard.verification;

import io.b2mash.clauseguard.clause.ClauseInput;
import io.b2mash.clauseguard.conflict.HeuristicConflictDetector;
import io.b2mash.clauseguard.proposition.PropositionExtractor;
import java.util.List;
import org.springframework.stereotype.Component;

/** Extracts a proposition per clause and compares every pair. */
@Component
public class HeuristicConsistencyStrategy implements ConsistencyStrategy {

  private final PropositionExtractor extractor;
  private final HeuristicConflictDetector detector;

  public HeuristicConsistencyStrategy(
      PropositionExtractor extractor, HeuristicConflictDetector detector) {
    this.extractor = extractor;
    this.detector = detector;
  }

  @Override
  public VerificationMode mode() {
    return VerificationMode.HEURISTIC;
  }

  @Override
  public StrategyOutcome evaluate(List<ClauseInput> clauses) {
    var propositions = extractor.extractAll(clauses.stream().map(ClauseInput::text).toList());
    return StrategyOutcome.heuristic(detector.detect(propositions));
  }
}
