package io.b2mash.clauseguard.conflict;

import io.b2mash.clauseguard.proposition.Proposition;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares every unordered pair of propositions against an ordered rule list. At most one conflict
 * is reported per pair: the first rule that fires wins and later rules are not consulted, so a
 * second genuine conflict between the same two clauses stays hidden. {@link #evaluateAll} exposes
 * every firing rule for diagnostics.
 */
@Component
public class HeuristicConflictDetector {

  private static final Logger log = LoggerFactory.getLogger(HeuristicConflictDetector.class);

  private final List<ConflictRule> rules;

  public HeuristicConflictDetector() {
    this(
        List.of(
            new NoticeVersusMinimumTermRule(),
            new TerminationPermissionRule(),
            new ExclusivityCollisionRule()));
  }

  HeuristicConflictDetector(List<ConflictRule> rules) {
    this.rules = List.copyOf(rules);
  }

  /**
   * Detects conflicts in discovery order: ascending {@code i}, then ascending {@code j > i}.
   *
   * @param propositions propositions in submitted clause order
   * @return at most one conflict per pair
   */
  public List<ConflictRecord> detect(List<Proposition> propositions) {
    List<ConflictRecord> conflicts = new ArrayList<>();
    for (int i = 0; i < propositions.size(); i++) {
      for (int j = i + 1; j < propositions.size(); j++) {
        firstConflict(propositions.get(i), propositions.get(j), i, j).ifPresent(conflicts::add);
      }
    }
    log.debug("Checked {} clause(s), found {} conflict(s)", propositions.size(), conflicts.size());
    return conflicts;
  }

  /** Every rule that fires for the pair, in precedence order. */
  public List<ConflictRecord> evaluateAll(
      Proposition first, Proposition second, int indexFirst, int indexSecond) {
    List<ConflictRecord> fired = new ArrayList<>();
    for (ConflictRule rule : rules) {
      rule.evaluate(first, second)
          .ifPresent(
              reason ->
                  fired.add(new ConflictRecord(indexFirst, indexSecond, rule.name(), reason)));
    }
    return fired;
  }

  private Optional<ConflictRecord> firstConflict(
      Proposition first, Proposition second, int i, int j) {
    for (ConflictRule rule : rules) {
      var reason = rule.evaluate(first, second);
      if (reason.isPresent()) {
        return Optional.of(new ConflictRecord(i, j, rule.name(), reason.get()));
      }
    }
    return Optional.empty();
  }
}
