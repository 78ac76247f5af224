package io.b2mash.clauseguard.conflict;

import io.b2mash.clauseguard.proposition.Proposition;
import java.util.Optional;

/**
 * Fires when one clause grants termination with a notice period shorter than a minimum term
 * imposed by the other: terminating early would breach the minimum-term obligation.
 */
public class NoticeVersusMinimumTermRule implements ConflictRule {

  @Override
  public String name() {
    return "notice-vs-minimum-term";
  }

  @Override
  public Optional<String> evaluate(Proposition first, Proposition second) {
    return check(first, second).or(() -> check(second, first));
  }

  private static Optional<String> check(Proposition terminating, Proposition restricting) {
    if (!terminating.canTerminate()
        || terminating.noticeDays().isEmpty()
        || restricting.minTermDays().isEmpty()) {
      return Optional.empty();
    }
    int notice = terminating.noticeDays().getAsInt();
    int minimumTerm = restricting.minTermDays().getAsInt();
    if (notice < minimumTerm) {
      return Optional.of(
          "Termination notice ("
              + notice
              + " days) conflicts with minimum term ("
              + minimumTerm
              + " days)");
    }
    return Optional.empty();
  }
}
