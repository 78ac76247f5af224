package io.b2mash.clauseguard.conflict;

import io.b2mash.clauseguard.proposition.Proposition;
import java.util.Optional;

/** Fires when one clause permits termination and the other prohibits it. */
public class TerminationPermissionRule implements ConflictRule {

  static final String REASON = "Permission to terminate conflicts with prohibition on termination";

  @Override
  public String name() {
    return "permission-vs-prohibition";
  }

  @Override
  public Optional<String> evaluate(Proposition first, Proposition second) {
    if (permitsWhatOtherForbids(first, second) || permitsWhatOtherForbids(second, first)) {
      return Optional.of(REASON);
    }
    return Optional.empty();
  }

  private static boolean permitsWhatOtherForbids(Proposition permitting, Proposition forbidding) {
    return permitting.permission()
        && permitting.canTerminate()
        && permitting.mentionsTerminate()
        && forbidding.prohibition()
        && forbidding.mentionsTerminate();
  }
}
