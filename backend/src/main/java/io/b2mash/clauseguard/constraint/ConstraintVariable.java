package io.b2mash.clauseguard.constraint;

import io.b2mash.clauseguard.clause.ClauseCategory;
import java.util.Optional;

/**
 * The fixed set of shared integer quantities that clauses jointly constrain. Every variable is
 * bounded below by zero.
 */
public enum ConstraintVariable {
  CONTRACT_DURATION_MONTHS("contract_duration_months"),
  MAX_LIABILITY_USD("max_liability_usd"),
  /** Reserved: bounded but not targeted by any clause category yet. */
  NOTICE_PERIOD_DAYS("notice_period_days");

  private final String variableName;

  ConstraintVariable(String variableName) {
    this.variableName = variableName;
  }

  public String variableName() {
    return variableName;
  }

  /** The variable a clause category compiles onto, if any. */
  public static Optional<ConstraintVariable> forCategory(ClauseCategory category) {
    if (category == null) {
      return Optional.empty();
    }
    return switch (category) {
      case DURATION -> Optional.of(CONTRACT_DURATION_MONTHS);
      case LIABILITY -> Optional.of(MAX_LIABILITY_USD);
      case OTHER -> Optional.empty();
    };
  }
}
