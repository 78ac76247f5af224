package io.b2mash.clauseguard.constraint;

/**
 * One compiled constraint {@code variable relation literal}, tagged with the clause it came from.
 *
 * @param variable the constrained shared variable
 * @param relation EQ, GTE or LTE
 * @param literal non-negative bound
 * @param qualifier the qualifier the relation was derived from
 * @param sourceClauseId id of the originating clause
 */
public record ClauseConstraint(
    ConstraintVariable variable,
    Relation relation,
    long literal,
    Qualifier qualifier,
    String sourceClauseId) {

  /** Readable form, e.g. {@code contract_duration_months >= 24}. */
  public String describe() {
    return variable.variableName() + " " + relation.operator() + " " + literal;
  }
}
