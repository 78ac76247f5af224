package io.b2mash.clauseguard.constraint;

/** Relation between a constraint variable and an integer literal. */
public enum Relation {
  EQ("="),
  GTE(">="),
  LTE("<=");

  private final String operator;

  Relation(String operator) {
    this.operator = operator;
  }

  /** The arithmetic operator symbol, as accepted by the solver. */
  public String operator() {
    return operator;
  }
}
