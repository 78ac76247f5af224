package io.b2mash.clauseguard.clause;

/** Category of a clause, deciding which shared quantity it constrains on the formal path. */
public enum ClauseCategory {
  /** Constrains the overall contract duration, in months. */
  DURATION,

  /** Constrains the amount of liability, in US dollars. */
  LIABILITY,

  /** Anything else. Ignored by the formal path. */
  OTHER
}
