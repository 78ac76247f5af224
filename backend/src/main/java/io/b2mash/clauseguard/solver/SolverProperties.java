package io.b2mash.clauseguard.solver;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the satisfiability engine.
 *
 * @param timeout wall-clock limit for a single solver check
 * @param explainConflicts whether an unsatisfiable result is narrowed down to the conflicting
 *     clauses
 */
@ConfigurationProperties(prefix = "verification.solver")
public record SolverProperties(
    @DefaultValue("2s") Duration timeout, @DefaultValue("true") boolean explainConflicts) {

  public static SolverProperties defaults() {
    return new SolverProperties(Duration.ofSeconds(2), true);
  }
}
