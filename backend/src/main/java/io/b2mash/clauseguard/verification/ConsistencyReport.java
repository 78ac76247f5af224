package io.b2mash.clauseguard.verification;

import io.b2mash.clauseguard.solver.SatVerdict;
import java.util.List;
import java.util.Map;

/**
 * Combined result of one verification call.
 *
 * @param consistent true unless a heuristic conflict was found or the solver proved the
 *     constraints unsatisfiable
 * @param conflicts heuristic conflicts in discovery order
 * @param message human-readable summary
 * @param verdict solver verdict, or null when the formal path did not run
 * @param unsatCoreClauseIds clauses blamed for an unsatisfiable verdict
 * @param warnings notes that do not affect consistency (skipped clauses, solver indecision)
 * @param assignment witness values when the constraints are satisfiable
 * @param strategies the paths that ran
 */
public record ConsistencyReport(
    boolean consistent,
    List<ReportedConflict> conflicts,
    String message,
    SatVerdict verdict,
    List<String> unsatCoreClauseIds,
    List<String> warnings,
    Map<String, Long> assignment,
    List<VerificationMode> strategies) {}
