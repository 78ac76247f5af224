package io.b2mash.clauseguard.verification;

/**
 * A conflict as reported to the caller, addressed both by position and by clause id.
 *
 * @param clauseIndexA zero-based index of the earlier clause
 * @param clauseIndexB zero-based index of the later clause
 * @param clauseIdA id of the earlier clause
 * @param clauseIdB id of the later clause
 * @param rule name of the rule that fired
 * @param reason human-readable explanation
 */
public record ReportedConflict(
    int clauseIndexA,
    int clauseIndexB,
    String clauseIdA,
    String clauseIdB,
    String rule,
    String reason) {}
