package io.b2mash.clauseguard.conflict;

/**
 * A conflict found between two clauses, addressed by their position in the submitted list.
 *
 * @param clauseIndexA zero-based index of the earlier clause
 * @param clauseIndexB zero-based index of the later clause ({@code clauseIndexA < clauseIndexB})
 * @param rule name of the rule that fired
 * @param reason human-readable explanation
 */
public record ConflictRecord(int clauseIndexA, int clauseIndexB, String rule, String reason) {}
