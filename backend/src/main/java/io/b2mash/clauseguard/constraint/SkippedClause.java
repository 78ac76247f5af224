package io.b2mash.clauseguard.constraint;

/**
 * A categorized clause that was left out of the constraint set because no qualifier keyword was
 * recognized in its text.
 */
public record SkippedClause(int clauseIndex, String clauseId, String reason) {}
