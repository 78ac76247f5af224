package io.b2mash.clauseguard.verification.dto;

import io.b2mash.clauseguard.verification.ConsistencyReport;
import io.b2mash.clauseguard.verification.ReportedConflict;
import java.util.List;
import java.util.Map;

public record ConsistencyReportResponse(
    boolean consistent,
    List<ConflictResponse> conflicts,
    String message,
    String verdict,
    List<String> unsatCoreClauseIds,
    List<String> warnings,
    Map<String, Long> assignment,
    List<String> strategies) {

  public static ConsistencyReportResponse from(ConsistencyReport report) {
    return new ConsistencyReportResponse(
        report.consistent(),
        report.conflicts().stream().map(ConflictResponse::from).toList(),
        report.message(),
        report.verdict() != null ? report.verdict().name() : null,
        report.unsatCoreClauseIds(),
        report.warnings(),
        report.assignment(),
        report.strategies().stream().map(Enum::name).toList());
  }

  public record ConflictResponse(
      String clauseIdA,
      String clauseIdB,
      int clauseIndexA,
      int clauseIndexB,
      String rule,
      String reason) {

    public static ConflictResponse from(ReportedConflict conflict) {
      return new ConflictResponse(
          conflict.clauseIdA(),
          conflict.clauseIdB(),
          conflict.clauseIndexA(),
          conflict.clauseIndexB(),
          conflict.rule(),
          conflict.reason());
    }
  }
}
