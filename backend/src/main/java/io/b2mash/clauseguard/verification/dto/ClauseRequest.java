package io.b2mash.clauseguard.verification.dto;

import io.b2mash.clauseguard.clause.ClauseCategory;
import io.b2mash.clauseguard.clause.ClauseInput;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ClauseRequest(
    @NotBlank(message = "id is required")
        @Size(max = 100, message = "id must not exceed 100 characters")
        String id,
    @NotNull(message = "text is required")
        @Size(max = 10_000, message = "text must not exceed 10000 characters")
        String text,
    ClauseCategory category,
    Long value) {

  public ClauseInput toClauseInput() {
    return new ClauseInput(id, text, category, value);
  }
}
