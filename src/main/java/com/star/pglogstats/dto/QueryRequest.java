package com.star.pglogstats.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "SQL text to classify and normalize")
public class QueryRequest {

    @NotBlank(message = "SQL is required")
    @Size(max = 100000, message = "SQL cannot exceed 100000 characters")
    @Schema(description = "One or more semicolon-separated statements", example = "SELECT * FROM users WHERE id = 42")
    private String sql;
}
