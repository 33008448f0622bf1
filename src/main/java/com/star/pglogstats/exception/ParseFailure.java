package com.star.pglogstats.exception;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParseFailure {

    private long lineNumber;

    private String rawLine;

    private String reason;

    @Override
    public String toString() {
        return String.format("Line %d: %s", lineNumber, reason);
    }
}
