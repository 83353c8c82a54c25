package org.kartograph.mutations.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One non-blocking warning, located by line and operation.
 *
 * @param line 1-based source line
 * @param operationIndex batch index of the operation
 * @param message the warning
 */
public record WarningEntry(
    int line,
    @JsonProperty("operation_index") int operationIndex,
    String message
) {}
