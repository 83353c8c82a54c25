package org.kartograph.mutations.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Operation counts per kind.
 *
 * @param define DEFINE operations
 * @param create CREATE operations
 * @param update UPDATE operations
 * @param delete DELETE operations
 * @param unknown lines that could not be decoded into an operation
 * @param total decoded operations
 */
@Schema(description = "Operation counts per kind")
public record OperationBreakdown(
    @Schema(description = "DEFINE operations", example = "2") int define,
    @Schema(description = "CREATE operations", example = "120") int create,
    @Schema(description = "UPDATE operations", example = "4") int update,
    @Schema(description = "DELETE operations", example = "1") int delete,
    @Schema(description = "Lines that could not be decoded", example = "0") int unknown,
    @Schema(description = "Decoded operations", example = "127") int total
) {}
