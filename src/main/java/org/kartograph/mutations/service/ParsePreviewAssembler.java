package org.kartograph.mutations.service;

import java.util.ArrayList;
import java.util.List;
import org.kartograph.mutations.config.ParseDispatcherProperties;
import org.kartograph.mutations.domain.BatchError;
import org.kartograph.mutations.domain.MutationOperation;
import org.kartograph.mutations.domain.ParsedBatch;
import org.kartograph.mutations.domain.ParsedOperation;
import org.kartograph.mutations.dto.OperationBreakdown;
import org.kartograph.mutations.dto.OperationPreview;
import org.kartograph.mutations.dto.ParsePreview;
import org.kartograph.mutations.dto.PreviewMode;
import org.kartograph.mutations.dto.WarningEntry;
import org.springframework.stereotype.Component;

/**
 * Turns a parsed batch into the preview shown to authors.
 */
@Component
public class ParsePreviewAssembler {

  private final ParseDispatcherProperties properties;

  /**
   * Constructs a ParsePreviewAssembler.
   *
   * @param properties limits for warnings and summary errors
   */
  public ParsePreviewAssembler(ParseDispatcherProperties properties) {
    this.properties = properties;
  }

  /**
   * Builds a full preview.
   *
   * @param batch the validated batch
   * @param parseTimeMs time spent parsing
   * @param operationLimit maximum operations to include
   * @return the preview
   */
  public ParsePreview full(ParsedBatch batch, long parseTimeMs, int operationLimit) {
    List<WarningEntry> warnings = new ArrayList<>();
    List<OperationPreview> operations = new ArrayList<>();
    for (ParsedOperation parsed : batch.operations()) {
      MutationOperation operation = parsed.operation();
      for (String warning : parsed.warnings()) {
        if (warnings.size() < properties.getWarningLimit()) {
          warnings.add(new WarningEntry(
              operation.span().startLine(), operation.index(), warning));
        }
      }
      if (operations.size() < operationLimit) {
        operations.add(new OperationPreview(
            operation.index(),
            operation.kind().name(),
            operation.entityKind().wireValue(),
            operation.label(),
            operation.id(),
            operation.span().startLine(),
            parsed.warnings()));
      }
    }
    return new ParsePreview(
        PreviewMode.FULL,
        breakdown(batch),
        batch.errorMessages(),
        batch.errors().size(),
        warnings,
        batch.warningCount(),
        operations,
        operations.size() < batch.operations().size(),
        parseTimeMs,
        !batch.hasErrors());
  }

  /**
   * Builds a read-only breakdown: counts and the first errors, no warnings or operations.
   *
   * @param batch the structurally validated batch
   * @param parseTimeMs time spent parsing
   * @return the preview
   */
  public ParsePreview summary(ParsedBatch batch, long parseTimeMs) {
    List<String> firstErrors = batch.errorMessages().stream()
        .limit(properties.getSummaryErrorLimit())
        .toList();
    return new ParsePreview(
        PreviewMode.SUMMARY,
        breakdown(batch),
        firstErrors,
        batch.errors().size(),
        List.of(),
        0,
        List.of(),
        !batch.operations().isEmpty(),
        parseTimeMs,
        !batch.hasErrors());
  }

  /**
   * Counts operations per kind. Lines that decoded to no operation count as unknown.
   *
   * @param batch the batch
   * @return the breakdown
   */
  public static OperationBreakdown breakdown(ParsedBatch batch) {
    int define = 0;
    int create = 0;
    int update = 0;
    int delete = 0;
    for (ParsedOperation parsed : batch.operations()) {
      switch (parsed.operation().kind()) {
        case DEFINE -> define++;
        case CREATE -> create++;
        case UPDATE -> update++;
        case DELETE -> delete++;
        default -> throw new IllegalStateException(
            "Unhandled operation kind: " + parsed.operation().kind());
      }
    }
    int unknown = (int) batch.errors().stream()
        .filter(error -> error.category() == BatchError.Category.PARSE)
        .count();
    return new OperationBreakdown(
        define, create, update, delete, unknown, batch.operations().size());
  }
}
