package org.kartograph.mutations.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import org.kartograph.mutations.domain.BatchOutcome;
import org.kartograph.mutations.domain.MutationResult;
import org.kartograph.mutations.domain.ParsedBatch;
import org.kartograph.mutations.dto.ParsePreview;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for submitting mutation batches.
 * A batch with any parse or structural error is rejected without reaching the applier.
 */
@Service
public class GraphMutationService {

  private static final Logger logger = LoggerFactory.getLogger(GraphMutationService.class);

  private final MutationBatchParser parser;
  private final MutationApplier applier;
  private final ParsePreviewAssembler assembler;
  private final MeterRegistry meterRegistry;

  /**
   * Constructs a GraphMutationService.
   *
   * @param parser the shared parse pipeline
   * @param applier the applier
   * @param assembler the preview assembler
   * @param meterRegistry the meter registry
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public GraphMutationService(
      MutationBatchParser parser,
      MutationApplier applier,
      ParsePreviewAssembler assembler,
      MeterRegistry meterRegistry) {
    this.parser = parser;
    this.applier = applier;
    this.assembler = assembler;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Parses, validates and applies a JSONL batch.
   *
   * @param jsonl the batch text
   * @return the outcome with its mutation result
   */
  public BatchOutcome applyJsonl(String jsonl) {
    long start = System.nanoTime();
    ParsedBatch batch = parser.parse(jsonl != null ? jsonl : "");
    if (batch.hasErrors()) {
      logger.info("Rejected batch: {} errors in {} operations",
          batch.errors().size(), batch.operations().size());
      meterRegistry.timer(MutationApplier.TIMER_NAME, "outcome", "rejected")
          .record(Duration.ofNanos(System.nanoTime() - start));
      return new BatchOutcome(
          BatchOutcome.Status.REJECTED, MutationResult.failed(batch.errorMessages()));
    }
    if (batch.warningCount() > 0) {
      logger.debug("Applying batch with {} warnings", batch.warningCount());
    }

    MutationResult result = applier.apply(batch.mutationOperations());
    BatchOutcome.Status status =
        result.success() ? BatchOutcome.Status.COMMITTED : BatchOutcome.Status.ABORTED;
    return new BatchOutcome(status, result);
  }

  /**
   * Parses and validates a batch without applying it.
   *
   * @param jsonl the batch text
   * @return the full preview, including every operation
   */
  public ParsePreview validate(String jsonl) {
    long start = System.nanoTime();
    ParsedBatch batch = parser.parse(jsonl != null ? jsonl : "");
    long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
    return assembler.full(batch, elapsedMs, Integer.MAX_VALUE);
  }
}
