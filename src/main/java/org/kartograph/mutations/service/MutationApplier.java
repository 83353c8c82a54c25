package org.kartograph.mutations.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.kartograph.mutations.config.MutationProperties;
import org.kartograph.mutations.domain.BatchError;
import org.kartograph.mutations.domain.CreateOperation;
import org.kartograph.mutations.domain.DefineOperation;
import org.kartograph.mutations.domain.DeleteOperation;
import org.kartograph.mutations.domain.EntityKind;
import org.kartograph.mutations.domain.GraphEdge;
import org.kartograph.mutations.domain.GraphNode;
import org.kartograph.mutations.domain.MutationOperation;
import org.kartograph.mutations.domain.MutationResult;
import org.kartograph.mutations.domain.SystemProperties;
import org.kartograph.mutations.domain.TypeDefinition;
import org.kartograph.mutations.domain.UpdateOperation;
import org.kartograph.mutations.exception.MutationApplyException;
import org.kartograph.mutations.repository.GraphStore;
import org.kartograph.mutations.repository.GraphTransaction;
import org.kartograph.mutations.repository.TypeDefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies a batch of operations to the graph store as one transaction.
 *
 * <p>Operations run in sorted order (DEFINE first). The first operation that cannot take
 * effect aborts the batch: the transaction is rolled back, no DEFINE is published, and the
 * result reports {@code operations_applied = 0} with the failing operation's index and reason.
 * A batch with structural errors is refused without touching the store.
 */
@Service
public class MutationApplier {

  private static final Logger logger = LoggerFactory.getLogger(MutationApplier.class);

  static final String TIMER_NAME = "kartograph.mutations.apply";
  static final String OPERATIONS_COUNTER = "kartograph.mutations.operations";

  private final GraphStore graphStore;
  private final TypeDefinitionRepository registry;
  private final MutationValidator validator;
  private final OperationSorter sorter;
  private final MutationProperties properties;
  private final MeterRegistry meterRegistry;

  /**
   * Constructs a MutationApplier.
   *
   * @param graphStore the graph store
   * @param registry the schema registry DEFINEs are published to
   * @param validator the validator used to re-check structure
   * @param sorter the execution-order sorter
   * @param properties mutation settings
   * @param meterRegistry the meter registry
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public MutationApplier(
      GraphStore graphStore,
      TypeDefinitionRepository registry,
      MutationValidator validator,
      OperationSorter sorter,
      MutationProperties properties,
      MeterRegistry meterRegistry) {
    this.graphStore = graphStore;
    this.registry = registry;
    this.validator = validator;
    this.sorter = sorter;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Applies operations atomically.
   *
   * @param operations operations in input order
   * @return committed result, or a failed result with {@code operations_applied = 0}
   */
  public MutationResult apply(List<MutationOperation> operations) {
    Timer.Sample sample = Timer.start(meterRegistry);

    List<BatchError> structural = validator.checkStructure(operations);
    if (!structural.isEmpty()) {
      logger.warn("Refusing batch of {} operations with {} structural errors",
          operations.size(), structural.size());
      sample.stop(meterRegistry.timer(TIMER_NAME, "outcome", "rejected"));
      return MutationResult.failed(structural.stream().map(BatchError::message).toList());
    }

    List<MutationOperation> ordered = sorter.sort(operations);
    try (GraphTransaction tx = graphStore.begin()) {
      logger.debug("Applying batch of {} operations in transaction {}",
          ordered.size(), tx.transactionId());
      ApplyVisitor visitor = new ApplyVisitor(tx);
      try {
        for (MutationOperation operation : ordered) {
          if (Thread.currentThread().isInterrupted()) {
            throw new MutationApplyException(operation, "apply interrupted");
          }
          runOperation(operation, visitor);
        }
      } catch (MutationApplyException e) {
        tx.rollback();
        logger.warn("Aborted transaction {} at operation {} (line {}): {}",
            tx.transactionId(), e.getOperationIndex(), e.getLine(), e.getMessage());
        sample.stop(meterRegistry.timer(TIMER_NAME, "outcome", "aborted"));
        return MutationResult.failed(List.of(e.toErrorMessage()));
      }

      tx.commit();
      registry.saveAll(visitor.stagedDefinitions.values());
      logger.info("Committed transaction {}: {} operations applied",
          tx.transactionId(), ordered.size());
    }

    for (MutationOperation operation : ordered) {
      meterRegistry.counter(OPERATIONS_COUNTER, "op", operation.kind().name()).increment();
    }
    sample.stop(meterRegistry.timer(TIMER_NAME, "outcome", "committed"));
    return MutationResult.committed(ordered.size());
  }

  private static void runOperation(MutationOperation operation, ApplyVisitor visitor) {
    try {
      operation.accept(visitor);
    } catch (IllegalStateException e) {
      throw new MutationApplyException(operation, e.getMessage());
    }
  }

  private Map<String, Object> withGraphId(Map<String, Object> setProperties) {
    Map<String, Object> stamped = new LinkedHashMap<>(setProperties);
    stamped.put(SystemProperties.GRAPH_ID, properties.getGraphName());
    return stamped;
  }

  /**
   * Executes operations against one transaction. DEFINEs are collected and published only
   * after commit.
   */
  private final class ApplyVisitor implements MutationOperation.Visitor<Void> {

    private final GraphTransaction tx;
    private final Map<String, TypeDefinition> stagedDefinitions = new LinkedHashMap<>();

    ApplyVisitor(GraphTransaction tx) {
      this.tx = tx;
    }

    @Override
    public Void visitDefine(DefineOperation operation) {
      TypeDefinition definition = operation.toTypeDefinition();
      String key = definition.entityKind().wireValue() + ":" + definition.label();
      stagedDefinitions.remove(key);
      stagedDefinitions.put(key, definition);
      return null;
    }

    @Override
    public Void visitCreate(CreateOperation operation) {
      Map<String, Object> updates = withGraphId(operation.setProperties());
      if (operation.entityKind() == EntityKind.NODE) {
        if (tx.findEdge(operation.id()).isPresent()) {
          throw new MutationApplyException(operation,
              "id '" + operation.id() + "' is already used by an edge");
        }
        GraphNode node = tx.findNode(operation.id())
            .map(existing -> existing.withProperties(updates))
            .orElseGet(() -> new GraphNode(operation.id(), operation.label(), updates));
        tx.putNode(node);
        return null;
      }

      if (tx.findNode(operation.id()).isPresent()) {
        throw new MutationApplyException(operation,
            "id '" + operation.id() + "' is already used by a node");
      }
      Optional<GraphEdge> existing = tx.findEdge(operation.id());
      if (existing.isPresent()) {
        tx.putEdge(existing.get().withProperties(updates));
        return null;
      }
      requireNode(operation, operation.startId(), "start");
      requireNode(operation, operation.endId(), "end");
      tx.putEdge(new GraphEdge(operation.id(), operation.label(),
          operation.startId(), operation.endId(), updates));
      return null;
    }

    @Override
    public Void visitUpdate(UpdateOperation operation) {
      Map<String, Object> updates =
          operation.setProperties() != null ? operation.setProperties() : Map.of();
      List<String> removals =
          operation.removeProperties() != null ? operation.removeProperties() : List.of();

      if (operation.entityKind() == EntityKind.NODE) {
        GraphNode node = tx.findNode(operation.id())
            .orElseThrow(() -> missingTarget(operation));
        tx.putNode(node.withProperties(updates).withoutProperties(removals));
      } else {
        GraphEdge edge = tx.findEdge(operation.id())
            .orElseThrow(() -> missingTarget(operation));
        tx.putEdge(edge.withProperties(updates).withoutProperties(removals));
      }
      return null;
    }

    @Override
    public Void visitDelete(DeleteOperation operation) {
      if (operation.entityKind() == EntityKind.NODE) {
        tx.findNode(operation.id()).orElseThrow(() -> missingTarget(operation));
        List<GraphEdge> incident = tx.findIncidentEdges(operation.id());
        for (GraphEdge edge : incident) {
          tx.removeEdge(edge.id());
        }
        tx.removeNode(operation.id());
        if (!incident.isEmpty()) {
          logger.debug("Deleting node {} removed {} incident edges",
              operation.id(), incident.size());
        }
      } else {
        tx.findEdge(operation.id()).orElseThrow(() -> missingTarget(operation));
        tx.removeEdge(operation.id());
      }
      return null;
    }

    private void requireNode(CreateOperation operation, String nodeId, String role) {
      if (tx.findNode(nodeId).isEmpty()) {
        throw new MutationApplyException(operation,
            role + " node '" + nodeId + "' does not exist");
      }
    }

    private MutationApplyException missingTarget(MutationOperation operation) {
      return new MutationApplyException(operation,
          operation.entityKind().wireValue() + " '" + operation.id() + "' does not exist");
    }
  }
}
