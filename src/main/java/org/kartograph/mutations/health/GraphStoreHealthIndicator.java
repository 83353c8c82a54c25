package org.kartograph.mutations.health;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.kartograph.mutations.repository.GraphStore;
import org.kartograph.mutations.repository.TypeDefinitionRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the graph store and schema registry.
 * Reports committed node, edge and type definition counts.
 */
@Component
public class GraphStoreHealthIndicator implements HealthIndicator {

  private final GraphStore graphStore;
  private final TypeDefinitionRepository registry;

  /**
   * Creates a new graph store health indicator.
   *
   * @param graphStore the graph store
   * @param registry the schema registry
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repositories are Spring-managed beans and are intentionally shared"
  )
  public GraphStoreHealthIndicator(GraphStore graphStore, TypeDefinitionRepository registry) {
    this.graphStore = graphStore;
    this.registry = registry;
  }

  /**
   * Checks graph store health.
   *
   * @return health status
   */
  @Override
  public Health health() {
    try {
      return Health.up()
          .withDetail("nodes", graphStore.nodeCount())
          .withDetail("edges", graphStore.edgeCount())
          .withDetail("typeDefinitions", registry.count())
          .build();
    } catch (RuntimeException e) {
      return Health.down()
          .withDetail("error", e.getMessage())
          .withException(e)
          .build();
    }
  }
}
