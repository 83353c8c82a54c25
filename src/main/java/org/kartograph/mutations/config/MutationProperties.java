package org.kartograph.mutations.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for mutation validation and apply.
 */
@Component
@ConfigurationProperties(prefix = "kartograph.mutations")
public class MutationProperties {

  /**
   * Graph name stamped onto every created entity as {@code graph_id}.
   */
  private String graphName = "kartograph";

  /**
   * Whether a node CREATE without {@code slug} gets a warning.
   */
  private boolean requireNodeSlug = false;

  public String getGraphName() {
    return graphName;
  }

  /**
   * Sets the graph name.
   *
   * @param graphName the graph name (must not be blank)
   * @throws IllegalArgumentException if the name is blank
   */
  public void setGraphName(String graphName) {
    if (graphName == null || graphName.isBlank()) {
      throw new IllegalArgumentException("Graph name cannot be blank");
    }
    this.graphName = graphName;
  }

  public boolean isRequireNodeSlug() {
    return requireNodeSlug;
  }

  public void setRequireNodeSlug(boolean requireNodeSlug) {
    this.requireNodeSlug = requireNodeSlug;
  }
}
