package org.kartograph.mutations.domain;

import java.util.List;
import java.util.Set;

/**
 * Property names managed by the platform rather than by type definitions.
 */
public final class SystemProperties {

  /** Identifier of the data source an entity was extracted from. */
  public static final String DATA_SOURCE_ID = "data_source_id";

  /** Path within the data source an entity was extracted from. */
  public static final String SOURCE_PATH = "source_path";

  /** Human-readable node key. */
  public static final String SLUG = "slug";

  /** Name of the graph an entity was written to; stamped at apply time. */
  public static final String GRAPH_ID = "graph_id";

  /** Provenance fields every CREATE must carry, in reporting order. */
  public static final List<String> PROVENANCE = List.of(DATA_SOURCE_ID, SOURCE_PATH);

  private SystemProperties() {
    // Utility class
  }

  /**
   * Returns the system properties of an entity kind.
   *
   * @param kind the entity kind
   * @return provenance fields plus {@code slug} for nodes, plus {@code graph_id}
   */
  public static Set<String> forKind(EntityKind kind) {
    return kind == EntityKind.NODE
        ? Set.of(DATA_SOURCE_ID, SOURCE_PATH, SLUG, GRAPH_ID)
        : Set.of(DATA_SOURCE_ID, SOURCE_PATH, GRAPH_ID);
  }
}
