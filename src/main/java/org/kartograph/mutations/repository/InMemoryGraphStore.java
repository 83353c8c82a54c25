package org.kartograph.mutations.repository;

import com.github.f4b6a3.uuid.UuidCreator;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.kartograph.mutations.domain.GraphEdge;
import org.kartograph.mutations.domain.GraphNode;
import org.kartograph.mutations.domain.SystemProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * In-memory implementation of GraphStore.
 *
 * <p>Thread Safety:
 * <ul>
 * <li>One transaction at a time: {@link #begin()} takes a writer lock that is held until the
 * transaction commits or closes</li>
 * <li>Writes are staged in a per-transaction overlay and published under the state write lock,
 * so readers never see a partially applied batch</li>
 * <li>Reads outside a transaction take the state read lock</li>
 * </ul>
 */
@Repository
public class InMemoryGraphStore implements GraphStore {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStore.class);

  private final Map<String, GraphNode> nodes = new HashMap<>();
  private final Map<String, GraphEdge> edges = new HashMap<>();
  // Key: node id → ids of edges starting or ending there
  private final Map<String, Set<String>> incidence = new HashMap<>();

  private final ReadWriteLock stateLock = new ReentrantReadWriteLock();
  private final ReentrantLock writerLock = new ReentrantLock();

  @Override
  public Optional<GraphNode> findNode(String id) {
    stateLock.readLock().lock();
    try {
      return Optional.ofNullable(nodes.get(id));
    } finally {
      stateLock.readLock().unlock();
    }
  }

  @Override
  public Optional<GraphEdge> findEdge(String id) {
    stateLock.readLock().lock();
    try {
      return Optional.ofNullable(edges.get(id));
    } finally {
      stateLock.readLock().unlock();
    }
  }

  @Override
  public List<GraphEdge> findIncidentEdges(String nodeId) {
    stateLock.readLock().lock();
    try {
      return committedIncidentEdges(nodeId);
    } finally {
      stateLock.readLock().unlock();
    }
  }

  @Override
  public List<GraphNode> findNodesBySlug(String slug, String label) {
    Objects.requireNonNull(slug, "Slug cannot be null");
    stateLock.readLock().lock();
    try {
      return nodes.values().stream()
          .filter(node -> slug.equals(node.properties().get(SystemProperties.SLUG)))
          .filter(node -> label == null || label.equals(node.label()))
          .toList();
    } finally {
      stateLock.readLock().unlock();
    }
  }

  @Override
  public long nodeCount() {
    stateLock.readLock().lock();
    try {
      return nodes.size();
    } finally {
      stateLock.readLock().unlock();
    }
  }

  @Override
  public long edgeCount() {
    stateLock.readLock().lock();
    try {
      return edges.size();
    } finally {
      stateLock.readLock().unlock();
    }
  }

  @Override
  public GraphTransaction begin() {
    writerLock.lock();
    String transactionId = UuidCreator.getTimeOrderedEpoch().toString();
    logger.debug("Began graph transaction {}", transactionId);
    return new InMemoryTransaction(transactionId);
  }

  /**
   * Removes every node and edge. Intended for tests.
   */
  public void clear() {
    writerLock.lock();
    try {
      stateLock.writeLock().lock();
      try {
        nodes.clear();
        edges.clear();
        incidence.clear();
      } finally {
        stateLock.writeLock().unlock();
      }
    } finally {
      writerLock.unlock();
    }
  }

  private List<GraphEdge> committedIncidentEdges(String nodeId) {
    Set<String> edgeIds = incidence.getOrDefault(nodeId, Set.of());
    List<GraphEdge> result = new ArrayList<>(edgeIds.size());
    for (String edgeId : edgeIds) {
      result.add(edges.get(edgeId));
    }
    return result;
  }

  private static void link(Map<String, Set<String>> index, GraphEdge edge) {
    index.computeIfAbsent(edge.startId(), k -> new LinkedHashSet<>()).add(edge.id());
    index.computeIfAbsent(edge.endId(), k -> new LinkedHashSet<>()).add(edge.id());
  }

  private static void unlink(Map<String, Set<String>> index, GraphEdge edge) {
    for (String nodeId : List.of(edge.startId(), edge.endId())) {
      Set<String> edgeIds = index.get(nodeId);
      if (edgeIds != null) {
        edgeIds.remove(edge.id());
        if (edgeIds.isEmpty()) {
          index.remove(nodeId);
        }
      }
    }
  }

  /**
   * Transaction over the committed maps. Committed state cannot change while it is active,
   * since it holds the writer lock.
   */
  private final class InMemoryTransaction implements GraphTransaction {

    private final String transactionId;
    private final Map<String, GraphNode> stagedNodes = new LinkedHashMap<>();
    private final Set<String> deletedNodes = new HashSet<>();
    private final Map<String, GraphEdge> stagedEdges = new LinkedHashMap<>();
    private final Set<String> deletedEdges = new HashSet<>();
    private final Map<String, Set<String>> stagedIncidence = new HashMap<>();
    private boolean active = true;

    InMemoryTransaction(String transactionId) {
      this.transactionId = transactionId;
    }

    @Override
    public String transactionId() {
      return transactionId;
    }

    @Override
    public Optional<GraphNode> findNode(String id) {
      ensureActive();
      if (deletedNodes.contains(id)) {
        return Optional.empty();
      }
      GraphNode staged = stagedNodes.get(id);
      return staged != null ? Optional.of(staged) : Optional.ofNullable(nodes.get(id));
    }

    @Override
    public Optional<GraphEdge> findEdge(String id) {
      ensureActive();
      if (deletedEdges.contains(id)) {
        return Optional.empty();
      }
      GraphEdge staged = stagedEdges.get(id);
      return staged != null ? Optional.of(staged) : Optional.ofNullable(edges.get(id));
    }

    @Override
    public List<GraphEdge> findIncidentEdges(String nodeId) {
      ensureActive();
      Set<String> edgeIds = new LinkedHashSet<>(incidence.getOrDefault(nodeId, Set.of()));
      edgeIds.addAll(stagedIncidence.getOrDefault(nodeId, Set.of()));
      List<GraphEdge> result = new ArrayList<>();
      for (String edgeId : edgeIds) {
        findEdge(edgeId).filter(edge -> edge.touches(nodeId)).ifPresent(result::add);
      }
      return result;
    }

    @Override
    public void putNode(GraphNode node) {
      ensureActive();
      deletedNodes.remove(node.id());
      stagedNodes.put(node.id(), node);
    }

    @Override
    public void putEdge(GraphEdge edge) {
      ensureActive();
      if (findNode(edge.startId()).isEmpty() || findNode(edge.endId()).isEmpty()) {
        throw new IllegalStateException("Edge " + edge.id() + " references a missing node");
      }
      GraphEdge previous = stagedEdges.put(edge.id(), edge);
      if (previous != null) {
        unlink(stagedIncidence, previous);
      }
      deletedEdges.remove(edge.id());
      link(stagedIncidence, edge);
    }

    @Override
    public void removeNode(String id) {
      ensureActive();
      if (!findIncidentEdges(id).isEmpty()) {
        throw new IllegalStateException("Node " + id + " still has incident edges");
      }
      stagedNodes.remove(id);
      if (nodes.containsKey(id)) {
        deletedNodes.add(id);
      }
    }

    @Override
    public void removeEdge(String id) {
      ensureActive();
      GraphEdge staged = stagedEdges.remove(id);
      if (staged != null) {
        unlink(stagedIncidence, staged);
      }
      if (edges.containsKey(id)) {
        deletedEdges.add(id);
      }
    }

    @Override
    public void commit() {
      ensureActive();
      stateLock.writeLock().lock();
      try {
        for (String edgeId : deletedEdges) {
          GraphEdge removed = edges.remove(edgeId);
          if (removed != null) {
            unlink(incidence, removed);
          }
        }
        for (String nodeId : deletedNodes) {
          nodes.remove(nodeId);
        }
        nodes.putAll(stagedNodes);
        for (GraphEdge edge : stagedEdges.values()) {
          GraphEdge previous = edges.put(edge.id(), edge);
          if (previous != null) {
            unlink(incidence, previous);
          }
          link(incidence, edge);
        }
      } finally {
        stateLock.writeLock().unlock();
      }
      logger.debug("Committed graph transaction {}: {} node writes, {} edge writes, "
              + "{} node deletes, {} edge deletes", transactionId, stagedNodes.size(),
          stagedEdges.size(), deletedNodes.size(), deletedEdges.size());
      release();
    }

    @Override
    public void rollback() {
      if (!active) {
        return;
      }
      logger.debug("Rolled back graph transaction {}", transactionId);
      release();
    }

    @Override
    public void close() {
      rollback();
    }

    private void ensureActive() {
      if (!active) {
        throw new IllegalStateException("Transaction " + transactionId + " is no longer active");
      }
    }

    private void release() {
      active = false;
      stagedNodes.clear();
      stagedEdges.clear();
      deletedNodes.clear();
      deletedEdges.clear();
      stagedIncidence.clear();
      writerLock.unlock();
    }
  }
}
