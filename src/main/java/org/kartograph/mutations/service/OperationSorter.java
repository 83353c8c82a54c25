package org.kartograph.mutations.service;

import java.util.ArrayList;
import java.util.List;
import org.kartograph.mutations.domain.DefineOperation;
import org.kartograph.mutations.domain.MutationOperation;
import org.springframework.stereotype.Component;

/**
 * Produces the execution order of a batch: every DEFINE first, then every other operation,
 * each group keeping its input order.
 *
 * <p>This is a stable partition, not a dependency sort. A node CREATE is not moved ahead of
 * an edge CREATE that references it; violating that order fails at apply time.
 */
@Component
public class OperationSorter {

  /**
   * Sorts operations into execution order.
   *
   * @param operations operations in input order
   * @return a new list in execution order
   */
  public List<MutationOperation> sort(List<MutationOperation> operations) {
    List<MutationOperation> ordered = new ArrayList<>(operations.size());
    List<MutationOperation> others = new ArrayList<>();
    for (MutationOperation operation : operations) {
      if (operation instanceof DefineOperation) {
        ordered.add(operation);
      } else {
        others.add(operation);
      }
    }
    ordered.addAll(others);
    return ordered;
  }
}
