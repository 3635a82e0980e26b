package tech.yump.settings.core;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Identity-keyed bookkeeping for one traversal pass. Two equal but distinct objects are
 * tracked separately; the same instance reached twice is processed once.
 */
public final class VisitedSet {

  private final Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());

  /**
   * @return true if the instance had not been visited yet in this pass.
   */
  public boolean add(Object instance) {
    return visited.add(instance);
  }

  public boolean contains(Object instance) {
    return visited.contains(instance);
  }

  public int size() {
    return visited.size();
  }
}
